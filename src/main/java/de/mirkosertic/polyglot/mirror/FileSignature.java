package de.mirkosertic.polyglot.mirror;

/**
 * Identity of a file's content as far as synchronization is concerned. A hardlink shares its
 * inode with the source, so an up to date mirror file carries the same signature.
 */
public record FileSignature(long size, long lastModifiedMillis) {
}
