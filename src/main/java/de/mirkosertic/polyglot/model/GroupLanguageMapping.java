package de.mirkosertic.polyglot.model;

import java.util.UUID;

/**
 * Maps a directory group to a language alternative. Higher priority wins when a user is a
 * member of several mapped groups.
 */
public class GroupLanguageMapping {

    private UUID id = UUID.randomUUID();
    private String groupDn = "";
    private String groupName = "";
    private UUID alternativeId;
    private int priority;

    public GroupLanguageMapping deepCopy() {
        final GroupLanguageMapping copy = new GroupLanguageMapping();
        copy.id = id;
        copy.groupDn = groupDn;
        copy.groupName = groupName;
        copy.alternativeId = alternativeId;
        copy.priority = priority;
        return copy;
    }

    public UUID getId() {
        return id;
    }

    public void setId(final UUID id) {
        this.id = id;
    }

    public String getGroupDn() {
        return groupDn;
    }

    public void setGroupDn(final String groupDn) {
        this.groupDn = groupDn;
    }

    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(final String groupName) {
        this.groupName = groupName;
    }

    public UUID getAlternativeId() {
        return alternativeId;
    }

    public void setAlternativeId(final UUID alternativeId) {
        this.alternativeId = alternativeId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(final int priority) {
        this.priority = priority;
    }
}
