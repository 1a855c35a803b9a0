package de.mirkosertic.polyglot.admin;

import de.mirkosertic.polyglot.ErrorKind;
import de.mirkosertic.polyglot.PolyglotException;
import de.mirkosertic.polyglot.access.LibraryAccessService;
import de.mirkosertic.polyglot.host.HostUser;
import de.mirkosertic.polyglot.host.InMemoryLibraryDirectory;
import de.mirkosertic.polyglot.host.InMemoryUserDirectory;
import de.mirkosertic.polyglot.host.VirtualLibrary;
import de.mirkosertic.polyglot.mirror.CancellationToken;
import de.mirkosertic.polyglot.mirror.DeleteMirrorResult;
import de.mirkosertic.polyglot.mirror.MirrorLockRegistry;
import de.mirkosertic.polyglot.mirror.MirrorService;
import de.mirkosertic.polyglot.mirror.MirrorValidator;
import de.mirkosertic.polyglot.mirror.SyncAllResult;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.SyncStatus;
import de.mirkosertic.polyglot.store.ConfigurationStore;
import de.mirkosertic.polyglot.store.InMemoryConfigurationPersistence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AlternativeAdministration Tests")
class AlternativeAdministrationTest {

    @TempDir
    Path tempDir;

    private Path sourceRoot;
    private InMemoryLibraryDirectory libraryDirectory;
    private InMemoryUserDirectory userDirectory;
    private ConfigurationStore store;
    private MirrorService mirrorService;
    private LibraryAccessService accessService;
    private AlternativeAdministration administration;
    private VirtualLibrary movies;

    @BeforeEach
    void setUp() throws IOException {
        sourceRoot = Files.createDirectories(tempDir.resolve("media/Movies"));
        Files.createDirectories(sourceRoot.resolve("Alien (1979)"));
        Files.writeString(sourceRoot.resolve("Alien (1979)/Alien.mkv"), "alien", StandardCharsets.UTF_8);

        libraryDirectory = new InMemoryLibraryDirectory();
        movies = libraryDirectory.addLibrary("Movies", "movies", sourceRoot.toString());
        userDirectory = new InMemoryUserDirectory();
        store = new ConfigurationStore(new InMemoryConfigurationPersistence());
        store.init();
        mirrorService = new MirrorService(store, libraryDirectory, new MirrorLockRegistry());
        accessService = new LibraryAccessService(store, libraryDirectory, userDirectory);
        administration = new AlternativeAdministration(store, mirrorService,
                new MirrorValidator(store, libraryDirectory), accessService);
    }

    private LanguageAlternative german() throws PolyglotException {
        return administration.createAlternative(
                new CreateAlternativeRequest("German", "de-DE", tempDir.resolve("polyglot/german").toString()));
    }

    @Nested
    @DisplayName("Alternatives")
    class Alternatives {

        @Test
        @DisplayName("Should derive metadata language and country from the code")
        void shouldCreateAlternative() throws PolyglotException {
            final LanguageAlternative german = german();

            assertThat(german.getMetadataLanguage()).isEqualTo("de");
            assertThat(german.getMetadataCountry()).isEqualTo("DE");
            assertThat(store.getAlternative(german.getId())).isPresent();
        }

        @Test
        @DisplayName("Should prefer explicit metadata settings")
        void shouldUseExplicitMetadata() throws PolyglotException {
            final LanguageAlternative portuguese = administration.createAlternative(new CreateAlternativeRequest(
                    "Portuguese", "pt", "pt", "BR", tempDir.resolve("polyglot/pt").toString()));

            assertThat(portuguese.getMetadataCountry()).isEqualTo("BR");
        }

        @Test
        @DisplayName("Should reject invalid requests and duplicates")
        void shouldValidateRequest() throws PolyglotException {
            german();

            assertValidationError(new CreateAlternativeRequest(" ", "de", "/polyglot"));
            assertValidationError(new CreateAlternativeRequest("Spanish", "", "/polyglot"));
            assertValidationError(new CreateAlternativeRequest("Spanish", "es", "relative/path"));
            assertValidationError(new CreateAlternativeRequest("german", "de", tempDir.toString()));
        }

        private void assertValidationError(final CreateAlternativeRequest request) {
            assertThatThrownBy(() -> administration.createAlternative(request))
                    .isInstanceOf(PolyglotException.class)
                    .extracting(e -> ((PolyglotException) e).getKind())
                    .isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("Should split language codes")
        void shouldSplitCodes() {
            assertThat(AlternativeAdministration.languageFromCode("pt-BR")).isEqualTo("pt");
            assertThat(AlternativeAdministration.countryFromCode("pt-BR")).isEqualTo("BR");
            assertThat(AlternativeAdministration.languageFromCode("de")).isEqualTo("de");
            assertThat(AlternativeAdministration.countryFromCode("de")).isEmpty();
        }

        @Test
        @DisplayName("Should delete an alternative with its mirrors and libraries")
        void shouldDeleteAlternative() throws PolyglotException {
            // Given
            final LanguageAlternative german = german();
            final LibraryMirror mirror = administration.addLibraryMirror(german.getId(), movies.id(), null, null);

            // When
            final DeleteAlternativeResult result = administration.deleteAlternative(german.getId(), true, true);

            // Then
            assertThat(result.outcome()).isEqualTo(DeleteAlternativeResult.Outcome.DELETED);
            assertThat(result.deletedMirrors()).containsExactly(mirror.getId());
            assertThat(store.getAlternatives()).isEmpty();
            assertThat(Path.of(mirror.getTargetPath())).doesNotExist();
            assertThat(libraryDirectory.byName("Movies (German)")).isNull();
            assertThat(sourceRoot.resolve("Alien (1979)/Alien.mkv")).exists();
        }

        @Test
        @DisplayName("Should report NOT_FOUND for an unknown alternative")
        void shouldReportUnknownAlternative() {
            assertThat(administration.deleteAlternative(UUID.randomUUID(), true, true).outcome())
                    .isEqualTo(DeleteAlternativeResult.Outcome.NOT_FOUND);
        }

        @Test
        @DisplayName("Should keep the alternative when a mirror cannot be deleted")
        void shouldKeepAlternativeOnMirrorFailure() throws PolyglotException {
            final LanguageAlternative german = german();
            administration.addLibraryMirror(german.getId(), movies.id(), null, null);
            libraryDirectory.failRemovalOf("Movies (German)");

            final DeleteAlternativeResult result = administration.deleteAlternative(german.getId(), true, false);

            assertThat(result.outcome()).isEqualTo(DeleteAlternativeResult.Outcome.MIRROR_DELETION_FAILED);
            assertThat(result.failedMirrors()).hasSize(1);
            assertThat(store.getAlternative(german.getId())).isPresent();
        }

        @Test
        @DisplayName("Should report a conflict when a mirror is added during deletion")
        void shouldDetectConcurrentMirror() throws PolyglotException {
            // Given
            final LanguageAlternative german = german();
            final LibraryMirror existing = new LibraryMirror();
            existing.setSourceLibraryId(movies.id());
            store.addMirror(german.getId(), existing);
            final LibraryMirror late = new LibraryMirror();
            late.setSourceLibraryId(UUID.randomUUID());

            final MirrorService racingService = mock(MirrorService.class);
            when(racingService.deleteMirror(any(), anyBoolean(), anyBoolean(), anyBoolean())).thenAnswer(invocation -> {
                store.removeMirror(invocation.getArgument(0));
                store.addMirror(german.getId(), late);
                return new DeleteMirrorResult(true, null, null);
            });
            final AlternativeAdministration racing = new AlternativeAdministration(store, racingService,
                    new MirrorValidator(store, libraryDirectory), accessService);

            // When
            final DeleteAlternativeResult result = racing.deleteAlternative(german.getId(), true, true);

            // Then
            assertThat(result.outcome()).isEqualTo(DeleteAlternativeResult.Outcome.CONFLICT);
            assertThat(result.unexpectedMirrorIds()).containsExactly(late.getId());
            assertThat(store.getMirror(late.getId())).isPresent();
        }
    }

    @Nested
    @DisplayName("Mirrors")
    class Mirrors {

        @Test
        @DisplayName("Should create a mirror below the base path and update its users")
        void shouldAddMirror() throws Exception {
            // Given
            final LanguageAlternative german = german();
            final HostUser user = userDirectory.addUser("alice", false, Set.of(movies.id()));
            store.updateOrCreateUserLanguage(user.id(), c -> c.setSelectedAlternativeId(german.getId()));

            // When
            final LibraryMirror mirror = administration.addLibraryMirror(german.getId(), movies.id(), null, null);

            // Then
            assertThat(mirror.getStatus()).isEqualTo(SyncStatus.SYNCED);
            assertThat(mirror.getTargetPath()).isEqualTo(tempDir.resolve("polyglot/german/Movies").toString());
            assertThat(mirror.getTargetLibraryName()).isEqualTo("Movies (German)");
            assertThat(mirror.getCollectionType()).isEqualTo("movies");
            assertThat(Files.isSameFile(Path.of(mirror.getTargetPath(), "Alien (1979)", "Alien.mkv"),
                    sourceRoot.resolve("Alien (1979)/Alien.mkv"))).isTrue();
            assertThat(userDirectory.get(user.id()).enabledFolders()).containsExactly(mirror.getTargetLibraryId());
        }

        @Test
        @DisplayName("Should reject a mirror of a mirror")
        void shouldRejectMirrorOfMirror() throws PolyglotException {
            final LanguageAlternative german = german();
            final LibraryMirror mirror = administration.addLibraryMirror(german.getId(), movies.id(), null, null);
            final LanguageAlternative french = administration.createAlternative(
                    new CreateAlternativeRequest("French", "fr", tempDir.resolve("polyglot/french").toString()));

            assertThatThrownBy(() -> administration.addLibraryMirror(french.getId(), mirror.getTargetLibraryId(), null, null))
                    .isInstanceOf(PolyglotException.class)
                    .extracting(e -> ((PolyglotException) e).getKind())
                    .isEqualTo(ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("Should reject a second mirror of the same source")
        void shouldRejectDuplicateMirror() throws PolyglotException {
            final LanguageAlternative german = german();
            administration.addLibraryMirror(german.getId(), movies.id(), null, null);

            assertThatThrownBy(() -> administration.addLibraryMirror(german.getId(), movies.id(),
                    tempDir.resolve("elsewhere").toString(), "Movies again"))
                    .isInstanceOf(PolyglotException.class)
                    .extracting(e -> ((PolyglotException) e).getKind())
                    .isEqualTo(ErrorKind.CONFLICT);
        }

        @Test
        @DisplayName("Should remove the configuration entry when creation fails")
        void shouldRemoveFailedMirror() throws PolyglotException {
            final LanguageAlternative german = german();
            libraryDirectory.setFailCreate(true);

            assertThatThrownBy(() -> administration.addLibraryMirror(german.getId(), movies.id(), null, null))
                    .isInstanceOf(PolyglotException.class);

            assertThat(store.getAllMirrors()).isEmpty();
            assertThat(tempDir.resolve("polyglot/german/Movies")).doesNotExist();
        }

        @Test
        @DisplayName("Should delete a mirror by its source library")
        void shouldDeleteLibraryMirror() throws PolyglotException {
            final LanguageAlternative german = german();
            administration.addLibraryMirror(german.getId(), movies.id(), null, null);

            final DeleteMirrorResult result = administration.deleteLibraryMirror(german.getId(), movies.id(), true, true, false);

            assertThat(result.removedFromConfig()).isTrue();
            assertThat(store.getAllMirrors()).isEmpty();
            assertThatThrownBy(() -> administration.deleteLibraryMirror(german.getId(), movies.id(), true, true, false))
                    .isInstanceOf(PolyglotException.class)
                    .extracting(e -> ((PolyglotException) e).getKind())
                    .isEqualTo(ErrorKind.NOT_FOUND);
        }

        @Test
        @DisplayName("Should sync all mirrors of an alternative")
        void shouldSyncAlternative() throws Exception {
            final LanguageAlternative german = german();
            final LibraryMirror mirror = administration.addLibraryMirror(german.getId(), movies.id(), null, null);
            Files.writeString(sourceRoot.resolve("Alien (1979)/Alien.de.srt"), "untertitel", StandardCharsets.UTF_8);

            final SyncAllResult result = administration.syncAlternative(german.getId(), CancellationToken.NONE);

            assertThat(result.status()).isEqualTo(SyncAllResult.Status.COMPLETED);
            assertThat(Path.of(mirror.getTargetPath(), "Alien (1979)", "Alien.de.srt")).exists();
        }

        @Test
        @DisplayName("Should replace characters that are invalid in directory names")
        void shouldSanitizeDirectoryNames() {
            assertThat(AlternativeAdministration.sanitizeDirectoryName("Movies: 4K/HDR")).isEqualTo("Movies_ 4K_HDR");
            assertThat(AlternativeAdministration.sanitizeDirectoryName("..")).isEqualTo("_");
        }
    }
}
