package de.mirkosertic.polyglot.store;

import de.mirkosertic.polyglot.model.GroupLanguageMapping;
import de.mirkosertic.polyglot.model.LanguageAlternative;
import de.mirkosertic.polyglot.model.LibraryMirror;
import de.mirkosertic.polyglot.model.SyncStatus;
import de.mirkosertic.polyglot.model.UserLanguageConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConfigurationStore Tests")
class ConfigurationStoreTest {

    private InMemoryConfigurationPersistence persistence;
    private ConfigurationStore store;

    @BeforeEach
    void setUp() {
        persistence = new InMemoryConfigurationPersistence();
        store = new ConfigurationStore(persistence);
        store.init();
    }

    private static LanguageAlternative alternative(final String name) {
        final LanguageAlternative alternative = new LanguageAlternative();
        alternative.setName(name);
        alternative.setLanguageCode("de");
        alternative.setMetadataLanguage("de");
        alternative.setDestinationBasePath("/media/polyglot/" + name);
        return alternative;
    }

    private static LibraryMirror mirror(final UUID sourceId) {
        final LibraryMirror mirror = new LibraryMirror();
        mirror.setSourceLibraryId(sourceId);
        mirror.setSourceLibraryName("Movies");
        mirror.setTargetLibraryName("Movies (German)");
        mirror.setTargetPath("/media/polyglot/german/Movies");
        return mirror;
    }

    @Nested
    @DisplayName("Alternatives")
    class Alternatives {

        @Test
        @DisplayName("Should add and read back an alternative")
        void shouldAddAlternative() {
            // Given
            final LanguageAlternative german = alternative("German");

            // When
            final boolean added = store.addAlternative(german);

            // Then
            assertThat(added).isTrue();
            assertThat(store.getAlternative(german.getId())).get()
                    .extracting(LanguageAlternative::getName).isEqualTo("German");
            assertThat(persistence.getSaveCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject a duplicate name regardless of case")
        void shouldRejectDuplicateName() {
            store.addAlternative(alternative("German"));

            assertThat(store.addAlternative(alternative("GERMAN"))).isFalse();
            assertThat(store.getAlternatives()).hasSize(1);
        }

        @Test
        @DisplayName("Should hand out copies that do not affect the stored state")
        void shouldReturnDeepCopies() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            store.addMirror(german.getId(), mirror(UUID.randomUUID()));

            // When
            final LanguageAlternative copy = store.getAlternative(german.getId()).orElseThrow();
            copy.setName("Changed");
            copy.getMirroredLibraries().get(0).setStatus(SyncStatus.ERROR);
            copy.getMirroredLibraries().clear();

            // Then
            final LanguageAlternative stored = store.getAlternative(german.getId()).orElseThrow();
            assertThat(stored.getName()).isEqualTo("German");
            assertThat(stored.getMirroredLibraries()).hasSize(1);
            assertThat(stored.getMirroredLibraries().get(0).getStatus()).isEqualTo(SyncStatus.PENDING);
        }

        @Test
        @DisplayName("Should clear default and group mappings when removing an alternative")
        void shouldClearReferencesOnRemove() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            store.updateSettings(settings -> {
                settings.setDefaultAlternativeId(german.getId());
                return true;
            });
            final GroupLanguageMapping mapping = new GroupLanguageMapping();
            mapping.setGroupDn("cn=german,dc=example");
            mapping.setAlternativeId(german.getId());
            store.addGroupMapping(mapping);

            // When
            final boolean removed = store.removeAlternative(german.getId());

            // Then
            assertThat(removed).isTrue();
            assertThat(store.getSettings().getDefaultAlternativeId()).isNull();
            assertThat(store.getGroupMappings()).isEmpty();
        }

        @Test
        @DisplayName("Should apply an update to an alternative")
        void shouldUpdateAlternative() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);

            // When
            final boolean updated = store.updateAlternative(german.getId(), a -> a.setName("Deutsch"));

            // Then
            assertThat(updated).isTrue();
            final LanguageAlternative stored = store.getAlternative(german.getId()).orElseThrow();
            assertThat(stored.getName()).isEqualTo("Deutsch");
            assertThat(stored.getModifiedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should refuse a rename onto another alternative's name and keep the old name")
        void shouldRejectCollidingRename() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            store.addAlternative(alternative("French"));
            final int saves = persistence.getSaveCount();

            // When
            final boolean updated = store.updateAlternative(german.getId(), a -> a.setName("FRENCH"));

            // Then
            assertThat(updated).isFalse();
            assertThat(store.getAlternative(german.getId()).orElseThrow().getName()).isEqualTo("German");
            assertThat(persistence.getSaveCount()).isEqualTo(saves);
        }

        @Test
        @DisplayName("Should refuse atomic removal when an unexpected mirror appeared")
        void shouldDetectConcurrentlyAddedMirror() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            final LibraryMirror late = mirror(UUID.randomUUID());
            store.addMirror(german.getId(), late);

            // When
            final RemoveAlternativeResult result = store.tryRemoveAlternativeAtomic(german.getId(), Set.of());

            // Then
            assertThat(result.outcome()).isEqualTo(RemoveAlternativeResult.Outcome.NEW_MIRRORS_ADDED);
            assertThat(result.unexpectedMirrorIds()).containsExactly(late.getId());
            assertThat(store.getAlternative(german.getId())).isPresent();
        }

        @Test
        @DisplayName("Should remove atomically when only expected mirrors remain")
        void shouldRemoveAtomically() {
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            final LibraryMirror known = mirror(UUID.randomUUID());
            store.addMirror(german.getId(), known);

            final RemoveAlternativeResult result = store.tryRemoveAlternativeAtomic(german.getId(), Set.of(known.getId()));

            assertThat(result.isSuccess()).isTrue();
            assertThat(store.getAlternatives()).isEmpty();
            assertThat(store.tryRemoveAlternativeAtomic(german.getId(), Set.of()).outcome())
                    .isEqualTo(RemoveAlternativeResult.Outcome.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Mirrors")
    class Mirrors {

        @Test
        @DisplayName("Should reject a second mirror of the same source in one alternative")
        void shouldRejectDuplicateSource() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            final UUID sourceId = UUID.randomUUID();

            // When
            final boolean first = store.addMirror(german.getId(), mirror(sourceId));
            final boolean second = store.addMirror(german.getId(), mirror(sourceId));

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(store.getAllMirrors()).hasSize(1);
        }

        @Test
        @DisplayName("Should allow the same source in different alternatives")
        void shouldAllowSourceInSeveralAlternatives() {
            final LanguageAlternative german = alternative("German");
            final LanguageAlternative french = alternative("French");
            store.addAlternative(german);
            store.addAlternative(french);
            final UUID sourceId = UUID.randomUUID();

            assertThat(store.addMirror(german.getId(), mirror(sourceId))).isTrue();
            assertThat(store.addMirror(french.getId(), mirror(sourceId))).isTrue();
        }

        @Test
        @DisplayName("Should refuse a mirror for an unknown alternative")
        void shouldRejectUnknownAlternative() {
            assertThat(store.addMirror(UUID.randomUUID(), mirror(UUID.randomUUID()))).isFalse();
        }

        @Test
        @DisplayName("Should update and locate a mirror with its alternative")
        void shouldUpdateMirror() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            final LibraryMirror movies = mirror(UUID.randomUUID());
            store.addMirror(german.getId(), movies);

            // When
            store.updateMirror(movies.getId(), m -> {
                m.setStatus(SyncStatus.SYNCED);
                m.setLastSyncFileCount(42);
            });

            // Then
            final MirrorLocation location = store.getMirrorWithAlternative(movies.getId()).orElseThrow();
            assertThat(location.alternative().getId()).isEqualTo(german.getId());
            assertThat(location.mirror().getStatus()).isEqualTo(SyncStatus.SYNCED);
            assertThat(location.mirror().getLastSyncFileCount()).isEqualTo(42);
            assertThat(store.removeMirror(movies.getId())).isTrue();
            assertThat(store.getMirror(movies.getId())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Users and settings")
    class UsersAndSettings {

        @Test
        @DisplayName("Should create a user record on first update only")
        void shouldCreateUserOnce() {
            final UUID userId = UUID.randomUUID();
            final UUID alternativeId = UUID.randomUUID();

            final boolean created = store.updateOrCreateUserLanguage(userId, u -> u.setSelectedAlternativeId(alternativeId));
            final boolean createdAgain = store.updateOrCreateUserLanguage(userId, u -> u.setManuallySet(true));

            assertThat(created).isTrue();
            assertThat(createdAgain).isFalse();
            final UserLanguageConfig config = store.getUserLanguage(userId).orElseThrow();
            assertThat(config.getSelectedAlternativeId()).isEqualTo(alternativeId);
            assertThat(config.isManuallySet()).isTrue();
            assertThat(config.isPluginManaged()).isTrue();
        }

        @Test
        @DisplayName("Should reject a group mapping with a duplicate DN")
        void shouldRejectDuplicateGroupDn() {
            final GroupLanguageMapping first = new GroupLanguageMapping();
            first.setGroupDn("CN=German,DC=example");
            first.setAlternativeId(UUID.randomUUID());
            final GroupLanguageMapping second = new GroupLanguageMapping();
            second.setGroupDn("cn=german,dc=example");
            second.setAlternativeId(UUID.randomUUID());

            assertThat(store.addGroupMapping(first)).isTrue();
            assertThat(store.addGroupMapping(second)).isFalse();
        }

        @Test
        @DisplayName("Should remove a group mapping by id")
        void shouldRemoveGroupMapping() {
            // Given
            final GroupLanguageMapping mapping = new GroupLanguageMapping();
            mapping.setGroupDn("CN=German,DC=example");
            mapping.setAlternativeId(UUID.randomUUID());
            store.addGroupMapping(mapping);

            // When
            final boolean removed = store.removeGroupMapping(mapping.getId());
            final boolean removedAgain = store.removeGroupMapping(mapping.getId());

            // Then
            assertThat(removed).isTrue();
            assertThat(removedAgain).isFalse();
            assertThat(store.getGroupMappings()).isEmpty();
        }

        @Test
        @DisplayName("Should expose default exclusion lists case-insensitively")
        void shouldExposeExclusions() {
            assertThat(store.getExcludedExtensions()).contains(".NFO", ".jpg");
            assertThat(store.getExcludedDirectories()).contains("Metadata");
            assertThat(store.getIncludedDirectories()).contains(".trickplay");
        }

        @Test
        @DisplayName("Should only save settings when the update reports a change")
        void shouldSaveSettingsOnlyOnChange() {
            final int before = persistence.getSaveCount();

            store.updateSettings(settings -> false);
            store.updateSettings(settings -> {
                settings.setAutoManageNewUsers(true);
                return true;
            });

            assertThat(persistence.getSaveCount()).isEqualTo(before + 1);
            assertThat(store.getSettings().isAutoManageNewUsers()).isTrue();
        }

        @Test
        @DisplayName("Should reset everything on clearAll")
        void shouldClearAll() {
            store.addAlternative(alternative("German"));
            store.updateOrCreateUserLanguage(UUID.randomUUID(), u -> u.setManuallySet(true));

            assertThat(store.clearAll()).isTrue();

            assertThat(store.getAlternatives()).isEmpty();
            assertThat(store.getUserLanguages()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Availability")
    class Availability {

        @Test
        @DisplayName("Should refuse all mutations when the document could not be loaded")
        void shouldBeUnavailableAfterLoadFailure() {
            // Given
            final InMemoryConfigurationPersistence broken = new InMemoryConfigurationPersistence();
            broken.setFailLoad(true);
            final ConfigurationStore unavailable = new ConfigurationStore(broken);

            // When
            unavailable.init();

            // Then
            assertThat(unavailable.isAvailable()).isFalse();
            assertThat(unavailable.addAlternative(alternative("German"))).isFalse();
            assertThat(unavailable.getAlternatives()).isEmpty();
            assertThat(unavailable.tryRemoveAlternativeAtomic(UUID.randomUUID(), Set.of()).outcome())
                    .isEqualTo(RemoveAlternativeResult.Outcome.UNAVAILABLE);
            assertThat(broken.getSaveCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Save failures")
    class SaveFailures {

        @Test
        @DisplayName("Should report failure and drop the change when adding an alternative cannot be saved")
        void shouldRevertAddOnSaveFailure() {
            // Given
            persistence.setFailSave(true);

            // When
            final boolean added = store.addAlternative(alternative("German"));

            // Then
            assertThat(added).isFalse();
            assertThat(store.getAlternatives()).isEmpty();
        }

        @Test
        @DisplayName("Should keep the previous mirror state when an update cannot be saved")
        void shouldRevertMirrorUpdateOnSaveFailure() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            final LibraryMirror mirror = mirror(UUID.randomUUID());
            store.addMirror(german.getId(), mirror);
            persistence.setFailSave(true);

            // When
            final boolean updated = store.updateMirror(mirror.getId(), m -> m.setStatus(SyncStatus.SYNCED));
            final boolean removed = store.removeMirror(mirror.getId());

            // Then
            assertThat(updated).isFalse();
            assertThat(removed).isFalse();
            assertThat(store.getMirror(mirror.getId())).get()
                    .extracting(LibraryMirror::getStatus).isEqualTo(SyncStatus.PENDING);
        }

        @Test
        @DisplayName("Should keep the alternative when its atomic removal cannot be saved")
        void shouldKeepAlternativeWhenRemovalCannotBeSaved() {
            // Given
            final LanguageAlternative german = alternative("German");
            store.addAlternative(german);
            persistence.setFailSave(true);

            // When
            final RemoveAlternativeResult result = store.tryRemoveAlternativeAtomic(german.getId(), Set.of());

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(store.getAlternative(german.getId())).isPresent();
        }

        @Test
        @DisplayName("Should accept changes again once saving works")
        void shouldRecoverAfterSaveFailure() {
            persistence.setFailSave(true);
            store.addAlternative(alternative("German"));
            persistence.setFailSave(false);

            assertThat(store.addAlternative(alternative("German"))).isTrue();
            assertThat(store.getAlternatives()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should keep one mirror per source under concurrent adds")
    void shouldSerializeConcurrentMutations() throws Exception {
        // Given
        final LanguageAlternative german = alternative("German");
        store.addAlternative(german);
        final UUID sourceId = UUID.randomUUID();
        final int threads = 8;
        final ExecutorService executor = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);

        // When
        final List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return store.addMirror(german.getId(), mirror(sourceId));
            }));
        }
        start.countDown();
        int successes = 0;
        for (final Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        executor.shutdown();

        // Then
        assertThat(successes).isEqualTo(1);
        assertThat(store.getAllMirrors()).hasSize(1);
    }
}
