package de.mirkosertic.polyglot.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should use the classpath defaults")
    void shouldLoadDefaults() {
        final ApplicationConfig config = ApplicationConfig.load(tempDir.resolve("missing.yaml"), Map.<String, String>of()::get);

        assertThat(config.getGhostThreshold()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.getThreadPoolSize()).isEqualTo(2);
        assertThat(config.isCleanupOrphansOnStartup()).isTrue();
        assertThat(config.isReconcileOnStartup()).isTrue();
        assertThat(config.getDataPath()).endsWith("data");
        assertThat(config.getConfigurationFile().getFileName().toString()).isEqualTo("configuration.json");
    }

    @Test
    @DisplayName("Should let the user config file override defaults")
    void shouldApplyUserConfig() throws IOException {
        // Given
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, String.join("\n",
                "polyglot:",
                "  data:",
                "    path: " + tempDir.resolve("data"),
                "  mirror:",
                "    ghost-threshold-minutes: 5",
                "    cleanup-orphans-on-startup: false",
                "  access:",
                "    reconcile-on-startup: false",
                ""), StandardCharsets.UTF_8);

        // When
        final ApplicationConfig config = ApplicationConfig.load(userConfig, Map.<String, String>of()::get);

        // Then
        assertThat(config.getDataPath()).isEqualTo(tempDir.resolve("data").toString());
        assertThat(config.getGhostThreshold()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.isCleanupOrphansOnStartup()).isFalse();
        assertThat(config.isReconcileOnStartup()).isFalse();
        assertThat(config.getThreadPoolSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should resolve variables with defaults in paths")
    void shouldResolveVariables() throws IOException {
        final Path userConfig = tempDir.resolve("config.yaml");
        Files.writeString(userConfig, "polyglot:\n  data:\n    path: ${POLYGLOT_TEST_ROOT:/srv}/polyglot\n",
                StandardCharsets.UTF_8);

        final ApplicationConfig withDefault = ApplicationConfig.load(userConfig, Map.<String, String>of()::get);
        final ApplicationConfig withEnv = ApplicationConfig.load(userConfig,
                Map.of("POLYGLOT_TEST_ROOT", "/data")::get);

        assertThat(withDefault.getDataPath()).isEqualTo("/srv/polyglot");
        assertThat(withEnv.getDataPath()).isEqualTo("/data/polyglot");
    }

    @Test
    @DisplayName("Should let environment variables win")
    void shouldApplyEnvironment() {
        final Map<String, String> env = Map.of(
                ApplicationConfig.ENV_DATA_DIR, " /var/lib/polyglot ",
                ApplicationConfig.ENV_GHOST_THRESHOLD_MINUTES, "90",
                ApplicationConfig.ENV_THREAD_POOL_SIZE, "4");

        final ApplicationConfig config = ApplicationConfig.load(tempDir.resolve("missing.yaml"), env::get);

        assertThat(config.getDataPath()).isEqualTo("/var/lib/polyglot");
        assertThat(config.getGhostThreshold()).isEqualTo(Duration.ofMinutes(90));
        assertThat(config.getThreadPoolSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should ignore malformed numeric environment values")
    void shouldIgnoreInvalidEnvironment() {
        final Map<String, String> env = Map.of(ApplicationConfig.ENV_THREAD_POOL_SIZE, "many");

        final ApplicationConfig config = ApplicationConfig.load(tempDir.resolve("missing.yaml"), env::get);

        assertThat(config.getThreadPoolSize()).isEqualTo(2);
    }
}
