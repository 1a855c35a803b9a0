package de.mirkosertic.polyglot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Central configuration of the mirror manager.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.polyglot/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_DATA_DIR = "POLYGLOT_DATA_DIR";
    static final String ENV_GHOST_THRESHOLD_MINUTES = "POLYGLOT_GHOST_THRESHOLD_MINUTES";
    static final String ENV_THREAD_POOL_SIZE = "POLYGLOT_THREAD_POOL_SIZE";
    private static final String CONFIG_DIR = ".polyglot";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String CONFIGURATION_FILE = "configuration.json";

    private String dataPath;
    private long ghostThresholdMinutes = 30;
    private boolean cleanupOrphansOnStartup = true;
    private int threadPoolSize = 2;
    private boolean reconcileOnStartup = true;

    private final Function<String, String> environment;

    private ApplicationConfig(final Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath(), System::getenv);
    }

    static ApplicationConfig load(final Path userConfigPath, final Function<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig(environment);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Apply system properties and environment variables (highest priority)
        config.applyOverrides();

        logger.info("Configuration loaded: dataPath={}, ghostThresholdMinutes={}, threadPoolSize={}",
                config.dataPath, config.ghostThresholdMinutes, config.threadPoolSize);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> polyglotConfig = (Map<String, Object>) config.get("polyglot");
        if (polyglotConfig == null) {
            return;
        }

        final Map<String, Object> dataConfig = (Map<String, Object>) polyglotConfig.get("data");
        if (dataConfig != null && dataConfig.get("path") != null) {
            this.dataPath = resolveVariables(dataConfig.get("path").toString());
        }

        final Map<String, Object> mirrorConfig = (Map<String, Object>) polyglotConfig.get("mirror");
        if (mirrorConfig != null) {
            if (mirrorConfig.containsKey("ghost-threshold-minutes")) {
                this.ghostThresholdMinutes = ((Number) mirrorConfig.get("ghost-threshold-minutes")).longValue();
            }
            if (mirrorConfig.containsKey("cleanup-orphans-on-startup")) {
                this.cleanupOrphansOnStartup = (Boolean) mirrorConfig.get("cleanup-orphans-on-startup");
            }
        }

        final Map<String, Object> executorConfig = (Map<String, Object>) polyglotConfig.get("executor");
        if (executorConfig != null && executorConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) executorConfig.get("thread-pool-size")).intValue();
        }

        final Map<String, Object> accessConfig = (Map<String, Object>) polyglotConfig.get("access");
        if (accessConfig != null && accessConfig.containsKey("reconcile-on-startup")) {
            this.reconcileOnStartup = (Boolean) accessConfig.get("reconcile-on-startup");
        }
    }

    private void applyOverrides() {
        final String propDataPath = System.getProperty("polyglot.data.path");
        if (propDataPath != null && !propDataPath.isEmpty()) {
            this.dataPath = propDataPath;
        }

        final String envDataPath = environment.apply(ENV_DATA_DIR);
        if (envDataPath != null && !envDataPath.trim().isEmpty()) {
            this.dataPath = envDataPath.trim();
            logger.info("Data path from environment: {}", this.dataPath);
        }

        if (this.dataPath == null || this.dataPath.isEmpty()) {
            this.dataPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "data").toString();
        }

        final String envThreshold = environment.apply(ENV_GHOST_THRESHOLD_MINUTES);
        if (envThreshold != null && !envThreshold.trim().isEmpty()) {
            try {
                this.ghostThresholdMinutes = Long.parseLong(envThreshold.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}: {}", ENV_GHOST_THRESHOLD_MINUTES, envThreshold);
            }
        }

        final String envPoolSize = environment.apply(ENV_THREAD_POOL_SIZE);
        if (envPoolSize != null && !envPoolSize.trim().isEmpty()) {
            try {
                this.threadPoolSize = Integer.parseInt(envPoolSize.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}: {}", ENV_THREAD_POOL_SIZE, envPoolSize);
            }
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = environment.apply(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public String getDataPath() {
        return dataPath;
    }

    public Path getConfigurationFile() {
        return Paths.get(dataPath, CONFIGURATION_FILE);
    }

    public Duration getGhostThreshold() {
        return Duration.ofMinutes(ghostThresholdMinutes);
    }

    public boolean isCleanupOrphansOnStartup() {
        return cleanupOrphansOnStartup;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public boolean isReconcileOnStartup() {
        return reconcileOnStartup;
    }
}
