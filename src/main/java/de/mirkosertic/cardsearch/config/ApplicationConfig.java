package de.mirkosertic.cardsearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the card search engine.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.cardsearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CARDS_FILE = "CARDSEARCH_CARDS_FILE";
    private static final String ENV_RESULT_LIMIT = "CARDSEARCH_RESULT_LIMIT";
    private static final String PROP_CARDS_FILE = "cardsearch.cards.file";
    private static final String PROP_QUIET = "cardsearch.quiet";
    private static final String CONFIG_DIR = ".cardsearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Data settings
    private String cardsFile;
    private String setsFile;

    // Search settings
    private int resultLimit = 300;
    private long timeoutMs = 2000;
    private int parallelThreshold = 5000;
    private int threadPoolSize = 2;

    // Query settings
    private int maxClauses = 32;
    private long regexCacheSize = 1000;

    private boolean quietMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: cardsFile={}, setsFile={}, resultLimit={}, timeoutMs={}, maxClauses={}",
                config.cardsFile, config.setsFile, config.resultLimit, config.timeoutMs, config.maxClauses);

        return config;
    }

    /**
     * Built-in defaults only, ignoring every external source.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.cardsFile = "cards.json";
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("cardsearch");
        if (root == null) {
            return;
        }

        final Map<String, Object> dataConfig = (Map<String, Object>) root.get("data");
        if (dataConfig != null) {
            if (dataConfig.get("cards-file") != null) {
                this.cardsFile = resolveVariables(dataConfig.get("cards-file").toString());
            }
            if (dataConfig.get("sets-file") != null) {
                this.setsFile = resolveVariables(dataConfig.get("sets-file").toString());
            }
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) root.get("search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }

        final Map<String, Object> queryConfig = (Map<String, Object>) root.get("query");
        if (queryConfig != null) {
            if (queryConfig.containsKey("max-clauses")) {
                this.maxClauses = ((Number) queryConfig.get("max-clauses")).intValue();
            }
            if (queryConfig.containsKey("regex-cache-size")) {
                this.regexCacheSize = ((Number) queryConfig.get("regex-cache-size")).longValue();
            }
        }
    }

    private void applySearchConfig(final Map<String, Object> searchConfig) {
        if (searchConfig.containsKey("result-limit")) {
            this.resultLimit = ((Number) searchConfig.get("result-limit")).intValue();
        }
        if (searchConfig.containsKey("timeout-ms")) {
            this.timeoutMs = ((Number) searchConfig.get("timeout-ms")).longValue();
        }
        if (searchConfig.containsKey("parallel-threshold")) {
            this.parallelThreshold = ((Number) searchConfig.get("parallel-threshold")).intValue();
        }
        if (searchConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) searchConfig.get("thread-pool-size")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envCardsFile = System.getenv(ENV_CARDS_FILE);
        if (envCardsFile != null && !envCardsFile.trim().isEmpty()) {
            this.cardsFile = envCardsFile.trim();
            logger.info("Cards file from environment: {}", this.cardsFile);
        }

        final String propCardsFile = System.getProperty(PROP_CARDS_FILE);
        if (propCardsFile != null && !propCardsFile.isEmpty()) {
            this.cardsFile = propCardsFile;
        }

        if (this.cardsFile == null || this.cardsFile.isEmpty()) {
            this.cardsFile = "cards.json";
        }

        final String envResultLimit = System.getenv(ENV_RESULT_LIMIT);
        if (envResultLimit != null && !envResultLimit.trim().isEmpty()) {
            try {
                this.resultLimit = Integer.parseInt(envResultLimit.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}: {}", ENV_RESULT_LIMIT, envResultLimit);
            }
        }

        this.quietMode = Boolean.parseBoolean(System.getProperty(PROP_QUIET, "false"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
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

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
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

    public void setQuietMode(final boolean quietMode) {
        this.quietMode = quietMode;
    }

    // Getters
    public String getCardsFile() {
        return cardsFile;
    }

    /**
     * The set list with TCG release dates, or null or empty if none is configured.
     */
    public String getSetsFile() {
        return setsFile;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getMaxClauses() {
        return maxClauses;
    }

    public long getRegexCacheSize() {
        return regexCacheSize;
    }

    public boolean isQuietMode() {
        return quietMode;
    }
}
