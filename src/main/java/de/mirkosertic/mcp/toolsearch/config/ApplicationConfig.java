package de.mirkosertic.mcp.toolsearch.config;

import de.mirkosertic.mcp.toolsearch.SearchOptions;
import org.jspecify.annotations.Nullable;
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
 * Central configuration for the MCP Tool Search Server application.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.mcptoolsearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CATALOG_PATH = "TOOLSEARCH_CATALOG_PATH";
    private static final String ENV_SYNONYMS_PATH = "TOOLSEARCH_SYNONYMS_PATH";
    private static final String PROP_CATALOG_PATH = "toolsearch.catalog.path";
    private static final String PROP_PROFILE = "toolsearch.profile";
    private static final String CONFIG_DIR = ".mcptoolsearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String DEFAULT_CATALOG_FILE = "catalog.yaml";

    // Catalog and dictionary
    private String catalogPath;
    private @Nullable String synonymsPath;

    // Search defaults
    private double threshold = SearchOptions.DEFAULT_THRESHOLD;
    private int limit = SearchOptions.DEFAULT_LIMIT;
    private boolean useSynonyms = SearchOptions.DEFAULT_USE_SYNONYMS;

    // Tokenizer
    private long tokenizerCacheSize = 10_000;

    // Profile settings
    private boolean deployedMode = false;

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

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: catalogPath={}, synonymsPath={}, threshold={}, limit={}, useSynonyms={}, deployedMode={}",
                config.catalogPath, config.synonymsPath, config.threshold, config.limit, config.useSynonyms,
                config.deployedMode);

        return config;
    }

    /**
     * Configuration built only from a YAML map, without classpath defaults, user file or
     * environment.
     */
    public static ApplicationConfig fromYaml(final Map<String, Object> yaml) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yaml);
        if (config.catalogPath == null || config.catalogPath.isEmpty()) {
            config.catalogPath = getConfigDirectory().resolve(DEFAULT_CATALOG_FILE).toString();
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
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
        // Navigate to toolsearch section
        final Map<String, Object> toolsearchConfig = (Map<String, Object>) config.get("toolsearch");
        if (toolsearchConfig == null) {
            return;
        }

        final Map<String, Object> catalogConfig = (Map<String, Object>) toolsearchConfig.get("catalog");
        if (catalogConfig != null && catalogConfig.get("path") != null) {
            this.catalogPath = resolveVariables(catalogConfig.get("path").toString());
        }

        final Map<String, Object> synonymsConfig = (Map<String, Object>) toolsearchConfig.get("synonyms");
        if (synonymsConfig != null && synonymsConfig.get("path") != null) {
            final String path = resolveVariables(synonymsConfig.get("path").toString());
            this.synonymsPath = path.isBlank() ? null : path;
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) toolsearchConfig.get("search");
        if (searchConfig != null) {
            applySearchConfig(searchConfig);
        }

        final Map<String, Object> tokenizerConfig = (Map<String, Object>) toolsearchConfig.get("tokenizer");
        if (tokenizerConfig != null && tokenizerConfig.containsKey("cache-size")) {
            this.tokenizerCacheSize = ((Number) tokenizerConfig.get("cache-size")).longValue();
        }
    }

    private void applySearchConfig(final Map<String, Object> searchConfig) {
        if (searchConfig.containsKey("threshold")) {
            this.threshold = ((Number) searchConfig.get("threshold")).doubleValue();
        }
        if (searchConfig.containsKey("limit")) {
            this.limit = ((Number) searchConfig.get("limit")).intValue();
        }
        if (searchConfig.containsKey("use-synonyms")) {
            this.useSynonyms = (Boolean) searchConfig.get("use-synonyms");
        }
    }

    private void applyEnvironmentOverrides() {
        final String envCatalogPath = System.getenv(ENV_CATALOG_PATH);
        if (envCatalogPath != null && !envCatalogPath.trim().isEmpty()) {
            this.catalogPath = envCatalogPath.trim();
            logger.info("Catalog path from environment: {}", this.catalogPath);
        }

        final String envSynonymsPath = System.getenv(ENV_SYNONYMS_PATH);
        if (envSynonymsPath != null && !envSynonymsPath.trim().isEmpty()) {
            this.synonymsPath = envSynonymsPath.trim();
            logger.info("Synonym dictionary from environment: {}", this.synonymsPath);
        }

        // System property for catalog path
        final String propCatalogPath = System.getProperty(PROP_CATALOG_PATH);
        if (propCatalogPath != null && !propCatalogPath.isEmpty()) {
            this.catalogPath = propCatalogPath;
        }

        // Default catalog path if not set
        if (this.catalogPath == null || this.catalogPath.isEmpty()) {
            this.catalogPath = getConfigDirectory().resolve(DEFAULT_CATALOG_FILE).toString();
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfile();
    }

    /**
     * True when the system property {@code toolsearch.profile} (or {@code profile}) is {@code deployed}.
     * Readable before the configuration is loaded, so logging can be set up first.
     */
    public static boolean isDeployedProfile() {
        final String profile = System.getProperty(PROP_PROFILE, System.getProperty("profile", "default"));
        return "deployed".equalsIgnoreCase(profile);
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

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Search options used when a request does not specify its own.
     */
    public SearchOptions getDefaultSearchOptions() {
        return new SearchOptions(threshold, limit, useSynonyms);
    }

    // Getters
    public Path getCatalogPath() {
        return Paths.get(catalogPath);
    }

    public @Nullable Path getSynonymsPath() {
        return synonymsPath != null ? Paths.get(synonymsPath) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getLimit() {
        return limit;
    }

    public boolean isUseSynonyms() {
        return useSynonyms;
    }

    public long getTokenizerCacheSize() {
        return tokenizerCacheSize;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
