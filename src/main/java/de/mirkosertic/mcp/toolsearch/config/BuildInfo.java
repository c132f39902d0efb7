package de.mirkosertic.mcp.toolsearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, read from the Maven-filtered
 * {@code build-info.properties}. Runs from an IDE without filtering report
 * {@code dev} and {@code unknown}.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String RESOURCE = "build-info.properties";
    private static final String UNFILTERED_MARKER = "${";

    private static Properties properties;

    private static final String VERSION = read("build.version", "dev");
    private static final String BUILD_TIMESTAMP = read("build.timestamp", "unknown");

    private BuildInfo() {
    }

    public static String getVersion() {
        return VERSION;
    }

    public static String getBuildTimestamp() {
        return BUILD_TIMESTAMP;
    }

    /**
     * Version and timestamp in one line, for log output.
     */
    public static String describe() {
        return VERSION + " (built " + BUILD_TIMESTAMP + ")";
    }

    private static synchronized String read(final String key, final String fallback) {
        if (properties == null) {
            properties = new Properties();
            try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (input != null) {
                    properties.load(input);
                } else {
                    logger.debug("{} not found, using development defaults", RESOURCE);
                }
            } catch (final IOException e) {
                logger.warn("Failed to read {}, using development defaults", RESOURCE, e);
            }
        }
        final String value = properties.getProperty(key);
        if (value == null || value.isBlank() || value.contains(UNFILTERED_MARKER)) {
            return fallback;
        }
        return value.trim();
    }
}
