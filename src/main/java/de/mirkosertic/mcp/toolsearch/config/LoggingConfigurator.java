package de.mirkosertic.mcp.toolsearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Selects the Logback configuration for the active profile.
 * <p>
 * The MCP STDIO transport owns stdout, so in deployed mode logging is switched to
 * {@code logback-deployed.xml}, which writes to {@code ~/.mcptoolsearch/log} only. The
 * default profile keeps {@code logback.xml}, which logs to stderr.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "toolsearch.log.dir";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging. Call this before anything else logs.
     *
     * @param deployedMode true when running as a deployed STDIO server
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDir = ApplicationConfig.getConfigDirectory().resolve("log");
        System.setProperty(LOG_DIR_PROPERTY, logDir.toString());
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
        reconfigure(DEPLOYED_CONFIG);
    }

    private static void reconfigure(final String resource) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream config = LoggingConfigurator.class.getClassLoader().getResourceAsStream(resource)) {
            if (config == null) {
                System.err.println("Warning: " + resource + " not found on classpath, keeping default logging");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(config);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Could not apply " + resource + ": " + e.getMessage());
        }
    }
}
