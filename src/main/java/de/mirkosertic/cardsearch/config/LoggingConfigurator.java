package de.mirkosertic.cardsearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Switches Logback to the quiet configuration when search results are piped.
 * <p>
 * In quiet mode logback-quiet.xml is loaded, which only reports warnings and errors
 * on stderr so that stdout carries nothing but results.
 * <p>
 * Otherwise logback.xml is picked up automatically by Logback.
 */
public final class LoggingConfigurator {

    static final String QUIET_CONFIG = "logback-quiet.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first search so no INFO output leaks into piped results.
     *
     * @param quietMode true to load the quiet configuration
     * @return true if a configuration was (re)loaded
     */
    public static boolean configure(final boolean quietMode) {
        if (quietMode) {
            return loadConfiguration(QUIET_CONFIG);
        }
        return false;
    }

    private static boolean loadConfiguration(final String configFile) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            System.err.println("Warning: Logback is not the active SLF4J binding, cannot load " + configFile);
            return false;
        }
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return false;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
            return false;
        }
    }
}
