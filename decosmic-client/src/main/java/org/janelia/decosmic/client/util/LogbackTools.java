package org.janelia.decosmic.client.util;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Tools for manipulating logback logging levels from code.
 */
public class LogbackTools {

    public static final String DECOSMIC_LOGGER_NAME = "org.janelia.decosmic";

    public static void setRootLogLevel(final Level rootLogLevel) {
        setLogLevel(ROOT_LOGGER_NAME, rootLogLevel);
    }

    /**
     * Sets the level for all decosmic loggers.
     *
     * @param  levelName  level name (e.g. DEBUG); unknown names are rejected.
     *
     * @throws IllegalArgumentException
     *   if the level name is not a logback level.
     */
    public static void setDecosmicLogLevel(final String levelName)
            throws IllegalArgumentException {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            throw new IllegalArgumentException("unknown log level '" + levelName + "'");
        }
        setLogLevel(DECOSMIC_LOGGER_NAME, level);
    }

    public static void setLogLevel(final String loggerName,
                                   final Level logLevel) {
        getLogger(loggerName).setLevel(logLevel);
    }

    public static Level getEffectiveLevel(final String loggerName) {
        return getLogger(loggerName).getEffectiveLevel();
    }

    private static Logger getLogger(final String loggerName) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(loggerName);
        if (logger == null) {
            throw new IllegalArgumentException("logger with name '" + loggerName + "' not found");
        }
        return logger;
    }
}
