package com.leakguard.logging;

import ch.qos.logback.classic.Level;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level switch for the CLI's verbose flag.
 */
public final class LogSetup {
    private LogSetup() {}

    /**
     * Sets the root logger level. A no-op when SLF4J is bound to something other than Logback.
     */
    public static void setRootLevel(Level level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        Logger root = factory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
        }
    }
}
