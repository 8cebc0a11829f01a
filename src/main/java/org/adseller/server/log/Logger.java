package org.adseller.server.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Thin facade over Log4j 2 that keeps the caller location pointing at the class that logs.
 */
public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public void error(Object message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    public void error(String message, Object... params) {
        log(Level.ERROR, message, params);
    }

    public void warn(Object message) {
        log(Level.WARN, message, null);
    }

    public void warn(String message, Object... params) {
        log(Level.WARN, message, params);
    }

    public void info(String message, Object... params) {
        log(Level.INFO, message, params);
    }

    public void debug(String message, Object... params) {
        log(Level.DEBUG, message, params);
    }

    private void log(Level level, Object message, Throwable t) {
        delegate.logIfEnabled(FQCN, level, null, message, t);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, new FormattedMessage(message, params), null);
    }
}
