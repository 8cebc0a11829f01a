package org.adseller.server.log;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.spi.ExtendedLogger;

public class LoggerFactory {

    private LoggerFactory() {
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.isAnonymousClass()
                ? clazz.getEnclosingClass().getCanonicalName()
                : clazz.getCanonicalName());
    }

    public static Logger getLogger(String name) {
        return new Logger((ExtendedLogger) LogManager.getLogger(name));
    }
}
