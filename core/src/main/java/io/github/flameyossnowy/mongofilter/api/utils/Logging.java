package io.github.flameyossnowy.mongofilter.api.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Library-wide logging switchboard. {@code info} messages need {@link #ENABLED}, {@code deepInfo}
 * messages additionally need {@link #DEEP}; warnings and errors are always forwarded.
 */
public final class Logging {
    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("mongofilter");

    private Logging() {
        throw new AssertionError("No instances");
    }

    public static void info(String message) {
        if (ENABLED) LOGGER.info(message);
    }

    public static void info(Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) LOGGER.info(message.get());
    }

    public static void deepInfo(String message) {
        if (ENABLED && DEEP) LOGGER.debug(message);
    }

    public static void deepInfo(Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) LOGGER.debug(message.get());
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }
}
