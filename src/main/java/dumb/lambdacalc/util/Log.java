package dumb.lambdacalc.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

public class Log {

    private static final Logger logger = LoggerFactory.getLogger("lambdacalc");

    public static void debug(String message) {
        message(message, LogLevel.DEBUG);
    }

    /** Builds the message only when debug output is enabled. */
    public static void debug(Supplier<String> message) {
        if (logger.isDebugEnabled()) logger.debug(message.get());
    }

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case DEBUG -> logger.debug(message);
            case INFO -> logger.info(message);
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }

    public enum LogLevel {
        DEBUG, INFO, WARNING, ERROR
    }
}
