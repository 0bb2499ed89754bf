package net.imagetools.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Helpers for logging warnings and errors with an optional cause appended to the
 * placeholder arguments, so call sites don't juggle varargs arrays.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.error(message, withCause(throwable, args));
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        logger.warn(message, withCause(throwable, args));
    }

    /**
     * Root-cause message for compact single-line logs.
     */
    public static String rootMessage(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return current.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static Object[] withCause(Throwable throwable, Object... args) {
        Object[] base = (args == null) ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
