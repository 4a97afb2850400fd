package tally.core.util;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 *
 * Log lines go to stderr so that they never interleave with the reporting events, which are written to stdout by
 * default.
 */
public final class Logger {
    private static volatile boolean globalEnabled = true;
    private final String className;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Logs the specified message to stderr if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled) {
            System.err.println(this.className + ": " + message);
        }
    }

    /**
     * Logs the specified message followed by the stack trace of the given throwable if logging is enabled.
     *
     * @param message The message to log.
     * @param throwable The throwable whose trace is appended.
     */
    public void log(String message, Throwable throwable) {
        if (globalEnabled) {
            StringWriter trace = new StringWriter();
            throwable.printStackTrace(new PrintWriter(trace));
            System.err.println(this.className + ": " + message + System.lineSeparator() + trace);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled: " + globalEnabled + " }";
    }
}
