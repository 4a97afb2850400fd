package tally.core.error;

import tally.core.exception.UnreachableException;
import tally.core.util.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * A stateless class that renders an {@link ErrorPayload} into a single block of text in the familiar stack trace
 * layout:
 *
 * <pre>
 * java.lang.AssertionError: expected 1 but was 2
 * 	at com.example.FooTest.adds(FooTest.java:12)
 * Caused by: java.lang.IllegalStateException: boom
 * 	at ...
 * </pre>
 *
 * Formatting never throws. If the payload cannot be rendered, the result is {@link #FORMAT_FAILURE_MARKER} followed
 * by the trace of whatever went wrong while rendering it.
 */
public final class ErrorFormatter {
    private static final Logger LOGGER = Logger.forClass(ErrorFormatter.class);
    public static final String FORMAT_FAILURE_MARKER = "*FAILED TO GET TRACEBACK*: ";
    private static final String CAUSE_PREFIX = "Caused by: ";
    private static final String FRAME_PREFIX = "\tat ";

    /**
     * Formats the specified payload.
     *
     * @param payload The payload to format.
     * @return the formatted text, never null or empty.
     */
    public static String format(ErrorPayload payload) {
        try {
            StringBuilder builder = new StringBuilder();

            if (payload instanceof ErrorPayload.Structured) {
                Throwable value = ((ErrorPayload.Structured) payload).value;
                appendHeader(builder, payload.category, value.getLocalizedMessage());
                appendFrames(builder, payload.trace);
                appendCauses(builder, value);
            } else if (payload instanceof ErrorPayload.Text) {
                appendHeader(builder, payload.category, ((ErrorPayload.Text) payload).message);
                appendFrames(builder, payload.trace);
            } else {
                throw new UnreachableException("unknown error payload: " + payload);
            }

            return builder.toString();
        } catch (Throwable e) {
            return describeFormatFailure(e);
        }
    }

    /**
     * Renders the failure that interrupted formatting. If even that cannot be printed, only the failure's class name
     * is used.
     */
    private static String describeFormatFailure(Throwable failure) {
        try {
            LOGGER.log("Failed to format error payload.", failure);
            StringWriter trace = new StringWriter();
            failure.printStackTrace(new PrintWriter(trace));
            return FORMAT_FAILURE_MARKER + trace;
        } catch (Throwable e) {
            return FORMAT_FAILURE_MARKER + failure.getClass().getName();
        }
    }

    private static void appendHeader(StringBuilder builder, Class<?> category, String message) {
        builder.append(category.getName());
        if (message != null) {
            builder.append(": ").append(message);
        }
        builder.append('\n');
    }

    private static void appendFrames(StringBuilder builder, StackTraceElement[] frames) {
        for (StackTraceElement frame : frames) {
            builder.append(FRAME_PREFIX).append(frame).append('\n');
        }
    }

    private static void appendCauses(StringBuilder builder, Throwable value) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(value);

        Throwable cause = value.getCause();
        while (cause != null && seen.add(cause)) {
            builder.append(CAUSE_PREFIX).append(cause).append('\n');
            appendFrames(builder, cause.getStackTrace());
            cause = cause.getCause();
        }
    }
}
