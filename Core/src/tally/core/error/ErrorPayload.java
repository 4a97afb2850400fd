package tally.core.error;

/**
 * The error reported alongside a failing, erroring or expectedly-failing test: a category, a value and a trace.
 *
 * The value is either a real {@link Throwable} ({@link Structured}) or, for hosts that only hand over a message, bare
 * text ({@link Text}). Both render the same way through {@link ErrorFormatter}.
 *
 * No component is validated here. A malformed payload is still a payload, and {@link ErrorFormatter} degrades
 * gracefully when it meets one.
 */
public abstract class ErrorPayload {
    public final Class<?> category;
    public final StackTraceElement[] trace;

    private ErrorPayload(Class<?> category, StackTraceElement[] trace) {
        this.category = category;
        this.trace = trace;
    }

    /**
     * Returns a structured payload built from the throwable's own class and stack trace.
     *
     * @param throwable The error.
     * @return the payload.
     */
    public static ErrorPayload of(Throwable throwable) {
        return structured(throwable.getClass(), throwable, throwable.getStackTrace());
    }

    public static ErrorPayload structured(Class<?> category, Throwable value, StackTraceElement[] trace) {
        return new Structured(category, value, trace);
    }

    public static ErrorPayload text(Class<?> category, String message, StackTraceElement[] trace) {
        return new Text(category, message, trace);
    }

    public static final class Structured extends ErrorPayload {
        public final Throwable value;

        private Structured(Class<?> category, Throwable value, StackTraceElement[] trace) {
            super(category, trace);
            this.value = value;
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName() + " { category: " + this.category + ", value: " + this.value + " }";
        }
    }

    public static final class Text extends ErrorPayload {
        public final String message;

        private Text(Class<?> category, String message, StackTraceElement[] trace) {
            super(category, trace);
            this.message = message;
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName() + " { category: " + this.category + ", message: " + this.message + " }";
        }
    }
}
