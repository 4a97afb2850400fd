package tally.core.sink;

import tally.core.util.ObjectChecker;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * A sink that writes each event as a TeamCity service message line, for example:
 *
 * <pre>
 * ##teamcity[testFailed details='...' message='Failure' name='com.example.FooTest.adds' timestamp='2024-01-01T10:00:00.000']
 * </pre>
 *
 * Attributes are written in sorted order and the stream is flushed after every message.
 */
public final class ServiceMessageSink implements MessageSink {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");
    private final PrintStream stream;
    private final Clock clock;

    private ServiceMessageSink(PrintStream stream, Clock clock) {
        ObjectChecker.assertNonNull(stream, clock);
        this.stream = stream;
        this.clock = clock;
    }

    public static ServiceMessageSink toStream(PrintStream stream) {
        return new ServiceMessageSink(stream, Clock.systemDefaultZone());
    }

    /**
     * Constructs a sink that stamps its messages with the time read from the given clock.
     *
     * @param stream The stream to write to.
     * @param clock The clock to stamp messages with.
     * @return the new sink.
     */
    public static ServiceMessageSink toStream(PrintStream stream, Clock clock) {
        return new ServiceMessageSink(stream, clock);
    }

    @Override
    public void testStarted(String testIdentity) {
        Map<String, String> attributes = new TreeMap<>();
        attributes.put("name", testIdentity);
        write("testStarted", attributes);
    }

    @Override
    public void testFinished(String testIdentity, long durationMillis) {
        Map<String, String> attributes = new TreeMap<>();
        attributes.put("name", testIdentity);
        attributes.put("duration", Long.toString(durationMillis));
        write("testFinished", attributes);
    }

    @Override
    public void testFailed(String testIdentity, String message, String details) {
        Map<String, String> attributes = new TreeMap<>();
        attributes.put("name", testIdentity);
        attributes.put("message", message);
        attributes.put("details", details);
        write("testFailed", attributes);
    }

    @Override
    public void testIgnored(String testIdentity, String message) {
        Map<String, String> attributes = new TreeMap<>();
        attributes.put("name", testIdentity);
        attributes.put("message", message);
        write("testIgnored", attributes);
    }

    private void write(String messageName, Map<String, String> attributes) {
        attributes.put("timestamp", LocalDateTime.now(this.clock).format(TIMESTAMP_FORMAT));

        StringBuilder message = new StringBuilder("##teamcity[").append(messageName);
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            if (attribute.getValue() != null) {
                message.append(' ').append(attribute.getKey()).append("='").append(escape(attribute.getValue())).append('\'');
            }
        }
        message.append(']');

        this.stream.println(message);
        this.stream.flush();
    }

    /**
     * Escapes the specified attribute value so that it can be safely placed between single quotes in a service
     * message.
     *
     * @param value The value to escape.
     * @return the escaped value.
     */
    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '|': escaped.append("||"); break;
                case '\'': escaped.append("|'"); break;
                case '\n': escaped.append("|n"); break;
                case '\r': escaped.append("|r"); break;
                case '[': escaped.append("|["); break;
                case ']': escaped.append("|]"); break;
                case '\u0085': escaped.append("|x"); break;
                case '\u2028': escaped.append("|l"); break;
                case '\u2029': escaped.append("|p"); break;
                default: escaped.append(c);
            }
        }
        return escaped.toString();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { clock: " + this.clock + " }";
    }
}
