package tally.core.sink;

import com.google.gson.JsonObject;
import tally.core.util.ObjectChecker;

import java.io.PrintStream;

/**
 * A sink that writes each event as a single-line JSON object, for consumers that would rather not parse service
 * messages.
 */
public final class JsonMessageSink implements MessageSink {
    private final PrintStream stream;

    private JsonMessageSink(PrintStream stream) {
        ObjectChecker.assertNonNull(stream);
        this.stream = stream;
    }

    public static JsonMessageSink toStream(PrintStream stream) {
        return new JsonMessageSink(stream);
    }

    @Override
    public void testStarted(String testIdentity) {
        write(newEvent("testStarted", testIdentity));
    }

    @Override
    public void testFinished(String testIdentity, long durationMillis) {
        JsonObject event = newEvent("testFinished", testIdentity);
        event.addProperty("duration_ms", durationMillis);
        write(event);
    }

    @Override
    public void testFailed(String testIdentity, String message, String details) {
        JsonObject event = newEvent("testFailed", testIdentity);
        event.addProperty("message", message);
        event.addProperty("details", details);
        write(event);
    }

    @Override
    public void testIgnored(String testIdentity, String message) {
        JsonObject event = newEvent("testIgnored", testIdentity);
        event.addProperty("message", message);
        write(event);
    }

    private static JsonObject newEvent(String eventName, String testIdentity) {
        JsonObject event = new JsonObject();
        event.addProperty("event", eventName);
        event.addProperty("name", testIdentity);
        return event;
    }

    private void write(JsonObject event) {
        this.stream.println(event.toString());
        this.stream.flush();
    }

    @Override
    public String toString() {
        return this.getClass().getName();
    }
}
