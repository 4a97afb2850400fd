package tally.core.helper;

import tally.core.sink.MessageSink;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A sink that keeps every event it receives, in order.
 */
public final class RecordingMessageSink implements MessageSink {
    public final List<Event> events = new ArrayList<>();

    @Override
    public void testStarted(String testIdentity) {
        this.events.add(new Event("testStarted", testIdentity, null, null, -1));
    }

    @Override
    public void testFinished(String testIdentity, long durationMillis) {
        this.events.add(new Event("testFinished", testIdentity, null, null, durationMillis));
    }

    @Override
    public void testFailed(String testIdentity, String message, String details) {
        this.events.add(new Event("testFailed", testIdentity, message, details, -1));
    }

    @Override
    public void testIgnored(String testIdentity, String message) {
        this.events.add(new Event("testIgnored", testIdentity, message, null, -1));
    }

    /**
     * @return each event as {@code "<event> <identity>"}.
     */
    public List<String> summary() {
        return this.events.stream().map(e -> e.name + " " + e.testIdentity).collect(Collectors.toList());
    }

    public Event get(int index) {
        return this.events.get(index);
    }

    public Event first(String eventName) {
        for (Event event : this.events) {
            if (event.name.equals(eventName)) {
                return event;
            }
        }
        throw new AssertionError("no " + eventName + " event in " + summary());
    }

    public static final class Event {
        public final String name;
        public final String testIdentity;
        public final String message;
        public final String details;
        public final long durationMillis;

        private Event(String name, String testIdentity, String message, String details, long durationMillis) {
            this.name = name;
            this.testIdentity = testIdentity;
            this.message = message;
            this.details = details;
            this.durationMillis = durationMillis;
        }

        @Override
        public String toString() {
            return this.name + " " + this.testIdentity + " { message: " + this.message + ", duration: " + this.durationMillis + " }";
        }
    }
}
