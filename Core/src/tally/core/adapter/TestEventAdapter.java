package tally.core.adapter;

import tally.core.error.ErrorFormatter;
import tally.core.error.ErrorPayload;
import tally.core.exception.TestNotStartedException;
import tally.core.handle.TestHandle;
import tally.core.handle.TestKind;
import tally.core.sink.MessageSink;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Turns host framework callbacks into reporting events on a {@link MessageSink}.
 *
 * Every started test produces a {@code testStarted} event, at most one {@code testFailed} or {@code testIgnored} event
 * and then a {@code testFinished} event carrying the elapsed time. A test that finishes without an outcome event
 * passed.
 *
 * An adapter keeps the start times of its open tests in a plain map and is meant to be driven from a single thread.
 * Each concurrently executing stream of tests needs its own adapter.
 */
public final class TestEventAdapter implements TestLifecycleListener {
    private static final Logger LOGGER = Logger.forClass(TestEventAdapter.class);
    static final String FAILURE_MESSAGE = "Failure";
    static final String ERROR_MESSAGE = "Error";
    static final String SKIPPED_MESSAGE = "Skipped";
    static final String EXPECTED_FAILURE_PREFIX = "Expected failure: ";
    static final String UNEXPECTED_SUCCESS_DETAILS = "Test should not succeed since it's marked with an expected-failure annotation";
    private final MessageSink sink;
    private final LongSupplier nanoClock;
    private final Map<String, Long> startTimesNanos = new HashMap<>();

    private TestEventAdapter(MessageSink sink, LongSupplier nanoClock) {
        ObjectChecker.assertNonNull(sink, nanoClock);
        this.sink = sink;
        this.nanoClock = nanoClock;
    }

    /**
     * Constructs a new adapter that emits its events to the given sink and times tests with {@link System#nanoTime()}.
     *
     * @param sink The sink to emit events to.
     * @return the new adapter.
     */
    public static TestEventAdapter forSink(MessageSink sink) {
        return new TestEventAdapter(sink, System::nanoTime);
    }

    /**
     * Constructs a new adapter that emits its events to the given sink and times tests with the given clock.
     *
     * @param sink The sink to emit events to.
     * @param nanoClock A monotonic source of nanoseconds.
     * @return the new adapter.
     */
    public static TestEventAdapter withClock(MessageSink sink, LongSupplier nanoClock) {
        return new TestEventAdapter(sink, nanoClock);
    }

    @Override
    public void onStart(TestHandle test) {
        String identity = TestIdentity.of(test);
        this.startTimesNanos.put(identity, this.nanoClock.getAsLong());
        this.sink.testStarted(identity);
    }

    @Override
    public void onSuccess(TestHandle test) {
        LOGGER.log("Test passed: " + TestIdentity.of(test));
    }

    @Override
    public void onFailure(TestHandle test, ErrorPayload error) {
        this.sink.testFailed(TestIdentity.of(test), FAILURE_MESSAGE, ErrorFormatter.format(error));
    }

    @Override
    public void onError(TestHandle test, ErrorPayload error) {
        String details = ErrorFormatter.format(error);

        if (test.kind() == TestKind.COLLECTION_ERROR) {
            // Nothing started this one, so it gets a complete start/fail/finish sequence of its own.
            String name = TestIdentity.fromCollectionErrorLabel(test.id());
            LOGGER.log("Reporting standalone error as " + name);
            this.sink.testStarted(name);
            this.sink.testFailed(name, FAILURE_MESSAGE, details);
            this.sink.testFinished(name, 0);
            return;
        }

        this.sink.testFailed(TestIdentity.of(test), ERROR_MESSAGE, details);
    }

    @Override
    public void onSkip(TestHandle test, String reason) {
        String message = (reason == null || reason.isEmpty()) ? SKIPPED_MESSAGE : SKIPPED_MESSAGE + ": " + reason;
        this.sink.testIgnored(TestIdentity.of(test), message);
    }

    @Override
    public void onExpectedFailure(TestHandle test, ErrorPayload error) {
        this.sink.testIgnored(TestIdentity.of(test), EXPECTED_FAILURE_PREFIX + ErrorFormatter.format(error));
    }

    @Override
    public void onUnexpectedSuccess(TestHandle test) {
        this.sink.testFailed(TestIdentity.of(test), FAILURE_MESSAGE, UNEXPECTED_SUCCESS_DETAILS);
    }

    /**
     * Emits the finish event for the specified test.
     *
     * @param test The finished test.
     * @throws TestNotStartedException If no start is recorded for this test.
     */
    @Override
    public void onFinish(TestHandle test) {
        String identity = TestIdentity.of(test);
        Long startNanos = this.startTimesNanos.remove(identity);
        if (startNanos == null) {
            throw new TestNotStartedException(identity);
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(this.nanoClock.getAsLong() - startNanos);
        this.sink.testFinished(identity, Math.max(0, elapsedMillis));
    }

    /**
     * @return the number of tests that were started but not yet finished.
     */
    public int openTestCount() {
        return this.startTimesNanos.size();
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { sink: " + this.sink + ", open tests: " + this.startTimesNanos.size() + " }";
    }
}
