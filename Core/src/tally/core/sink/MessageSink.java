package tally.core.sink;

/**
 * The receiving end of the reporting events. Every event is addressed by test identity.
 *
 * Implementations must deliver events in exactly the order they are called, since consumers rebuild the nesting of
 * start and finish events positionally.
 */
public interface MessageSink {

    public void testStarted(String testIdentity);

    /**
     * @param testIdentity The test.
     * @param durationMillis The elapsed wall time of the test, never negative.
     */
    public void testFinished(String testIdentity, long durationMillis);

    public void testFailed(String testIdentity, String message, String details);

    public void testIgnored(String testIdentity, String message);
}
