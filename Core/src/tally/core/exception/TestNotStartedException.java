package tally.core.exception;

/**
 * Thrown when a test is finished under an identity that has no recorded start, meaning the host framework called its
 * callbacks out of order.
 */
public final class TestNotStartedException extends IllegalStateException {
    public final String testIdentity;

    public TestNotStartedException(String testIdentity) {
        super("test finished without a matching start: " + testIdentity);
        this.testIdentity = testIdentity;
    }
}
