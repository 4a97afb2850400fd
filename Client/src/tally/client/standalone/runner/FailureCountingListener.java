package tally.client.standalone.runner;

import tally.core.adapter.TestLifecycleListener;
import tally.core.error.ErrorPayload;
import tally.core.handle.TestHandle;
import tally.core.util.ObjectChecker;

/**
 * A {@link TestLifecycleListener} that forwards every callback and counts the ones that end up reported as failed:
 * failures, errors (collection errors included) and unexpected successes. Expected failures and skips do not count.
 */
final class FailureCountingListener implements TestLifecycleListener {
    private final TestLifecycleListener delegate;
    private int failedCount = 0;

    private FailureCountingListener(TestLifecycleListener delegate) {
        ObjectChecker.assertNonNull(delegate);
        this.delegate = delegate;
    }

    static FailureCountingListener wrapping(TestLifecycleListener delegate) {
        return new FailureCountingListener(delegate);
    }

    int failedCount() {
        return this.failedCount;
    }

    @Override
    public void onStart(TestHandle test) {
        this.delegate.onStart(test);
    }

    @Override
    public void onSuccess(TestHandle test) {
        this.delegate.onSuccess(test);
    }

    @Override
    public void onFailure(TestHandle test, ErrorPayload error) {
        this.failedCount++;
        this.delegate.onFailure(test, error);
    }

    @Override
    public void onError(TestHandle test, ErrorPayload error) {
        this.failedCount++;
        this.delegate.onError(test, error);
    }

    @Override
    public void onSkip(TestHandle test, String reason) {
        this.delegate.onSkip(test, reason);
    }

    @Override
    public void onExpectedFailure(TestHandle test, ErrorPayload error) {
        this.delegate.onExpectedFailure(test, error);
    }

    @Override
    public void onUnexpectedSuccess(TestHandle test) {
        this.failedCount++;
        this.delegate.onUnexpectedSuccess(test);
    }

    @Override
    public void onFinish(TestHandle test) {
        this.delegate.onFinish(test);
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { failed: " + this.failedCount + ", delegate: " + this.delegate + " }";
    }
}
