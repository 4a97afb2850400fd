package tally.core.adapter;

import tally.core.error.ErrorPayload;
import tally.core.handle.TestHandle;

/**
 * The callbacks a host test framework drives while it executes tests.
 *
 * For every test the host calls {@link #onStart(TestHandle)}, then at most one outcome callback, then
 * {@link #onFinish(TestHandle)}. The one exception is {@link #onError(TestHandle, ErrorPayload)} for a
 * collection-error handle, which stands alone.
 */
public interface TestLifecycleListener {

    public void onStart(TestHandle test);

    public void onSuccess(TestHandle test);

    public void onFailure(TestHandle test, ErrorPayload error);

    public void onError(TestHandle test, ErrorPayload error);

    /**
     * @param test The skipped test.
     * @param reason Why it was skipped, possibly null or empty.
     */
    public void onSkip(TestHandle test, String reason);

    public void onExpectedFailure(TestHandle test, ErrorPayload error);

    public void onUnexpectedSuccess(TestHandle test);

    public void onFinish(TestHandle test);
}
