package tally.core.junit;

import org.junit.Ignore;
import org.junit.runner.Description;
import org.junit.runner.Result;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunListener;
import tally.core.adapter.TestLifecycleListener;
import tally.core.error.ErrorPayload;
import tally.core.handle.TestHandle;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.HashSet;
import java.util.Set;

/**
 * A JUnit 4 {@link RunListener} that drives a {@link TestLifecycleListener}.
 *
 * JUnit does not report every test the same way, so this class evens out the differences:
 * <ul>
 *     <li>Ignored tests are never started or finished by JUnit. They are reported here as started, skipped and
 *     finished.</li>
 *     <li>A failing {@code @BeforeClass} or {@code @AfterClass} hook is reported against the class description
 *     without any test being started. It is handed over as a collection error.</li>
 *     <li>JUnit has no success notification. A test that finishes without an outcome is reported as a success.</li>
 *     <li>JUnit reports every throwable of a test separately, for example a failing body and a failing
 *     {@code @After}. Only the first one becomes the test's outcome.</li>
 * </ul>
 */
public final class JUnitLifecycleBridge extends RunListener {
    private static final Logger LOGGER = Logger.forClass(JUnitLifecycleBridge.class);
    private final TestLifecycleListener listener;
    private final Set<String> classesWithStartedTests = new HashSet<>();
    private final Set<Description> testsWithOutcome = new HashSet<>();

    private JUnitLifecycleBridge(TestLifecycleListener listener) {
        ObjectChecker.assertNonNull(listener);
        this.listener = listener;
    }

    public static JUnitLifecycleBridge forListener(TestLifecycleListener listener) {
        return new JUnitLifecycleBridge(listener);
    }

    @Override
    public void testRunStarted(Description description) {
        LOGGER.log("Run started with " + description.testCount() + " tests.");
    }

    @Override
    public void testRunFinished(Result result) {
        LOGGER.log("Run finished. Ran: " + result.getRunCount() + ", failed: " + result.getFailureCount() + ", ignored: " + result.getIgnoreCount() + ", time: " + result.getRunTime() + "ms");
    }

    @Override
    public void testStarted(Description description) {
        this.classesWithStartedTests.add(description.getClassName());
        this.listener.onStart(toHandle(description));
    }

    @Override
    public void testFailure(Failure failure) {
        Description description = failure.getDescription();
        ErrorPayload error = ErrorPayload.of(failure.getException());

        if (description.getMethodName() == null) {
            this.listener.onError(toCollectionErrorHandle(description), error);
            return;
        }

        if (!this.testsWithOutcome.add(description)) {
            LOGGER.log("Dropping additional failure of " + description.getDisplayName() + ", an outcome was already reported.", failure.getException());
            return;
        }

        TestHandle test = toHandle(description);
        if (description.getAnnotation(ExpectedFailure.class) != null) {
            this.listener.onExpectedFailure(test, error);
        } else if (failure.getException() instanceof AssertionError) {
            this.listener.onFailure(test, error);
        } else {
            this.listener.onError(test, error);
        }
    }

    @Override
    public void testAssumptionFailure(Failure failure) {
        Description description = failure.getDescription();
        String reason = failure.getException() == null ? null : failure.getException().getMessage();

        if (description.getMethodName() == null) {
            if (this.classesWithStartedTests.contains(description.getClassName())) {
                // The assumption failed in an @AfterClass hook and every test already has its outcome.
                LOGGER.log("Ignoring assumption failure after the tests of " + description.getClassName() + " ran: " + reason);
            } else {
                skipAll(description, reason);
            }
            return;
        }

        if (!this.testsWithOutcome.add(description)) {
            LOGGER.log("Dropping assumption failure of " + description.getDisplayName() + ", an outcome was already reported: " + reason);
            return;
        }

        this.listener.onSkip(toHandle(description), reason);
    }

    @Override
    public void testIgnored(Description description) {
        Ignore ignore = description.getAnnotation(Ignore.class);
        skipAll(description, ignore == null ? null : ignore.value());
    }

    @Override
    public void testFinished(Description description) {
        TestHandle test = toHandle(description);

        if (!this.testsWithOutcome.remove(description)) {
            if (description.getAnnotation(ExpectedFailure.class) != null) {
                this.listener.onUnexpectedSuccess(test);
            } else {
                this.listener.onSuccess(test);
            }
        }

        this.listener.onFinish(test);
    }

    private void skipAll(Description description, String reason) {
        if (description.isTest()) {
            TestHandle test = toHandle(description);
            this.listener.onStart(test);
            this.listener.onSkip(test, reason);
            this.listener.onFinish(test);
            return;
        }

        for (Description child : description.getChildren()) {
            skipAll(child, reason);
        }
    }

    /**
     * Returns a handle named {@code <class name>.<method name>}, described by the method's {@link Summary} if it has
     * one. A description without a method, such as that of an ignored class, is named after the class alone.
     */
    static TestHandle toHandle(Description description) {
        Summary summary = description.getAnnotation(Summary.class);
        String methodName = description.getMethodName();
        String id = methodName == null ? description.getClassName() : description.getClassName() + "." + methodName;
        return TestHandle.regular(id, summary == null ? null : summary.value());
    }

    /**
     * Returns a collection-error handle labelled {@code "beforeClass (<class name>)"} if no test of the class has
     * started yet, and {@code "afterClass (<class name>)"} otherwise.
     */
    private TestHandle toCollectionErrorHandle(Description description) {
        String className = description.getClassName();
        String fixture = this.classesWithStartedTests.contains(className) ? "afterClass" : "beforeClass";
        return TestHandle.collectionError(fixture + " (" + className + ")");
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { listener: " + this.listener + " }";
    }
}
