package tally.client.standalone.runner;

import org.junit.runner.JUnitCore;
import org.junit.runner.Result;
import tally.core.adapter.TestLifecycleListener;
import tally.core.error.ErrorPayload;
import tally.core.handle.TestHandle;
import tally.core.junit.JUnitLifecycleBridge;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;

/**
 * A class that loads test classes by name and runs them with JUnit, reporting every lifecycle callback to a
 * {@link TestLifecycleListener}.
 *
 * A class that cannot be loaded is reported as a collection error labelled {@code "loadClass (<class name>)"} and is
 * otherwise skipped.
 */
public final class TestSuiteRunner {
    private static final Logger LOGGER = Logger.forClass(TestSuiteRunner.class);
    private final ClassLoader classLoader;
    private final TestLifecycleListener listener;

    private TestSuiteRunner(ClassLoader classLoader, TestLifecycleListener listener) {
        ObjectChecker.assertNonNull(classLoader, listener);
        this.classLoader = classLoader;
        this.listener = listener;
    }

    public static TestSuiteRunner withListener(ClassLoader classLoader, TestLifecycleListener listener) {
        return new TestSuiteRunner(classLoader, listener);
    }

    /**
     * Runs all of the loadable classes among the specified ones.
     *
     * @param classNames The fully qualified names of the test classes.
     * @return the outcome of the run.
     */
    public SuiteOutcome run(List<String> classNames) {
        ObjectChecker.assertNonNull(classNames);
        FailureCountingListener counter = FailureCountingListener.wrapping(this.listener);

        List<Class<?>> testClasses = new ArrayList<>();
        int unloadableClasses = 0;
        for (String className : classNames) {
            try {
                testClasses.add(Class.forName(className, true, this.classLoader));
                LOGGER.log("Loaded test class " + className);
            } catch (ClassNotFoundException | LinkageError e) {
                LOGGER.log("Unable to load test class " + className, e);
                counter.onError(TestHandle.collectionError("loadClass (" + className + ")"), ErrorPayload.of(e));
                unloadableClasses++;
            }
        }

        JUnitCore core = new JUnitCore();
        core.addListener(JUnitLifecycleBridge.forListener(counter));
        Result result = core.run(testClasses.toArray(new Class<?>[0]));

        return new SuiteOutcome(result.getRunCount(), counter.failedCount(), result.getIgnoreCount(), unloadableClasses);
    }

    /**
     * The outcome of a run. {@code failureCount} is the number of outcomes reported as failed, so an expected failure
     * does not count and an unexpected success does. It includes the collection errors of unloadable classes. The
     * run and ignore counts are JUnit's.
     */
    public static final class SuiteOutcome {
        public final int runCount;
        public final int failureCount;
        public final int ignoreCount;
        public final int unloadableClassCount;

        public SuiteOutcome(int runCount, int failureCount, int ignoreCount, int unloadableClassCount) {
            this.runCount = runCount;
            this.failureCount = failureCount;
            this.ignoreCount = ignoreCount;
            this.unloadableClassCount = unloadableClassCount;
        }

        public boolean isSuccessful() {
            return this.failureCount == 0 && this.unloadableClassCount == 0;
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName() + " { run: " + this.runCount + ", failed: " + this.failureCount + ", ignored: " + this.ignoreCount + ", unloadable: " + this.unloadableClassCount + " }";
        }
    }
}
