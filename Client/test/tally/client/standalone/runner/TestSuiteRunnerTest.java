package tally.client.standalone.runner;

import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import tally.core.adapter.TestEventAdapter;
import tally.core.junit.ExpectedFailure;
import tally.core.sink.MessageSink;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;

public class TestSuiteRunnerTest {
    private EventLog events;
    private TestSuiteRunner runner;

    @Before
    public void setup() {
        this.events = new EventLog();
        this.runner = TestSuiteRunner.withListener(getClass().getClassLoader(), TestEventAdapter.forSink(this.events));
    }

    @Test
    public void testPassingClass() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Collections.singletonList(Passing.class.getName()));

        Assert.assertTrue(outcome.isSuccessful());
        Assert.assertEquals(1, outcome.runCount);
        Assert.assertEquals(Arrays.asList("testStarted " + Passing.class.getName() + ".passes", "testFinished " + Passing.class.getName() + ".passes"), this.events.lines);
    }

    @Test
    public void testFailingClass() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Collections.singletonList(Failing.class.getName()));

        Assert.assertFalse(outcome.isSuccessful());
        Assert.assertEquals(1, outcome.failureCount);
        Assert.assertEquals("testFailed " + Failing.class.getName() + ".fails Failure", this.events.lines.get(1));
    }

    @Test
    public void testUnloadableClassIsReportedAndOthersStillRun() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Arrays.asList("com.example.MissingTest", Passing.class.getName()));

        Assert.assertFalse(outcome.isSuccessful());
        Assert.assertEquals(1, outcome.unloadableClassCount);
        Assert.assertEquals(1, outcome.runCount);
        Assert.assertEquals(Arrays.asList(
                "testStarted com.example.MissingTest.loadClass",
                "testFailed com.example.MissingTest.loadClass Failure",
                "testFinished com.example.MissingTest.loadClass",
                "testStarted " + Passing.class.getName() + ".passes",
                "testFinished " + Passing.class.getName() + ".passes"), this.events.lines);
        assertThat(this.events.details.get(0), startsWith("java.lang.ClassNotFoundException: com.example.MissingTest"));
    }

    @Test
    public void testFailingExpectedFailureIsSuccessful() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Collections.singletonList(KnownBug.class.getName()));

        Assert.assertTrue(outcome.isSuccessful());
        Assert.assertEquals(0, outcome.failureCount);
        assertThat(this.events.lines.get(1), startsWith("testIgnored " + KnownBug.class.getName() + ".fails Expected failure: java.lang.AssertionError: still broken"));
    }

    @Test
    public void testPassingExpectedFailureIsNotSuccessful() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Collections.singletonList(FixedBug.class.getName()));

        Assert.assertFalse(outcome.isSuccessful());
        Assert.assertEquals(1, outcome.failureCount);
        Assert.assertEquals("testFailed " + FixedBug.class.getName() + ".passes Failure", this.events.lines.get(1));
    }

    @Test
    public void testFailingBeforeClassIsNotSuccessful() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Collections.singletonList(BrokenSetup.class.getName()));

        Assert.assertFalse(outcome.isSuccessful());
        Assert.assertEquals(1, outcome.failureCount);
        Assert.assertEquals("testFailed " + BrokenSetup.class.getName() + ".beforeClass Failure", this.events.lines.get(1));
    }

    @Test
    public void testEmptyRun() {
        TestSuiteRunner.SuiteOutcome outcome = this.runner.run(Collections.<String>emptyList());

        Assert.assertTrue(outcome.isSuccessful());
        Assert.assertEquals(0, outcome.runCount);
        Assert.assertTrue(this.events.lines.isEmpty());
        assertThat(outcome.toString(), containsString("run: 0"));
    }

    public static class Passing {

        @Test
        public void passes() {
        }
    }

    public static class Failing {

        @Test
        public void fails() {
            Assert.fail("nope");
        }
    }

    public static class KnownBug {

        @Test
        @ExpectedFailure
        public void fails() {
            Assert.fail("still broken");
        }
    }

    public static class FixedBug {

        @Test
        @ExpectedFailure
        public void passes() {
        }
    }

    public static class BrokenSetup {

        @BeforeClass
        public static void setUp() {
            throw new IllegalStateException("no fixture");
        }

        @Test
        public void neverRuns() {
        }
    }

    private static final class EventLog implements MessageSink {
        private final List<String> lines = new ArrayList<>();
        private final List<String> details = new ArrayList<>();

        @Override
        public void testStarted(String testIdentity) {
            this.lines.add("testStarted " + testIdentity);
        }

        @Override
        public void testFinished(String testIdentity, long durationMillis) {
            this.lines.add("testFinished " + testIdentity);
        }

        @Override
        public void testFailed(String testIdentity, String message, String details) {
            this.lines.add("testFailed " + testIdentity + " " + message);
            this.details.add(details);
        }

        @Override
        public void testIgnored(String testIdentity, String message) {
            this.lines.add("testIgnored " + testIdentity + " " + message);
        }
    }
}
