package tally.client.standalone;

import tally.client.standalone.runner.TestSuiteRunner;
import tally.core.adapter.TestEventAdapter;
import tally.core.sink.JsonMessageSink;
import tally.core.sink.MessageSink;
import tally.core.sink.ServiceMessageSink;
import tally.core.util.Logger;

import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.Arrays;
import java.util.Properties;

/**
 * A single-use client that runs the given JUnit test classes and reports their lifecycle as events, then exits.
 *
 * Exits with 0 if no outcome was reported as failed, 1 if any was (including classes that could not be loaded), and 2
 * on bad usage or configuration.
 */
public final class StandaloneClient {
    private static final Logger LOGGER = Logger.forClass(StandaloneClient.class);
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    /**
     * args: the fully qualified names of the test classes to run, all of which must be on the classpath.
     *
     * See {@link ClientConfig} for the system properties that configure the run.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.getProperties()));
    }

    static int run(String[] args, Properties properties) {
        ClientConfig config;
        try {
            config = ClientConfig.fromProperties(properties);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.err.println(usage());
            return EXIT_USAGE;
        }
        return run(args, config);
    }

    static int run(String[] args, ClientConfig config) {
        if (!config.loggerEnabled) {
            Logger.globalDisable();
        }

        if (args == null || args.length == 0) {
            System.err.println("No test classes given.");
            System.err.println(usage());
            return EXIT_USAGE;
        }

        LOGGER.log("Running with " + config);
        PrintStream stream = null;
        try {
            stream = openStream(config);
            MessageSink sink = config.format == ClientConfig.OutputFormat.JSON ? JsonMessageSink.toStream(stream) : ServiceMessageSink.toStream(stream);
            TestEventAdapter adapter = TestEventAdapter.forSink(sink);

            ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
            TestSuiteRunner.SuiteOutcome outcome = TestSuiteRunner.withListener(classLoader, adapter).run(Arrays.asList(args));
            LOGGER.log("Suite finished: " + outcome);

            return outcome.isSuccessful() ? EXIT_SUCCESS : EXIT_FAILURES;
        } catch (FileNotFoundException | UnsupportedEncodingException e) {
            System.err.println("Unable to open output " + config.output + ": " + e.getMessage());
            return EXIT_USAGE;
        } finally {
            if (stream != null && !config.writesToStandardStream()) {
                stream.close();
            }
            LOGGER.log("Exiting.");
        }
    }

    private static PrintStream openStream(ClientConfig config) throws FileNotFoundException, UnsupportedEncodingException {
        if (ClientConfig.STDOUT.equals(config.output)) {
            return System.out;
        } else if (ClientConfig.STDERR.equals(config.output)) {
            return System.err;
        } else {
            return new PrintStream(config.output, "UTF-8");
        }
    }

    private static String usage() {
        return StandaloneClient.class.getName()
                + " [[test class]...]"
                + "\n\ttest class: the fully qualified name of a JUnit test class on the classpath."
                + "\n\t-Doutput=<stdout|stderr|file>: where to write events (default stdout)."
                + "\n\t-Dformat=<teamcity|json>: how to write events (default teamcity)."
                + "\n\t-Denable_logger=<true|false>: diagnostic logging to stderr (default false).";
    }
}
