package tally.client.standalone;

import tally.core.util.ObjectChecker;

import java.util.Properties;

/**
 * The settings of a {@link StandaloneClient} run, read from JVM system properties:
 *
 * {@code enable_logger}: whether diagnostic logging to stderr is enabled. Defaults to false.
 * {@code output}: where events go: {@code stdout}, {@code stderr} or a file path. Defaults to stdout.
 * {@code format}: how events are written: {@code teamcity} or {@code json}. Defaults to teamcity.
 */
public final class ClientConfig {
    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";
    public final boolean loggerEnabled;
    public final String output;
    public final OutputFormat format;

    private ClientConfig(boolean loggerEnabled, String output, OutputFormat format) {
        ObjectChecker.assertNonNull(output, format);
        this.loggerEnabled = loggerEnabled;
        this.output = output;
        this.format = format;
    }

    /**
     * Reads the configuration from the given properties, falling back to the defaults for anything absent.
     *
     * @param properties The properties, usually {@link System#getProperties()}.
     * @return the configuration.
     * @throws IllegalArgumentException If the output is blank or the format is unknown.
     */
    public static ClientConfig fromProperties(Properties properties) {
        ObjectChecker.assertNonNull(properties);
        boolean loggerEnabled = Boolean.parseBoolean(properties.getProperty("enable_logger"));

        String output = properties.getProperty("output", STDOUT).trim();
        if (output.isEmpty()) {
            throw new IllegalArgumentException("output must be stdout, stderr or a file path but was blank.");
        }

        OutputFormat format = OutputFormat.fromName(properties.getProperty("format", OutputFormat.TEAMCITY.name));
        return new ClientConfig(loggerEnabled, output, format);
    }

    public boolean writesToStandardStream() {
        return STDOUT.equals(this.output) || STDERR.equals(this.output);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { logger enabled: " + this.loggerEnabled + ", output: " + this.output + ", format: " + this.format + " }";
    }

    public enum OutputFormat {
        TEAMCITY("teamcity"), JSON("json");

        public final String name;

        OutputFormat(String name) {
            this.name = name;
        }

        public static OutputFormat fromName(String name) {
            for (OutputFormat format : values()) {
                if (format.name.equalsIgnoreCase(name.trim())) {
                    return format;
                }
            }
            throw new IllegalArgumentException("unknown format: " + name + " (expected teamcity or json)");
        }
    }
}
