package tally.client.standalone;

import org.junit.Assert;
import org.junit.Test;

import java.util.Properties;

public class ClientConfigTest {

    @Test
    public void testDefaults() {
        ClientConfig config = ClientConfig.fromProperties(new Properties());

        Assert.assertFalse(config.loggerEnabled);
        Assert.assertEquals(ClientConfig.STDOUT, config.output);
        Assert.assertEquals(ClientConfig.OutputFormat.TEAMCITY, config.format);
        Assert.assertTrue(config.writesToStandardStream());
    }

    @Test
    public void testExplicitValues() {
        Properties properties = new Properties();
        properties.setProperty("enable_logger", "true");
        properties.setProperty("output", " build/events.txt ");
        properties.setProperty("format", "JSON");

        ClientConfig config = ClientConfig.fromProperties(properties);

        Assert.assertTrue(config.loggerEnabled);
        Assert.assertEquals("build/events.txt", config.output);
        Assert.assertEquals(ClientConfig.OutputFormat.JSON, config.format);
        Assert.assertFalse(config.writesToStandardStream());
    }

    @Test
    public void testStderrIsAStandardStream() {
        Properties properties = new Properties();
        properties.setProperty("output", "stderr");

        Assert.assertTrue(ClientConfig.fromProperties(properties).writesToStandardStream());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownFormat() {
        Properties properties = new Properties();
        properties.setProperty("format", "xml");

        ClientConfig.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankOutput() {
        Properties properties = new Properties();
        properties.setProperty("output", "  ");

        ClientConfig.fromProperties(properties);
    }
}
