package org.janelia.decosmic.client;

import ch.qos.logback.classic.Level;

import com.beust.jcommander.Parameter;

import org.janelia.decosmic.client.parameter.CommandLineParameters;
import org.janelia.decosmic.client.util.LogbackTools;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 */
public class ClientRunnerTest {

    public static class CountParameters extends CommandLineParameters {

        @Parameter(
                names = "--count",
                description = "Number of items",
                required = true)
        public Integer count;
    }

    /** Counts runs and fails for a zero count. */
    private static class CountRunner extends ClientRunner<CountParameters> {

        private int runCount = 0;

        CountRunner() {
            super(ClientRunnerTest.class, new CountParameters());
        }

        @Override
        protected void run(final CountParameters parameters) {
            runCount++;
            if (parameters.count == 0) {
                throw new IllegalArgumentException("count must be positive");
            }
        }
    }

    private Level originalLevel;

    @Before
    public void setup() {
        originalLevel = LogbackTools.getEffectiveLevel(LogbackTools.DECOSMIC_LOGGER_NAME);
    }

    @After
    public void tearDown() {
        LogbackTools.setLogLevel(LogbackTools.DECOSMIC_LOGGER_NAME, originalLevel);
    }

    @Test
    public void testSuccess() {
        final CountRunner runner = new CountRunner();
        Assert.assertEquals("invalid exit status", ClientRunner.EXIT_SUCCESS,
                            runner.execute(new String[] { "--count", "3" }));
        Assert.assertEquals("tool should run once", 1, runner.runCount);
        Assert.assertEquals("invalid parsed count", Integer.valueOf(3), runner.getParameters().count);
    }

    @Test
    public void testToolFailure() {
        final CountRunner runner = new CountRunner();
        Assert.assertEquals("exception should map to failure", ClientRunner.EXIT_FAILURE,
                            runner.execute(new String[] { "--count", "0" }));
        Assert.assertEquals("tool should run once", 1, runner.runCount);
    }

    @Test
    public void testHelpSkipsTool() {
        final CountRunner runner = new CountRunner();
        Assert.assertEquals("help should succeed", ClientRunner.EXIT_SUCCESS,
                            runner.execute(new String[] { "--help" }));
        Assert.assertEquals("tool should not run", 0, runner.runCount);
    }

    @Test
    public void testRejectedArgumentsSkipTool() {
        final CountRunner runner = new CountRunner();
        Assert.assertEquals("missing option should fail", ClientRunner.EXIT_FAILURE,
                            runner.execute(new String[0]));
        Assert.assertEquals("unknown option should fail", ClientRunner.EXIT_FAILURE,
                            runner.execute(new String[] { "--count", "1", "--bogus" }));
        Assert.assertEquals("tool should not run", 0, runner.runCount);
    }

    @Test
    public void testLogLevelIsApplied() {
        final CountRunner runner = new CountRunner();
        Assert.assertEquals("invalid exit status", ClientRunner.EXIT_SUCCESS,
                            runner.execute(new String[] { "--count", "1", "--logLevel", "TRACE" }));
        Assert.assertEquals("decosmic loggers should use requested level",
                            Level.TRACE, LogbackTools.getEffectiveLevel("org.janelia.decosmic.FrameStack"));
    }

    @Test
    public void testUnknownLogLevelFails() {
        final CountRunner runner = new CountRunner();
        Assert.assertEquals("unknown level should fail", ClientRunner.EXIT_FAILURE,
                            runner.execute(new String[] { "--count", "1", "--logLevel", "loud" }));
        Assert.assertEquals("tool should not run", 0, runner.runCount);
    }
}
