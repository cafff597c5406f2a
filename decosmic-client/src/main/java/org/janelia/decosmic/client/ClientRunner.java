package org.janelia.decosmic.client;

import org.janelia.decosmic.client.parameter.CommandLineParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared main flow for decosmic command line tools: parse arguments, apply the requested log level,
 * run the tool, and map the outcome to a process exit status.
 * <p>
 * Every run that gets past argument parsing ends with an "exit" log message, so a missing message
 * identifies a process that was killed externally.
 *
 * @param <P> parameters type of the tool.
 */
public abstract class ClientRunner<P extends CommandLineParameters> {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private final Class<?> programClass;
    private final P parameters;

    /**
     * @param  programClass  class with the tool's main method (used for usage and log messages).
     * @param  parameters    empty parameters instance populated from the command line.
     */
    public ClientRunner(final Class<?> programClass,
                        final P parameters) {
        this.programClass = programClass;
        this.parameters = parameters;
    }

    public P getParameters() {
        return parameters;
    }

    /**
     * @return {@link #EXIT_SUCCESS} if the tool completed or only help was requested,
     *         otherwise {@link #EXIT_FAILURE}.
     */
    public int execute(final String[] args) {

        if (! parameters.parse(args, programClass)) {
            return parameters.isHelpRequested() ? EXIT_SUCCESS : EXIT_FAILURE;
        }

        final String toolName = programClass.getSimpleName();
        final long startTime = System.currentTimeMillis();
        int exitStatus;
        try {
            parameters.applyLogLevel();
            LOG.info("execute: entry, {} parameters={}", toolName, parameters);
            run(parameters);
            exitStatus = EXIT_SUCCESS;
        } catch (final Exception e) {
            LOG.error("execute: " + toolName + " failed", e);
            exitStatus = EXIT_FAILURE;
        }

        LOG.info("execute: exit, {} {} after {} ms",
                 toolName, exitStatus == EXIT_SUCCESS ? "succeeded" : "failed",
                 System.currentTimeMillis() - startTime);

        return exitStatus;
    }

    /**
     * Runs {@link #execute} and terminates the JVM with its status.
     */
    public void executeAndExit(final String[] args) {
        System.exit(execute(args));
    }

    /**
     * Tool specific work, called with fully parsed parameters.
     *
     * @throws Exception
     *   if the tool fails for any reason.
     */
    protected abstract void run(final P parameters) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
