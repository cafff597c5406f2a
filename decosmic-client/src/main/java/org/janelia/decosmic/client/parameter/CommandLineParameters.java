package org.janelia.decosmic.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.decosmic.client.util.LogbackTools;
import org.janelia.decosmic.json.JsonUtils;

/**
 * Options shared by every decosmic command line tool: usage display and log verbosity.
 * <p>
 * Parsing never exits the JVM.  Callers (normally {@link org.janelia.decosmic.client.ClientRunner})
 * decide on the exit status from {@link #parse} and {@link #isHelpRequested}.
 */
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Show the available options and exit",
            help = true)
    public transient boolean help;

    @Parameter(
            names = "--logLevel",
            description = "Level for decosmic log messages (e.g. DEBUG, or TRACE for per-frame counts)")
    public String logLevel;

    public CommandLineParameters() {
        this.help = false;
        this.logLevel = null;
    }

    @JsonIgnore
    public boolean isHelpRequested() {
        return help;
    }

    /**
     * Populates these parameters from the specified arguments.
     * Usage is printed when help is requested or when the arguments are rejected.
     *
     * @param  args          command line arguments.
     * @param  programClass  class with the main method, shown in usage.
     *
     * @return true if processing should continue (arguments are complete and help was not requested).
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass) {

        final JCommander commander = JCommander.newBuilder()
                .addObject(this)
                .programName(programClass.getSimpleName())
                .build();

        String problem = null;
        try {
            commander.parse(args);
        } catch (final ParameterException pe) {
            problem = pe.getMessage();
        }

        if (problem != null) {
            commander.getConsole().println("\n" + programClass.getSimpleName() + ": " + problem + "\n");
            commander.usage();
        } else if (help) {
            commander.usage();
        }

        return (problem == null) && (! help);
    }

    /**
     * Applies {@link #logLevel} (when specified) to all decosmic loggers.
     *
     * @throws IllegalArgumentException
     *   if the level name is not a logback level.
     */
    public void applyLogLevel()
            throws IllegalArgumentException {
        if (logLevel != null) {
            LogbackTools.setDecosmicLogLevel(logLevel);
        }
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
