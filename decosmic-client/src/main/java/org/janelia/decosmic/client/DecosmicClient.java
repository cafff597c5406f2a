package org.janelia.decosmic.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.ImagePlus;
import ij.process.ImageProcessor;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.janelia.decosmic.DecosmicParameters;
import org.janelia.decosmic.DecosmicProcessor;
import org.janelia.decosmic.DecosmicResult;
import org.janelia.decosmic.FrameSanitizer;
import org.janelia.decosmic.FrameStack;
import org.janelia.decosmic.client.parameter.CommandLineParameters;
import org.janelia.decosmic.client.parameter.ProcessingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for removing donut and streak artifacts from a series of detector frames
 * and saving the average, clean, difference, and mask images.
 */
public class DecosmicClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Frame file, directory of frame files, or multi-slice TIFF file",
                required = true)
        public String input;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for result images",
                required = true)
        public String outputDirectory;

        @Parameter(
                names = "--prefix",
                description = "Prefix for result file names")
        public String prefix = ResultWriter.DEFAULT_PREFIX;

        @ParametersDelegate
        public ProcessingParameters processing = new ProcessingParameters();

        @Parameter(
                names = "--userMask",
                description = "Image with non-zero values for pixels that may be used and modified (default is all pixels)")
        public String userMask;

        @Parameter(
                names = "--saturationLimit",
                description = "Frame values above this limit are treated as 0 (default is no limit)")
        public Double saturationLimit;

        @Parameter(
                names = "--extension",
                description = "Extension of frame files in an input directory")
        public String extension = FrameStackLoader.DEFAULT_EXTENSION;

        public FrameSanitizer buildSanitizer() {
            return saturationLimit == null ? FrameSanitizer.DEFAULT : new FrameSanitizer(saturationLimit);
        }
    }

    public static void main(final String[] args) {
        new DecosmicClientRunner().executeAndExit(args);
    }

    /**
     * Runs {@link #cleanSeries} for command line arguments.
     */
    static class DecosmicClientRunner extends ClientRunner<Parameters> {

        DecosmicClientRunner() {
            super(DecosmicClient.class, new Parameters());
        }

        @Override
        protected void run(final Parameters parameters) throws IOException {
            new DecosmicClient(parameters).cleanSeries();
        }
    }

    private final Parameters parameters;

    public DecosmicClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Loads the input series, removes artifacts, and writes all result images.
     *
     * @return paths of all written files.
     *
     * @throws IOException
     *   if the series can not be read or the results can not be written.
     */
    public List<Path> cleanSeries()
            throws IOException {

        // validate parameters before decoding any frames
        final DecosmicParameters decosmicParameters = parameters.processing.buildDecosmicParameters();

        final FrameStackLoader loader = new FrameStackLoader(parameters.extension, parameters.buildSanitizer());
        final FrameStack frameStack = loader.load(Paths.get(parameters.input));

        final ImageProcessor userMask;
        if (parameters.userMask == null) {
            userMask = null;
        } else {
            final ImagePlus userMaskImage = FrameStackLoader.openImagePlus(Paths.get(parameters.userMask));
            userMask = userMaskImage.getProcessor();
        }

        final DecosmicProcessor processor = new DecosmicProcessor(frameStack, userMask);
        final DecosmicResult result = processor.process(decosmicParameters);

        final ResultWriter writer = new ResultWriter(Paths.get(parameters.outputDirectory), parameters.prefix);
        final List<Path> writtenPaths = writer.write(result);

        LOG.info("cleanSeries: exit, {}", result.getSummary());

        return writtenPaths;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DecosmicClient.class);
}
