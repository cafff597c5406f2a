package org.janelia.decosmic.client;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.decosmic.DecosmicParameters;
import org.janelia.decosmic.DecosmicResult;
import org.janelia.decosmic.ResultImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists the named images of a {@link DecosmicResult} as TIFF files.
 * <p>
 * Each image is written to <code>[prefix]_[name].tif</code> (32-bit float for images, 8-bit for masks)
 * and the run parameters and summary are written to <code>[prefix]_parameters.json</code> and
 * <code>[prefix]_summary.json</code>.
 */
public class ResultWriter {

    public static final String DEFAULT_PREFIX = "decosmic";

    private final Path outputDirectory;
    private final String prefix;

    public ResultWriter(final Path outputDirectory,
                        final String prefix) {
        this.outputDirectory = outputDirectory.toAbsolutePath();
        this.prefix = prefix;
    }

    /**
     * Writes every named image of the result.
     *
     * @return paths of all written files.
     *
     * @throws IOException
     *   if the output directory can not be created or any file can not be written.
     */
    public List<Path> write(final DecosmicResult result)
            throws IOException {

        ensureWritableDirectory(outputDirectory.toFile());

        final List<Path> writtenPaths = new ArrayList<>();
        for (final ResultImage resultImage : ResultImage.values()) {
            writtenPaths.add(writeImage(resultImage.getName(), result.getImage(resultImage)));
        }

        final Path parametersPath = getPath("parameters.json");
        writeText(parametersPath, result.getParameters().toJson());
        writtenPaths.add(parametersPath);

        final Path summaryPath = getPath("summary.json");
        writeText(summaryPath, result.getSummary().toJson());
        writtenPaths.add(summaryPath);

        LOG.info("write: exit, wrote {} files to {}", writtenPaths.size(), outputDirectory);

        return writtenPaths;
    }

    public Path getImagePath(final String name) {
        return getPath(name + ".tif");
    }

    /**
     * @return previously written image with the specified name.
     *
     * @throws IllegalArgumentException
     *   if the image does not exist or can not be decoded.
     */
    public ImageProcessor readImage(final String name)
            throws IllegalArgumentException {
        return readImage(outputDirectory, prefix, name);
    }

    /**
     * @return previously written parameters.
     */
    public DecosmicParameters readParameters()
            throws IllegalArgumentException {
        return DecosmicParameters.fromJsonFile(getPath("parameters.json"));
    }

    /**
     * @return image that was written with the specified prefix and name to the specified directory.
     *
     * @throws IllegalArgumentException
     *   if the image does not exist or can not be decoded.
     */
    public static ImageProcessor readImage(final Path directory,
                                           final String prefix,
                                           final String name)
            throws IllegalArgumentException {
        final Path path = directory.resolve(prefix + "_" + name + ".tif");
        if (! Files.exists(path)) {
            throw new IllegalArgumentException(path.toAbsolutePath() + " does not exist");
        }
        return FrameStackLoader.openImagePlus(path).getProcessor();
    }

    private Path writeImage(final String name,
                            final ImageProcessor image)
            throws IOException {

        final Path path = getImagePath(name);
        final ImagePlus imagePlus = new ImagePlus(prefix + "_" + name, image);
        final FileSaver fileSaver = new FileSaver(imagePlus);
        if (! fileSaver.saveAsTiff(path.toString())) {
            throw new IOException("failed to save " + path);
        }

        LOG.debug("writeImage: saved {}", path);

        return path;
    }

    private Path getPath(final String suffix) {
        return outputDirectory.resolve(prefix + "_" + suffix);
    }

    private static void writeText(final Path path,
                                  final String text)
            throws IOException {
        try {
            Files.write(path, text.getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new IOException("failed to write " + path, e);
        }
        LOG.debug("writeText: saved {}", path);
    }

    static void ensureWritableDirectory(final File directory) {
        // another client may create the directory concurrently
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    throw new IllegalArgumentException("failed to create " + directory);
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ResultWriter.class);
}
