package org.janelia.decosmic.client;

import ij.ImagePlus;
import ij.io.Opener;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.decosmic.FrameSanitizer;
import org.janelia.decosmic.FrameStack;
import org.janelia.decosmic.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes detector frame files into a {@link FrameStack}.
 * <p>
 * A series is either every file with the configured extension in a directory (sorted by name)
 * or the slices of one multi-slice TIFF file.  When a single-slice file is specified,
 * the series is the file's directory.
 */
public class FrameStackLoader {

    public static final String DEFAULT_EXTENSION = "tif";

    private final String extension;
    private final FrameSanitizer sanitizer;

    public FrameStackLoader() {
        this(DEFAULT_EXTENSION, FrameSanitizer.DEFAULT);
    }

    /**
     * @param  extension  extension (without dot) of frame files; "tif" also matches "tiff" files.
     * @param  sanitizer  sanitizer applied to each decoded frame.
     */
    public FrameStackLoader(final String extension,
                            final FrameSanitizer sanitizer) {
        this.extension = extension.startsWith(".") ? extension.substring(1) : extension;
        this.sanitizer = sanitizer;
    }

    /**
     * @return stack for the series identified by the specified file or directory.
     *
     * @throws IllegalArgumentException
     *   if the path does not exist, no frames are found, or a frame can not be decoded.
     *
     * @throws ShapeMismatchException
     *   if fewer than two frames are found or the frames differ in shape.
     */
    public FrameStack load(final Path inputPath)
            throws IllegalArgumentException, ShapeMismatchException, IOException {

        final Path absolutePath = inputPath.toAbsolutePath();

        LOG.info("load: entry, inputPath={}", absolutePath);

        final FrameStack frameStack;
        if (Files.isDirectory(absolutePath)) {
            frameStack = loadDirectory(absolutePath);
        } else if (Files.isRegularFile(absolutePath)) {
            final ImagePlus imagePlus = openImagePlus(absolutePath);
            if (imagePlus.getStackSize() > 1) {
                frameStack = FrameStack.fromImagePlus(imagePlus, sanitizer);
            } else {
                frameStack = loadDirectory(absolutePath.getParent());
            }
        } else {
            throw new IllegalArgumentException(absolutePath + " does not exist");
        }

        LOG.info("load: exit, loaded {}", frameStack);

        return frameStack;
    }

    /**
     * @return sorted list of frame files in the specified directory.
     */
    public List<Path> listFrameFiles(final Path directory)
            throws IOException {
        try (final Stream<Path> paths = Files.list(directory)) {
            return paths.filter(path -> Files.isRegularFile(path) && hasFrameExtension(path))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private FrameStack loadDirectory(final Path directory)
            throws IOException, ShapeMismatchException {

        final List<Path> frameFiles = listFrameFiles(directory);
        if (frameFiles.isEmpty()) {
            throw new IllegalArgumentException("no ." + extension + " files found in " + directory);
        }

        final List<ImageProcessor> frames = new ArrayList<>(frameFiles.size());
        final List<String> labels = new ArrayList<>(frameFiles.size());
        for (final Path frameFile : frameFiles) {
            final ImagePlus imagePlus = openImagePlus(frameFile);
            if (imagePlus.getStackSize() > 1) {
                LOG.warn("loadDirectory: only the first of {} slices in {} is used",
                         imagePlus.getStackSize(), frameFile);
            }
            frames.add(imagePlus.getProcessor());
            labels.add(frameFile.getFileName().toString());
        }

        LOG.debug("loadDirectory: decoded {} frames from {}", frames.size(), directory);

        return new FrameStack(frames, labels, sanitizer);
    }

    private boolean hasFrameExtension(final Path path) {
        final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        final String lowerExtension = extension.toLowerCase(Locale.ROOT);
        boolean matches = name.endsWith("." + lowerExtension);
        if ((! matches) && "tif".equals(lowerExtension)) {
            matches = name.endsWith(".tiff");
        }
        return matches;
    }

    /**
     * @return image decoded by ImageJ.
     *
     * @throws IllegalArgumentException
     *   if the file can not be decoded.
     */
    static ImagePlus openImagePlus(final Path path)
            throws IllegalArgumentException {

        // openers keep state about the file being opened, so we need to create a new opener for each load
        final Opener opener = new Opener();
        opener.setSilentMode(true);

        final File file = path.toFile();
        final ImagePlus imagePlus;
        try {
            imagePlus = opener.openImage(file.getAbsolutePath());
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to decode " + file.getAbsolutePath(), t);
        }

        if (imagePlus == null) {
            throw new IllegalArgumentException("failed to decode " + file.getAbsolutePath());
        }

        return imagePlus;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameStackLoader.class);
}
