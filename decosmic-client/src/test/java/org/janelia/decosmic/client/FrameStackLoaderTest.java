package org.janelia.decosmic.client;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.janelia.decosmic.FrameSanitizer;
import org.janelia.decosmic.FrameStack;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link FrameStackLoader} class.
 */
public class FrameStackLoaderTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testLoadDirectory() throws IOException {
        final File directory = temporaryFolder.newFolder("series");
        saveFrame(directory, "frame_b.tiff", 3, 2, 20.0f);
        saveFrame(directory, "frame_a.tif", 3, 2, 10.0f);
        Files.write(new File(directory, "notes.txt").toPath(), "not a frame".getBytes(StandardCharsets.UTF_8));

        final FrameStack stack = new FrameStackLoader().load(directory.toPath());

        Assert.assertEquals("invalid frame count", 2, stack.getFrameCount());
        Assert.assertEquals("invalid width", 3, stack.getWidth());
        Assert.assertEquals("frames should be sorted by name", "frame_a.tif", stack.getLabel(0));
        Assert.assertEquals("invalid first frame value", 10.0f, stack.getPixels(0)[0], 0.0f);
        Assert.assertEquals("invalid second frame value", 20.0f, stack.getPixels(1)[5], 0.0f);
    }

    @Test
    public void testSingleFrameFileLoadsItsDirectory() throws IOException {
        final File directory = temporaryFolder.newFolder("series");
        final File first = saveFrame(directory, "frame_0.tif", 2, 2, 1.0f);
        saveFrame(directory, "frame_1.tif", 2, 2, 2.0f);
        saveFrame(directory, "frame_2.tif", 2, 2, 3.0f);

        final FrameStack stack = new FrameStackLoader().load(first.toPath());
        Assert.assertEquals("every frame in the directory should be loaded", 3, stack.getFrameCount());
    }

    @Test
    public void testMultiSliceFile() throws IOException {
        final File directory = temporaryFolder.newFolder("stack");
        final ImageStack imageStack = new ImageStack(4, 3);
        for (int slice = 0; slice < 3; slice++) {
            final float[] pixels = new float[12];
            Arrays.fill(pixels, 100.0f * (slice + 1));
            imageStack.addSlice("slice" + slice, new FloatProcessor(4, 3, pixels));
        }
        final File file = new File(directory, "series.tif");
        Assert.assertTrue("failed to save stack",
                          new FileSaver(new ImagePlus("series", imageStack)).saveAsTiffStack(file.getAbsolutePath()));

        final FrameStack stack = new FrameStackLoader().load(file.toPath());
        Assert.assertEquals("each slice should be a frame", 3, stack.getFrameCount());
        Assert.assertEquals("invalid last slice value", 300.0f, stack.getPixels(2)[11], 0.0f);
    }

    @Test
    public void testSaturationLimit() throws IOException {
        final File directory = temporaryFolder.newFolder("series");
        saveFrame(directory, "a.tif", 2, 2, 500.0f);
        saveFrame(directory, "b.tif", 2, 2, 20000.0f);

        final FrameStack stack = new FrameStackLoader("tif", new FrameSanitizer(10000.0)).load(directory.toPath());
        Assert.assertEquals("saturated value should be zeroed", 0.0f, stack.getPixels(1)[0], 0.0f);
        Assert.assertEquals("valid value should be kept", 500.0f, stack.getPixels(0)[0], 0.0f);
    }

    @Test
    public void testOtherExtension() throws IOException {
        final File directory = temporaryFolder.newFolder("series");
        saveFrame(directory, "a.tif", 2, 2, 1.0f);
        saveFrame(directory, "b.tif", 2, 2, 1.0f);

        final FrameStackLoader loader = new FrameStackLoader(".edf", FrameSanitizer.DEFAULT);
        Assert.assertEquals("tif files should not match", 0, loader.listFrameFiles(directory.toPath()).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyDirectory() throws IOException {
        new FrameStackLoader().load(temporaryFolder.newFolder("empty").toPath());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingInput() throws IOException {
        final Path missing = temporaryFolder.getRoot().toPath().resolve("missing");
        new FrameStackLoader().load(missing);
    }

    static File saveFrame(final File directory,
                          final String name,
                          final int width,
                          final int height,
                          final float value) {
        final float[] pixels = new float[width * height];
        Arrays.fill(pixels, value);
        return saveFrame(directory, name, new FloatProcessor(width, height, pixels));
    }

    static File saveFrame(final File directory,
                          final String name,
                          final FloatProcessor frame) {
        final File file = new File(directory, name);
        Assert.assertTrue("failed to save " + file,
                          new FileSaver(new ImagePlus(name, frame)).saveAsTiff(file.getAbsolutePath()));
        return file;
    }
}
