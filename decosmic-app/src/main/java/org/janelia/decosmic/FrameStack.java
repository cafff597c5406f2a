package org.janelia.decosmic;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of repeated exposures that share the same detector geometry.
 * <p>
 * Frames are copied and sanitized on construction, so a stack can not be changed once built.
 * The frame order is preserved for traceability, but statistics derived from the stack do not depend on it.
 */
public class FrameStack {

    public static final int MIN_FRAME_COUNT = 2;

    private final int width;
    private final int height;
    private final List<FloatProcessor> frames;
    private final List<String> labels;

    /**
     * Constructs a stack from frames that were already decoded in memory.
     *
     * @param  frames     decoded frames (any ImageJ pixel type).
     * @param  labels     optional source labels (one per frame) used for logging, or null.
     * @param  sanitizer  sanitizer applied to each frame.
     *
     * @throws ShapeMismatchException
     *   if fewer than two frames are provided or if the frames differ in shape.
     */
    public FrameStack(final List<? extends ImageProcessor> frames,
                      final List<String> labels,
                      final FrameSanitizer sanitizer)
            throws ShapeMismatchException {

        if ((frames == null) || (frames.size() < MIN_FRAME_COUNT)) {
            final int count = frames == null ? 0 : frames.size();
            throw new ShapeMismatchException("stack must contain at least " + MIN_FRAME_COUNT +
                                             " frames but " + count + " were provided");
        }

        if ((labels != null) && (labels.size() != frames.size())) {
            throw new IllegalArgumentException(labels.size() + " labels were provided for " +
                                               frames.size() + " frames");
        }

        final ImageProcessor firstFrame = frames.get(0);
        if (firstFrame == null) {
            throw new IllegalArgumentException("frame 0 is null");
        }

        this.width = firstFrame.getWidth();
        this.height = firstFrame.getHeight();

        final List<FloatProcessor> sanitizedFrames = new ArrayList<>(frames.size());
        final List<String> frameLabels = new ArrayList<>(frames.size());
        for (int i = 0; i < frames.size(); i++) {
            final ImageProcessor frame = frames.get(i);
            if (frame == null) {
                throw new IllegalArgumentException("frame " + i + " is null");
            }
            if ((frame.getWidth() != width) || (frame.getHeight() != height)) {
                throw new ShapeMismatchException("frame " + i + " is " + frame.getWidth() + "x" + frame.getHeight() +
                                                 " but frame 0 is " + width + "x" + height);
            }
            sanitizedFrames.add(sanitizer.sanitize(frame));
            frameLabels.add(labels == null ? "frame " + i : labels.get(i));
        }

        this.frames = Collections.unmodifiableList(sanitizedFrames);
        this.labels = Collections.unmodifiableList(frameLabels);

        LOG.debug("FrameStack: created stack with {} frames of size {}x{} using {}",
                  this.frames.size(), width, height, sanitizer);
    }

    /**
     * @return stack built from the specified frames using the default sanitizer.
     */
    public static FrameStack fromProcessors(final List<? extends ImageProcessor> frames)
            throws ShapeMismatchException {
        return new FrameStack(frames, null, FrameSanitizer.DEFAULT);
    }

    /**
     * @return stack built from row-major pixel arrays that each contain width * height values.
     */
    public static FrameStack fromPixels(final int width,
                                        final int height,
                                        final List<float[]> pixelArrays)
            throws ShapeMismatchException {

        final List<FloatProcessor> processors = new ArrayList<>(pixelArrays.size());
        final int expectedLength = width * height;
        for (int i = 0; i < pixelArrays.size(); i++) {
            final float[] pixels = pixelArrays.get(i);
            if (pixels.length != expectedLength) {
                throw new ShapeMismatchException("frame " + i + " has " + pixels.length + " pixels but " +
                                                 width + "x" + height + " frames need " + expectedLength);
            }
            processors.add(new FloatProcessor(width, height, pixels));
        }
        return fromProcessors(processors);
    }

    /**
     * @return stack with one frame for each slice of the specified image.
     */
    public static FrameStack fromImagePlus(final ImagePlus imagePlus,
                                           final FrameSanitizer sanitizer)
            throws ShapeMismatchException {

        final ImageStack imageStack = imagePlus.getStack();
        final List<ImageProcessor> processors = new ArrayList<>(imageStack.getSize());
        final List<String> labels = new ArrayList<>(imageStack.getSize());
        for (int slice = 1; slice <= imageStack.getSize(); slice++) {
            processors.add(imageStack.getProcessor(slice));
            final String sliceLabel = imageStack.getSliceLabel(slice);
            labels.add(sliceLabel == null ? imagePlus.getTitle() + " slice " + slice : sliceLabel);
        }
        return new FrameStack(processors, labels, sanitizer);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return width * height;
    }

    public int getFrameCount() {
        return frames.size();
    }

    public String getLabel(final int frameIndex) {
        return labels.get(frameIndex);
    }

    /**
     * @return the row-major pixel array of the specified frame.
     *         The array backs this stack and must not be modified.
     */
    public float[] getPixels(final int frameIndex) {
        return (float[]) frames.get(frameIndex).getPixels();
    }

    /**
     * @return a copy of the specified frame.
     */
    public FloatProcessor getFrame(final int frameIndex) {
        return (FloatProcessor) frames.get(frameIndex).duplicate();
    }

    /**
     * Copies the values of all frames at the specified pixel into the target array.
     *
     * @return the target array.
     */
    public float[] getPixelValues(final int pixelIndex,
                                  final float[] target) {
        for (int f = 0; f < frames.size(); f++) {
            target[f] = getPixels(f)[pixelIndex];
        }
        return target;
    }

    public boolean hasSameShape(final ImageProcessor ip) {
        return (ip.getWidth() == width) && (ip.getHeight() == height);
    }

    @Override
    public String toString() {
        return "FrameStack{frameCount=" + frames.size() + ", width=" + width + ", height=" + height + '}';
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameStack.class);
}
