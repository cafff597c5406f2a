package org.janelia.decosmic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds small synthetic frame stacks for tests.
 */
public class SyntheticStackBuilder {

    private final int width;
    private final int height;
    private final List<float[]> frames;

    public SyntheticStackBuilder(final int width,
                                 final int height,
                                 final int frameCount,
                                 final float background) {
        this.width = width;
        this.height = height;
        this.frames = new ArrayList<>(frameCount);
        for (int f = 0; f < frameCount; f++) {
            final float[] pixels = new float[width * height];
            Arrays.fill(pixels, background);
            frames.add(pixels);
        }
    }

    public SyntheticStackBuilder set(final int frameIndex,
                                     final int x,
                                     final int y,
                                     final float value) {
        frames.get(frameIndex)[y * width + x] = value;
        return this;
    }

    /** Sets the pixel in every frame. */
    public SyntheticStackBuilder setAll(final int x,
                                        final int y,
                                        final float value) {
        for (int f = 0; f < frames.size(); f++) {
            set(f, x, y, value);
        }
        return this;
    }

    /** Sets a horizontal run of pixels in one frame. */
    public SyntheticStackBuilder setRow(final int frameIndex,
                                        final int y,
                                        final int fromX,
                                        final int toX,
                                        final float value) {
        for (int x = fromX; x < toX; x++) {
            set(frameIndex, x, y, value);
        }
        return this;
    }

    public FrameStack build() {
        final List<float[]> copies = new ArrayList<>(frames.size());
        for (final float[] pixels : frames) {
            copies.add(pixels.clone());
        }
        return FrameStack.fromPixels(width, height, copies);
    }

    public static int index(final int width,
                            final int x,
                            final int y) {
        return y * width + x;
    }
}
