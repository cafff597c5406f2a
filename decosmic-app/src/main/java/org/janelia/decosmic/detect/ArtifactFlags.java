package org.janelia.decosmic.detect;

import ij.process.ByteProcessor;

import java.util.ArrayList;
import java.util.List;

import org.janelia.decosmic.mask.MaskUtil;

/**
 * Per-frame donut and streak flags for every pixel of a stack.
 * Stack level masks are derived by folding the per-frame flags with a logical OR.
 */
public class ArtifactFlags {

    private static final byte DONUT_BIT = 1;
    private static final byte STREAK_BIT = 2;

    private final int width;
    private final int height;
    private final byte[][] frameFlags;

    public ArtifactFlags(final int width,
                         final int height,
                         final int frameCount) {
        this.width = width;
        this.height = height;
        this.frameFlags = new byte[frameCount][];
    }

    /**
     * Records the detector results for one frame.
     * Each frame is recorded once, so frames may be recorded concurrently.
     */
    public void record(final int frameIndex,
                       final byte[] donutFlags,
                       final byte[] streakFlags) {
        final byte[] flags = new byte[donutFlags.length];
        for (int i = 0; i < flags.length; i++) {
            if (donutFlags[i] != 0) {
                flags[i] |= DONUT_BIT;
            }
            if (streakFlags[i] != 0) {
                flags[i] |= STREAK_BIT;
            }
        }
        frameFlags[frameIndex] = flags;
    }

    public int getFrameCount() {
        return frameFlags.length;
    }

    public boolean isDonut(final int frameIndex,
                           final int pixelIndex) {
        return (frameFlags[frameIndex][pixelIndex] & DONUT_BIT) != 0;
    }

    public boolean isStreak(final int frameIndex,
                            final int pixelIndex) {
        return (frameFlags[frameIndex][pixelIndex] & STREAK_BIT) != 0;
    }

    /**
     * @return true if either detector flagged the specified frame at the specified pixel.
     */
    public boolean isFlagged(final int frameIndex,
                             final int pixelIndex) {
        return frameFlags[frameIndex][pixelIndex] != 0;
    }

    public ByteProcessor getDonutMask() {
        return foldFrames(DONUT_BIT);
    }

    public ByteProcessor getStreakMask() {
        return foldFrames(STREAK_BIT);
    }

    private ByteProcessor foldFrames(final byte bit) {
        final List<ByteProcessor> frameMasks = new ArrayList<>(frameFlags.length);
        for (final byte[] flags : frameFlags) {
            if (flags == null) {
                throw new IllegalStateException("flags have not been recorded for every frame");
            }
            final ByteProcessor frameMask = MaskUtil.createEmptyMask(width, height);
            final byte[] maskPixels = (byte[]) frameMask.getPixels();
            for (int i = 0; i < flags.length; i++) {
                if ((flags[i] & bit) != 0) {
                    MaskUtil.set(maskPixels, i);
                }
            }
            frameMasks.add(frameMask);
        }
        return MaskUtil.orAll(width, height, frameMasks);
    }
}
