package org.janelia.decosmic.detect;

import java.util.stream.IntStream;

import org.janelia.decosmic.InvalidParameterException;
import org.janelia.decosmic.mask.MaskUtil;

/**
 * Detects elongated excursions ("streaks") left by grazing particle tracks.
 * <p>
 * Individual streak pixels often stay below the donut threshold, so the detector slides a window of
 * winStreak pixels along each row and each column of a frame's score map and flags every pixel of a
 * window whose weighted mean score exceeds the threshold:
 * <pre>
 *     (sum(score in window) / winStreak)^expStreak &gt; thStreak
 * </pre>
 * Overlapping flagged windows simply union their pixels.
 * Only pixels inside the validity mask are flagged.
 */
public class StreakDetector {

    private final int winStreak;
    private final double thStreak;
    private final double expStreak;

    /**
     * @throws InvalidParameterException
     *   if the window is smaller than one pixel or the threshold or exponent is negative.
     */
    public StreakDetector(final int winStreak,
                          final double thStreak,
                          final double expStreak)
            throws InvalidParameterException {
        if (winStreak < 1) {
            throw new InvalidParameterException("win_streak (" + winStreak + ") must be at least 1");
        }
        if (! (thStreak >= 0.0)) {
            throw new InvalidParameterException("th_streak (" + thStreak + ") must be a non-negative number");
        }
        if (! (expStreak >= 0.0)) {
            throw new InvalidParameterException("exp_streak (" + expStreak + ") must be a non-negative number");
        }
        this.winStreak = winStreak;
        this.thStreak = thStreak;
        this.expStreak = expStreak;
    }

    /**
     * @throws InvalidParameterException
     *   if the window does not fit into rows or columns of the specified frame size.
     */
    public void checkFrameSize(final int width,
                               final int height)
            throws InvalidParameterException {
        if ((winStreak > width) || (winStreak > height)) {
            throw new InvalidParameterException("win_streak (" + winStreak + ") exceeds frame size " +
                                                width + "x" + height);
        }
    }

    public boolean isFlagged(final double windowSum) {
        return ExcursionScorer.applyExponent(windowSum / winStreak, expStreak) > thStreak;
    }

    /**
     * Flags streak pixels of one frame.
     *
     * @param  scores          row-major score map of the frame.
     * @param  validityPixels  validity mask pixels.
     * @param  width           frame width.
     * @param  height          frame height.
     *
     * @return mask pixels that are set where the frame has a streak artifact.
     */
    public byte[] detect(final double[] scores,
                         final byte[] validityPixels,
                         final int width,
                         final int height) {

        checkFrameSize(width, height);

        final byte[] flags = new byte[scores.length];

        // rows and columns are scanned in separate passes so that parallel tasks never share a pixel
        IntStream.range(0, height).parallel().forEach(y ->
                scanLine(scores, validityPixels, flags, y * width, 1, width));

        IntStream.range(0, width).parallel().forEach(x ->
                scanLine(scores, validityPixels, flags, x, width, height));

        return flags;
    }

    /**
     * Slides the window along one scan line using a running sum.
     *
     * @param  start   index of the first pixel in the line.
     * @param  stride  index distance between neighboring pixels in the line.
     * @param  length  number of pixels in the line.
     */
    private void scanLine(final double[] scores,
                          final byte[] validityPixels,
                          final byte[] flags,
                          final int start,
                          final int stride,
                          final int length) {

        double windowSum = 0.0;
        int positiveCount = 0;
        for (int k = 0; k < winStreak; k++) {
            final double score = scores[start + k * stride];
            windowSum += score;
            if (score > 0.0) {
                positiveCount++;
            }
        }

        int markedUntil = 0; // line positions before this have already been marked
        final int lastWindowStart = length - winStreak;
        for (int windowStart = 0; windowStart <= lastWindowStart; windowStart++) {

            if (windowStart > 0) {
                final double newest = scores[start + (windowStart + winStreak - 1) * stride];
                final double oldest = scores[start + (windowStart - 1) * stride];
                windowSum += newest - oldest;
                if (newest > 0.0) {
                    positiveCount++;
                }
                if (oldest > 0.0) {
                    positiveCount--;
                }
                // drop rounding residue left behind by the running sum
                if (positiveCount == 0) {
                    windowSum = 0.0;
                }
            }

            if (isFlagged(windowSum)) {
                final int windowStop = windowStart + winStreak;
                for (int k = Math.max(windowStart, markedUntil); k < windowStop; k++) {
                    final int i = start + k * stride;
                    if (MaskUtil.isSet(validityPixels, i)) {
                        MaskUtil.set(flags, i);
                    }
                }
                markedUntil = windowStop;
            }
        }
    }

    @Override
    public String toString() {
        return "StreakDetector{winStreak=" + winStreak + ", thStreak=" + thStreak + ", expStreak=" + expStreak + '}';
    }
}
