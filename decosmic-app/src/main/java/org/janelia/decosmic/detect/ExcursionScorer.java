package org.janelia.decosmic.detect;

import ij.process.ByteProcessor;

import java.util.stream.IntStream;

import org.janelia.decosmic.mask.MaskUtil;
import org.janelia.decosmic.statistics.StackStatistics;

/**
 * Measures how far each pixel of a frame rises above the stack mean, in units of the stack's
 * per-pixel standard deviation:
 * <pre>
 *     score(f,p) = max(0, (frame_f[p] - mean[p]) / dispersion[p])
 * </pre>
 * Pixels outside the validity mask and pixels without dispersion (all frames equal) score 0.
 */
public class ExcursionScorer {

    private final StackStatistics statistics;
    private final byte[] validityPixels;

    public ExcursionScorer(final StackStatistics statistics,
                           final ByteProcessor validityMask) {
        this.statistics = statistics;
        this.validityPixels = (byte[]) validityMask.getPixels();
    }

    /**
     * @return row-major score map for the specified frame pixels.
     */
    public double[] score(final float[] framePixels) {

        final int width = statistics.getWidth();
        final double[] scores = new double[framePixels.length];

        IntStream.range(0, statistics.getHeight()).parallel().forEach(y -> {
            final int rowStop = (y + 1) * width;
            for (int i = y * width; i < rowStop; i++) {
                if (MaskUtil.isSet(validityPixels, i)) {
                    scores[i] = score(framePixels[i], statistics.getMean(i), statistics.getDispersion(i));
                }
            }
        });

        return scores;
    }

    public static double score(final double value,
                               final double mean,
                               final double dispersion) {
        double score = 0.0;
        if (dispersion > 0.0) {
            final double excursion = (value - mean) / dispersion;
            if (excursion > 0.0) {
                score = excursion;
            }
        }
        return score;
    }

    /**
     * Raises a non-negative score to the specified exponent.
     * Exponents above 1 suppress weak outliers relative to strong ones.
     * An exponent of 0 turns the score into a binary indicator (1 for any positive score, 0 otherwise).
     */
    public static double applyExponent(final double score,
                                       final double exponent) {
        final double weightedScore;
        if (exponent == 0.0) {
            weightedScore = score > 0.0 ? 1.0 : 0.0;
        } else {
            weightedScore = Math.pow(score, exponent);
        }
        return weightedScore;
    }

}
