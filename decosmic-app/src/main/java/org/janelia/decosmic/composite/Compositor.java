package org.janelia.decosmic.composite;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.janelia.decosmic.DecosmicParameters;
import org.janelia.decosmic.DecosmicResult;
import org.janelia.decosmic.DecosmicSummary;
import org.janelia.decosmic.FrameStack;
import org.janelia.decosmic.detect.ArtifactFlags;
import org.janelia.decosmic.mask.MaskUtil;
import org.janelia.decosmic.statistics.MedianUtil;
import org.janelia.decosmic.statistics.StackStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges detector masks and synthesizes the average, clean, and difference frames.
 * <p>
 * Artifact pixels of the clean frame are replaced with the median of the stack values from frames that
 * were not flagged at that pixel.  When every frame was flagged, a value propagated inward from the
 * nearest valid non-artifact average values is used instead (see {@link #neighborhoodEstimates}).
 * If the frame has no valid non-artifact pixel at all, the median of every stack value at the pixel
 * is used, so a valid pixel always receives a value.
 * <p>
 * Pixels outside the validity mask hold 0 in the average, clean, difference and variance frames.
 */
public class Compositor {

    public Compositor() {
    }

    public DecosmicResult compose(final FrameStack frameStack,
                                  final StackStatistics statistics,
                                  final ByteProcessor validityMask,
                                  final ArtifactFlags flags,
                                  final DecosmicParameters parameters) {

        final int width = frameStack.getWidth();
        final int height = frameStack.getHeight();

        final ByteProcessor donutMask = MaskUtil.and(flags.getDonutMask(), validityMask);
        final ByteProcessor streakMask = MaskUtil.and(flags.getStreakMask(), validityMask);
        final ByteProcessor artifactMask = MaskUtil.and(MaskUtil.or(donutMask, streakMask), validityMask);

        final FloatProcessor average = statistics.getMaskedMean(validityMask);
        final FloatProcessor clean = buildClean(frameStack, average, validityMask, artifactMask, flags);

        final float[] averagePixels = (float[]) average.getPixels();
        final float[] cleanPixels = (float[]) clean.getPixels();
        final float[] differencePixels = new float[averagePixels.length];
        double removedIntensity = 0.0;
        for (int i = 0; i < differencePixels.length; i++) {
            differencePixels[i] = averagePixels[i] - cleanPixels[i];
            removedIntensity += (double) averagePixels[i] - cleanPixels[i];
        }
        final FloatProcessor difference = new FloatProcessor(width, height, differencePixels);

        final DecosmicSummary summary = new DecosmicSummary(parameters,
                                                            frameStack.getFrameCount(),
                                                            width,
                                                            height,
                                                            MaskUtil.count(validityMask),
                                                            MaskUtil.count(donutMask),
                                                            MaskUtil.count(streakMask),
                                                            MaskUtil.count(artifactMask),
                                                            removedIntensity);

        return new DecosmicResult(average,
                                  clean,
                                  difference,
                                  validityMask,
                                  donutMask,
                                  streakMask,
                                  artifactMask,
                                  statistics.getMean(),
                                  statistics.getMaskedVariance(validityMask),
                                  summary);
    }

    private FloatProcessor buildClean(final FrameStack frameStack,
                                      final FloatProcessor average,
                                      final ByteProcessor validityMask,
                                      final ByteProcessor artifactMask,
                                      final ArtifactFlags flags) {

        final int width = frameStack.getWidth();
        final int height = frameStack.getHeight();
        final int frameCount = frameStack.getFrameCount();
        final float[] averagePixels = (float[]) average.getPixels();
        final byte[] artifactPixels = (byte[]) artifactMask.getPixels();
        final float[] cleanPixels = averagePixels.clone();
        final boolean[] isFullyFlagged = new boolean[cleanPixels.length];
        final int[] fallbackCount = new int[height];

        IntStream.range(0, height).parallel().forEach(y -> {
            final float[] values = new float[frameCount];
            for (int x = 0; x < width; x++) {
                final int i = y * width + x;
                if (MaskUtil.isSet(artifactPixels, i)) {
                    int count = 0;
                    for (int f = 0; f < frameCount; f++) {
                        if (! flags.isFlagged(f, i)) {
                            values[count] = frameStack.getPixels(f)[i];
                            count++;
                        }
                    }
                    if (count > 0) {
                        cleanPixels[i] = (float) MedianUtil.median(values, count);
                    } else {
                        isFullyFlagged[i] = true;
                        fallbackCount[y]++;
                    }
                }
            }
        });

        int totalFallbackCount = 0;
        for (final int count : fallbackCount) {
            totalFallbackCount += count;
        }

        if (totalFallbackCount > 0) {
            final float[] estimates = neighborhoodEstimates(average, validityMask, artifactMask);
            final float[] values = new float[frameCount];
            for (int i = 0; i < cleanPixels.length; i++) {
                if (isFullyFlagged[i]) {
                    if (estimates == null) {
                        cleanPixels[i] = (float) MedianUtil.median(frameStack.getPixelValues(i, values));
                    } else {
                        cleanPixels[i] = estimates[i];
                    }
                }
            }
            LOG.debug("buildClean: {} artifact pixels were flagged in every frame and used {} values",
                      totalFallbackCount, estimates == null ? "stack median" : "neighborhood");
        }

        return new FloatProcessor(width, height, cleanPixels);
    }

    /**
     * Estimates a value for every pixel from the valid non-artifact average values around it.
     * <p>
     * Candidate pixels (valid and not artifact) keep their average value.  Remaining pixels are filled in
     * order of their chessboard distance d to the nearest candidate: each one receives the median of the
     * estimates of its 8 neighbors at distance d - 1.  Pixels next to a candidate therefore get the
     * median of their adjacent candidates, and the whole frame is filled in a single breadth first pass.
     *
     * @return per-pixel estimates, or null if the frame has no candidate pixel.
     */
    static float[] neighborhoodEstimates(final FloatProcessor average,
                                         final ByteProcessor validityMask,
                                         final ByteProcessor artifactMask) {

        final int width = average.getWidth();
        final int height = average.getHeight();
        final int pixelCount = width * height;
        final float[] averagePixels = (float[]) average.getPixels();
        final byte[] validityPixels = (byte[]) validityMask.getPixels();
        final byte[] artifactPixels = (byte[]) artifactMask.getPixels();

        final float[] estimates = new float[pixelCount];
        final int[] distances = new int[pixelCount];
        Arrays.fill(distances, -1);

        // queue holds each pixel once, in order of distance
        final int[] queue = new int[pixelCount];
        int tail = 0;
        for (int i = 0; i < pixelCount; i++) {
            if (MaskUtil.isSet(validityPixels, i) && (! MaskUtil.isSet(artifactPixels, i))) {
                distances[i] = 0;
                estimates[i] = averagePixels[i];
                queue[tail] = i;
                tail++;
            }
        }

        if (tail == 0) {
            return null;
        }

        final float[] neighborValues = new float[8];
        for (int head = 0; head < tail; head++) {
            final int i = queue[head];
            final int x = i % width;
            final int y = i / width;
            final int distance = distances[i];
            int neighborCount = 0;
            for (int ny = Math.max(0, y - 1); ny <= Math.min(height - 1, y + 1); ny++) {
                for (int nx = Math.max(0, x - 1); nx <= Math.min(width - 1, x + 1); nx++) {
                    final int n = ny * width + nx;
                    if (n != i) {
                        if (distances[n] == -1) {
                            distances[n] = distance + 1;
                            queue[tail] = n;
                            tail++;
                        } else if ((distance > 0) && (distances[n] == distance - 1)) {
                            neighborValues[neighborCount] = estimates[n];
                            neighborCount++;
                        }
                    }
                }
            }
            if (distance > 0) {
                estimates[i] = (float) MedianUtil.median(neighborValues, neighborCount);
            }
        }

        return estimates;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Compositor.class);
}
