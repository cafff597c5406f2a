package org.janelia.decosmic.statistics;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.stream.IntStream;

import org.janelia.decosmic.FrameStack;
import org.janelia.decosmic.mask.MaskUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-pixel statistics across all frames of a stack: the mean (center), the population variance,
 * and the standard deviation (dispersion) that every per-frame comparison is measured against.
 * <p>
 * Statistics are computed for every pixel and do not depend on processing parameters,
 * so one instance can be reused for any number of runs on the same stack.
 * Masked views ({@link #getMaskedMean}, {@link #getMaskedVariance}) hold 0 for pixels outside a validity mask.
 */
public class StackStatistics {

    private final int width;
    private final int height;
    private final int frameCount;
    private final double[] mean;
    private final double[] variance;
    private final double[] dispersion;

    private StackStatistics(final int width,
                            final int height,
                            final int frameCount,
                            final double[] mean,
                            final double[] variance) {
        this.width = width;
        this.height = height;
        this.frameCount = frameCount;
        this.mean = mean;
        this.variance = variance;
        this.dispersion = new double[variance.length];
        for (int i = 0; i < variance.length; i++) {
            this.dispersion[i] = Math.sqrt(variance[i]);
        }
    }

    /**
     * Computes mean and population variance for each pixel with a two pass algorithm.
     * Rows are processed in parallel; each pixel is accumulated by a single task in frame order,
     * so results are identical between runs.
     */
    public static StackStatistics compute(final FrameStack frameStack) {

        final long startTime = System.currentTimeMillis();

        final int width = frameStack.getWidth();
        final int height = frameStack.getHeight();
        final int frameCount = frameStack.getFrameCount();
        final double[] mean = new double[width * height];
        final double[] variance = new double[width * height];

        IntStream.range(0, height).parallel().forEach(y -> {
            final int rowStart = y * width;
            final int rowStop = rowStart + width;
            for (int f = 0; f < frameCount; f++) {
                final float[] pixels = frameStack.getPixels(f);
                for (int i = rowStart; i < rowStop; i++) {
                    mean[i] += pixels[i];
                }
            }
            for (int i = rowStart; i < rowStop; i++) {
                mean[i] = mean[i] / frameCount;
            }
            for (int f = 0; f < frameCount; f++) {
                final float[] pixels = frameStack.getPixels(f);
                for (int i = rowStart; i < rowStop; i++) {
                    final double delta = pixels[i] - mean[i];
                    variance[i] += delta * delta;
                }
            }
            for (int i = rowStart; i < rowStop; i++) {
                variance[i] = variance[i] / frameCount;
            }
        });

        LOG.debug("compute: derived statistics for {} frames of size {}x{} in {} ms",
                  frameCount, width, height, System.currentTimeMillis() - startTime);

        return new StackStatistics(width, height, frameCount, mean, variance);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public double getMean(final int pixelIndex) {
        return mean[pixelIndex];
    }

    public double getVariance(final int pixelIndex) {
        return variance[pixelIndex];
    }

    public double getDispersion(final int pixelIndex) {
        return dispersion[pixelIndex];
    }

    /**
     * @return the maximum per-pixel mean (0 for an all-zero stack).
     */
    public double getMaxMean() {
        double max = 0.0;
        for (final double value : mean) {
            if (value > max) {
                max = value;
            }
        }
        return max;
    }

    /**
     * @return unmasked per-pixel mean of the stack.
     */
    public FloatProcessor getMean() {
        return toProcessor(mean, null);
    }

    public FloatProcessor getMaskedMean(final ByteProcessor validityMask) {
        return toProcessor(mean, validityMask);
    }

    public FloatProcessor getMaskedVariance(final ByteProcessor validityMask) {
        return toProcessor(variance, validityMask);
    }

    private FloatProcessor toProcessor(final double[] values,
                                       final ByteProcessor validityMask) {
        final float[] pixels = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            if ((validityMask == null) || MaskUtil.isSet(validityMask, i)) {
                pixels[i] = (float) values[i];
            }
        }
        return new FloatProcessor(width, height, pixels);
    }

    @Override
    public String toString() {
        return "StackStatistics{frameCount=" + frameCount + ", width=" + width + ", height=" + height + '}';
    }

    private static final Logger LOG = LoggerFactory.getLogger(StackStatistics.class);
}
