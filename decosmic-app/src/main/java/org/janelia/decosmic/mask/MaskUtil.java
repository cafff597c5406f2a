package org.janelia.decosmic.mask;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.List;

/**
 * Utilities for boolean pixel masks stored in 8-bit processors.
 * A pixel is set when its value is {@link #ON} (255) and clear when it is {@link #OFF} (0),
 * so masks can be saved and viewed like any other 8-bit image.
 */
public class MaskUtil {

    public static final int ON = 255;
    public static final int OFF = 0;

    private static final byte ON_BYTE = (byte) ON;

    public static ByteProcessor createEmptyMask(final int width,
                                                final int height) {
        return new ByteProcessor(width, height);
    }

    /**
     * @return mask that is set wherever the specified flags are true.
     */
    public static ByteProcessor fromFlags(final int width,
                                          final int height,
                                          final boolean[] flags) {
        final ByteProcessor mask = createEmptyMask(width, height);
        final byte[] maskPixels = (byte[]) mask.getPixels();
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                maskPixels[i] = ON_BYTE;
            }
        }
        return mask;
    }

    /**
     * @return mask that is set wherever the specified processor has a non-zero value
     *         (e.g. a user mask loaded from an 8-bit or 16-bit image).
     */
    public static ByteProcessor fromNonZero(final ImageProcessor ip) {
        final ByteProcessor mask = createEmptyMask(ip.getWidth(), ip.getHeight());
        final byte[] maskPixels = (byte[]) mask.getPixels();
        for (int i = 0; i < maskPixels.length; i++) {
            if (ip.getf(i) != 0.0f) {
                maskPixels[i] = ON_BYTE;
            }
        }
        return mask;
    }

    public static boolean isSet(final ByteProcessor mask,
                                final int pixelIndex) {
        return ((byte[]) mask.getPixels())[pixelIndex] != 0;
    }

    public static boolean isSet(final byte[] maskPixels,
                                final int pixelIndex) {
        return maskPixels[pixelIndex] != 0;
    }

    public static void set(final byte[] maskPixels,
                           final int pixelIndex) {
        maskPixels[pixelIndex] = ON_BYTE;
    }

    public static int count(final ByteProcessor mask) {
        final byte[] maskPixels = (byte[]) mask.getPixels();
        int count = 0;
        for (final byte b : maskPixels) {
            if (b != 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return new mask that is set wherever both masks are set.
     */
    public static ByteProcessor and(final ByteProcessor a,
                                    final ByteProcessor b) {
        checkSameShape(a, b);
        final byte[] aPixels = (byte[]) a.getPixels();
        final byte[] bPixels = (byte[]) b.getPixels();
        final ByteProcessor result = createEmptyMask(a.getWidth(), a.getHeight());
        final byte[] resultPixels = (byte[]) result.getPixels();
        for (int i = 0; i < resultPixels.length; i++) {
            if ((aPixels[i] != 0) && (bPixels[i] != 0)) {
                resultPixels[i] = ON_BYTE;
            }
        }
        return result;
    }

    /**
     * @return new mask that is set wherever either mask is set.
     */
    public static ByteProcessor or(final ByteProcessor a,
                                   final ByteProcessor b) {
        checkSameShape(a, b);
        final byte[] aPixels = (byte[]) a.getPixels();
        final byte[] bPixels = (byte[]) b.getPixels();
        final ByteProcessor result = createEmptyMask(a.getWidth(), a.getHeight());
        final byte[] resultPixels = (byte[]) result.getPixels();
        for (int i = 0; i < resultPixels.length; i++) {
            if ((aPixels[i] != 0) || (bPixels[i] != 0)) {
                resultPixels[i] = ON_BYTE;
            }
        }
        return result;
    }

    /**
     * Folds the specified masks with {@link #or}.  The fold is associative and commutative,
     * so the order of the masks does not matter.
     *
     * @return new mask that is set wherever any of the masks is set.
     */
    public static ByteProcessor orAll(final int width,
                                      final int height,
                                      final List<ByteProcessor> masks) {
        ByteProcessor result = createEmptyMask(width, height);
        for (final ByteProcessor mask : masks) {
            result = or(result, mask);
        }
        return result;
    }

    private static void checkSameShape(final ImageProcessor a,
                                       final ImageProcessor b)
            throws IllegalArgumentException {
        if ((a.getWidth() != b.getWidth()) || (a.getHeight() != b.getHeight())) {
            throw new IllegalArgumentException("mask sizes differ: " + a.getWidth() + "x" + a.getHeight() +
                                               " and " + b.getWidth() + "x" + b.getHeight());
        }
    }
}
