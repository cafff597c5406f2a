package org.janelia.decosmic.statistics;

import java.util.Arrays;

/**
 * Median helpers for small sample sets (stack values at one pixel or a pixel neighborhood).
 */
public class MedianUtil {

    /**
     * @param  values  sample values (not modified).
     * @param  count   number of leading values to use.
     *
     * @return median of the first count values; the mean of the two middle values for even counts.
     *
     * @throws IllegalArgumentException
     *   if count is not positive.
     */
    public static double median(final float[] values,
                                final int count)
            throws IllegalArgumentException {

        if (count < 1) {
            throw new IllegalArgumentException("median requires at least one value");
        }

        final float[] sorted = Arrays.copyOf(values, count);
        Arrays.sort(sorted);

        final int middle = count / 2;
        final double median;
        if ((count % 2) == 0) {
            median = (sorted[middle - 1] + (double) sorted[middle]) / 2.0;
        } else {
            median = sorted[middle];
        }
        return median;
    }

    public static double median(final float[] values) {
        return median(values, values.length);
    }
}
