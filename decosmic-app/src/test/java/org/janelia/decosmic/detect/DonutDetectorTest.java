package org.janelia.decosmic.detect;

import java.util.Arrays;

import org.janelia.decosmic.InvalidParameterException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DonutDetector} class.
 */
public class DonutDetectorTest {

    private static final double[] SCORES = { 0.0, 0.5, 1.0, 2.0, 4.0 };

    @Test
    public void testThresholds() {
        final double[] thresholds = { 0.0, 0.5, 1.0, 3.0, 5.0 };
        final int[] expectedCounts = { 4, 3, 2, 1, 0 };
        for (int t = 0; t < thresholds.length; t++) {
            Assert.assertEquals("invalid count for th_donut " + thresholds[t],
                                expectedCounts[t], countFlags(new DonutDetector(thresholds[t], 1.0)));
        }
    }

    @Test
    public void testHigherThresholdNeverFlagsMore() {
        int previousCount = Integer.MAX_VALUE;
        for (double th = 0.0; th < 6.0; th += 0.25) {
            final int count = countFlags(new DonutDetector(th, 1.0));
            Assert.assertTrue("count increased for th_donut " + th, count <= previousCount);
            previousCount = count;
        }
    }

    @Test
    public void testExponents() {
        // squared scores are 0, 0.25, 1, 4, 16
        Assert.assertEquals("invalid count for exp_donut 2", 2, countFlags(new DonutDetector(1.0, 2.0)));

        // exponent 0 flags any positive excursion when the threshold is below 1
        Assert.assertEquals("invalid binary count below 1", 4, countFlags(new DonutDetector(0.5, 0.0)));
        Assert.assertEquals("invalid binary count at 1", 0, countFlags(new DonutDetector(1.0, 0.0)));
    }

    @Test
    public void testInvalidPixelsAreNeverFlagged() {
        final byte[] validity = allValid(SCORES.length);
        validity[4] = 0;
        final byte[] flags = new DonutDetector(0.0, 1.0).detect(SCORES, validity);
        Assert.assertEquals("invalid pixel should not be flagged", 0, flags[4]);
        Assert.assertEquals("valid pixel should be flagged", (byte) 255, flags[3]);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNegativeThreshold() {
        new DonutDetector(-0.1, 1.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNegativeExponent() {
        new DonutDetector(1.0, -1.0);
    }

    static byte[] allValid(final int length) {
        final byte[] validity = new byte[length];
        Arrays.fill(validity, (byte) 255);
        return validity;
    }

    static int countFlags(final byte[] flags) {
        int count = 0;
        for (final byte flag : flags) {
            if (flag != 0) {
                count++;
            }
        }
        return count;
    }

    private static int countFlags(final DonutDetector detector) {
        return countFlags(detector.detect(SCORES, allValid(SCORES.length)));
    }
}
