package org.janelia.decosmic.statistics;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link MedianUtil} class.
 */
public class MedianUtilTest {

    @Test
    public void testMedian() {
        Assert.assertEquals("invalid odd median", 3.0, MedianUtil.median(new float[] { 9.0f, 3.0f, 1.0f }), 0.0);
        Assert.assertEquals("invalid even median", 2.5, MedianUtil.median(new float[] { 4.0f, 1.0f, 2.0f, 3.0f }), 0.0);
        Assert.assertEquals("invalid single median", 7.0, MedianUtil.median(new float[] { 7.0f }), 0.0);
    }

    @Test
    public void testMedianOfLeadingValues() {
        final float[] values = { 5.0f, 1.0f, 100.0f, -3.0f };
        Assert.assertEquals("only leading values should be used", 3.0, MedianUtil.median(values, 2), 0.0);
        Assert.assertArrayEquals("values should not be modified",
                                 new float[] { 5.0f, 1.0f, 100.0f, -3.0f }, values, 0.0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyMedian() {
        MedianUtil.median(new float[3], 0);
    }
}
