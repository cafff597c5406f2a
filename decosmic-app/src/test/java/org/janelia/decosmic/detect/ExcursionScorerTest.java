package org.janelia.decosmic.detect;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ExcursionScorer} class.
 */
public class ExcursionScorerTest {

    @Test
    public void testScore() {
        Assert.assertEquals("invalid positive score", 2.0, ExcursionScorer.score(14.0, 10.0, 2.0), 1e-12);
        Assert.assertEquals("negative excursion should be 0", 0.0, ExcursionScorer.score(6.0, 10.0, 2.0), 0.0);
        Assert.assertEquals("zero dispersion should be 0", 0.0, ExcursionScorer.score(60.0, 10.0, 0.0), 0.0);
    }

    @Test
    public void testApplyExponent() {
        Assert.assertEquals("invalid squared score", 9.0, ExcursionScorer.applyExponent(3.0, 2.0), 1e-12);
        Assert.assertEquals("invalid root score", 3.0, ExcursionScorer.applyExponent(9.0, 0.5), 1e-12);
        Assert.assertEquals("invalid binary positive score", 1.0, ExcursionScorer.applyExponent(0.01, 0.0), 0.0);
        Assert.assertEquals("invalid binary zero score", 0.0, ExcursionScorer.applyExponent(0.0, 0.0), 0.0);
    }
}
