package org.janelia.decosmic.detect;

import org.janelia.decosmic.InvalidParameterException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StreakDetector} class.
 */
public class StreakDetectorTest {

    private static final int WIDTH = 8;
    private static final int HEIGHT = 6;

    @Test
    public void testHorizontalRun() {
        final double[] scores = buildHorizontalRun(1.5);

        final byte[] flags = new StreakDetector(4, 1.2, 1.0).detect(scores, DonutDetectorTest.allValid(scores.length),
                                                                    WIDTH, HEIGHT);
        Assert.assertEquals("invalid flag count", 4, DonutDetectorTest.countFlags(flags));
        for (int x = 2; x < 6; x++) {
            Assert.assertTrue("run pixel " + x + " should be flagged", flags[3 * WIDTH + x] != 0);
        }
    }

    @Test
    public void testVerticalRun() {
        final double[] scores = new double[WIDTH * HEIGHT];
        for (int y = 1; y < 5; y++) {
            scores[y * WIDTH + 6] = 1.5;
        }
        final byte[] flags = new StreakDetector(3, 1.2, 1.0).detect(scores, DonutDetectorTest.allValid(scores.length),
                                                                    WIDTH, HEIGHT);
        Assert.assertEquals("invalid flag count", 4, DonutDetectorTest.countFlags(flags));
        Assert.assertTrue("top run pixel should be flagged", flags[WIDTH + 6] != 0);
        Assert.assertTrue("bottom run pixel should be flagged", flags[4 * WIDTH + 6] != 0);
    }

    @Test
    public void testLargerWindowsNeverFlagMore() {
        final double[] scores = buildHorizontalRun(1.5);
        final byte[] validity = DonutDetectorTest.allValid(scores.length);

        int previousCount = Integer.MAX_VALUE;
        for (int win = 1; win <= HEIGHT; win++) {
            final int count = DonutDetectorTest.countFlags(new StreakDetector(win, 1.2, 1.0).detect(scores, validity,
                                                                                                    WIDTH, HEIGHT));
            if (win <= 4) {
                Assert.assertEquals("invalid count for win_streak " + win, 4, count);
            }
            Assert.assertTrue("count increased for win_streak " + win, count <= previousCount);
            previousCount = count;
        }
        Assert.assertEquals("run is shorter than the largest window", 0, previousCount);
    }

    @Test
    public void testZeroThresholdIgnoresWindowsWithoutExcursions() {
        final double[] scores = new double[WIDTH * HEIGHT];
        scores[2 * WIDTH] = 0.1;
        scores[2 * WIDTH + 1] = 0.2;
        scores[2 * WIDTH + 2] = 0.3;

        final byte[] flags = new StreakDetector(3, 0.0, 1.0).detect(scores, DonutDetectorTest.allValid(scores.length),
                                                                    WIDTH, HEIGHT);

        // row windows reach x = 4, column windows cover rows 0 to 4 of the first three columns
        Assert.assertEquals("invalid flag count", 17, DonutDetectorTest.countFlags(flags));
        Assert.assertTrue("last window with an excursion should be flagged", flags[2 * WIDTH + 4] != 0);
        Assert.assertEquals("window without excursions should not be flagged", 0, flags[2 * WIDTH + 5]);
    }

    @Test
    public void testSquaredWindowMean() {
        // window mean 1.5 weighs 2.25 with exp_streak 2
        Assert.assertTrue("squared mean should pass 2.0", new StreakDetector(2, 2.0, 2.0).isFlagged(3.0));
        Assert.assertFalse("squared mean should not pass 2.5", new StreakDetector(2, 2.5, 2.0).isFlagged(3.0));
        Assert.assertFalse("plain mean should not pass 2.0", new StreakDetector(2, 2.0, 1.0).isFlagged(3.0));

        final double[] scores = buildHorizontalRun(1.5);
        final byte[] flags = new StreakDetector(4, 2.0, 2.0).detect(scores, DonutDetectorTest.allValid(scores.length),
                                                                    WIDTH, HEIGHT);
        Assert.assertEquals("invalid flag count", 4, DonutDetectorTest.countFlags(flags));
    }

    @Test
    public void testZeroExponentIsBinary() {
        Assert.assertTrue("any positive mean should weigh 1", new StreakDetector(2, 0.5, 0.0).isFlagged(0.01));
        Assert.assertFalse("weight 1 should not pass 1.0", new StreakDetector(2, 1.0, 0.0).isFlagged(3.0));
        Assert.assertFalse("empty window should weigh 0", new StreakDetector(2, 0.5, 0.0).isFlagged(0.0));

        final double[] scores = buildHorizontalRun(1.5);
        final byte[] validity = DonutDetectorTest.allValid(scores.length);

        // every window touching the run: all of row 3 plus columns 2 to 5
        final byte[] flags = new StreakDetector(4, 0.5, 0.0).detect(scores, validity, WIDTH, HEIGHT);
        Assert.assertEquals("invalid flag count", 28, DonutDetectorTest.countFlags(flags));
        Assert.assertTrue("row end should be flagged", flags[3 * WIDTH + 7] != 0);
        Assert.assertTrue("column top should be flagged", flags[2] != 0);
        Assert.assertEquals("column outside run should not be flagged", 0, flags[1]);

        Assert.assertEquals("binary weight never exceeds 1.0", 0,
                            DonutDetectorTest.countFlags(new StreakDetector(4, 1.0, 0.0).detect(scores, validity,
                                                                                                WIDTH, HEIGHT)));
    }

    @Test
    public void testInvalidPixelsAreNotFlagged() {
        final double[] scores = buildHorizontalRun(1.5);
        final byte[] validity = DonutDetectorTest.allValid(scores.length);
        validity[3 * WIDTH + 2] = 0;

        final byte[] flags = new StreakDetector(2, 1.2, 1.0).detect(scores, validity, WIDTH, HEIGHT);
        Assert.assertEquals("invalid pixel should not be flagged", 0, flags[3 * WIDTH + 2]);
        Assert.assertTrue("valid run pixel should be flagged", flags[3 * WIDTH + 3] != 0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testWindowWiderThanFrame() {
        new StreakDetector(WIDTH + 1, 1.0, 1.0).checkFrameSize(WIDTH, HEIGHT);
    }

    @Test(expected = InvalidParameterException.class)
    public void testWindowTallerThanFrame() {
        new StreakDetector(HEIGHT + 1, 1.0, 1.0).checkFrameSize(WIDTH, HEIGHT);
    }

    @Test(expected = InvalidParameterException.class)
    public void testEmptyWindow() {
        new StreakDetector(0, 1.0, 1.0);
    }

    /**
     * @return scores with a four pixel run in row 3 (x = 2 to 5).
     */
    private static double[] buildHorizontalRun(final double value) {
        final double[] scores = new double[WIDTH * HEIGHT];
        for (int x = 2; x < 6; x++) {
            scores[3 * WIDTH + x] = value;
        }
        return scores;
    }
}
