package org.janelia.decosmic.detect;

import ij.process.ByteProcessor;

import org.janelia.decosmic.DecosmicParameters;
import org.janelia.decosmic.FrameStack;
import org.janelia.decosmic.statistics.StackStatistics;
import org.janelia.decosmic.util.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the donut and streak detectors on every frame of a stack.
 * Each frame is scored once and the same score map feeds both detectors.
 */
public class ArtifactDetector {

    private final DonutDetector donutDetector;
    private final StreakDetector streakDetector;

    public ArtifactDetector(final DecosmicParameters parameters) {
        this(new DonutDetector(parameters.getThDonut(), parameters.getExpDonut()),
             new StreakDetector(parameters.getWinStreak(), parameters.getThStreak(), parameters.getExpStreak()));
    }

    public ArtifactDetector(final DonutDetector donutDetector,
                            final StreakDetector streakDetector) {
        this.donutDetector = donutDetector;
        this.streakDetector = streakDetector;
    }

    public ArtifactFlags detect(final FrameStack frameStack,
                                final StackStatistics statistics,
                                final ByteProcessor validityMask) {

        final int width = frameStack.getWidth();
        final int height = frameStack.getHeight();
        final int frameCount = frameStack.getFrameCount();

        streakDetector.checkFrameSize(width, height);

        LOG.debug("detect: entry, {}, {}", donutDetector, streakDetector);

        final ExcursionScorer scorer = new ExcursionScorer(statistics, validityMask);
        final byte[] validityPixels = (byte[]) validityMask.getPixels();
        final ArtifactFlags flags = new ArtifactFlags(width, height, frameCount);
        final ProgressTracker progress = new ProgressTracker(LOG, "detect", frameCount);

        for (int f = 0; f < frameCount; f++) {
            final double[] scores = scorer.score(frameStack.getPixels(f));
            final byte[] donutFlags = donutDetector.detect(scores, validityPixels);
            final byte[] streakFlags = streakDetector.detect(scores, validityPixels, width, height);
            flags.record(f, donutFlags, streakFlags);

            if (LOG.isTraceEnabled()) {
                LOG.trace("detect: {} has {} donut and {} streak pixels",
                          frameStack.getLabel(f), countSet(donutFlags), countSet(streakFlags));
            }

            progress.itemCompleted();
        }

        LOG.debug("detect: exit, scored {} frames in {}", progress.getCompletedCount(), progress);

        return flags;
    }

    private static int countSet(final byte[] flags) {
        int count = 0;
        for (final byte flag : flags) {
            if (flag != 0) {
                count++;
            }
        }
        return count;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactDetector.class);
}
