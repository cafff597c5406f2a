package org.janelia.decosmic;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import org.janelia.decosmic.composite.Compositor;
import org.janelia.decosmic.detect.ArtifactDetector;
import org.janelia.decosmic.detect.ArtifactFlags;
import org.janelia.decosmic.mask.MaskUtil;
import org.janelia.decosmic.mask.ValidityMaskBuilder;
import org.janelia.decosmic.statistics.StackStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes transient high energy artifacts (donuts and streaks) from a stack of repeated exposures.
 * <p>
 * The pipeline derives per-pixel stack statistics, builds a validity mask, scores every frame against
 * the statistics, flags donut and streak pixels, and composes average, clean and difference frames.
 * <p>
 * Stack statistics do not depend on processing parameters, so they are computed once per processor and
 * reused when {@link #process(DecosmicParameters)} is called again with different parameters.
 * Everything else is rebuilt for each call.
 */
public class DecosmicProcessor {

    private final FrameStack frameStack;
    private final ByteProcessor userMask;
    private StackStatistics statistics;

    public DecosmicProcessor(final FrameStack frameStack) {
        this(frameStack, null);
    }

    /**
     * @param  frameStack  frames to process.
     * @param  userMask    optional mask of pixels that may be used and modified (non-zero values), or null.
     *
     * @throws ShapeMismatchException
     *   if the user mask size differs from the frame size.
     */
    public DecosmicProcessor(final FrameStack frameStack,
                             final ImageProcessor userMask)
            throws ShapeMismatchException {

        if ((userMask != null) && (! frameStack.hasSameShape(userMask))) {
            throw new ShapeMismatchException("user mask is " + userMask.getWidth() + "x" + userMask.getHeight() +
                                             " but frames are " + frameStack.getWidth() + "x" +
                                             frameStack.getHeight());
        }

        this.frameStack = frameStack;
        this.userMask = userMask == null ? null : MaskUtil.fromNonZero(userMask);
        this.statistics = null;
    }

    /**
     * Convenience method for a single run.
     */
    public static DecosmicResult process(final FrameStack frameStack,
                                         final DecosmicParameters parameters)
            throws InvalidParameterException, EmptyMaskException {
        return new DecosmicProcessor(frameStack).process(parameters);
    }

    public FrameStack getFrameStack() {
        return frameStack;
    }

    /**
     * @return per-pixel statistics for this processor's stack (computed on first use).
     */
    public synchronized StackStatistics getStatistics() {
        if (statistics == null) {
            statistics = StackStatistics.compute(frameStack);
        }
        return statistics;
    }

    /**
     * Runs the full pipeline.  Either every result image is produced or an exception is thrown.
     *
     * @param  parameters  thresholds and exponents for this run.
     *
     * @return images and masks for this run.
     *
     * @throws InvalidParameterException
     *   if any parameter is out of range (checked before any pixel work).
     *
     * @throws EmptyMaskException
     *   if no pixel qualifies for statistics.
     */
    public DecosmicResult process(final DecosmicParameters parameters)
            throws InvalidParameterException, EmptyMaskException {

        final long startTime = System.currentTimeMillis();

        parameters.validateForFrameSize(frameStack.getWidth(), frameStack.getHeight());

        final ValidityMaskBuilder validityMaskBuilder = new ValidityMaskBuilder(parameters.getThMask(), userMask);
        final ArtifactDetector artifactDetector = new ArtifactDetector(parameters);

        LOG.info("process: entry, {}, parameters={}", frameStack, parameters);

        final StackStatistics stackStatistics = getStatistics();
        final ByteProcessor validityMask = validityMaskBuilder.build(stackStatistics);
        final ArtifactFlags flags = artifactDetector.detect(frameStack, stackStatistics, validityMask);
        final DecosmicResult result = new Compositor().compose(frameStack,
                                                               stackStatistics,
                                                               validityMask,
                                                               flags,
                                                               parameters);

        LOG.info("process: exit, summary={}, elapsed {} ms",
                 result.getSummary(), System.currentTimeMillis() - startTime);

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(DecosmicProcessor.class);
}
