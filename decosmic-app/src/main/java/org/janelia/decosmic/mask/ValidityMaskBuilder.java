package org.janelia.decosmic.mask;

import ij.process.ByteProcessor;

import org.janelia.decosmic.EmptyMaskException;
import org.janelia.decosmic.InvalidParameterException;
import org.janelia.decosmic.ShapeMismatchException;
import org.janelia.decosmic.statistics.StackStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the mask of detector pixels that are eligible for statistics.
 * <p>
 * The unmasked stack average is normalized by its maximum value and a pixel is valid when its
 * normalized intensity is at least the configured fraction.  This separates the illuminated scatter
 * region from beamstop shadow and detector edges.  An optional user mask (non-zero = usable)
 * further restricts the result.
 */
public class ValidityMaskBuilder {

    private final double thMask;
    private final ByteProcessor userMask;

    /**
     * @param  thMask    fraction of the maximum average intensity, in (0,1).
     * @param  userMask  optional mask of pixels the user allows to be used and modified, or null.
     *
     * @throws InvalidParameterException
     *   if thMask is not in (0,1).
     */
    public ValidityMaskBuilder(final double thMask,
                               final ByteProcessor userMask)
            throws InvalidParameterException {
        if (! (thMask > 0.0 && thMask < 1.0)) {
            throw new InvalidParameterException("th_mask (" + thMask + ") must be between 0 and 1 (exclusive)");
        }
        this.thMask = thMask;
        this.userMask = userMask;
    }

    /**
     * @return validity mask for the specified statistics.
     *
     * @throws ShapeMismatchException
     *   if the user mask does not match the frame size.
     *
     * @throws EmptyMaskException
     *   if no pixel is valid.
     */
    public ByteProcessor build(final StackStatistics statistics)
            throws ShapeMismatchException, EmptyMaskException {

        final int width = statistics.getWidth();
        final int height = statistics.getHeight();

        if ((userMask != null) && ((userMask.getWidth() != width) || (userMask.getHeight() != height))) {
            throw new ShapeMismatchException("user mask is " + userMask.getWidth() + "x" + userMask.getHeight() +
                                             " but frames are " + width + "x" + height);
        }

        final double maxMean = statistics.getMaxMean();
        final ByteProcessor mask = MaskUtil.createEmptyMask(width, height);
        final byte[] maskPixels = (byte[]) mask.getPixels();

        int validCount = 0;
        if (maxMean > 0.0) {
            for (int i = 0; i < maskPixels.length; i++) {
                final double normalizedIntensity = statistics.getMean(i) / maxMean;
                if ((normalizedIntensity >= thMask) && ((userMask == null) || MaskUtil.isSet(userMask, i))) {
                    MaskUtil.set(maskPixels, i);
                    validCount++;
                }
            }
        }

        if (validCount == 0) {
            throw new EmptyMaskException("no pixel has a normalized average intensity of at least " + thMask +
                                         (userMask == null ? "" : " inside the user mask") +
                                         " (maximum average intensity is " + maxMean + ")");
        }

        LOG.debug("build: {} of {} pixels are valid for th_mask {}", validCount, maskPixels.length, thMask);

        return mask;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ValidityMaskBuilder.class);
}
