package org.janelia.decosmic.detect;

import org.janelia.decosmic.InvalidParameterException;
import org.janelia.decosmic.mask.MaskUtil;

/**
 * Detects halo shaped single frame excursions ("donuts") left by high energy events.
 * <p>
 * A pixel is flagged in a frame when its weighted excursion score exceeds the threshold:
 * <pre>
 *     score(f,p)^expDonut &gt; thDonut
 * </pre>
 * A single flagged frame is enough to mark the pixel location as an artifact for the stack.
 * A threshold of 0 flags every pixel with a positive excursion.
 */
public class DonutDetector {

    private final double thDonut;
    private final double expDonut;

    /**
     * @throws InvalidParameterException
     *   if the threshold or exponent is negative.
     */
    public DonutDetector(final double thDonut,
                         final double expDonut)
            throws InvalidParameterException {
        if (! (thDonut >= 0.0)) {
            throw new InvalidParameterException("th_donut (" + thDonut + ") must be a non-negative number");
        }
        if (! (expDonut >= 0.0)) {
            throw new InvalidParameterException("exp_donut (" + expDonut + ") must be a non-negative number");
        }
        this.thDonut = thDonut;
        this.expDonut = expDonut;
    }

    public boolean isFlagged(final double score) {
        return ExcursionScorer.applyExponent(score, expDonut) > thDonut;
    }

    /**
     * Flags donut pixels of one frame.
     *
     * @param  scores          score map of the frame.
     * @param  validityPixels  validity mask pixels.
     *
     * @return mask pixels that are set where the frame has a donut artifact.
     */
    public byte[] detect(final double[] scores,
                         final byte[] validityPixels) {
        final byte[] flags = new byte[scores.length];
        for (int i = 0; i < scores.length; i++) {
            if (MaskUtil.isSet(validityPixels, i) && isFlagged(scores[i])) {
                MaskUtil.set(flags, i);
            }
        }
        return flags;
    }

    @Override
    public String toString() {
        return "DonutDetector{thDonut=" + thDonut + ", expDonut=" + expDonut + '}';
    }
}
