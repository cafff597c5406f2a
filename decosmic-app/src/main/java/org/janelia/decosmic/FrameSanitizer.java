package org.janelia.decosmic;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.io.Serializable;

/**
 * Converts decoded detector frames into non-negative float counts.
 * <p>
 * NaN, infinite and negative values become 0.  When a saturation limit is configured,
 * values strictly above the limit (hot or saturated pixels) also become 0.
 */
public class FrameSanitizer
        implements Serializable {

    /** Sanitizer that keeps every finite non-negative value. */
    public static final FrameSanitizer DEFAULT = new FrameSanitizer(Double.POSITIVE_INFINITY);

    private final double saturationLimit;

    /**
     * @param  saturationLimit  values above this limit are zeroed
     *                          (use {@link Double#POSITIVE_INFINITY} to disable).
     *
     * @throws IllegalArgumentException
     *   if the limit is NaN or negative.
     */
    public FrameSanitizer(final double saturationLimit)
            throws IllegalArgumentException {
        if (! (saturationLimit >= 0.0)) {
            throw new IllegalArgumentException("saturationLimit (" + saturationLimit + ") must be non-negative");
        }
        this.saturationLimit = saturationLimit;
    }

    public double getSaturationLimit() {
        return saturationLimit;
    }

    /**
     * @return sanitized float copy of the specified frame (the source is never modified).
     */
    public FloatProcessor sanitize(final ImageProcessor frame) {
        final FloatProcessor converted = frame.convertToFloatProcessor();
        final float[] source = (float[]) converted.getPixels();
        final float[] pixels = new float[source.length];
        for (int i = 0; i < source.length; i++) {
            pixels[i] = sanitize(source[i]);
        }
        return new FloatProcessor(frame.getWidth(), frame.getHeight(), pixels);
    }

    public float sanitize(final float value) {
        final float sanitizedValue;
        if (Float.isNaN(value) || Float.isInfinite(value) || (value < 0) || (value > saturationLimit)) {
            sanitizedValue = 0.0f;
        } else {
            sanitizedValue = value;
        }
        return sanitizedValue;
    }

    @Override
    public String toString() {
        return "FrameSanitizer{saturationLimit=" + saturationLimit + '}';
    }
}
