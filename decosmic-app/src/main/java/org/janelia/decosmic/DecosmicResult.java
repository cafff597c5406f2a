package org.janelia.decosmic;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Images and masks produced by one artifact removal run.
 * <p>
 * Every image can be retrieved by its {@link ResultImage} name.  Accessors return copies,
 * so a result can not be changed after it has been created.
 */
public class DecosmicResult {

    private final Map<ResultImage, ImageProcessor> images;
    private final DecosmicSummary summary;

    public DecosmicResult(final FloatProcessor average,
                          final FloatProcessor clean,
                          final FloatProcessor difference,
                          final ByteProcessor validityMask,
                          final ByteProcessor donutMask,
                          final ByteProcessor streakMask,
                          final ByteProcessor artifactMask,
                          final FloatProcessor direct,
                          final FloatProcessor variance,
                          final DecosmicSummary summary) {

        final Map<ResultImage, ImageProcessor> map = new EnumMap<>(ResultImage.class);
        map.put(ResultImage.AVERAGE, average);
        map.put(ResultImage.CLEAN, clean);
        map.put(ResultImage.DIFFERENCE, difference);
        map.put(ResultImage.MASK, validityMask);
        map.put(ResultImage.DONUT, donutMask);
        map.put(ResultImage.STREAK, streakMask);
        map.put(ResultImage.ARTIFACT, artifactMask);
        map.put(ResultImage.DIRECT, direct);
        map.put(ResultImage.VARIANCE, variance);

        for (final Map.Entry<ResultImage, ImageProcessor> entry : map.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException(entry.getKey().getName() + " image is missing");
            }
        }

        this.images = Collections.unmodifiableMap(map);
        this.summary = summary;
    }

    /**
     * @return copy of the image with the specified name
     *         (one of average, clean, difference, mask, donut, streak, artifact, direct, variance).
     *
     * @throws IllegalArgumentException
     *   if the name is unknown.
     */
    public ImageProcessor getImage(final String name)
            throws IllegalArgumentException {
        return getImage(ResultImage.fromName(name));
    }

    public ImageProcessor getImage(final ResultImage resultImage) {
        return images.get(resultImage).duplicate();
    }

    public FloatProcessor getAverage() {
        return (FloatProcessor) getImage(ResultImage.AVERAGE);
    }

    public FloatProcessor getClean() {
        return (FloatProcessor) getImage(ResultImage.CLEAN);
    }

    public FloatProcessor getDifference() {
        return (FloatProcessor) getImage(ResultImage.DIFFERENCE);
    }

    public ByteProcessor getMask() {
        return (ByteProcessor) getImage(ResultImage.MASK);
    }

    public ByteProcessor getDonut() {
        return (ByteProcessor) getImage(ResultImage.DONUT);
    }

    public ByteProcessor getStreak() {
        return (ByteProcessor) getImage(ResultImage.STREAK);
    }

    public ByteProcessor getArtifact() {
        return (ByteProcessor) getImage(ResultImage.ARTIFACT);
    }

    public FloatProcessor getDirect() {
        return (FloatProcessor) getImage(ResultImage.DIRECT);
    }

    public FloatProcessor getVariance() {
        return (FloatProcessor) getImage(ResultImage.VARIANCE);
    }

    public DecosmicSummary getSummary() {
        return summary;
    }

    public DecosmicParameters getParameters() {
        return summary.getParameters();
    }

    @Override
    public String toString() {
        return "DecosmicResult" + summary;
    }
}
