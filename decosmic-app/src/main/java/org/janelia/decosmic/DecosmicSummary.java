package org.janelia.decosmic;

import java.io.Serializable;

import org.janelia.decosmic.json.JsonUtils;

/**
 * Counts and totals that describe one artifact removal run.
 */
public class DecosmicSummary
        implements Serializable {

    private final DecosmicParameters parameters;
    private final int frameCount;
    private final int width;
    private final int height;
    private final int validPixelCount;
    private final int donutPixelCount;
    private final int streakPixelCount;
    private final int artifactPixelCount;
    private final double removedIntensity;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DecosmicSummary() {
        this(null, 0, 0, 0, 0, 0, 0, 0, 0.0);
    }

    public DecosmicSummary(final DecosmicParameters parameters,
                           final int frameCount,
                           final int width,
                           final int height,
                           final int validPixelCount,
                           final int donutPixelCount,
                           final int streakPixelCount,
                           final int artifactPixelCount,
                           final double removedIntensity) {
        this.parameters = parameters;
        this.frameCount = frameCount;
        this.width = width;
        this.height = height;
        this.validPixelCount = validPixelCount;
        this.donutPixelCount = donutPixelCount;
        this.streakPixelCount = streakPixelCount;
        this.artifactPixelCount = artifactPixelCount;
        this.removedIntensity = removedIntensity;
    }

    public DecosmicParameters getParameters() {
        return parameters;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getValidPixelCount() {
        return validPixelCount;
    }

    public int getDonutPixelCount() {
        return donutPixelCount;
    }

    public int getStreakPixelCount() {
        return streakPixelCount;
    }

    public int getArtifactPixelCount() {
        return artifactPixelCount;
    }

    /**
     * @return sum of the difference image (average intensity attributed to artifacts).
     */
    public double getRemovedIntensity() {
        return removedIntensity;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static DecosmicSummary fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    @Override
    public String toString() {
        return "{frameCount: " + frameCount +
               ", size: " + width + "x" + height +
               ", validPixelCount: " + validPixelCount +
               ", donutPixelCount: " + donutPixelCount +
               ", streakPixelCount: " + streakPixelCount +
               ", artifactPixelCount: " + artifactPixelCount +
               ", removedIntensity: " + removedIntensity +
               '}';
    }

    private static final JsonUtils.Helper<DecosmicSummary> JSON_HELPER =
            new JsonUtils.Helper<>(DecosmicSummary.class);
}
