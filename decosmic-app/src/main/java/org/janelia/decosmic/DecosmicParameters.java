package org.janelia.decosmic;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.nio.file.Path;

import org.janelia.decosmic.json.JsonUtils;

/**
 * Immutable set of thresholds and exponents that control one artifact removal run.
 * <p>
 * Field names are serialized with the underscore names used in parameter files
 * (e.g. <code>{"th_donut": 15.0, "th_mask": 0.05, ...}</code>).
 * Missing properties keep their default values.
 * <ul>
 *     <li>thDonut: threshold for the weighted per-pixel excursion score (&gt;= 0)</li>
 *     <li>thMask: fraction of the maximum average intensity a pixel needs to be used for statistics, in (0,1)</li>
 *     <li>thStreak: threshold for the weighted window mean of excursion scores (&gt;= 0)</li>
 *     <li>winStreak: number of pixels in each streak window (&gt;= 1)</li>
 *     <li>expDonut: exponent applied to per-pixel scores (&gt;= 0, 0 means binary)</li>
 *     <li>expStreak: exponent applied to window means (&gt;= 0, 0 means binary)</li>
 * </ul>
 */
public class DecosmicParameters
        implements Serializable {

    public static final double DEFAULT_TH_DONUT = 15.0;
    public static final double DEFAULT_TH_MASK = 0.05;
    public static final double DEFAULT_TH_STREAK = 3.0;
    public static final int DEFAULT_WIN_STREAK = 3;
    public static final double DEFAULT_EXP_DONUT = 1.0;
    public static final double DEFAULT_EXP_STREAK = 1.0;

    @JsonProperty("th_donut")
    private final double thDonut;

    @JsonProperty("th_mask")
    private final double thMask;

    @JsonProperty("th_streak")
    private final double thStreak;

    @JsonProperty("win_streak")
    private final int winStreak;

    @JsonProperty("exp_donut")
    private final double expDonut;

    @JsonProperty("exp_streak")
    private final double expStreak;

    /**
     * Constructs a parameter set with default values
     * (also used for JSON deserialization).
     */
    public DecosmicParameters() {
        this(DEFAULT_TH_DONUT,
             DEFAULT_TH_MASK,
             DEFAULT_TH_STREAK,
             DEFAULT_WIN_STREAK,
             DEFAULT_EXP_DONUT,
             DEFAULT_EXP_STREAK);
    }

    public DecosmicParameters(final double thDonut,
                              final double thMask,
                              final double thStreak,
                              final int winStreak,
                              final double expDonut,
                              final double expStreak) {
        this.thDonut = thDonut;
        this.thMask = thMask;
        this.thStreak = thStreak;
        this.winStreak = winStreak;
        this.expDonut = expDonut;
        this.expStreak = expStreak;
    }

    public double getThDonut() {
        return thDonut;
    }

    public double getThMask() {
        return thMask;
    }

    public double getThStreak() {
        return thStreak;
    }

    public int getWinStreak() {
        return winStreak;
    }

    public double getExpDonut() {
        return expDonut;
    }

    public double getExpStreak() {
        return expStreak;
    }

    /**
     * @throws InvalidParameterException
     *   if any parameter is outside of its allowed range.
     */
    public void validate()
            throws InvalidParameterException {

        validateNonNegative("th_donut", thDonut);

        if (! (thMask > 0.0 && thMask < 1.0)) {
            throw new InvalidParameterException("th_mask (" + thMask + ") must be between 0 and 1 (exclusive)");
        }

        validateNonNegative("th_streak", thStreak);

        if (winStreak < 1) {
            throw new InvalidParameterException("win_streak (" + winStreak + ") must be at least 1");
        }

        validateNonNegative("exp_donut", expDonut);
        validateNonNegative("exp_streak", expStreak);
    }

    /**
     * Validates these parameters for frames with the specified dimensions.
     * Streak windows are slid along rows and columns, so they must fit in both directions.
     *
     * @throws InvalidParameterException
     *   if any parameter is invalid or the streak window does not fit into a frame.
     */
    public void validateForFrameSize(final int width,
                                     final int height)
            throws InvalidParameterException {

        validate();

        if (winStreak > width) {
            throw new InvalidParameterException("win_streak (" + winStreak + ") exceeds frame width (" + width + ")");
        }
        if (winStreak > height) {
            throw new InvalidParameterException("win_streak (" + winStreak + ") exceeds frame height (" + height + ")");
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static DecosmicParameters fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @return parameters loaded from the specified file; unknown property names are rejected.
     */
    public static DecosmicParameters fromJsonFile(final Path jsonPath)
            throws IllegalArgumentException {
        return STRICT_JSON_HELPER.fromJsonFile(jsonPath);
    }

    @Override
    public boolean equals(final Object o) {
        final boolean result;
        if (this == o) {
            result = true;
        } else if (o instanceof DecosmicParameters) {
            final DecosmicParameters that = (DecosmicParameters) o;
            result = (Double.compare(thDonut, that.thDonut) == 0) &&
                     (Double.compare(thMask, that.thMask) == 0) &&
                     (Double.compare(thStreak, that.thStreak) == 0) &&
                     (winStreak == that.winStreak) &&
                     (Double.compare(expDonut, that.expDonut) == 0) &&
                     (Double.compare(expStreak, that.expStreak) == 0);
        } else {
            result = false;
        }
        return result;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(thDonut);
        result = 31 * result + Double.hashCode(thMask);
        result = 31 * result + Double.hashCode(thStreak);
        result = 31 * result + winStreak;
        result = 31 * result + Double.hashCode(expDonut);
        result = 31 * result + Double.hashCode(expStreak);
        return result;
    }

    @Override
    public String toString() {
        return COMPACT_JSON_HELPER.toJson(this);
    }

    private static void validateNonNegative(final String name,
                                            final double value)
            throws InvalidParameterException {
        if (! (value >= 0.0)) {
            throw new InvalidParameterException(name + " (" + value + ") must be a non-negative number");
        }
    }

    private static final JsonUtils.Helper<DecosmicParameters> JSON_HELPER =
            new JsonUtils.Helper<>(DecosmicParameters.class);

    private static final JsonUtils.Helper<DecosmicParameters> STRICT_JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.STRICT_MAPPER, DecosmicParameters.class);

    private static final JsonUtils.Helper<DecosmicParameters> COMPACT_JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, DecosmicParameters.class);
}
