package org.janelia.decosmic.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Paths;

import org.janelia.decosmic.DecosmicParameters;
import org.janelia.decosmic.InvalidParameterException;

/**
 * Artifact removal thresholds and exponents for command line clients.
 * <p>
 * Values are read from an optional JSON parameters file first, then any value
 * explicitly specified on the command line overrides the file (or default) value.
 */
public class ProcessingParameters
        implements Serializable {

    @Parameter(
            names = "--paramsFile",
            description = "JSON file with th_donut, th_mask, th_streak, win_streak, exp_donut, and/or exp_streak values")
    public String paramsFile;

    @Parameter(
            names = "--thDonut",
            description = "Threshold for weighted per-pixel excursion scores (default is 15)")
    public Double thDonut;

    @Parameter(
            names = "--thMask",
            description = "Fraction of the maximum average intensity a pixel needs to be used for statistics (default is 0.05)")
    public Double thMask;

    @Parameter(
            names = "--thStreak",
            description = "Threshold for weighted streak window means (default is 3)")
    public Double thStreak;

    @Parameter(
            names = "--winStreak",
            description = "Number of pixels in each streak window (default is 3)")
    public Integer winStreak;

    @Parameter(
            names = "--expDonut",
            description = "Exponent applied to per-pixel excursion scores, 0 means binary (default is 1)")
    public Double expDonut;

    @Parameter(
            names = "--expStreak",
            description = "Exponent applied to streak window means, 0 means binary (default is 1)")
    public Double expStreak;

    /**
     * @return validated parameters built from the file (if specified) and command line overrides.
     *
     * @throws IllegalArgumentException
     *   if the parameters file can not be parsed.
     *
     * @throws InvalidParameterException
     *   if any resulting value is out of range.
     */
    public DecosmicParameters buildDecosmicParameters()
            throws IllegalArgumentException, InvalidParameterException {

        final DecosmicParameters base = paramsFile == null ?
                                        new DecosmicParameters() :
                                        DecosmicParameters.fromJsonFile(Paths.get(paramsFile));

        final DecosmicParameters merged =
                new DecosmicParameters(thDonut == null ? base.getThDonut() : thDonut,
                                       thMask == null ? base.getThMask() : thMask,
                                       thStreak == null ? base.getThStreak() : thStreak,
                                       winStreak == null ? base.getWinStreak() : winStreak,
                                       expDonut == null ? base.getExpDonut() : expDonut,
                                       expStreak == null ? base.getExpStreak() : expStreak);
        merged.validate();

        return merged;
    }
}
