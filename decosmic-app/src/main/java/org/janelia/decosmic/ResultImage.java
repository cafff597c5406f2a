package org.janelia.decosmic;

/**
 * Named images produced by an artifact removal run.
 */
public enum ResultImage {

    /** Stack mean restricted to valid pixels. */
    AVERAGE("average", false),

    /** Average with artifact pixels replaced by robust estimates. */
    CLEAN("clean", false),

    /** Average minus clean. */
    DIFFERENCE("difference", false),

    /** Pixels eligible for statistics. */
    MASK("mask", true),

    /** Pixels flagged by the donut detector in at least one frame. */
    DONUT("donut", true),

    /** Pixels flagged by the streak detector in at least one frame. */
    STREAK("streak", true),

    /** Union of donut and streak pixels. */
    ARTIFACT("artifact", true),

    /** Unmasked stack mean. */
    DIRECT("direct", false),

    /** Stack variance restricted to valid pixels. */
    VARIANCE("variance", false);

    private final String name;
    private final boolean isMask;

    ResultImage(final String name,
                final boolean isMask) {
        this.name = name;
        this.isMask = isMask;
    }

    public String getName() {
        return name;
    }

    public boolean isMask() {
        return isMask;
    }

    /**
     * @throws IllegalArgumentException
     *   if no result image has the specified name.
     */
    public static ResultImage fromName(final String name)
            throws IllegalArgumentException {
        for (final ResultImage resultImage : values()) {
            if (resultImage.name.equals(name)) {
                return resultImage;
            }
        }
        throw new IllegalArgumentException("unknown result image name '" + name + "'");
    }
}
