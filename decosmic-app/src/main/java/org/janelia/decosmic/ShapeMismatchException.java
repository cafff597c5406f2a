package org.janelia.decosmic;

/**
 * Thrown when frames (or a user mask) do not share the same width and height,
 * or when too few frames are available to derive stack statistics.
 */
public class ShapeMismatchException
        extends IllegalArgumentException {

    public ShapeMismatchException(final String message) {
        super(message);
    }
}
