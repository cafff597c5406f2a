package org.janelia.decosmic;

/**
 * Thrown when no detector pixel qualifies for statistics.
 */
public class EmptyMaskException
        extends IllegalStateException {

    public EmptyMaskException(final String message) {
        super(message);
    }
}
