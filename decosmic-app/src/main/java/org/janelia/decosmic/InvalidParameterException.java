package org.janelia.decosmic;

/**
 * Thrown when a processing parameter is out of range or inconsistent with the frames being processed.
 * Always raised before any pixel work begins.
 */
public class InvalidParameterException
        extends IllegalArgumentException {

    public InvalidParameterException(final String message) {
        super(message);
    }

    public InvalidParameterException(final String message,
                                     final Throwable cause) {
        super(message, cause);
    }
}
