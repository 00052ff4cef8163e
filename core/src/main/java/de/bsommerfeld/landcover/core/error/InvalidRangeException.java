package de.bsommerfeld.landcover.core.error;

/**
 * Thrown when interval bounds are inverted, unparsable, or the period
 * frequency is not recognized.
 */
public class InvalidRangeException extends LandCoverException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
