package de.bsommerfeld.landcover.core.error;

/**
 * Root of the error taxonomy. Every failure raised by the aggregation and
 * assessment components is a subclass, so callers can catch the whole family
 * in one place or react to the specific type.
 */
public class LandCoverException extends RuntimeException {

    public LandCoverException(String message) {
        super(message);
    }

    public LandCoverException(String message, Throwable cause) {
        super(message, cause);
    }
}
