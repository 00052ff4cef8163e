package de.bsommerfeld.landcover.core.error;

/**
 * Thrown when the raster backend fails or cannot be reached. Not retried.
 */
public class BackendUnavailableException extends LandCoverException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
