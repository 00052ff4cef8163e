package de.bsommerfeld.landcover.core.error;

import java.time.Duration;

/**
 * Thrown when a backend call does not complete within the caller's timeout.
 * Not retried.
 */
public class BackendTimeoutException extends LandCoverException {

    public BackendTimeoutException(String operation, Duration timeout) {
        super("Backend call '" + operation + "' timed out after " + timeout.toMillis() + " ms");
    }
}
