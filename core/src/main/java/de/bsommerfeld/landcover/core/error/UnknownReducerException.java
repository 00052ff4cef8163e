package de.bsommerfeld.landcover.core.error;

/**
 * Thrown when a statistic name does not map to a supported reducer.
 */
public class UnknownReducerException extends LandCoverException {

    public UnknownReducerException(String name) {
        super("Unsupported reducer: '" + name + "'");
    }
}
