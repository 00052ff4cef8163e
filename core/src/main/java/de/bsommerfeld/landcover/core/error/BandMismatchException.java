package de.bsommerfeld.landcover.core.error;

/**
 * Thrown when a band rename list does not match the band count, or when rasters
 * with different band schemas are combined into one series.
 */
public class BandMismatchException extends LandCoverException {

    public BandMismatchException(String message) {
        super(message);
    }
}
