package de.bsommerfeld.landcover.core.error;

/**
 * Thrown when stratified sampling of a region yields no valid points.
 */
public class EmptyRegionException extends LandCoverException {

    public EmptyRegionException(String message) {
        super(message);
    }
}
