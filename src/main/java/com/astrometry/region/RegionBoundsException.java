package com.astrometry.region;

/**
 * A coordinate lies outside the region's image data, or is not finite.
 */
public class RegionBoundsException extends Exception {

    public RegionBoundsException(String message) {
        super(message);
    }
}
