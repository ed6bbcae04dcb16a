package com.astrometry.view;

/**
 * The image has no usable astrometric solution for the requested transform.
 */
public class SkyTransformException extends Exception {

    public SkyTransformException(String message) {
        super(message);
    }

    public SkyTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
