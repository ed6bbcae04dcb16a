package com.astrometry.service;

/**
 * A centroid could not be computed from the cutout: too little valid data, flat data,
 * or a fit that did not converge.
 */
public class CentroidException extends Exception {

    public CentroidException(String message) {
        super(message);
    }

    public CentroidException(String message, Throwable cause) {
        super(message, cause);
    }
}
