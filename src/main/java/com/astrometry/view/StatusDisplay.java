package com.astrometry.view;

/**
 * Transient, non-fatal messages for the user.
 */
public interface StatusDisplay {

    void showError(String message);

    void showWarning(String message);
}
