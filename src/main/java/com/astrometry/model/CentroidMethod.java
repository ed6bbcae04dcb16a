package com.astrometry.model;

public enum CentroidMethod {
    NONE("none"),
    PEAK("peak"),
    GAUSSIAN_2D("2D Gaussian");

    private final String label;

    CentroidMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Offered method sets are always built from the registered methods, so an unknown
     * label is a programming error.
     */
    public static CentroidMethod fromLabel(String label) {
        for (CentroidMethod m : values()) {
            if (m.label.equalsIgnoreCase(label) || m.name().equalsIgnoreCase(label)) return m;
        }
        throw new IllegalArgumentException(label + " is not a valid centering method");
    }

    @Override
    public String toString() {
        return label;
    }
}
