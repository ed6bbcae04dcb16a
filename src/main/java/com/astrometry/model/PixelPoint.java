package com.astrometry.model;

import java.util.Locale;

public class PixelPoint {
    public final double x;
    public final double y;

    public PixelPoint(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelPoint)) return false;
        PixelPoint other = (PixelPoint) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.3f, %.3f)", x, y);
    }
}
