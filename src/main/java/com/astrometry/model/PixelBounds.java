package com.astrometry.model;

/**
 * Integer pixel bounds of a region, {@code x1 <= x2} and {@code y1 <= y2}.
 * The data window they describe is {@code [x1, x2) x [y1, y2)}.
 */
public class PixelBounds {
    public final int x1;
    public final int y1;
    public final int x2;
    public final int y2;

    public PixelBounds(int x1, int y1, int x2, int y2) {
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException(
                    "Invalid bounds (" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + ")");
        }
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public int getWidth() { return x2 - x1; }
    public int getHeight() { return y2 - y1; }

    public boolean isEmpty() {
        return getWidth() == 0 || getHeight() == 0;
    }

    /** Inclusive test on both edges; NaN and infinities are never inside. */
    public boolean contains(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) return false;
        return x >= x1 && x <= x2 && y >= y1 && y <= y2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBounds)) return false;
        PixelBounds b = (PixelBounds) o;
        return x1 == b.x1 && y1 == b.y1 && x2 == b.x2 && y2 == b.y2;
    }

    @Override
    public int hashCode() {
        return ((x1 * 31 + y1) * 31 + x2) * 31 + y2;
    }

    @Override
    public String toString() {
        return "(" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + ")";
    }
}
