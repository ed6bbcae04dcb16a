package com.astrometry.model;

/**
 * Masked window of image samples under a region. Rows are indexed by y, columns by x,
 * relative to the origin of {@link #getBounds()}. A masked sample takes no part in
 * statistics or peak searches.
 */
public class Cutout {

    private final PixelBounds bounds;
    private final double[][] data;
    private final boolean[][] mask;

    public Cutout(PixelBounds bounds, double[][] data, boolean[][] mask) {
        if (data.length != bounds.getHeight() || mask.length != data.length) {
            throw new IllegalArgumentException("Cutout rows do not match bounds " + bounds);
        }
        for (int j = 0; j < data.length; j++) {
            if (data[j].length != bounds.getWidth() || mask[j].length != bounds.getWidth()) {
                throw new IllegalArgumentException("Cutout columns do not match bounds " + bounds);
            }
        }
        this.bounds = bounds;
        this.data = data;
        this.mask = mask;
    }

    /** A zero-size cutout that remembers where it was requested. */
    public static Cutout empty(PixelBounds requested) {
        PixelBounds b = new PixelBounds(requested.x1, requested.y1, requested.x1, requested.y1);
        return new Cutout(b, new double[0][0], new boolean[0][0]);
    }

    /** An unmasked cutout over the given samples. */
    public static Cutout of(int x1, int y1, double[][] data) {
        int h = data.length;
        int w = h == 0 ? 0 : data[0].length;
        return new Cutout(new PixelBounds(x1, y1, x1 + w, y1 + h), data, new boolean[h][w]);
    }

    public PixelBounds getBounds() { return bounds; }

    public PixelPoint getOrigin() {
        return new PixelPoint(bounds.x1, bounds.y1);
    }

    public int getWidth() { return bounds.getWidth(); }
    public int getHeight() { return bounds.getHeight(); }

    public int size() {
        return getWidth() * getHeight();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public double getValue(int x, int y) {
        return data[y][x];
    }

    public boolean isMasked(int x, int y) {
        return mask[y][x];
    }

    /** Unmasked and finite. */
    public boolean isValid(int x, int y) {
        return !mask[y][x] && Double.isFinite(data[y][x]);
    }

    public int countValid() {
        int n = 0;
        for (int y = 0; y < getHeight(); y++) {
            for (int x = 0; x < getWidth(); x++) {
                if (isValid(x, y)) n++;
            }
        }
        return n;
    }

    /**
     * Minimum and maximum of the valid samples, or null when there are none.
     */
    public double[] getRange() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        boolean any = false;
        for (int y = 0; y < getHeight(); y++) {
            for (int x = 0; x < getWidth(); x++) {
                if (!isValid(x, y)) continue;
                min = Math.min(min, data[y][x]);
                max = Math.max(max, data[y][x]);
                any = true;
            }
        }
        return any ? new double[]{min, max} : null;
    }
}
