package com.astrometry.model;

/**
 * Raw lower-left / upper-right corners of a shape, in image pixel coordinates.
 */
public class BoundingBox {
    public final double x1;
    public final double y1;
    public final double x2;
    public final double y2;

    public BoundingBox(double x1, double y1, double x2, double y2) {
        this.x1 = Math.min(x1, x2);
        this.y1 = Math.min(y1, y2);
        this.x2 = Math.max(x1, x2);
        this.y2 = Math.max(y1, y2);
    }

    public double getWidth() { return x2 - x1; }
    public double getHeight() { return y2 - y1; }

    /** Rounds every corner half-up to the nearest pixel. */
    public PixelBounds round() {
        return new PixelBounds(
                (int) Math.round(x1), (int) Math.round(y1),
                (int) Math.round(x2), (int) Math.round(y2));
    }
}
