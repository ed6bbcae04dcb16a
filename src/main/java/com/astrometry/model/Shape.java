package com.astrometry.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * A shape drawn on the image canvas.
 *
 * The geometry is a closed set of kinds. Centered kinds keep a center plus radii, vertex
 * kinds (rectangle, polygons, line) keep their vertices. Shapes are owned by the canvas;
 * regions hold a reference and move it in place.
 */
public final class Shape {

    public enum Kind {
        BOX("box"),
        SQUAREBOX("squarebox"),
        RECTANGLE("rectangle"),
        CIRCLE("circle"),
        ELLIPSE("ellipse"),
        FREEPOLYGON("freepolygon"),
        POLYGON("polygon"),
        POINT("point"),
        LINE("line");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        /** Kinds that can back a centering region. */
        public boolean isRegion() {
            return this != POINT && this != LINE;
        }

        /** Kinds whose footprint is exactly their bounding box. */
        public boolean isRectilinear() {
            return this == BOX || this == SQUAREBOX || this == RECTANGLE;
        }

        public static Kind fromLabel(String label) {
            for (Kind k : values()) {
                if (k.label.equalsIgnoreCase(label)) return k;
            }
            throw new IllegalArgumentException(label + " is not a known shape kind");
        }
    }

    private final Kind kind;
    private double x;
    private double y;
    private final double xRadius;
    private final double yRadius;
    private final double rotation;
    private final double[] xs;
    private final double[] ys;
    private String color;

    private Shape(Kind kind, double x, double y, double xRadius, double yRadius, double rotation,
                  double[] xs, double[] ys, String color) {
        this.kind = kind;
        this.x = x;
        this.y = y;
        this.xRadius = xRadius;
        this.yRadius = yRadius;
        this.rotation = rotation;
        this.xs = xs;
        this.ys = ys;
        this.color = color;
    }

    private static Shape centered(Kind kind, double x, double y, double xr, double yr, double rot) {
        if (xr < 0 || yr < 0) throw new IllegalArgumentException("Negative radius for " + kind.getLabel());
        return new Shape(kind, x, y, xr, yr, rot, null, null, "cyan");
    }

    private static Shape vertices(Kind kind, double[] xs, double[] ys, int minPoints) {
        if (xs.length != ys.length || xs.length < minPoints) {
            throw new IllegalArgumentException(kind.getLabel() + " needs at least " + minPoints + " vertices");
        }
        return new Shape(kind, 0, 0, 0, 0, 0, xs.clone(), ys.clone(), "cyan");
    }

    public static Shape box(double x, double y, double xRadius, double yRadius) {
        return centered(Kind.BOX, x, y, xRadius, yRadius, 0);
    }

    public static Shape squareBox(double x, double y, double radius) {
        return centered(Kind.SQUAREBOX, x, y, radius, radius, 0);
    }

    public static Shape rectangle(double x1, double y1, double x2, double y2) {
        return vertices(Kind.RECTANGLE, new double[]{x1, x2}, new double[]{y1, y2}, 2);
    }

    public static Shape circle(double x, double y, double radius) {
        return centered(Kind.CIRCLE, x, y, radius, radius, 0);
    }

    public static Shape ellipse(double x, double y, double xRadius, double yRadius, double rotationDeg) {
        return centered(Kind.ELLIPSE, x, y, xRadius, yRadius, rotationDeg);
    }

    public static Shape polygon(double[] xs, double[] ys) {
        return vertices(Kind.POLYGON, xs, ys, 3);
    }

    public static Shape freePolygon(double[] xs, double[] ys) {
        return vertices(Kind.FREEPOLYGON, xs, ys, 3);
    }

    public static Shape point(double x, double y) {
        return centered(Kind.POINT, x, y, 0, 0, 0);
    }

    public static Shape line(double x1, double y1, double x2, double y2) {
        return vertices(Kind.LINE, new double[]{x1, x2}, new double[]{y1, y2}, 2);
    }

    /**
     * Shape of the given kind centered on (x, y) with the given half sizes. Vertex kinds
     * without a natural center fall back to a box.
     */
    public static Shape of(Kind kind, double x, double y, double halfWidth, double halfHeight) {
        switch (kind) {
            case SQUAREBOX: return squareBox(x, y, Math.max(halfWidth, halfHeight));
            case RECTANGLE: return rectangle(x - halfWidth, y - halfHeight, x + halfWidth, y + halfHeight);
            case CIRCLE: return circle(x, y, Math.max(halfWidth, halfHeight));
            case ELLIPSE: return ellipse(x, y, halfWidth, halfHeight, 0);
            case POINT: return point(x, y);
            default: return box(x, y, halfWidth, halfHeight);
        }
    }

    public Kind getKind() { return kind; }

    public String getColor() { return color; }

    public void setColor(String color) {
        this.color = color;
    }

    public PixelPoint getCenter() {
        return switch (kind) {
            case BOX, SQUAREBOX, CIRCLE, ELLIPSE, POINT -> new PixelPoint(x, y);
            case RECTANGLE, FREEPOLYGON, POLYGON, LINE -> new PixelPoint(mean(xs), mean(ys));
        };
    }

    public BoundingBox getBoundingBox() {
        return switch (kind) {
            case BOX, SQUAREBOX, CIRCLE, POINT ->
                    new BoundingBox(x - xRadius, y - yRadius, x + xRadius, y + yRadius);
            case ELLIPSE -> {
                double t = Math.toRadians(rotation);
                double c = Math.cos(t), s = Math.sin(t);
                double hx = Math.hypot(xRadius * c, yRadius * s);
                double hy = Math.hypot(xRadius * s, yRadius * c);
                yield new BoundingBox(x - hx, y - hy, x + hx, y + hy);
            }
            case RECTANGLE, FREEPOLYGON, POLYGON, LINE ->
                    new BoundingBox(min(xs), min(ys), max(xs), max(ys));
        };
    }

    /** True when the pixel coordinate (px, py) lies inside the shape's footprint. */
    public boolean contains(double px, double py) {
        if (!Double.isFinite(px) || !Double.isFinite(py)) return false;
        return switch (kind) {
            case BOX, SQUAREBOX -> Math.abs(px - x) <= xRadius && Math.abs(py - y) <= yRadius;
            case RECTANGLE -> px >= min(xs) && px <= max(xs) && py >= min(ys) && py <= max(ys);
            case CIRCLE -> {
                double dx = px - x, dy = py - y;
                yield dx * dx + dy * dy <= xRadius * xRadius;
            }
            case ELLIPSE -> ellipseContains(px, py);
            case FREEPOLYGON, POLYGON -> polygonContains(px, py);
            case POINT -> px == x && py == y;
            case LINE -> false;
        };
    }

    /** Moves the shape so that its center lands on (nx, ny). */
    public void moveTo(double nx, double ny) {
        switch (kind) {
            case BOX, SQUAREBOX, CIRCLE, ELLIPSE, POINT -> {
                x = nx;
                y = ny;
            }
            case RECTANGLE, FREEPOLYGON, POLYGON, LINE -> {
                PixelPoint c = getCenter();
                double dx = nx - c.x, dy = ny - c.y;
                for (int i = 0; i < xs.length; i++) {
                    xs[i] += dx;
                    ys[i] += dy;
                }
            }
        }
    }

    private boolean ellipseContains(double px, double py) {
        if (xRadius == 0 || yRadius == 0) return false;
        double t = Math.toRadians(-rotation);
        double dx = px - x, dy = py - y;
        double u = dx * Math.cos(t) - dy * Math.sin(t);
        double v = dx * Math.sin(t) + dy * Math.cos(t);
        return (u * u) / (xRadius * xRadius) + (v * v) / (yRadius * yRadius) <= 1.0;
    }

    // even-odd rule
    private boolean polygonContains(double px, double py) {
        boolean inside = false;
        for (int i = 0, j = xs.length - 1; i < xs.length; j = i++) {
            boolean crosses = (ys[i] > py) != (ys[j] > py);
            if (crosses && px < (xs[j] - xs[i]) * (py - ys[i]) / (ys[j] - ys[i]) + xs[i]) {
                inside = !inside;
            }
        }
        return inside;
    }

    private static double mean(double[] v) {
        double s = 0;
        for (double d : v) s += d;
        return s / v.length;
    }

    private static double min(double[] v) {
        return Arrays.stream(v).min().orElse(Double.NaN);
    }

    private static double max(double[] v) {
        return Arrays.stream(v).max().orElse(Double.NaN);
    }

    @Override
    public String toString() {
        PixelPoint c = getCenter();
        return String.format(Locale.US, "%s at (%.2f, %.2f)", kind.getLabel(), c.x, c.y);
    }
}
