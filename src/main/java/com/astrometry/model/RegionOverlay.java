package com.astrometry.model;

/**
 * What a centering region draws on the canvas: its shape, the peak marker and a text label.
 */
public class RegionOverlay {

    public static class PeakMarker {
        public static final double RADIUS = 6;

        private double x;
        private double y;
        private boolean visible = true;
        private final String color = "red";

        PeakMarker(double x, double y) {
            this.x = x;
            this.y = y;
        }

        public double getX() { return x; }
        public double getY() { return y; }
        public String getColor() { return color; }
        public boolean isVisible() { return visible; }

        public PixelPoint getPosition() {
            return new PixelPoint(x, y);
        }

        public void moveTo(double nx, double ny) {
            x = nx;
            y = ny;
        }

        public void setVisible(boolean visible) {
            this.visible = visible;
        }
    }

    public static class Label {
        private double x;
        private double y;
        private final String text;
        private final String color;

        Label(double x, double y, String text, String color) {
            this.x = x;
            this.y = y;
            this.text = text;
            this.color = color;
        }

        public double getX() { return x; }
        public double getY() { return y; }
        public String getText() { return text; }
        public String getColor() { return color; }

        public void moveTo(double nx, double ny) {
            x = nx;
            y = ny;
        }
    }

    private final Shape shape;
    private final PeakMarker peak;
    private final Label label;

    public RegionOverlay(Shape shape, String text) {
        this.shape = shape;
        PixelPoint c = shape.getCenter();
        BoundingBox box = shape.getBoundingBox();
        this.peak = new PeakMarker(c.x, c.y);
        this.label = new Label(box.x1, box.y2, text, shape.getColor());
    }

    public Shape getShape() { return shape; }
    public PeakMarker getPeak() { return peak; }
    public Label getLabel() { return label; }
}
