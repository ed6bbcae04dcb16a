package com.astrometry.region;

import com.astrometry.model.AstrometryConfig;
import com.astrometry.model.BoundingBox;
import com.astrometry.model.CentroidMethod;
import com.astrometry.model.Cutout;
import com.astrometry.model.PixelBounds;
import com.astrometry.model.PixelPoint;
import com.astrometry.model.RegionOverlay;
import com.astrometry.model.Shape;
import com.astrometry.service.BoundedCutout;
import com.astrometry.service.CentroidException;
import com.astrometry.service.CentroidService;
import com.astrometry.view.Canvas;
import com.astrometry.view.Image;
import com.astrometry.view.ImageView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Image region for centering on objects.
 *
 * A region draws its shape, a peak marker and a label on the canvas, and keeps a cutout of
 * the image data under the shape. Every move of the shape re-extracts the cutout. The
 * overlay stays on the canvas until {@link #close()}.
 */
public class CenteringRegion implements AutoCloseable {

    public static final String DEFAULT_LABEL = "Astrometry";

    private static final Logger LOG = LoggerFactory.getLogger(CenteringRegion.class);

    private final ImageView view;
    private final Canvas canvas;
    private final BoundedCutout cutouts;
    private final CentroidService centroids;
    private final RegionOverlay overlay;
    private String tag;
    private Cutout data;

    public CenteringRegion(Shape shape, ImageView view, Canvas canvas, String label, CentroidService centroids) {
        if (!shape.getKind().isRegion()) {
            throw new IllegalArgumentException(shape.getKind().getLabel() + " cannot be used as a region");
        }
        this.view = view;
        this.canvas = canvas;
        this.cutouts = new BoundedCutout();
        this.centroids = centroids;
        this.overlay = new RegionOverlay(shape, label);
        this.tag = canvas.add(overlay);
        updateImageData();
    }

    /** Box region of the configured size and color centered on (x, y). */
    public static CenteringRegion atLocation(double x, double y, ImageView view, Canvas canvas,
                                             AstrometryConfig config, CentroidService centroids) {
        Shape box = Shape.box(x, y, config.regionWidth / 2.0, config.regionHeight / 2.0);
        box.setColor(config.regionColor);
        return new CenteringRegion(box, view, canvas, DEFAULT_LABEL, centroids);
    }

    public Shape getShape() { return overlay.getShape(); }

    public RegionOverlay.PeakMarker getPeak() { return overlay.getPeak(); }

    public RegionOverlay.Label getLabel() { return overlay.getLabel(); }

    public boolean owns(Shape shape) {
        return overlay.getShape() == shape;
    }

    /** A fresh cutout of the image data, masked by the region shape. */
    public Cutout getImageData() {
        Image image = view.getImage();
        if (image == null) return Cutout.empty(getBounds());
        return cutouts.extract(image, getShape());
    }

    public void updateImageData() {
        data = getImageData();
    }

    public Cutout getData() {
        return data;
    }

    public PixelPoint getCenter() {
        return getShape().getCenter();
    }

    /** Moves the region; the shape may extend past the image edges. */
    public void setCenter(double x, double y) {
        getShape().moveTo(x, y);
        BoundingBox box = getShape().getBoundingBox();
        getLabel().moveTo(box.x1, box.y2);
        updateImageData();
        canvas.redraw();
    }

    public PixelPoint getCenterPoint() {
        return getPeak().getPosition();
    }

    /**
     * Places the peak marker. A position outside the rounded bounds or not finite hides the
     * marker, parks it on the region center and is reported as an exception.
     */
    public void setCenterPoint(double x, double y) throws RegionBoundsException {
        PixelBounds b = getBounds();
        if (!b.contains(x, y)) {
            PixelPoint c = getCenter();
            getPeak().moveTo(c.x, c.y);
            getPeak().setVisible(false);
            canvas.redraw();
            throw new RegionBoundsException(String.format(Locale.US,
                    "Requested center (%.1f, %.1f) is outside of the image data.", x, y));
        }
        getPeak().setVisible(true);
        getPeak().moveTo(x, y);
        canvas.redraw();
    }

    /**
     * Image value under the peak marker, 0 for an empty cutout. The marker is checked
     * against the current bounds again since the shape may have moved after it was placed.
     */
    public double getCenterPointValue() throws RegionBoundsException {
        if (data.isEmpty()) return 0;

        PixelBounds b = getBounds();
        PixelPoint p = getCenterPoint();
        if (!b.contains(p.x, p.y)) {
            throw new RegionBoundsException("Center point " + p + " is outside the region image.");
        }
        PixelBounds cb = data.getBounds();
        int x = (int) Math.round(p.x - cb.x1);
        int y = (int) Math.round(p.y - cb.y1);
        if (x < 0 || y < 0 || x >= data.getWidth() || y >= data.getHeight()) {
            throw new RegionBoundsException("Center point " + p + " is outside the region image.");
        }
        return data.getValue(x, y);
    }

    /** The shape's bounding box rounded to the nearest pixel. */
    public PixelBounds getBounds() {
        return cutouts.getBounds(getShape());
    }

    /**
     * Centroid on the region data. The peak marker is not moved.
     */
    public PixelPoint centroid(CentroidMethod method) throws CentroidException {
        return centroids.centroid(method, data, getCenterPoint());
    }

    public boolean isClosed() {
        return tag == null;
    }

    /** Removes the overlay from the canvas. Safe to call more than once. */
    @Override
    public void close() {
        if (tag == null) return;
        if (canvas.contains(tag)) canvas.remove(tag);
        canvas.redraw();
        LOG.debug("removed region {}", getShape());
        tag = null;
    }
}
