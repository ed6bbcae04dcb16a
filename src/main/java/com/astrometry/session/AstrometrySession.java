package com.astrometry.session;

import com.astrometry.model.AstrometryConfig;
import com.astrometry.model.BoundingBox;
import com.astrometry.model.Cutout;
import com.astrometry.model.PixelPoint;
import com.astrometry.model.ReportRow;
import com.astrometry.model.Shape;
import com.astrometry.model.SkyPosition;
import com.astrometry.region.CenteringRegion;
import com.astrometry.region.RegionBoundsException;
import com.astrometry.service.AstrometricReport;
import com.astrometry.service.CentroidException;
import com.astrometry.service.CentroidService;
import com.astrometry.view.Canvas;
import com.astrometry.view.Image;
import com.astrometry.view.ImageView;
import com.astrometry.view.SkyTransformException;
import com.astrometry.view.StatusDisplay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Locale;

/**
 * Measurement session for one viewer: at most one centering region, the displayed center
 * measurement, observation metadata and the report. All calls come from the thread that
 * delivers the viewer's events.
 */
public class AstrometrySession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AstrometrySession.class);

    private final ImageView view;
    private final Canvas canvas;
    private final StatusDisplay status;
    private final CentroidService centroids;
    private final AstrometricReport report;
    private AstrometryConfig config;

    private CenteringRegion region;

    // displayed measurement, null when blank
    private Double centerX;
    private Double centerY;
    private Double centerValue;
    private SkyPosition centerSky;

    private String target = "";
    private String date = "";
    private String observerLocation = "";

    public AstrometrySession(ImageView view, Canvas canvas, StatusDisplay status,
                             AstrometryConfig config, CentroidService centroids, AstrometricReport report) {
        if (!centroids.getAvailableMethods().contains(config.centeringMethod)) {
            throw new IllegalArgumentException(config.centeringMethod + " centering is not available");
        }
        this.view = view;
        this.canvas = canvas;
        this.status = status;
        this.config = config;
        this.centroids = centroids;
        this.report = report;
    }

    public AstrometryConfig getConfig() { return config; }

    public void setConfig(AstrometryConfig config) {
        if (!centroids.getAvailableMethods().contains(config.centeringMethod)) {
            throw new IllegalArgumentException(config.centeringMethod + " centering is not available");
        }
        this.config = config;
    }

    public CenteringRegion getRegion() { return region; }

    public AstrometricReport getReport() { return report; }

    public Double getCenterX() { return centerX; }
    public Double getCenterY() { return centerY; }
    public Double getCenterValue() { return centerValue; }
    public SkyPosition getCenterSky() { return centerSky; }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target == null ? "" : target.trim(); }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date == null ? "" : date.trim(); }

    public String getObserverLocation() { return observerLocation; }
    public void setObserverLocation(String location) { this.observerLocation = location == null ? "" : location.trim(); }

    /**
     * A shape was drawn on the canvas: replace the region with one based on it. Shapes that
     * cannot be regions, or that exceed the maximum region size, are ignored.
     */
    public void onShapeDrawn(Shape shape) {
        if (!shape.getKind().isRegion()) {
            LOG.debug("ignoring {}", shape);
            return;
        }
        BoundingBox box = shape.getBoundingBox();
        if (box.getWidth() > config.maxRegionSize || box.getHeight() > config.maxRegionSize) {
            status.showError(String.format(Locale.US, "Region is larger than the maximum size (%d px)",
                    config.maxRegionSize));
            return;
        }

        discardRegion();
        region = new CenteringRegion(shape, view, canvas, CenteringRegion.DEFAULT_LABEL, centroids);
        setCutLevels();
        recenter();
    }

    /** A shape was edited on the canvas; refresh if it belongs to the region. */
    public void onShapeEdited(Shape shape) {
        if (region == null || !region.owns(shape)) return;
        region.updateImageData();
        setCutLevels();
        recenter();
    }

    /** Moves the region to the pointer, or creates a default one there. */
    public void buttonDown(double x, double y) {
        if (region == null) {
            region = CenteringRegion.atLocation(x, y, view, canvas, config, centroids);
        } else {
            region.setCenter(x, y);
        }
    }

    public void buttonDrag(double x, double y) {
        if (region == null) return;
        region.setCenter(x, y);
    }

    /** Final location: move, refresh the data and centroid. */
    public void buttonUp(double x, double y) {
        if (region == null) return;
        moveRegion(x, y);
        recenter();
    }

    /** Replaces the region with one of the configured type at the view center. */
    public void useViewCenter() {
        PixelPoint pan = view.getPan();
        Shape shape = Shape.of(config.regionType, pan.x, pan.y, config.regionWidth / 2.0, config.regionHeight / 2.0);
        shape.setColor(config.regionColor);
        onShapeDrawn(shape);
    }

    public void moveRegion(double x, double y) {
        if (region == null) return;
        region.setCenter(x, y);
        setCutLevels();
    }

    /** Centroids with the configured method and moves the peak there. */
    public void recenter() {
        if (region == null) return;
        PixelPoint p;
        try {
            p = region.centroid(config.centeringMethod);
        } catch (CentroidException e) {
            LOG.warn("centroid failed: {}", e.getMessage());
            status.showWarning(e.getMessage());
            return;
        }
        movePeak(p.x, p.y);
    }

    /**
     * Moves the region's peak marker and updates the displayed measurement.
     */
    public void movePeak(double x, double y) {
        if (region == null) return;
        try {
            region.setCenterPoint(x, y);
            centerX = x;
            centerY = y;
            centerValue = region.getCenterPointValue();
        } catch (RegionBoundsException e) {
            clearMeasurement();
            status.showError(e.getMessage());
            return;
        }

        Image image = view.getImageAt(x, y);
        centerSky = null;
        if (image == null) return;
        try {
            centerSky = image.pixelToSky(x, y);
        } catch (SkyTransformException e) {
            LOG.warn("Couldn't calculate sky coordinates: {}", e.getMessage());
        }
    }

    /** Scales the view to the data range of the region, when enabled. */
    public void setCutLevels() {
        if (!config.autoLevels || region == null) return;
        Cutout data = region.getImageData();
        double[] range = data.getRange();
        if (range != null) view.setCutLevels(range[0], range[1]);
    }

    /** Adds the displayed measurement to the report, keyed by image name. */
    public ReportRow addToReport() {
        if (region == null) return null;
        Image image = view.getImage();
        if (image == null) return null;

        ReportRow row = new ReportRow(view.getChannelName(), image.getName(), target, date, observerLocation,
                centerX, centerY,
                centerSky == null ? null : centerSky.ra,
                centerSky == null ? null : centerSky.dec);
        report.update(Collections.singletonMap(row.name, row));
        return row;
    }

    public void clearReport() {
        report.clear();
    }

    public void saveReport(File file) throws IOException {
        report.save(file);
    }

    /** The viewer switched images: the region no longer applies. */
    public void onImageChanged() {
        discardRegion();
        clearMeasurement();
    }

    private void discardRegion() {
        if (region != null) {
            region.close();
            region = null;
        }
    }

    private void clearMeasurement() {
        centerX = null;
        centerY = null;
        centerValue = null;
        centerSky = null;
    }

    @Override
    public void close() {
        discardRegion();
    }
}
