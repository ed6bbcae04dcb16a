package com.astrometry.main;

import com.astrometry.model.AstrometryConfig;
import com.astrometry.model.CentroidMethod;
import com.astrometry.model.ReportRow;
import com.astrometry.service.AstrometricReport;
import com.astrometry.service.CentroidService;
import com.astrometry.service.FitsImage;
import com.astrometry.service.FitsImageService;
import com.astrometry.session.AstrometrySession;
import com.astrometry.view.HeadlessCanvas;
import com.astrometry.view.SingleImageView;
import com.astrometry.view.StatusDisplay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Measures one source in a series of FITS images and writes the astrometric report.
 *
 * The region starts at the given position in every image and is re-centered with the
 * selected method before the row is recorded.
 */
public class AstrometryTool {

    private static final Logger LOG = LoggerFactory.getLogger(AstrometryTool.class);

    private final FitsImageService fitsService = new FitsImageService();
    private final CentroidService centroids;
    private final AstrometryConfig config;

    public AstrometryTool(AstrometryConfig config, CentroidService centroids) {
        this.config = config;
        this.centroids = centroids;
    }

    public AstrometricReport run(AstrometryToolParameters params) throws IOException {
        AstrometricReport report = new AstrometricReport();
        SingleImageView view = new SingleImageView("Image", null);
        HeadlessCanvas canvas = new HeadlessCanvas();
        StatusDisplay status = new LoggingStatusDisplay();

        try (AstrometrySession session = new AstrometrySession(view, canvas, status, config, centroids, report)) {
            session.setTarget(params.target);
            session.setDate(params.date);
            session.setObserverLocation(params.location);

            for (String path : params.images) {
                FitsImage image = fitsService.load(new File(path));
                view.setImage(image);
                session.onImageChanged();

                session.buttonDown(params.x, params.y);
                session.buttonUp(params.x, params.y);
                ReportRow row = session.addToReport();
                LOG.info("{}", row);
            }
            session.saveReport(new File(params.out));
        }
        return report;
    }

    static AstrometryConfig configFor(AstrometryToolParameters params, CentroidService centroids) {
        AstrometryConfig config = AstrometryConfig.defaults(centroids.getAvailableMethods())
                .withRegionSize(params.width, params.height);
        if (params.method != null) {
            CentroidMethod method = CentroidMethod.fromLabel(params.method);
            if (!centroids.getAvailableMethods().contains(method)) {
                throw new IllegalArgumentException(method + " centering is not available");
            }
            config = config.withCenteringMethod(method);
        }
        return config;
    }

    public static void main(String[] args) {
        AstrometryToolParameters params = new AstrometryToolParameters();
        if (!params.parse(args)) System.exit(1);

        CentroidService centroids = new CentroidService();
        try {
            new AstrometryTool(configFor(params, centroids), centroids).run(params);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("astrometry failed", e);
            System.exit(1);
        }
    }

    static class LoggingStatusDisplay implements StatusDisplay {
        @Override
        public void showError(String message) {
            LOG.error(message);
        }

        @Override
        public void showWarning(String message) {
            LOG.warn(message);
        }
    }
}
