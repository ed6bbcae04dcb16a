package com.astrometry.service;

import com.astrometry.model.CentroidMethod;
import com.astrometry.model.Cutout;
import com.astrometry.model.PixelPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Refines a position from the data in a cutout. Results are absolute image pixel
 * coordinates, the cutout origin being the lower-left corner of its bounds.
 */
public class CentroidService {

    private static final Logger LOG = LoggerFactory.getLogger(CentroidService.class);

    private static final String FITTER_CLASS =
            "org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer";

    private static final Set<CentroidMethod> INSTALLED = resolveInstalledMethods();

    private final Set<CentroidMethod> available;

    public CentroidService() {
        this(INSTALLED);
    }

    public CentroidService(Set<CentroidMethod> available) {
        this.available = Collections.unmodifiableSet(EnumSet.copyOf(available));
    }

    /** Methods supported by the current class path, resolved once. */
    public static Set<CentroidMethod> installedMethods() {
        return INSTALLED;
    }

    public Set<CentroidMethod> getAvailableMethods() {
        return available;
    }

    /**
     * @param current the position returned unchanged by {@link CentroidMethod#NONE}
     */
    public PixelPoint centroid(CentroidMethod method, Cutout cutout, PixelPoint current) throws CentroidException {
        if (!available.contains(method)) {
            throw new IllegalStateException(method + " centering is not available");
        }
        PixelPoint origin = cutout.getOrigin();
        switch (method) {
            case NONE:
                return current;
            case PEAK: {
                PixelPoint p = peak(cutout);
                return new PixelPoint(p.x + origin.x, p.y + origin.y);
            }
            case GAUSSIAN_2D: {
                PixelPoint p = new GaussianCentroider().fit(cutout);
                LOG.debug("gaussian fit center {} in cutout {}", p, cutout.getBounds());
                return new PixelPoint(p.x + origin.x, p.y + origin.y);
            }
            default:
                throw new IllegalArgumentException(method + " is not a valid centering method");
        }
    }

    /** Local coordinates of the first maximum in row-major order among valid samples. */
    PixelPoint peak(Cutout cutout) throws CentroidException {
        int bestX = -1, bestY = -1;
        double best = Double.NEGATIVE_INFINITY;
        for (int y = 0; y < cutout.getHeight(); y++) {
            for (int x = 0; x < cutout.getWidth(); x++) {
                if (!cutout.isValid(x, y)) continue;
                double v = cutout.getValue(x, y);
                if (bestX < 0 || v > best) {
                    best = v;
                    bestX = x;
                    bestY = y;
                }
            }
        }
        if (bestX < 0) throw new CentroidException("No valid pixels in region " + cutout.getBounds());
        return new PixelPoint(bestX, bestY);
    }

    private static Set<CentroidMethod> resolveInstalledMethods() {
        Set<CentroidMethod> methods = EnumSet.of(CentroidMethod.NONE, CentroidMethod.PEAK);
        try {
            Class.forName(FITTER_CLASS, false, CentroidService.class.getClassLoader());
            methods.add(CentroidMethod.GAUSSIAN_2D);
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.info("Gaussian fitting not found on the class path, some centroiding options are disabled");
        }
        return Collections.unmodifiableSet(methods);
    }
}
