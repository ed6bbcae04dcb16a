package com.astrometry.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.prefs.Preferences;

/**
 * Settings threaded into region creation and centroiding. Instances are immutable; use the
 * {@code with...} methods to derive a changed copy.
 */
public class AstrometryConfig {

    private static final Logger LOG = LoggerFactory.getLogger(AstrometryConfig.class);

    public static final double DEFAULT_REGION_WIDTH = 7;
    public static final double DEFAULT_REGION_HEIGHT = 7;
    public static final int DEFAULT_MAX_REGION_SIZE = 1024;
    public static final int MIN_REGION_SIZE_LIMIT = 5;
    public static final int MAX_REGION_SIZE_LIMIT = 10000;
    public static final String DEFAULT_REGION_COLOR = "green";

    private static final String KEY_REGION_TYPE = "region_type";
    private static final String KEY_REGION_COLOR = "region_color";
    private static final String KEY_MAX_REGION_SIZE = "max_region_size";
    private static final String KEY_CENTERING_METHOD = "centering_method";
    private static final String KEY_AUTO_LEVELS = "auto_levels";

    public final Shape.Kind regionType;
    public final String regionColor;
    public final double regionWidth;
    public final double regionHeight;
    public final int maxRegionSize;
    public final CentroidMethod centeringMethod;
    public final boolean autoLevels;

    public AstrometryConfig(Shape.Kind regionType, String regionColor, double regionWidth, double regionHeight,
                            int maxRegionSize, CentroidMethod centeringMethod, boolean autoLevels) {
        if (!regionType.isRegion()) {
            throw new IllegalArgumentException(regionType.getLabel() + " cannot be used as a region type");
        }
        if (maxRegionSize < MIN_REGION_SIZE_LIMIT || maxRegionSize > MAX_REGION_SIZE_LIMIT) {
            throw new IllegalArgumentException("Max region size must be within "
                    + MIN_REGION_SIZE_LIMIT + ".." + MAX_REGION_SIZE_LIMIT + ": " + maxRegionSize);
        }
        if (!(regionWidth > 0) || !(regionHeight > 0)) {
            throw new IllegalArgumentException("Region size must be positive");
        }
        this.regionType = regionType;
        this.regionColor = regionColor;
        this.regionWidth = regionWidth;
        this.regionHeight = regionHeight;
        this.maxRegionSize = maxRegionSize;
        this.centeringMethod = centeringMethod;
        this.autoLevels = autoLevels;
    }

    public static AstrometryConfig defaults(Set<CentroidMethod> available) {
        return new AstrometryConfig(Shape.Kind.BOX, DEFAULT_REGION_COLOR, DEFAULT_REGION_WIDTH,
                DEFAULT_REGION_HEIGHT, DEFAULT_MAX_REGION_SIZE, fallbackMethod(available), true);
    }

    public static AstrometryConfig load(Set<CentroidMethod> available) {
        return load(Preferences.userNodeForPackage(AstrometryConfig.class), available);
    }

    /**
     * Reads stored settings. Unknown region types fall back to a box; unknown or unavailable
     * centering methods fall back to the best available one.
     */
    public static AstrometryConfig load(Preferences prefs, Set<CentroidMethod> available) {
        Shape.Kind type = Shape.Kind.BOX;
        try {
            type = Shape.Kind.fromLabel(prefs.get(KEY_REGION_TYPE, Shape.Kind.BOX.getLabel()));
        } catch (IllegalArgumentException e) {
            LOG.warn("{}, using {}", e.getMessage(), Shape.Kind.BOX.getLabel());
        }
        if (!type.isRegion()) {
            LOG.warn("{} cannot be used as a region type, using {}", type.getLabel(), Shape.Kind.BOX.getLabel());
            type = Shape.Kind.BOX;
        }

        CentroidMethod method = fallbackMethod(available);
        String stored = prefs.get(KEY_CENTERING_METHOD, null);
        if (stored != null) {
            for (CentroidMethod m : available) {
                if (m.getLabel().equals(stored)) method = m;
            }
        }

        int maxSize = prefs.getInt(KEY_MAX_REGION_SIZE, DEFAULT_MAX_REGION_SIZE);
        maxSize = Math.max(MIN_REGION_SIZE_LIMIT, Math.min(MAX_REGION_SIZE_LIMIT, maxSize));

        return new AstrometryConfig(type, prefs.get(KEY_REGION_COLOR, DEFAULT_REGION_COLOR),
                DEFAULT_REGION_WIDTH, DEFAULT_REGION_HEIGHT, maxSize, method,
                prefs.getBoolean(KEY_AUTO_LEVELS, true));
    }

    public void store(Preferences prefs) {
        prefs.put(KEY_REGION_TYPE, regionType.getLabel());
        prefs.put(KEY_REGION_COLOR, regionColor);
        prefs.putInt(KEY_MAX_REGION_SIZE, maxRegionSize);
        prefs.put(KEY_CENTERING_METHOD, centeringMethod.getLabel());
        prefs.putBoolean(KEY_AUTO_LEVELS, autoLevels);
    }

    static CentroidMethod fallbackMethod(Set<CentroidMethod> available) {
        return available.contains(CentroidMethod.GAUSSIAN_2D) ? CentroidMethod.GAUSSIAN_2D : CentroidMethod.PEAK;
    }

    public AstrometryConfig withRegionType(Shape.Kind type) {
        return new AstrometryConfig(type, regionColor, regionWidth, regionHeight, maxRegionSize, centeringMethod, autoLevels);
    }

    public AstrometryConfig withRegionColor(String color) {
        return new AstrometryConfig(regionType, color, regionWidth, regionHeight, maxRegionSize, centeringMethod, autoLevels);
    }

    public AstrometryConfig withRegionSize(double width, double height) {
        return new AstrometryConfig(regionType, regionColor, width, height, maxRegionSize, centeringMethod, autoLevels);
    }

    public AstrometryConfig withMaxRegionSize(int size) {
        return new AstrometryConfig(regionType, regionColor, regionWidth, regionHeight, size, centeringMethod, autoLevels);
    }

    public AstrometryConfig withCenteringMethod(CentroidMethod method) {
        return new AstrometryConfig(regionType, regionColor, regionWidth, regionHeight, maxRegionSize, method, autoLevels);
    }

    public AstrometryConfig withAutoLevels(boolean auto) {
        return new AstrometryConfig(regionType, regionColor, regionWidth, regionHeight, maxRegionSize, centeringMethod, auto);
    }
}
