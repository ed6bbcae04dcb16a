package com.astrometry.service;

import com.astrometry.model.Cutout;
import com.astrometry.model.PixelBounds;
import com.astrometry.model.Shape;
import com.astrometry.view.Image;

public class BoundedCutout {

    /**
     * The shape's bounding box rounded half-up to whole pixels. Every pixel index derived
     * from a region goes through this rounding.
     */
    public PixelBounds getBounds(Shape shape) {
        return shape.getBoundingBox().round();
    }

    /**
     * Samples the image under the shape. The window is {@code [x1, x2) x [y1, y2)} of the
     * rounded bounds; pixels off the image, non-finite pixels and, for curved or polygonal
     * shapes, pixels outside the exact footprint are masked. A window that misses the image
     * entirely comes back zero-size.
     */
    public Cutout extract(Image image, Shape shape) {
        PixelBounds b = getBounds(shape);
        if (b.isEmpty()) return Cutout.empty(b);

        int imgW = image.getWidth();
        int imgH = image.getHeight();
        if (b.x2 <= 0 || b.y2 <= 0 || b.x1 >= imgW || b.y1 >= imgH) {
            return Cutout.empty(b);
        }

        int w = b.getWidth();
        int h = b.getHeight();
        boolean footprint = !shape.getKind().isRectilinear();
        double[][] data = new double[h][w];
        boolean[][] mask = new boolean[h][w];

        for (int j = 0; j < h; j++) {
            int py = b.y1 + j;
            for (int i = 0; i < w; i++) {
                int px = b.x1 + i;
                if (px < 0 || py < 0 || px >= imgW || py >= imgH) {
                    data[j][i] = Double.NaN;
                    mask[j][i] = true;
                    continue;
                }
                double v = image.getValue(px, py);
                data[j][i] = v;
                mask[j][i] = !Double.isFinite(v) || (footprint && !shape.contains(px, py));
            }
        }
        return new Cutout(b, data, mask);
    }
}
