package com.astrometry.service;

import com.astrometry.model.PixelPoint;
import com.astrometry.model.SkyPosition;
import com.astrometry.view.SkyTransformException;
import nom.tam.fits.Header;

/**
 * Gnomonic (TAN) world coordinate solution from FITS header keywords. Accepts either the
 * {@code CDi_j} matrix, {@code CDELTi} with {@code PCi_j}, or {@code CDELTi} with
 * {@code CROTA2}. Pixel coordinates are 0-based, so FITS pixel = pixel + 1.
 */
public class TanProjection {

    private final double crval1;
    private final double crval2;
    private final double crpix1;
    private final double crpix2;
    private final double cd11, cd12, cd21, cd22;
    private final double det;

    public TanProjection(double crval1, double crval2, double crpix1, double crpix2,
                         double cd11, double cd12, double cd21, double cd22) throws SkyTransformException {
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
        this.det = cd11 * cd22 - cd12 * cd21;
        if (det == 0 || !Double.isFinite(det)) {
            throw new SkyTransformException("Singular pixel scale matrix");
        }
    }

    public static TanProjection fromHeader(Header h) throws SkyTransformException {
        String ctype1 = h.getStringValue("CTYPE1");
        String ctype2 = h.getStringValue("CTYPE2");
        if (ctype1 == null || ctype2 == null) {
            throw new SkyTransformException("No WCS: CTYPE1/CTYPE2 missing");
        }
        if (!ctype1.trim().startsWith("RA") || !ctype1.contains("-TAN") || !ctype2.contains("-TAN")) {
            throw new SkyTransformException("Unsupported projection " + ctype1.trim() + " / " + ctype2.trim());
        }
        for (String key : new String[]{"CRVAL1", "CRVAL2", "CRPIX1", "CRPIX2"}) {
            if (!h.containsKey(key)) throw new SkyTransformException("No WCS: " + key + " missing");
        }
        double crval1 = h.getDoubleValue("CRVAL1", 0);
        double crval2 = h.getDoubleValue("CRVAL2", 0);
        double crpix1 = h.getDoubleValue("CRPIX1", 0);
        double crpix2 = h.getDoubleValue("CRPIX2", 0);

        double cd11, cd12, cd21, cd22;
        if (h.containsKey("CD1_1") || h.containsKey("CD2_2")) {
            cd11 = h.getDoubleValue("CD1_1", 0);
            cd12 = h.getDoubleValue("CD1_2", 0);
            cd21 = h.getDoubleValue("CD2_1", 0);
            cd22 = h.getDoubleValue("CD2_2", 0);
        } else if (h.containsKey("CDELT1") && h.containsKey("CDELT2")) {
            double cdelt1 = h.getDoubleValue("CDELT1", 0);
            double cdelt2 = h.getDoubleValue("CDELT2", 0);
            if (h.containsKey("PC1_1") || h.containsKey("PC2_2")) {
                cd11 = cdelt1 * h.getDoubleValue("PC1_1", 1);
                cd12 = cdelt1 * h.getDoubleValue("PC1_2", 0);
                cd21 = cdelt2 * h.getDoubleValue("PC2_1", 0);
                cd22 = cdelt2 * h.getDoubleValue("PC2_2", 1);
            } else {
                double rot = Math.toRadians(h.getDoubleValue("CROTA2", 0));
                cd11 = cdelt1 * Math.cos(rot);
                cd12 = -cdelt2 * Math.sin(rot);
                cd21 = cdelt1 * Math.sin(rot);
                cd22 = cdelt2 * Math.cos(rot);
            }
        } else {
            throw new SkyTransformException("No WCS: pixel scale missing");
        }
        return new TanProjection(crval1, crval2, crpix1, crpix2, cd11, cd12, cd21, cd22);
    }

    public SkyPosition pixelToSky(double x, double y) throws SkyTransformException {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new SkyTransformException("Pixel position is not finite");
        }
        double u = x + 1 - crpix1;
        double v = y + 1 - crpix2;
        double xi = Math.toRadians(cd11 * u + cd12 * v);
        double eta = Math.toRadians(cd21 * u + cd22 * v);

        double ra0 = Math.toRadians(crval1);
        double dec0 = Math.toRadians(crval2);
        double denom = Math.cos(dec0) - eta * Math.sin(dec0);
        double ra = ra0 + Math.atan2(xi, denom);
        double dec = Math.atan2(Math.sin(dec0) + eta * Math.cos(dec0), Math.hypot(xi, denom));

        double raDeg = Math.toDegrees(ra) % 360.0;
        if (raDeg < 0) raDeg += 360.0;
        return new SkyPosition(raDeg, Math.toDegrees(dec));
    }

    public PixelPoint skyToPixel(SkyPosition p) throws SkyTransformException {
        double ra = Math.toRadians(p.ra);
        double dec = Math.toRadians(p.dec);
        double ra0 = Math.toRadians(crval1);
        double dec0 = Math.toRadians(crval2);

        double cosc = Math.sin(dec0) * Math.sin(dec) + Math.cos(dec0) * Math.cos(dec) * Math.cos(ra - ra0);
        if (cosc <= 0) {
            throw new SkyTransformException("Position " + p + " is not on the projected hemisphere");
        }
        double xi = Math.toDegrees(Math.cos(dec) * Math.sin(ra - ra0) / cosc);
        double eta = Math.toDegrees((Math.cos(dec0) * Math.sin(dec)
                - Math.sin(dec0) * Math.cos(dec) * Math.cos(ra - ra0)) / cosc);

        double u = (cd22 * xi - cd12 * eta) / det;
        double v = (-cd21 * xi + cd11 * eta) / det;
        return new PixelPoint(u + crpix1 - 1, v + crpix2 - 1);
    }
}
