package com.astrometry.service;

import ij.process.FloatProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

public class FitsImageService {

    private static final Logger LOG = LoggerFactory.getLogger(FitsImageService.class);

    /**
     * Reads the first HDU holding 2D (or higher) image data. Cubes contribute their first
     * plane. Raw values are scaled with BSCALE and BZERO.
     */
    public FitsImage load(File fitsFile) throws IOException {
        try (Fits fits = new Fits(fitsFile)) {
            for (int i = 0; ; i++) {
                BasicHDU<?> hdu = fits.getHDU(i);
                if (hdu == null) break;
                Object plane = firstPlane(hdu.getKernel());
                if (plane == null) continue;

                Header header = hdu.getHeader();
                double bscale = header.getDoubleValue("BSCALE", 1.0);
                double bzero = header.getDoubleValue("BZERO", 0.0);
                FloatProcessor ip = toProcessor(plane, bscale, bzero);
                if (ip == null) {
                    throw new IOException(fitsFile.getName() + ": unsupported pixel type "
                            + plane.getClass().getSimpleName());
                }
                LOG.debug("loaded {} HDU {} ({} x {})", fitsFile.getName(), i, ip.getWidth(), ip.getHeight());
                return new FitsImage(fitsFile.getName(), ip, header);
            }
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS file " + fitsFile + ": " + e.getMessage(), e);
        }
        throw new IOException(fitsFile.getName() + " contains no image data");
    }

    // the 2D array of a kernel, descending into cubes
    private Object firstPlane(Object kernel) {
        Object k = kernel;
        while (k instanceof Object[]) {
            Object[] rows = (Object[]) k;
            if (rows.length == 0) return null;
            if (!(rows[0] instanceof Object[])) return k;
            k = rows[0];
        }
        return null;
    }

    private FloatProcessor toProcessor(Object k, double bscale, double bzero) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            FloatProcessor ip = new FloatProcessor(s[0].length, s.length);
            for (int y = 0; y < s.length; y++) for (int x = 0; x < s[0].length; x++) ip.setf(x, y, (float) (s[y][x] * bscale + bzero));
            return ip;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            FloatProcessor ip = new FloatProcessor(s[0].length, s.length);
            for (int y = 0; y < s.length; y++) for (int x = 0; x < s[0].length; x++) ip.setf(x, y, (float) (s[y][x] * bscale + bzero));
            return ip;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            FloatProcessor ip = new FloatProcessor(s[0].length, s.length);
            for (int y = 0; y < s.length; y++) for (int x = 0; x < s[0].length; x++) ip.setf(x, y, (float) ((s[y][x] & 0xFF) * bscale + bzero));
            return ip;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            FloatProcessor ip = new FloatProcessor(s[0].length, s.length);
            for (int y = 0; y < s.length; y++) for (int x = 0; x < s[0].length; x++) ip.setf(x, y, (float) (s[y][x] * bscale + bzero));
            return ip;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            FloatProcessor ip = new FloatProcessor(f[0].length, f.length);
            for (int y = 0; y < f.length; y++) for (int x = 0; x < f[0].length; x++) ip.setf(x, y, (float) (f[y][x] * bscale + bzero));
            return ip;
        }
        if (k instanceof double[][]) {
            double[][] d = (double[][]) k;
            FloatProcessor ip = new FloatProcessor(d[0].length, d.length);
            for (int y = 0; y < d.length; y++) for (int x = 0; x < d[0].length; x++) ip.setf(x, y, (float) (d[y][x] * bscale + bzero));
            return ip;
        }
        return null;
    }
}
