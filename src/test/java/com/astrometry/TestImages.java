package com.astrometry;

import com.astrometry.service.FitsImage;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.fits.HeaderCardException;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

/**
 * Synthetic images for tests.
 */
public class TestImages {

    public static double[][] blank(int width, int height, double level) {
        double[][] data = new double[height][width];
        for (double[] row : data) Arrays.fill(row, level);
        return data;
    }

    public static double[][] gaussian(int width, int height, double cx, double cy, double sigmaX, double sigmaY,
                                      double amplitude, double background) {
        double[][] data = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double dx = x - cx, dy = y - cy;
                data[y][x] = background + amplitude
                        * Math.exp(-0.5 * (dx * dx / (sigmaX * sigmaX) + dy * dy / (sigmaY * sigmaY)));
            }
        }
        return data;
    }

    public static FitsImage image(String name, double[][] data) {
        return FitsImage.of(name, data, new Header());
    }

    /** TAN solution with the reference pixel on 0-based (crpix1 - 1, crpix2 - 1), 1"/px. */
    public static Header wcsHeader(double crval1, double crval2, double crpix1, double crpix2)
            throws HeaderCardException {
        Header h = new Header();
        h.addValue("CTYPE1", "RA---TAN", "");
        h.addValue("CTYPE2", "DEC--TAN", "");
        h.addValue("CRVAL1", crval1, "");
        h.addValue("CRVAL2", crval2, "");
        h.addValue("CRPIX1", crpix1, "");
        h.addValue("CRPIX2", crpix2, "");
        h.addValue("CDELT1", -1.0 / 3600.0, "");
        h.addValue("CDELT2", 1.0 / 3600.0, "");
        return h;
    }

    /** Writes a single image HDU, copying the cards of {@code extra} into its header. */
    public static void writeFits(File file, Object data, Header extra) throws FitsException, IOException {
        BasicHDU<?> hdu = Fits.makeHDU(data);
        if (extra != null) {
            Cursor<String, HeaderCard> cards = extra.iterator();
            while (cards.hasNext()) {
                hdu.getHeader().addLine(cards.next());
            }
        }
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file, "rw")) {
            fits.addHDU(hdu);
            fits.write(out);
        }
    }
}
