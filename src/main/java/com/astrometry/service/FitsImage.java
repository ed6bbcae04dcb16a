package com.astrometry.service;

import com.astrometry.model.PixelPoint;
import com.astrometry.model.SkyPosition;
import com.astrometry.view.Image;
import com.astrometry.view.SkyTransformException;
import ij.process.FloatProcessor;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;

import java.util.Optional;

/**
 * FITS image held in an ImageJ float processor together with its header.
 */
public class FitsImage implements Image {

    private final String name;
    private final FloatProcessor pixels;
    private final Header header;
    private final TanProjection projection;
    private final String projectionError;

    public FitsImage(String name, FloatProcessor pixels, Header header) {
        this.name = name;
        this.pixels = pixels;
        this.header = header;

        TanProjection p = null;
        String error = null;
        try {
            p = TanProjection.fromHeader(header);
        } catch (SkyTransformException e) {
            error = e.getMessage();
        }
        this.projection = p;
        this.projectionError = error;
    }

    public static FitsImage of(String name, double[][] data, Header header) {
        int h = data.length;
        int w = h == 0 ? 0 : data[0].length;
        FloatProcessor ip = new FloatProcessor(w, h);
        float[] px = (float[]) ip.getPixels();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                px[y * w + x] = (float) data[y][x];
            }
        }
        return new FitsImage(name, ip, header);
    }

    @Override
    public String getName() { return name; }

    @Override
    public int getWidth() { return pixels.getWidth(); }

    @Override
    public int getHeight() { return pixels.getHeight(); }

    @Override
    public double getValue(int x, int y) {
        return pixels.getf(x, y);
    }

    public boolean hasSkySolution() {
        return projection != null;
    }

    @Override
    public Optional<String> getKeyword(String key) {
        HeaderCard card = header.findCard(key);
        if (card == null) return Optional.empty();
        String value = card.getValue();
        return Optional.of(value == null ? "" : value.trim());
    }

    @Override
    public SkyPosition pixelToSky(double x, double y) throws SkyTransformException {
        if (projection == null) throw new SkyTransformException(name + ": " + projectionError);
        return projection.pixelToSky(x, y);
    }

    @Override
    public PixelPoint skyToPixel(SkyPosition position) throws SkyTransformException {
        if (projection == null) throw new SkyTransformException(name + ": " + projectionError);
        return projection.skyToPixel(position);
    }
}
