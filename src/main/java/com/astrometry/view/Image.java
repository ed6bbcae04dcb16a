package com.astrometry.view;

import com.astrometry.model.PixelPoint;
import com.astrometry.model.SkyPosition;

import java.util.Optional;

/**
 * A 2D image as seen by the centroiding engine. Pixel coordinates are 0-based data
 * coordinates, pixel centers on integers.
 */
public interface Image {

    String getName();

    int getWidth();

    int getHeight();

    double getValue(int x, int y);

    /**
     * @return empty when the keyword is absent; an empty string when it is present without a value
     */
    Optional<String> getKeyword(String key);

    SkyPosition pixelToSky(double x, double y) throws SkyTransformException;

    PixelPoint skyToPixel(SkyPosition position) throws SkyTransformException;
}
