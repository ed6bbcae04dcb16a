package com.astrometry.view;

import com.astrometry.model.PixelPoint;

/**
 * The viewer a centering session is attached to.
 */
public interface ImageView {

    /** @return the image currently shown, or null */
    Image getImage();

    /** @return the image under the given pixel position, or null */
    Image getImageAt(double x, double y);

    PixelPoint getPan();

    void setCutLevels(double low, double high);

    String getChannelName();
}
