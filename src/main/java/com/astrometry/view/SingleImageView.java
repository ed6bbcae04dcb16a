package com.astrometry.view;

import com.astrometry.model.PixelPoint;

/**
 * View over one image, panned to its center unless told otherwise.
 */
public class SingleImageView implements ImageView {

    private final String channelName;
    private Image image;
    private PixelPoint pan;
    private double[] cutLevels;

    public SingleImageView(String channelName, Image image) {
        this.channelName = channelName;
        setImage(image);
    }

    public void setImage(Image image) {
        this.image = image;
        this.pan = image == null ? new PixelPoint(0, 0)
                : new PixelPoint((image.getWidth() - 1) / 2.0, (image.getHeight() - 1) / 2.0);
        this.cutLevels = null;
    }

    public void setPan(double x, double y) {
        this.pan = new PixelPoint(x, y);
    }

    @Override
    public Image getImage() {
        return image;
    }

    @Override
    public Image getImageAt(double x, double y) {
        return image;
    }

    @Override
    public PixelPoint getPan() {
        return pan;
    }

    @Override
    public void setCutLevels(double low, double high) {
        cutLevels = new double[]{low, high};
    }

    /** @return the last cut levels applied, or null */
    public double[] getCutLevels() {
        return cutLevels;
    }

    @Override
    public String getChannelName() {
        return channelName;
    }
}
