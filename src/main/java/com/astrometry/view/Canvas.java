package com.astrometry.view;

import com.astrometry.model.RegionOverlay;

/**
 * Drawing layer holding region overlays, addressed by tag.
 */
public interface Canvas {

    String add(RegionOverlay overlay);

    void remove(String tag);

    boolean contains(String tag);

    void redraw();
}
