package com.astrometry.view;

import com.astrometry.model.RegionOverlay;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canvas that only keeps track of its overlays. Used when no viewer is attached.
 */
public class HeadlessCanvas implements Canvas {

    private final Map<String, RegionOverlay> overlays = new LinkedHashMap<>();
    private int nextTag = 1;
    private int redrawCount = 0;

    @Override
    public String add(RegionOverlay overlay) {
        String tag = "overlay-" + nextTag++;
        overlays.put(tag, overlay);
        return tag;
    }

    @Override
    public void remove(String tag) {
        overlays.remove(tag);
    }

    @Override
    public boolean contains(String tag) {
        return overlays.containsKey(tag);
    }

    @Override
    public void redraw() {
        redrawCount++;
    }

    public Collection<RegionOverlay> getOverlays() {
        return Collections.unmodifiableCollection(overlays.values());
    }

    public int getRedrawCount() {
        return redrawCount;
    }
}
