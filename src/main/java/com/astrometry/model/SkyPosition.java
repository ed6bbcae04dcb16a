package com.astrometry.model;

import java.util.Locale;

/**
 * Celestial position in degrees.
 */
public class SkyPosition {
    public final double ra;
    public final double dec;

    public SkyPosition(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    /** Right ascension as hours, {@code hh:mm:ss.ss}. */
    public String formatRa() {
        double ra360 = ((ra % 360.0) + 360.0) % 360.0;
        return sexagesimal(ra360 / 15.0, false);
    }

    /** Declination as degrees, {@code +dd:mm:ss.ss}. */
    public String formatDec() {
        return sexagesimal(dec, true);
    }

    private static String sexagesimal(double value, boolean signed) {
        String sign = value < 0 ? "-" : (signed ? "+" : "");
        // work in hundredths of a second so rounding carries into minutes and degrees
        long hundredths = Math.round(Math.abs(value) * 360000.0);
        long whole = hundredths / 360000;
        if (!signed) whole %= 24;
        long minutes = (hundredths / 6000) % 60;
        double seconds = (hundredths % 6000) / 100.0;
        return String.format(Locale.US, "%s%02d:%02d:%05.2f", sign, whole, minutes, seconds);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.6f, %.6f)", ra, dec);
    }
}
