package com.astrometry.model;

import java.util.Locale;

/**
 * One measurement in the astrometric report, keyed by image name. Undefined numeric
 * fields are null and export as blanks.
 */
public class ReportRow {
    public final String channel;
    public final String name;
    public final String target;
    public final String date;
    public final String location;
    public final Double x;
    public final Double y;
    public final Double ra;
    public final Double dec;

    public ReportRow(String channel, String name, String target, String date, String location,
                     Double x, Double y, Double ra, Double dec) {
        this.channel = nullToEmpty(channel);
        this.name = nullToEmpty(name);
        this.target = nullToEmpty(target);
        this.date = nullToEmpty(date);
        this.location = nullToEmpty(location);
        this.x = round(x, 3);
        this.y = round(y, 3);
        this.ra = round(ra, 6);
        this.dec = round(dec, 6);
    }

    public String formatX() { return format(x, 3); }
    public String formatY() { return format(y, 3); }
    public String formatRa() { return format(ra, 6); }
    public String formatDec() { return format(dec, 6); }

    private static String format(Double v, int decimals) {
        if (v == null) return "";
        return String.format(Locale.US, "%." + decimals + "f", v);
    }

    private static Double round(Double v, int decimals) {
        if (v == null || !Double.isFinite(v)) return null;
        double scale = Math.pow(10, decimals);
        return Math.round(v * scale) / scale;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return name + " [" + channel + "] x=" + formatX() + " y=" + formatY()
                + " ra=" + formatRa() + " dec=" + formatDec();
    }
}
