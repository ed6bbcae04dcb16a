package com.astrometry.service;

import com.astrometry.model.ReportRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Astrometry and associated metadata, one row per image name. Rows are kept and exported
 * in lexical order of their key.
 */
public class AstrometricReport {

    public static final String CREATOR = "Astrometry Suite astrometry tool";

    private static final Logger LOG = LoggerFactory.getLogger(AstrometricReport.class);

    private static final String[] COLUMNS = {"channel", "name", "target", "date", "location", "x", "y", "ra", "dec"};
    private static final DateTimeFormatter ISO =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private final Map<String, ReportRow> rows = new TreeMap<>();
    private final Clock clock;

    public AstrometricReport() {
        this(Clock.systemUTC());
    }

    public AstrometricReport(Clock clock) {
        this.clock = clock;
    }

    /** Merges rows into the report; an existing key is replaced. */
    public void update(Map<String, ReportRow> results) {
        rows.putAll(results);
    }

    public void clear() {
        rows.clear();
    }

    public int size() {
        return rows.size();
    }

    public ReportRow get(String name) {
        return rows.get(name);
    }

    public Collection<ReportRow> getRows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    /**
     * Writes the report as an ECSV table, replacing any existing file.
     */
    public void save(File file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            out.write("# %ECSV 1.0\n");
            out.write("# ---\n");
            out.write("# delimiter: ','\n");
            out.write("# datatype:\n");
            for (String c : COLUMNS) {
                switch (c) {
                    case "x":
                    case "y":
                        out.write("# - {name: " + c + ", datatype: float64}\n");
                        break;
                    case "ra":
                    case "dec":
                        out.write("# - {name: " + c + ", unit: deg, datatype: float64}\n");
                        break;
                    default:
                        out.write("# - {name: " + c + ", datatype: string}\n");
                }
            }
            out.write("# meta: !!omap\n");
            out.write("# - {creator: " + CREATOR + "}\n");
            out.write("# - {creation date: '" + ISO.format(clock.instant()) + "'}\n");
            out.write("# schema: astropy-2.0\n");
            out.write(String.join(",", COLUMNS));
            out.write('\n');
            for (ReportRow r : rows.values()) {
                String[] fields = {r.channel, r.name, r.target, r.date, r.location,
                        r.formatX(), r.formatY(), r.formatRa(), r.formatDec()};
                for (int i = 0; i < fields.length; i++) {
                    if (i > 0) out.write(',');
                    out.write(quote(fields[i]));
                }
                out.write('\n');
            }
        }
        LOG.info("saved {} report rows to {}", rows.size(), file);
    }

    /**
     * Reads a table written by {@link #save(File)}.
     */
    public static AstrometricReport load(File file) throws IOException {
        AstrometricReport report = new AstrometricReport();
        try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            String line;
            List<String> header = null;
            int lineNumber = 0;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.startsWith("#") || line.isEmpty()) continue;
                List<String> fields = split(line);
                if (header == null) {
                    header = fields;
                    continue;
                }
                if (fields.size() != header.size()) {
                    throw new IOException(file.getName() + ":" + lineNumber + ": expected "
                            + header.size() + " columns, found " + fields.size());
                }
                Map<String, String> values = new TreeMap<>();
                for (int i = 0; i < header.size(); i++) values.put(header.get(i), fields.get(i));
                ReportRow row = new ReportRow(values.get("channel"), values.get("name"), values.get("target"),
                        values.get("date"), values.get("location"),
                        parse(values.get("x")), parse(values.get("y")),
                        parse(values.get("ra")), parse(values.get("dec")));
                report.rows.put(row.name, row);
            }
        } catch (NumberFormatException e) {
            throw new IOException(file.getName() + ": malformed number, " + e.getMessage(), e);
        }
        return report;
    }

    private static Double parse(String s) {
        if (s == null || s.isEmpty()) return null;
        return Double.valueOf(s);
    }

    // rows are one line each, so line breaks inside a field become spaces
    private static String quote(String field) {
        String s = field.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        if (s.isEmpty()) return s;
        boolean needsQuotes = s.indexOf(',') >= 0 || s.indexOf('"') >= 0
                || s.startsWith("#") || !s.equals(s.trim());
        if (!needsQuotes) return s;
        return '"' + s.replace("\"", "\"\"") + '"';
    }

    private static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    sb.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    sb.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(sb.toString());
                sb.setLength(0);
            } else {
                sb.append(c);
            }
        }
        fields.add(sb.toString());
        return fields;
    }
}
