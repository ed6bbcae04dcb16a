package com.astrometry.service;

import com.astrometry.model.ReportRow;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tests the {@link AstrometricReport} class.
 */
public class AstrometricReportTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static ReportRow row(String name, double x, double y, Double ra, Double dec) {
        return new ReportRow("Image", name, "2023 AB", "2023-01-01", "Mauna Kea", x, y, ra, dec);
    }

    @Test
    public void testUpdateReplacesRowWithSameName() {
        AstrometricReport report = new AstrometricReport();
        report.update(Collections.singletonMap("a.fits", row("a.fits", 1, 2, null, null)));
        report.update(Collections.singletonMap("a.fits", row("a.fits", 3, 4, 10.0, 20.0)));
        Assert.assertEquals(1, report.size());
        Assert.assertEquals(3.0, report.get("a.fits").x, 0);
        Assert.assertEquals(10.0, report.get("a.fits").ra, 0);

        report.clear();
        Assert.assertEquals(0, report.size());
    }

    @Test
    public void testEcsvHeader() throws IOException {
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T12:34:56.789Z"), ZoneOffset.UTC);
        AstrometricReport report = new AstrometricReport(clock);
        report.update(Collections.singletonMap("a.fits", row("a.fits", 1.23456, 2, 150.1234567, -20.5)));

        File file = folder.newFile("report.ecsv");
        report.save(file);
        List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);

        Assert.assertEquals("# %ECSV 1.0", lines.get(0));
        Assert.assertTrue(lines.contains("# - {name: ra, unit: deg, datatype: float64}"));
        Assert.assertTrue(lines.contains("# - {name: dec, unit: deg, datatype: float64}"));
        Assert.assertTrue(lines.contains("# - {creator: " + AstrometricReport.CREATOR + "}"));
        Assert.assertTrue(lines.contains("# - {creation date: '2026-10-18 12:34:56.789'}"));
        Assert.assertEquals("channel,name,target,date,location,x,y,ra,dec", lines.get(lines.size() - 2));
        Assert.assertEquals("Image,a.fits,2023 AB,2023-01-01,Mauna Kea,1.235,2.000,150.123457,-20.500000",
                lines.get(lines.size() - 1));
    }

    @Test
    public void testRowsInLexicalOrder() throws IOException {
        AstrometricReport report = new AstrometricReport();
        report.update(Collections.singletonMap("b.fits", row("b.fits", 1, 1, null, null)));
        report.update(Collections.singletonMap("A.fits", row("A.fits", 1, 1, null, null)));
        report.update(Collections.singletonMap("a.fits", row("a.fits", 1, 1, null, null)));

        List<String> names = new ArrayList<>();
        for (ReportRow r : report.getRows()) names.add(r.name);
        Assert.assertEquals(List.of("A.fits", "a.fits", "b.fits"), names);

        File file = folder.newFile("order.ecsv");
        report.save(file);
        List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        Assert.assertTrue(lines.get(lines.size() - 3).startsWith("Image,A.fits,"));
        Assert.assertTrue(lines.get(lines.size() - 1).startsWith("Image,b.fits,"));
    }

    @Test
    public void testSaveAndLoad() throws IOException {
        AstrometricReport report = new AstrometricReport();
        report.update(Collections.singletonMap("a.fits", row("a.fits", 10.5, 20.25, 150.0, 20.0)));
        ReportRow quoted = new ReportRow("Image", "b.fits", "Comet, \"bright\"", "", "", 1.0, 2.0, null, null);
        report.update(Collections.singletonMap("b.fits", quoted));

        File file = folder.newFile("roundtrip.ecsv");
        report.save(file);
        AstrometricReport loaded = AstrometricReport.load(file);

        Assert.assertEquals(2, loaded.size());
        Assert.assertEquals(20.25, loaded.get("a.fits").y, 0);
        Assert.assertEquals(150.0, loaded.get("a.fits").ra, 0);
        Assert.assertEquals("Comet, \"bright\"", loaded.get("b.fits").target);
        Assert.assertNull(loaded.get("b.fits").ra);
        Assert.assertEquals("", loaded.get("b.fits").date);
    }

    @Test
    public void testLineBreaksInFieldsSurviveReload() throws IOException {
        AstrometricReport report = new AstrometricReport();
        ReportRow row = new ReportRow("Image", "a.fits", "2023 AB", "", "Mauna Kea\nSummit\r\nHawaii", 1.0, 2.0, null, null);
        report.update(Collections.singletonMap("a.fits", row));

        File file = folder.newFile("multiline.ecsv");
        report.save(file);
        AstrometricReport loaded = AstrometricReport.load(file);

        Assert.assertEquals(1, loaded.size());
        Assert.assertEquals("Mauna Kea Summit Hawaii", loaded.get("a.fits").location);
        Assert.assertEquals(2.0, loaded.get("a.fits").y, 0);
    }

    @Test(expected = IOException.class)
    public void testSaveToMissingDirectory() throws IOException {
        File file = new File(folder.getRoot(), "missing/report.ecsv");
        new AstrometricReport().save(file);
    }

    @Test(expected = IOException.class)
    public void testLoadRejectsShortRows() throws IOException {
        File file = folder.newFile("bad.ecsv");
        Files.write(file.toPath(), List.of("# %ECSV 1.0", "channel,name,x", "Image,a.fits"), StandardCharsets.UTF_8);
        AstrometricReport.load(file);
    }
}
