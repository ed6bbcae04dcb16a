package com.astrometry.service;

import com.astrometry.TestImages;
import com.astrometry.model.SkyPosition;
import nom.tam.fits.Header;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Tests the {@link FitsImageService} class.
 */
public class FitsImageServiceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final FitsImageService service = new FitsImageService();

    @Test
    public void testScaledIntegerImage() throws Exception {
        short[][] raw = new short[4][6];
        raw[2][5] = 100;
        raw[0][0] = -32768;
        Header extra = new Header();
        extra.addValue("BZERO", 32768.0, "");
        extra.addValue("BSCALE", 1.0, "");
        extra.addValue("OBJECT", "M 42", "");

        File file = folder.newFile("m42.fits");
        TestImages.writeFits(file, raw, extra);

        FitsImage image = service.load(file);
        Assert.assertEquals("m42.fits", image.getName());
        Assert.assertEquals(6, image.getWidth());
        Assert.assertEquals(4, image.getHeight());
        Assert.assertEquals(32868, image.getValue(5, 2), 0);
        Assert.assertEquals(0, image.getValue(0, 0), 0);
        Assert.assertEquals(Optional.of("M 42"), image.getKeyword("OBJECT"));
        Assert.assertFalse(image.getKeyword("TELESCOP").isPresent());
        Assert.assertFalse(image.hasSkySolution());
    }

    @Test
    public void testCubeUsesFirstPlane() throws Exception {
        float[][][] cube = new float[2][3][3];
        cube[0][1][1] = 7;
        cube[1][1][1] = 99;
        File file = folder.newFile("cube.fits");
        TestImages.writeFits(file, cube, null);

        FitsImage image = service.load(file);
        Assert.assertEquals(3, image.getWidth());
        Assert.assertEquals(7, image.getValue(1, 1), 0);
    }

    @Test
    public void testSkySolutionFromHeader() throws Exception {
        File file = folder.newFile("wcs.fits");
        TestImages.writeFits(file, new float[10][10], TestImages.wcsHeader(150, 20, 5, 5));

        FitsImage image = service.load(file);
        Assert.assertTrue(image.hasSkySolution());
        SkyPosition p = image.pixelToSky(4, 4);
        Assert.assertEquals(150, p.ra, 1e-9);
        Assert.assertEquals(20, p.dec, 1e-9);
    }

    @Test(expected = IOException.class)
    public void testNotAFitsFile() throws IOException {
        File file = folder.newFile("notes.fits");
        Files.write(file.toPath(), "not a FITS file".getBytes(StandardCharsets.US_ASCII));
        service.load(file);
    }
}
