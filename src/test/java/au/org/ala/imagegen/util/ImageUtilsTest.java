package au.org.ala.imagegen.util;

import au.org.ala.imagegen.TestBase;
import au.org.ala.imagegen.format.ImageFormat;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class ImageUtilsTest extends TestBase {

    @Test
    public void testRoundHalfAwayFromZero() {
        assertEquals(3, ImageUtils.round(2.5));
        assertEquals(-3, ImageUtils.round(-2.5));
        assertEquals(2, ImageUtils.round(2.4999));
        assertEquals(0, ImageUtils.round(0.0));
    }

    @Test
    public void testScaleAndCrop() {
        BufferedImage src = gradient(200, 100);
        BufferedImage scaled = ImageUtils.scale(src, 50, 80);
        assertEquals(50, scaled.getWidth());
        assertEquals(80, scaled.getHeight());
        BufferedImage cropped = ImageUtils.crop(src, 10, 20, 30, 40);
        assertEquals(30, cropped.getWidth());
        assertEquals(40, cropped.getHeight());
        assertEquals(src.getRGB(10, 20), cropped.getRGB(0, 0));
    }

    @Test
    public void testToOpaque() {
        BufferedImage argb = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
        BufferedImage opaque = ImageUtils.toOpaque(argb);
        assertFalse(opaque.getColorModel().hasAlpha());
        BufferedImage rgb = gradient(10, 10);
        assertTrue(rgb == ImageUtils.toOpaque(rgb));
    }

    @Test
    public void testJpegQuality() throws Exception {
        BufferedImage image = gradient(300, 300);
        Path low = temp.getRoot().toPath().resolve("low.jpg");
        Path high = temp.getRoot().toPath().resolve("high.jpg");
        ImageUtils.write(image, ImageFormat.JPEG, low, 10);
        ImageUtils.write(image, ImageFormat.JPEG, high, 95);
        assertTrue(Files.size(low) < Files.size(high));

        ImageReaderUtils.Dimension dims = ImageReaderUtils.getImageDimensions(high);
        assertNotNull(dims);
        assertEquals(300, dims.width);
        assertEquals(300, dims.height);
    }

    @Test
    public void testWriteTransparentPngAsJpeg() throws Exception {
        BufferedImage argb = new BufferedImage(20, 20, BufferedImage.TYPE_INT_ARGB);
        Path out = temp.getRoot().toPath().resolve("alpha.jpg");
        ImageUtils.write(argb, ImageFormat.JPEG, out, 90);
        assertEquals(20, read(out).getWidth());
    }
}
