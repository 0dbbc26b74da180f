package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public class PlaceholderImageWriterTest extends TestBase {

    @Test
    public void testRender() throws Exception {
        Path dir = temp.getRoot().toPath().resolve("placeholders");
        PlaceholderImageWriter writer = new PlaceholderImageWriter(dir);
        Path placeholder = writer.render("w64h32");
        assertEquals(dir.resolve("placeholder_w64h32.png"), placeholder);
        BufferedImage image = read(placeholder);
        assertEquals(64, image.getWidth());
        assertEquals(32, image.getHeight());
        assertEquals(PlaceholderImageWriter.DEFAULT_COLOR.getRGB(), image.getRGB(10, 10));
    }

    @Test
    public void testExistingPlaceholderIsReused() throws Exception {
        Path dir = temp.getRoot().toPath().resolve("placeholders");
        PlaceholderImageWriter writer = new PlaceholderImageWriter(dir);
        Path first = writer.render("w20h20");
        long modified = Files.getLastModifiedTime(first).toMillis();
        Path second = writer.render("w20h20");
        assertEquals(first, second);
        assertEquals(modified, Files.getLastModifiedTime(second).toMillis());
    }

    @Test
    public void testInvalidToken() throws Exception {
        try {
            new PlaceholderImageWriter(temp.getRoot().toPath()).render("320x240");
            fail("not a size token");
        } catch (ImageGeneratorException e) {
            assertEquals(ImageGeneratorException.ErrorCode.INVALID_PARAMETERS, e.getErrorCode());
        }
    }
}
