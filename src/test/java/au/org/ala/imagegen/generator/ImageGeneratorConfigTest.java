package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.geometry.CornerAnchorMode;
import au.org.ala.imagegen.geometry.CropRectangle;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.List;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public class ImageGeneratorConfigTest {

    @Test
    public void testDefaults() {
        ImageGeneratorConfig config = new ImageGeneratorConfig();
        assertTrue(config.getCropPoints().isEmpty());
        assertEquals(CornerAnchorMode.INTENDED, config.getCornerAnchorMode());
        assertTrue(config.isStrictDecoding());
        assertEquals("", config.getBaseUrl());
    }

    @Test
    public void testLoadFromClasspath() {
        ImageGeneratorConfig config = ImageGeneratorConfig.load();
        assertEquals("https://images.example.org/static", config.getBaseUrl());
        assertEquals(CornerAnchorMode.LEGACY, config.getCornerAnchorMode());
        assertFalse(config.isStrictDecoding());
        assertEquals(List.of(400, 800), List.copyOf(config.getCropPoints().keySet()));
        assertEquals(new CropRectangle(10, 10, 210, 110), config.getCropPoints().get(800));
    }

    @Test
    public void testInvalidCropPoint() {
        Properties properties = new Properties();
        properties.setProperty("imagegen.cropPoints.400", "0,0,100");
        try {
            ImageGeneratorConfig.fromProperties(properties);
            fail("three coordinates");
        } catch (IllegalArgumentException e) {
            // expected
        }
        properties.setProperty("imagegen.cropPoints.400", "0,0,100,50");
        properties.setProperty("imagegen.cropPoints.wide", "0,0,100,50");
        try {
            ImageGeneratorConfig.fromProperties(properties);
            fail("threshold must be a number");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testCropRectangleSize() {
        CropRectangle rectangle = CropRectangle.parse("210,110,10,10");
        assertEquals(200, rectangle.getWidth());
        assertEquals(100, rectangle.getHeight());
    }
}
