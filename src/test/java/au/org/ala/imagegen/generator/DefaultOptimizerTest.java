package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class DefaultOptimizerTest extends TestBase {

    @Test
    public void testJpegIsReEncoded() throws Exception {
        Path jpeg = createImage("photo.jpg", 300, 300, "jpeg");
        Path copy = Files.copy(jpeg, temp.getRoot().toPath().resolve("copy.jpg"));
        DefaultOptimizer.INSTANCE.optimize(jpeg, 95);
        DefaultOptimizer.INSTANCE.optimize(copy, 20);
        assertTrue(Files.size(copy) < Files.size(jpeg));
        assertEquals(300, read(copy).getWidth());
    }

    @Test
    public void testPngIsUntouched() throws Exception {
        Path png = createImage("photo.png", 50, 50, "png");
        byte[] before = Files.readAllBytes(png);
        DefaultOptimizer.INSTANCE.optimize(png, 20);
        assertArrayEquals(before, Files.readAllBytes(png));
    }
}
