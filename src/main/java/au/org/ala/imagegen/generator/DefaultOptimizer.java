package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.format.ImageFormat;
import au.org.ala.imagegen.util.ImageReaderUtils;
import au.org.ala.imagegen.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Re-encodes JPEG files at the quality hint. Lossless formats are left untouched.
 */
public class DefaultOptimizer implements Optimizer {

    private static final Logger log = LoggerFactory.getLogger(DefaultOptimizer.class);

    public static final DefaultOptimizer INSTANCE = new DefaultOptimizer();

    @Override
    public void optimize(Path path, int quality) throws IOException {
        ImageFormat format = ImageFormat.fromPath(path);
        if (format != ImageFormat.JPEG) {
            log.debug("Skipping optimisation of {} ({})", path, format);
            return;
        }
        long before = Files.size(path);
        BufferedImage image = ImageReaderUtils.readImage(path);
        try {
            ImageUtils.write(image, ImageFormat.JPEG, path, quality);
        } finally {
            image.flush();
        }
        log.debug("Optimised {} at quality {}: {} -> {} bytes", path, quality, before, Files.size(path));
    }
}
