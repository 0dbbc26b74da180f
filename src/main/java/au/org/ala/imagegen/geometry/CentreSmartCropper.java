package au.org.ala.imagegen.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Fallback {@link SmartCropper} without any saliency analysis: covers the box and keeps the centre.
 */
public class CentreSmartCropper implements SmartCropper {

    private static final Logger log = LoggerFactory.getLogger(CentreSmartCropper.class);

    public static final CentreSmartCropper INSTANCE = new CentreSmartCropper();

    @Override
    public void crop(Path path, Integer width, Integer height, GeneratorImage image) {
        log.debug("centre crop {} to {}x{}", path, width, height);
        if (width != null && height != null) {
            image.resize(width, height, ResizeMode.EXACT);
        } else {
            image.resize(width, height);
        }
        image.save(path);
    }
}
