package au.org.ala.imagegen.geometry;

import java.nio.file.Path;

/**
 * Content aware cropping. Implementations crop the loaded image to the requested size and write the result back to
 * path.
 */
public interface SmartCropper {

    void crop(Path path, Integer width, Integer height, GeneratorImage image);

}
