package au.org.ala.imagegen.generator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Re-compresses a generated image in place.
 */
public interface Optimizer {

    /**
     * @param quality quality hint between 0 and 100
     */
    void optimize(Path path, int quality) throws IOException;

}
