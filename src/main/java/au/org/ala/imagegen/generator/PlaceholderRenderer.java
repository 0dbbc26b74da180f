package au.org.ala.imagegen.generator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders the image served in place of a derivative that couldn't be generated.
 */
public interface PlaceholderRenderer {

    /**
     * @param sizeToken the requested size as {@code w<width>h<height>}
     * @return the rendered placeholder
     */
    Path render(String sizeToken) throws IOException;

}
