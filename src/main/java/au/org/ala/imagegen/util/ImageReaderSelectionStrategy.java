package au.org.ala.imagegen.util;

import javax.imageio.ImageReader;
import java.util.Iterator;

public interface ImageReaderSelectionStrategy {

    default ImageReader selectImageReader(Iterable<ImageReader> candidates) {
        return selectImageReader(candidates.iterator());
    }

    /**
     * @return the chosen reader, or null if there are no candidates
     */
    ImageReader selectImageReader(Iterator<ImageReader> candidates);

}
