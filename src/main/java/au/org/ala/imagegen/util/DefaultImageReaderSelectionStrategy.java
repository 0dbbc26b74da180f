package au.org.ala.imagegen.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageReader;
import java.util.Iterator;

/**
 * Picks the first reader from a preferred plugin vendor (TwelveMonkeys by default), otherwise the first candidate.
 */
public class DefaultImageReaderSelectionStrategy implements ImageReaderSelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(DefaultImageReaderSelectionStrategy.class);

    public static final String TWELVEMONKEYS = "twelvemonkeys";

    public static final DefaultImageReaderSelectionStrategy INSTANCE = new DefaultImageReaderSelectionStrategy(TWELVEMONKEYS);

    private final String preferredVendor;

    /**
     * @param preferredVendor a fragment of the reader class name to prefer, eg {@code twelvemonkeys}
     */
    public DefaultImageReaderSelectionStrategy(String preferredVendor) {
        this.preferredVendor = preferredVendor;
    }

    @Override
    public ImageReader selectImageReader(Iterator<ImageReader> candidates) {
        if (candidates == null) {
            return null;
        }

        ImageReader first = null;
        while (candidates.hasNext()) {
            ImageReader reader = candidates.next();
            if (first == null) {
                first = reader;
            }
            if (preferredVendor != null && reader.getClass().getName().contains(preferredVendor)) {
                log.trace("Selected preferred ImageReader {}", reader.getClass().getName());
                return reader;
            }
        }

        return first;
    }

}
