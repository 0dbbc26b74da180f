package au.org.ala.imagegen.util;

import au.org.ala.imagegen.format.ImageFormat;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.event.IIOReadWarningListener;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class ImageReaderUtils {

    protected static Logger logger = LoggerFactory.getLogger(ImageReaderUtils.class);

    /**
     * Read the first image of a file, choosing the reader from the file content.
     *
     * @throws IOException if no reader accepts the content or decoding fails
     */
    public static BufferedImage readImage(Path path) throws IOException {
        return readImage(path, DefaultImageReaderSelectionStrategy.INSTANCE);
    }

    public static BufferedImage readImage(Path path, ImageReaderSelectionStrategy selectionStrategy) throws IOException {
        try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile())) {
            if (iis == null) {
                throw new IIOException("Failed to create ImageInputStream for " + path);
            }
            ImageReader reader = selectionStrategy.selectImageReader(ImageIO.getImageReaders(iis));
            if (reader == null) {
                throw new IIOException("No image readers for " + path);
            }
            logger.trace("ImageReader: {} for {}", reader.getClass().getName(), path);
            try {
                reader.setInput(iis, true, true);
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * @return all registered readers for a format, in ImageIO registration order
     */
    public static List<ImageReader> findImageReaders(ImageFormat format) {
        List<ImageReader> readers = new ArrayList<>();
        Iterator<ImageReader> iter = ImageIO.getImageReadersByFormatName(format.getFormatName());
        while (iter.hasNext()) {
            readers.add(iter.next());
        }
        return readers;
    }

    /**
     * Decode the first image of a file with the given reader. The reader is disposed afterwards.
     *
     * @param failOnWarning treat reader warnings (eg a premature end of a JPEG stream) as a decode failure
     * @throws IOException if decoding fails
     */
    public static BufferedImage readImage(Path path, ImageReader reader, boolean failOnWarning) throws IOException {
        List<String> warnings = new ArrayList<>();
        IIOReadWarningListener listener = (source, warning) -> warnings.add(warning);
        try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile())) {
            if (iis == null) {
                throw new IIOException("Failed to create ImageInputStream for " + path);
            }
            reader.addIIOReadWarningListener(listener);
            reader.setInput(iis, true, true);
            BufferedImage image = reader.read(0);
            if (failOnWarning && !warnings.isEmpty()) {
                image.flush();
                throw new IIOException("Image " + path + " decoded with warnings: " + warnings);
            }
            return image;
        } finally {
            reader.removeIIOReadWarningListener(listener);
            reader.dispose();
        }
    }

    /**
     * Read only the dimensions of the first image in a file.
     *
     * @return the dimensions or null if no reader accepts the file
     */
    public static Dimension getImageDimensions(Path path) {
        try (ImageInputStream iis = ImageIO.createImageInputStream(path.toFile())) {
            if (iis == null) {
                return null;
            }
            ImageReader reader = DefaultImageReaderSelectionStrategy.INSTANCE.selectImageReader(ImageIO.getImageReaders(iis));
            if (reader == null) {
                return null;
            }
            try {
                reader.setInput(iis, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            logger.error("Error reading image dimensions of {}", path, e);
        }
        return null;
    }

    public static class Dimension {
        public final int width;
        public final int height;

        public Dimension(int width, int height) {
            this.width = width;
            this.height = height;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("width", width)
                    .add("height", height)
                    .toString();
        }
    }
}
