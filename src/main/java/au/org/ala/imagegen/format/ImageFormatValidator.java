package au.org.ala.imagegen.format;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.util.DefaultImageReaderSelectionStrategy;
import au.org.ala.imagegen.util.ImageReaderSelectionStrategy;
import au.org.ala.imagegen.util.ImageReaderUtils;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import org.apache.commons.io.IOUtils;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.AutoDetectParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.CAPABILITY_UNAVAILABLE;

/**
 * Checks that a file really is a GIF, PNG or JPEG image by decoding it, so truncated files and files whose name or
 * content type lies about their format are rejected.
 */
public class ImageFormatValidator {

    private static final Logger log = LoggerFactory.getLogger(ImageFormatValidator.class);

    private final boolean strictDecoding;
    private final ImageReaderSelectionStrategy selectionStrategy;
    private final Detector detector;

    public ImageFormatValidator() {
        this(true);
    }

    /**
     * @param strictDecoding treat decoder warnings as an invalid image
     */
    public ImageFormatValidator(boolean strictDecoding) {
        this(strictDecoding, DefaultImageReaderSelectionStrategy.INSTANCE);
    }

    public ImageFormatValidator(boolean strictDecoding, ImageReaderSelectionStrategy selectionStrategy) {
        this.strictDecoding = strictDecoding;
        this.selectionStrategy = selectionStrategy;
        this.detector = new AutoDetectParser().getDetector();
    }

    /**
     * Validate a file against the format sniffed from its content.
     *
     * @return false if the content type is not a supported image or the file does not decode
     */
    public boolean isValidImage(Path path) {
        String contentType = detectContentType(path);
        ImageFormat format = ImageFormat.fromMimeType(contentType);
        if (format == null) {
            log.debug("Unsupported content type {} for {}", contentType, path);
            return false;
        }
        return isValidImage(path, format);
    }

    /**
     * Validate a file against a declared format.
     *
     * @param declaredFormat jpg, jpeg, png or gif, or null to sniff the format from the content
     * @throws ImageGeneratorException with {@code UNSUPPORTED_FORMAT} if the declared format is not supported, or
     * {@code CAPABILITY_UNAVAILABLE} if no decoder is installed for it
     */
    public boolean isValidImage(Path path, String declaredFormat) {
        if (declaredFormat == null) {
            return isValidImage(path);
        }
        return isValidImage(path, ImageFormat.parse(declaredFormat));
    }

    public boolean isValidImage(Path path, ImageFormat format) {
        List<ImageReader> readers = findImageReaders(format);
        ImageReader reader = selectionStrategy.selectImageReader(readers);
        if (reader == null) {
            throw new ImageGeneratorException(CAPABILITY_UNAVAILABLE, "No " + format.getFormatName() + " decoder is available now.");
        }
        if (!Files.isRegularFile(path)) {
            log.debug("{} is not a regular file", path);
            return false;
        }
        try {
            BufferedImage image = ImageReaderUtils.readImage(path, reader, strictDecoding);
            image.flush();
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("{} is not a valid {} image: {}", path, format.getFormatName(), e.getMessage());
            return false;
        }
    }

    /**
     * @return the content type detected from the bytes of the file, or null if the file can't be read
     */
    public String detectContentType(Path path) {
        ByteSource byteSource = MoreFiles.asByteSource(path);
        try (InputStream bis = byteSource.openBufferedStream()) {
            // content only, the file name must not influence the result
            MediaType mediaType = detector.detect(bis, new Metadata());
            IOUtils.consume(bis);
            return mediaType.getBaseType().toString();
        } catch (IOException ex) {
            log.error("Exception occurred detecting content type of {}", path, ex);
        }
        return null;
    }

    protected List<ImageReader> findImageReaders(ImageFormat format) {
        return ImageReaderUtils.findImageReaders(format);
    }

}
