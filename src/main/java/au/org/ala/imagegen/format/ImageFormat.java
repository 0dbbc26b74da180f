package au.org.ala.imagegen.format;

import au.org.ala.imagegen.ImageGeneratorException;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.UNSUPPORTED_FORMAT;

/**
 * The raster formats the generator reads and writes.
 */
public enum ImageFormat {
    GIF("gif", "image/gif"),
    PNG("png", "image/png"),
    JPEG("jpeg", "image/jpeg");

    private final String formatName;
    private final String mimeType;

    ImageFormat(String formatName, String mimeType) {
        this.formatName = formatName;
        this.mimeType = mimeType;
    }

    /**
     * @return the ImageIO format name
     */
    public String getFormatName() { return formatName; }
    public String getMimeType() { return mimeType; }

    /**
     * Parse a declared format. Accepts jpg/jpeg, png and gif, case-insensitive.
     *
     * @throws ImageGeneratorException with {@code UNSUPPORTED_FORMAT} for anything else
     */
    public static ImageFormat parse(String s) {
        ImageFormat format = fromToken(s);
        if (format == null) {
            throw new ImageGeneratorException(UNSUPPORTED_FORMAT,
                    "Format \"" + s + "\" is not supported. Did you mean \"png\", \"jpg\", \"jpeg\", \"gif\"?");
        }
        return format;
    }

    /**
     * @return the format for a detected content type, or null if the content type is not a supported image
     */
    public static ImageFormat fromMimeType(String mimeType) {
        if (mimeType == null) {
            return null;
        }
        for (ImageFormat format : values()) {
            if (format.mimeType.equalsIgnoreCase(mimeType.trim())) {
                return format;
            }
        }
        return null;
    }

    /**
     * @return the format matching the file extension of path, or null if the extension is not supported
     */
    public static ImageFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? null : fromToken(FilenameUtils.getExtension(fileName.toString()));
    }

    private static ImageFormat fromToken(String s) {
        if (s == null) {
            return null;
        }
        switch (s.trim().toLowerCase()) {
            case "jpg":
            case "jpeg":
                return JPEG;
            case "png":
                return PNG;
            case "gif":
                return GIF;
            default:
                return null;
        }
    }
}
