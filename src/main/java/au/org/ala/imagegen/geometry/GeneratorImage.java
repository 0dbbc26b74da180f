package au.org.ala.imagegen.geometry;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.format.ImageFormat;
import au.org.ala.imagegen.util.ImageReaderUtils;
import au.org.ala.imagegen.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Dimension;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.DECODE_FAILURE;
import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.ENCODE_FAILURE;

/**
 * A mutable image handle. {@link #crop} and {@link #resize} replace the wrapped image and return this handle so calls
 * can be chained.
 * <p>
 * Sizes are rounded half away from zero and never drop below one pixel. Crop windows are clamped to the image: a
 * negative offset shrinks the window and moves it to the edge, and the window never runs past the right or bottom edge.
 */
public class GeneratorImage {

    private static final Logger log = LoggerFactory.getLogger(GeneratorImage.class);

    public static final int DEFAULT_JPEG_QUALITY = 85;

    private BufferedImage image;

    public GeneratorImage(BufferedImage image) {
        this.image = Objects.requireNonNull(image, "image must not be null");
    }

    /**
     * @throws ImageGeneratorException with {@code DECODE_FAILURE} if the file can't be decoded
     */
    public static GeneratorImage load(Path path) {
        try {
            return new GeneratorImage(ImageReaderUtils.readImage(path));
        } catch (IOException | RuntimeException e) {
            throw new ImageGeneratorException(DECODE_FAILURE, "Unable to decode image \"" + path + "\": " + e.getMessage(), e);
        }
    }

    public void save(Path path) {
        save(path, DEFAULT_JPEG_QUALITY);
    }

    /**
     * Encode to path in the format given by its file extension.
     *
     * @param quality JPEG quality between 0 and 100
     * @throws ImageGeneratorException with {@code ENCODE_FAILURE} if the extension is not a supported format or
     * writing fails
     */
    public void save(Path path, int quality) {
        ImageFormat format = ImageFormat.fromPath(path);
        if (format == null) {
            throw new ImageGeneratorException(ENCODE_FAILURE, "Unable to save image \"" + path + "\", unsupported file extension.");
        }
        try {
            ImageUtils.write(image, format, path, quality);
        } catch (IOException | RuntimeException e) {
            throw new ImageGeneratorException(ENCODE_FAILURE, "Unable to save image \"" + path + "\": " + e.getMessage(), e);
        }
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    public BufferedImage getImage() {
        return image;
    }

    public GeneratorImage crop(int left, int top, int width, int height) {
        Rectangle cutout = calculateCutout(getWidth(), getHeight(), left, top, width, height);
        if (cutout.x == 0 && cutout.y == 0 && cutout.width == getWidth() && cutout.height == getHeight()) {
            return this;
        }
        log.trace("crop {}x{} to {}", getWidth(), getHeight(), cutout);
        replace(ImageUtils.crop(image, cutout.x, cutout.y, cutout.width, cutout.height));
        return this;
    }

    /**
     * Crop with offsets given as percentages of the space left over, eg 50/50 centres the window.
     */
    public GeneratorImage cropPercent(double leftPercent, double topPercent, int width, int height) {
        int left = ImageUtils.round((getWidth() - width) / 100.0 * leftPercent);
        int top = ImageUtils.round((getHeight() - height) / 100.0 * topPercent);
        return crop(left, top, width, height);
    }

    public GeneratorImage resize(Integer width, Integer height) {
        return resize(width, height, ResizeMode.FIT);
    }

    public GeneratorImage resize(Integer width, Integer height, ResizeMode mode) {
        if (mode == ResizeMode.EXACT) {
            if (width == null || height == null) {
                throw new IllegalArgumentException("For exact resizing must be both width and height specified.");
            }
            return resize(width, height, ResizeMode.FILL).cropPercent(50, 50, width, height);
        }
        Dimension size = calculateSize(getWidth(), getHeight(), width, height, mode);
        if (size.width == getWidth() && size.height == getHeight()) {
            return this;
        }
        log.trace("resize {}x{} to {}x{} ({})", getWidth(), getHeight(), size.width, size.height, mode);
        replace(ImageUtils.scale(image, size.width, size.height));
        return this;
    }

    private void replace(BufferedImage next) {
        if (next != image) {
            image.flush();
            image = next;
        }
    }

    /**
     * Calculate the dimensions of a resized image.
     *
     * @param newWidth  the requested width or null to derive it from the height (proportional modes only)
     * @param newHeight the requested height or null to derive it from the width (proportional modes only)
     */
    public static Dimension calculateSize(int srcWidth, int srcHeight, Integer newWidth, Integer newHeight, ResizeMode mode) {
        int width;
        int height;
        if (mode == ResizeMode.STRETCH || mode == ResizeMode.SHRINK_ONLY_STRETCH) {
            if (newWidth == null || newHeight == null || newWidth <= 0 || newHeight <= 0) {
                throw new IllegalArgumentException("For stretching must be both width and height specified.");
            }
            width = newWidth;
            height = newHeight;
            if (mode == ResizeMode.SHRINK_ONLY_STRETCH) {
                width = ImageUtils.round(srcWidth * Math.min(1, newWidth / (double) srcWidth));
                height = ImageUtils.round(srcHeight * Math.min(1, newHeight / (double) srcHeight));
            }
        } else {
            boolean hasWidth = newWidth != null && newWidth > 0;
            boolean hasHeight = newHeight != null && newHeight > 0;
            if (!hasWidth && !hasHeight) {
                throw new IllegalArgumentException("At least width or height must be specified.");
            }
            double widthScale = hasWidth ? newWidth / (double) srcWidth : Double.NaN;
            double heightScale = hasHeight ? newHeight / (double) srcHeight : Double.NaN;
            double scale;
            if (!hasWidth) {
                scale = heightScale;
            } else if (!hasHeight) {
                scale = widthScale;
            } else if (mode == ResizeMode.FILL) {
                scale = Math.max(widthScale, heightScale);
            } else {
                scale = Math.min(widthScale, heightScale);
            }
            width = ImageUtils.round(srcWidth * scale);
            height = ImageUtils.round(srcHeight * scale);
        }
        return new Dimension(Math.max(width, 1), Math.max(height, 1));
    }

    /**
     * Clamp a crop window to an image of the given size.
     */
    public static Rectangle calculateCutout(int srcWidth, int srcHeight, int left, int top, int width, int height) {
        if (left < 0) {
            width += left;
            left = 0;
        }
        if (top < 0) {
            height += top;
            top = 0;
        }
        left = Math.min(left, srcWidth - 1);
        top = Math.min(top, srcHeight - 1);
        width = Math.max(1, Math.min(width, srcWidth - left));
        height = Math.max(1, Math.min(height, srcHeight - top));
        return new Rectangle(left, top, width, height);
    }

}
