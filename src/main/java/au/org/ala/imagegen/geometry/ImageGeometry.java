package au.org.ala.imagegen.geometry;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.request.ScaleMode;
import au.org.ala.imagegen.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.INVALID_PARAMETERS;
import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.UNDEFINED_BREAKPOINT;

/**
 * The transform strategies. The path based methods load the image, apply one strategy and write it back over the same
 * path; the {@link GeneratorImage} based methods only transform the handle.
 */
public class ImageGeometry {

    private static final Logger log = LoggerFactory.getLogger(ImageGeometry.class);

    /** growth factor at or above which a ratio scale leaves the image alone */
    public static final double RATIO_SCALE_LIMIT = 1.3;

    private final BreakpointConfig breakpointConfig;
    private final SmartCropper smartCropper;
    private final CornerAnchorMode cornerAnchorMode;

    public ImageGeometry(BreakpointConfig breakpointConfig, SmartCropper smartCropper, CornerAnchorMode cornerAnchorMode) {
        this.breakpointConfig = Objects.requireNonNull(breakpointConfig, "breakpointConfig");
        this.smartCropper = Objects.requireNonNull(smartCropper, "smartCropper");
        this.cornerAnchorMode = cornerAnchorMode != null ? cornerAnchorMode : CornerAnchorMode.INTENDED;
    }

    public CornerAnchorMode getCornerAnchorMode() {
        return cornerAnchorMode;
    }

    // Breakpoint crop

    public void cropByBreakPoint(Path path, int width) {
        GeneratorImage image = GeneratorImage.load(path);
        cropByBreakPoint(image, width).save(path);
    }

    public GeneratorImage cropByBreakPoint(GeneratorImage image, int width) {
        Map<Integer, CropRectangle> cropPoints = breakpointConfig.getCropPoints();
        if (cropPoints == null || cropPoints.isEmpty()) {
            throw new ImageGeneratorException(UNDEFINED_BREAKPOINT, "Undefined breakpoint, no crop points are registered.");
        }
        int breakPoint = selectBreakPoint(width, cropPoints.keySet());
        CropRectangle rectangle = cropPoints.get(breakPoint);
        if (rectangle == null) {
            throw new ImageGeneratorException(UNDEFINED_BREAKPOINT, "Undefined breakpoint " + breakPoint
                    + ". Possible values: " + cropPoints.keySet());
        }
        log.debug("breakpoint {} selected for width {}: {}", breakPoint, width, rectangle);
        return image.crop(rectangle.getX1(), rectangle.getY1(), rectangle.getWidth(), rectangle.getHeight());
    }

    /**
     * Pick the first threshold above width from 0 plus the given thresholds, or the largest one when width is beyond
     * all of them.
     */
    public static int selectBreakPoint(int width, Collection<Integer> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new ImageGeneratorException(UNDEFINED_BREAKPOINT, "Undefined breakpoint, no crop points are registered.");
        }
        TreeSet<Integer> sorted = new TreeSet<>(thresholds);
        sorted.add(0);
        Integer above = sorted.higher(width);
        return above != null ? above : sorted.last();
    }

    // Scale

    public void scale(Path path, ScaleMode mode, Integer width, Integer height) {
        GeneratorImage image = GeneratorImage.load(path);
        scale(image, mode, width, height).save(path);
    }

    public GeneratorImage scale(GeneratorImage image, ScaleMode mode, Integer width, Integer height) {
        Objects.requireNonNull(mode, "mode");
        log.debug("{} scale {}x{} to {}x{}", mode, image.getWidth(), image.getHeight(), width, height);
        switch (mode) {
            case COVER:
                return image.resize(width, height, ResizeMode.EXACT);
            case ABSOLUTE:
                return image.resize(width, height, ResizeMode.SHRINK_ONLY_STRETCH);
            default:
                return ratioScale(image, width, height);
        }
    }

    private GeneratorImage ratioScale(GeneratorImage image, Integer width, Integer height) {
        int imageWidth = image.getWidth();
        int imageHeight = image.getHeight();
        if (width == null && height == null) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Ratio scale needs a width or a height.");
        }
        if (width == null) {
            double ratio = imageWidth / (double) imageHeight;
            width = (int) (ratio * height);
        }
        if (height == null) {
            double ratio = imageHeight / (double) imageWidth;
            height = (int) (ratio * width);
        }
        boolean belowLimit = width / (double) imageWidth < RATIO_SCALE_LIMIT && height / (double) imageHeight < RATIO_SCALE_LIMIT;
        boolean singleAxisEnlargement = (width == imageWidth && height >= imageHeight) || (height == imageHeight && width >= imageWidth);
        if (belowLimit && !singleAxisEnlargement) {
            image.resize(width, height);
        } else {
            log.debug("ratio scale to {}x{} skipped for {}x{}", width, height, imageWidth, imageHeight);
        }
        return image;
    }

    // Corner crop

    public void cropByCorner(Path path, String corner, Integer width, Integer height) {
        GeneratorImage image = GeneratorImage.load(path);
        cropByCorner(image, corner, width, height).save(path);
    }

    public GeneratorImage cropByCorner(GeneratorImage image, String code, Integer width, Integer height) {
        Corner corner = Corner.parse(code);
        int originalWidth = image.getWidth();
        int originalHeight = image.getHeight();
        if ((width != null && width > originalWidth) || (height != null && height > originalHeight)) {
            log.debug("corner crop {}x{} skipped, image is only {}x{}", width, height, originalWidth, originalHeight);
            return image;
        }
        MaxCropSize size = getMaxSizeForCrop(originalWidth, originalHeight, width, height);
        int top = 0;
        int left = 0;
        if (cornerAnchorMode == CornerAnchorMode.INTENDED) {
            top = corner.topOffset(originalHeight, size.getNeedleHeight());
            left = corner.leftOffset(originalWidth, size.getNeedleWidth());
        }
        log.debug("corner crop {} ({}) at {},{} size {}", corner, cornerAnchorMode, left, top, size);
        return image.crop(left, top, size.getNeedleWidth(), size.getNeedleHeight()).resize(width, height);
    }

    /**
     * Find the largest window with the aspect ratio of the needle that fits inside the original by growing the needle
     * step by step until it touches the original's bounds.
     *
     * @param needleWidth  requested width, or null to derive it from the original's aspect ratio
     * @param needleHeight requested height, or null to derive it from the original's aspect ratio
     */
    public static MaxCropSize getMaxSizeForCrop(int originalWidth, int originalHeight, Integer needleWidth, Integer needleHeight) {
        if (needleWidth == null && needleHeight == null) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Crop size needs a width or a height.");
        }
        if ((needleWidth != null && needleWidth <= 0) || (needleHeight != null && needleHeight <= 0)) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Crop size must be positive: " + needleWidth + "x" + needleHeight);
        }
        double width;
        double height;
        double ratio;
        if (needleWidth == null) {
            ratio = originalWidth / (double) originalHeight;
            width = (int) (ratio * needleHeight);
            height = needleHeight;
        } else if (needleHeight == null) {
            ratio = originalHeight / (double) originalWidth;
            width = needleWidth;
            height = (int) (ratio * needleWidth);
        } else {
            boolean widthIsGreater = needleWidth > needleHeight;
            width = needleWidth;
            height = needleHeight;
            ratio = widthIsGreater ? width / height : height / width;
            while (width < originalWidth && height < originalHeight) {
                if (widthIsGreater) {
                    width += ratio;
                    height++;
                } else {
                    height += ratio;
                    width++;
                }
            }
        }
        if (width > originalWidth) {
            width = originalWidth;
        }
        if (height > originalHeight) {
            height = originalHeight;
        }
        return new MaxCropSize((int) width, (int) height, ratio);
    }

    // Percentage shift

    public void percentageShift(Path path, Integer px, Integer py, int width, int height) {
        GeneratorImage image = GeneratorImage.load(path);
        percentageShift(image, px, py, width, height).save(path);
    }

    /**
     * Cover the needle box, then slide a needle sized window along the overflowing axis by px (wide images) or py
     * percent of the slack.
     */
    public GeneratorImage percentageShift(GeneratorImage image, Integer px, Integer py, int width, int height) {
        image.resize(width, height, ResizeMode.FILL);
        if (px == null && py == null) {
            return image;
        }
        double fx = (px == null ? 0 : px) / 100.0;
        double fy = (py == null ? 0 : py) / 100.0;
        int resizedWidth = image.getWidth();
        int resizedHeight = image.getHeight();
        int left = 0;
        int top = 0;
        if (resizedHeight * 2 < resizedWidth) {
            double slack = ((double) width * resizedHeight - (double) resizedWidth * height) / height;
            left = clamp(ImageUtils.round(Math.abs(slack) * fx), resizedWidth - width);
        } else {
            double slack = ((double) resizedWidth * height - (double) width * resizedHeight) / resizedWidth;
            top = clamp(ImageUtils.round(Math.abs(slack) * fy), resizedHeight - height);
        }
        log.debug("percentage shift {}x{} by {},{} to {}x{}", resizedWidth, resizedHeight, left, top, width, height);
        return image.crop(left, top, width, height);
    }

    private static int clamp(int offset, int overflow) {
        return Math.max(0, Math.min(offset, Math.max(0, overflow)));
    }

    // Smart crop

    public void cropSmart(Path path, Integer width, Integer height) {
        GeneratorImage image = GeneratorImage.load(path);
        log.debug("smart crop {} to {}x{} with {}", path, width, height, smartCropper.getClass().getSimpleName());
        smartCropper.crop(path, width, height, image);
    }
}
