package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.format.ImageFormatValidator;
import au.org.ala.imagegen.geometry.ImageGeometry;
import au.org.ala.imagegen.geometry.SmartCropper;
import au.org.ala.imagegen.request.ImageGeneratorRequest;
import au.org.ala.imagegen.util.ImageReaderUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.SOURCE_NOT_FOUND;
import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.TARGET_EXISTS;

/**
 * Generates one derivative image from a source image.
 * <p>
 * The source is validated, copied to a temp file next to the target and transformed there by exactly one strategy,
 * chosen in this order: breakpoint crop, scale, explicit crop (smart or corner), percentage shift, smart crop. The
 * result is re-compressed, validated again and moved over the target. Corrupt bytes at either validation step never
 * raise: a placeholder is rendered instead and nothing is written at the target.
 * <p>
 * Holds no per-request state, so one instance can serve several threads as long as they work on distinct targets.
 */
public class ImageGenerator {

    private static final Logger log = LoggerFactory.getLogger(ImageGenerator.class);

    /** images with more pixels than this get the lower quality hint */
    public static final int LARGE_IMAGE_PIXELS = 479999;
    public static final int LARGE_IMAGE_QUALITY = 85;
    public static final int SMALL_IMAGE_QUALITY = 95;

    public static final String TEMP_SUFFIX = "_temp";

    private final ImageFormatValidator validator;
    private final ImageGeometry geometry;
    private final Optimizer optimizer;
    private final PlaceholderRenderer placeholderRenderer;

    public ImageGenerator(ImageGeneratorConfig config, SmartCropper smartCropper, Optimizer optimizer, PlaceholderRenderer placeholderRenderer) {
        this(new ImageFormatValidator(config.isStrictDecoding()),
                new ImageGeometry(config, smartCropper, config.getCornerAnchorMode()),
                optimizer,
                placeholderRenderer);
    }

    public ImageGenerator(ImageFormatValidator validator, ImageGeometry geometry, Optimizer optimizer, PlaceholderRenderer placeholderRenderer) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer");
        this.placeholderRenderer = Objects.requireNonNull(placeholderRenderer, "placeholderRenderer");
    }

    /**
     * @throws ImageGeneratorException with {@code SOURCE_NOT_FOUND} or {@code TARGET_EXISTS} before anything is
     * written, or with the code of any invalid request detail found while transforming
     * @throws IOException if copying the source or moving the result fails
     */
    public GenerationResult generate(ImageGeneratorRequest request, Path source, Path target) throws IOException {
        Objects.requireNonNull(request, "request");
        if (!Files.isRegularFile(source)) {
            throw new ImageGeneratorException(SOURCE_NOT_FOUND, "Source file \"" + source + "\" does not exist.");
        }
        if (Files.exists(target)) {
            throw new ImageGeneratorException(TARGET_EXISTS, "Target file \"" + target + "\" already exists.");
        }
        if (!validator.isValidImage(source)) {
            log.warn("Source {} is not a valid image, rendering placeholder", source);
            return fallback(request, target);
        }

        Path temp = tempPath(target);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try {
            stage(source, temp);
            dispatch(request, temp);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        int quality = qualityFor(request);
        try {
            optimizer.optimize(temp, quality);
        } catch (IOException | RuntimeException e) {
            log.warn("Optimizing {} at quality {} failed", temp, quality, e);
        }

        boolean valid;
        try {
            valid = validator.isValidImage(temp);
        } catch (RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        if (!valid) {
            log.warn("Generated image {} is not valid, rendering placeholder", temp);
            Files.deleteIfExists(temp);
            return fallback(request, target);
        }
        try {
            commit(temp, target);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        ImageReaderUtils.Dimension dimension = ImageReaderUtils.getImageDimensions(target);
        log.debug("Generated {} from {} ({})", target, source, dimension);
        return dimension != null
                ? GenerationResult.generated(target, dimension.width, dimension.height)
                : GenerationResult.generated(target, 0, 0);
    }

    private void dispatch(ImageGeneratorRequest request, Path temp) {
        int width = request.getWidth();
        int height = request.getHeight();
        if (request.isBreakPoint()) {
            log.debug("{}: breakpoint crop", temp);
            geometry.cropByBreakPoint(temp, width);
        } else if (request.getScale() != null) {
            log.debug("{}: {} scale", temp, request.getScale());
            geometry.scale(temp, request.getScale(), width, height);
        } else if (request.getCrop() != null) {
            if (request.isSmartCrop()) {
                log.debug("{}: smart crop", temp);
                geometry.cropSmart(temp, width, height);
            } else {
                log.debug("{}: corner crop {}", temp, request.getCrop());
                geometry.cropByCorner(temp, request.getCrop(), width, height);
            }
        } else if (isSet(request.getPx()) || isSet(request.getPy())) {
            log.debug("{}: percentage shift {},{}", temp, request.getPx(), request.getPy());
            geometry.percentageShift(temp, request.getPx(), request.getPy(), width, height);
        } else {
            log.debug("{}: default smart crop", temp);
            geometry.cropSmart(temp, width, height);
        }
    }

    private static boolean isSet(Integer percentage) {
        return percentage != null && percentage != 0;
    }

    protected void stage(Path source, Path temp) throws IOException {
        Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
    }

    protected void commit(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a plain move", target);
            Files.move(temp, target);
        }
    }

    private GenerationResult fallback(ImageGeneratorRequest request, Path target) {
        String sizeToken = request.getSizeToken();
        Path placeholder = null;
        try {
            placeholder = placeholderRenderer.render(sizeToken);
        } catch (IOException | RuntimeException e) {
            log.error("Unable to render placeholder {} for {}", sizeToken, target, e);
        }
        return GenerationResult.placeholder(target, sizeToken, placeholder);
    }

    public static int qualityFor(ImageGeneratorRequest request) {
        return (long) request.getWidth() * request.getHeight() > LARGE_IMAGE_PIXELS ? LARGE_IMAGE_QUALITY : SMALL_IMAGE_QUALITY;
    }

    /**
     * {@code name.ext} becomes {@code name_temp.ext} in the same directory, a name without extension gets the suffix
     * appended.
     */
    public static Path tempPath(Path target) {
        String name = target.getFileName().toString();
        String extension = FilenameUtils.getExtension(name);
        String tempName = extension.isEmpty()
                ? name + TEMP_SUFFIX
                : FilenameUtils.removeExtension(name) + TEMP_SUFFIX + "." + extension;
        return target.resolveSibling(tempName);
    }
}
