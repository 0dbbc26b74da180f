package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.format.ImageFormat;
import au.org.ala.imagegen.util.ImageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.INVALID_PARAMETERS;

/**
 * Writes solid colour PNG placeholders named {@code placeholder_<sizeToken>.png} into a directory. A placeholder
 * that already exists is reused.
 */
public class PlaceholderImageWriter implements PlaceholderRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderImageWriter.class);

    private static final Pattern SIZE_TOKEN = Pattern.compile("^w(\\d+)h(\\d+)$");

    public static final Color DEFAULT_COLOR = new Color(221, 221, 221);

    private final Path directory;
    private final Color color;

    public PlaceholderImageWriter(Path directory) {
        this(directory, DEFAULT_COLOR);
    }

    public PlaceholderImageWriter(Path directory, Color color) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.color = Objects.requireNonNull(color, "color");
    }

    @Override
    public Path render(String sizeToken) throws IOException {
        Matcher m = sizeToken == null ? null : SIZE_TOKEN.matcher(sizeToken);
        if (m == null || !m.matches()) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Invalid placeholder size \"" + sizeToken + "\".");
        }
        int width;
        int height;
        try {
            width = Math.max(1, Integer.parseInt(m.group(1)));
            height = Math.max(1, Integer.parseInt(m.group(2)));
        } catch (NumberFormatException e) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Invalid placeholder size \"" + sizeToken + "\".", e);
        }

        Path placeholder = directory.resolve("placeholder_" + sizeToken + ".png");
        if (Files.isRegularFile(placeholder)) {
            return placeholder;
        }
        Files.createDirectories(directory);

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        try {
            ImageUtils.write(image, ImageFormat.PNG, placeholder, null);
        } finally {
            image.flush();
        }
        log.debug("Rendered placeholder {}", placeholder);
        return placeholder;
    }

    public Path getDirectory() {
        return directory;
    }
}
