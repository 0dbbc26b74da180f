package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.geometry.BreakpointConfig;
import au.org.ala.imagegen.geometry.CornerAnchorMode;
import au.org.ala.imagegen.geometry.CropRectangle;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

public class ImageGeneratorConfig implements BreakpointConfig {

    private static final Logger log = LoggerFactory.getLogger(ImageGeneratorConfig.class);

    public static final String DEFAULT_RESOURCE = "image-generator.properties";

    public static final String PREFIX = "imagegen.";
    public static final String BASE_URL = PREFIX + "baseUrl";
    public static final String CORNER_ANCHOR_MODE = PREFIX + "cornerAnchorMode";
    public static final String STRICT_DECODING = PREFIX + "strictDecoding";
    public static final String CROP_POINTS = PREFIX + "cropPoints.";

    private Map<Integer, CropRectangle> _cropPoints = new TreeMap<>();
    private String _baseUrl = "";
    private CornerAnchorMode _cornerAnchorMode = CornerAnchorMode.INTENDED;
    private boolean _strictDecoding = true;

    public ImageGeneratorConfig() {
    }

    public ImageGeneratorConfig(String baseUrl, Map<Integer, CropRectangle> cropPoints) {
        _baseUrl = baseUrl;
        setCropPoints(cropPoints);
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath, falling back to the defaults if it is missing.
     */
    public static ImageGeneratorConfig load() {
        try (InputStream is = ImageGeneratorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return new ImageGeneratorConfig();
            }
            Properties properties = new Properties();
            properties.load(is);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * @throws IllegalArgumentException if a crop point or the corner anchor mode can't be parsed
     */
    public static ImageGeneratorConfig fromProperties(Properties properties) {
        ImageGeneratorConfig config = new ImageGeneratorConfig();
        config.setBaseUrl(properties.getProperty(BASE_URL, config.getBaseUrl()));
        String mode = properties.getProperty(CORNER_ANCHOR_MODE);
        if (StringUtils.isNotBlank(mode)) {
            config.setCornerAnchorMode(CornerAnchorMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        }
        String strict = properties.getProperty(STRICT_DECODING);
        if (StringUtils.isNotBlank(strict)) {
            config.setStrictDecoding(Boolean.parseBoolean(strict.trim()));
        }
        for (String name : properties.stringPropertyNames()) {
            if (!name.startsWith(CROP_POINTS)) {
                continue;
            }
            String threshold = name.substring(CROP_POINTS.length());
            try {
                config.addCropPoint(Integer.parseInt(threshold.trim()), CropRectangle.parse(properties.getProperty(name)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid crop point threshold in " + name, e);
            }
        }
        log.debug("Loaded config: baseUrl={}, cornerAnchorMode={}, strictDecoding={}, cropPoints={}",
                config.getBaseUrl(), config.getCornerAnchorMode(), config.isStrictDecoding(), config.getCropPoints());
        return config;
    }

    @Override
    public Map<Integer, CropRectangle> getCropPoints() { return _cropPoints; }
    public void setCropPoints(Map<Integer, CropRectangle> cropPoints) {
        _cropPoints = new TreeMap<>();
        if (cropPoints != null) {
            _cropPoints.putAll(cropPoints);
        }
    }

    public ImageGeneratorConfig addCropPoint(int threshold, CropRectangle rectangle) {
        _cropPoints.put(threshold, rectangle);
        return this;
    }

    public String getBaseUrl() { return _baseUrl; }
    public void setBaseUrl(String baseUrl) { _baseUrl = baseUrl; }

    public CornerAnchorMode getCornerAnchorMode() { return _cornerAnchorMode; }
    public void setCornerAnchorMode(CornerAnchorMode mode) { _cornerAnchorMode = mode; }

    public boolean isStrictDecoding() { return _strictDecoding; }
    public void setStrictDecoding(boolean strictDecoding) { _strictDecoding = strictDecoding; }
}
