package au.org.ala.imagegen.request;

import au.org.ala.imagegen.ImageGeneratorException;
import com.google.common.base.MoreObjects;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.INVALID_PARAMETERS;

/**
 * The normalised parameters of a single image generation.
 * <p>
 * Width and height are mandatory. Values below {@link #MIN_DIMENSION} are raised to the minimum, values above
 * {@link #MAX_DIMENSION} are kept but reported. Both conditions are recorded in {@link #getAdvisories()} and logged,
 * neither of them fails the request.
 */
public final class ImageGeneratorRequest {

    private static final Logger log = LoggerFactory.getLogger(ImageGeneratorRequest.class);

    public static final int MIN_DIMENSION = 16;
    public static final int MAX_DIMENSION = 3000;

    public static final String CROP_SMART = "smart";
    /** short form of {@link #CROP_SMART} */
    public static final String CROP_SMART_ALIAS = "smt";

    private static final Pattern WIDTH_PATTERN = Pattern.compile("^w(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEIGHT_PATTERN = Pattern.compile("^(w\\d+)?h(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCALE_PATTERN = Pattern.compile("-sc([rca])", Pattern.CASE_INSENSITIVE);
    private static final Pattern CROP_PATTERN = Pattern.compile("-c([a-z]{2,5})");
    private static final Pattern PX_PATTERN = Pattern.compile("-px(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PY_PATTERN = Pattern.compile("-py(\\d+)", Pattern.CASE_INSENSITIVE);

    private final int width;
    private final int height;
    private final boolean breakPoint;
    private final ScaleMode scale;
    private final String crop;
    private final Integer px;
    private final Integer py;
    private final Set<DimensionAdvisory> advisories;

    /**
     * @param params keys {@code width}, {@code height} (mandatory), {@code breakPoint}, {@code scale}, {@code crop},
     *               {@code px}, {@code py}. Numbers may be given as {@link Number}s or numeric strings. A zero
     *               {@code px} or {@code py} counts as missing and {@code crop} is lower cased, as in the string form.
     * @throws ImageGeneratorException with {@code INVALID_PARAMETERS} if width or height are missing or malformed
     */
    public ImageGeneratorRequest(Map<String, ?> params) {
        Objects.requireNonNull(params, "params must not be null");
        Integer w = toInteger("width", params.get("width"));
        Integer h = toInteger("height", params.get("height"));
        if (w == null || h == null) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Width or height params are required.");
        }
        EnumSet<DimensionAdvisory> found = EnumSet.noneOf(DimensionAdvisory.class);
        this.width = normaliseDimension("width", w, DimensionAdvisory.WIDTH_BELOW_MINIMUM, DimensionAdvisory.WIDTH_OVERSIZED, found);
        this.height = normaliseDimension("height", h, DimensionAdvisory.HEIGHT_BELOW_MINIMUM, DimensionAdvisory.HEIGHT_OVERSIZED, found);
        this.advisories = Collections.unmodifiableSet(found);

        this.breakPoint = toBoolean(params.get("breakPoint"));
        this.scale = toScaleMode(params.get("scale"));
        Object cropValue = params.get("crop");
        this.crop = cropValue != null && StringUtils.isNotBlank(cropValue.toString()) ? cropValue.toString().trim().toLowerCase(Locale.ROOT) : null;
        this.px = zeroToNull(toInteger("px", params.get("px")));
        this.py = zeroToNull(toInteger("py", params.get("py")));
    }

    /**
     * Build a request from either a compact parameter string (see {@link #fromStringParams(String)}) or a parameter
     * map (see {@link #ImageGeneratorRequest(Map)}).
     */
    public static ImageGeneratorRequest fromParams(Object params) {
        if (params instanceof String) {
            return fromStringParams((String) params);
        }
        if (params instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) params).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return new ImageGeneratorRequest(copy);
        }
        throw new ImageGeneratorException(INVALID_PARAMETERS, "Unsupported parameter type: " + (params == null ? "null" : params.getClass().getName()));
    }

    /**
     * Parse the compact parameter grammar used in generated filenames, eg {@code w320h240-scc-px40}.
     * <ul>
     *     <li>{@code w<digits>} width, at the start</li>
     *     <li>{@code h<digits>} height, at the start or right after the width</li>
     *     <li>{@code -br} breakpoint crop</li>
     *     <li>{@code -sc[r|c|a]} scale mode</li>
     *     <li>{@code -c<2 to 5 letters>} crop mode, {@code smart} or a corner code</li>
     *     <li>{@code -px<digits>}, {@code -py<digits>} focal percentages</li>
     * </ul>
     * Anything else is ignored. A value of zero counts as missing.
     */
    public static ImageGeneratorRequest fromStringParams(String params) {
        if (params == null) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Width or height params are required.");
        }
        Map<String, Object> parsed = new LinkedHashMap<>();
        parsed.put("width", firstPositive(WIDTH_PATTERN.matcher(params), 1));
        parsed.put("height", firstPositive(HEIGHT_PATTERN.matcher(params), 2));
        parsed.put("breakPoint", params.contains("-br"));

        Matcher sc = SCALE_PATTERN.matcher(params);
        if (sc.find()) {
            parsed.put("scale", sc.group(1));
        }
        Matcher c = CROP_PATTERN.matcher(params);
        if (c.find()) {
            parsed.put("crop", c.group(1));
        }
        parsed.put("px", firstPositive(PX_PATTERN.matcher(params), 1));
        parsed.put("py", firstPositive(PY_PATTERN.matcher(params), 1));

        return new ImageGeneratorRequest(parsed);
    }

    private static Integer firstPositive(Matcher matcher, int group) {
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(group);
        if (StringUtils.isEmpty(digits)) {
            return null;
        }
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Number \"" + digits + "\" is out of range.", e);
        }
        return value != 0 ? value : null;
    }

    private static Integer zeroToNull(Integer value) {
        return value != null && value != 0 ? value : null;
    }

    private static int normaliseDimension(String name, int value, DimensionAdvisory belowMinimum, DimensionAdvisory oversized, Set<DimensionAdvisory> found) {
        if (value < MIN_DIMENSION) {
            log.warn("Minimal mandatory {} is {}px, but \"{}\" given.", name, MIN_DIMENSION, value);
            found.add(belowMinimum);
            value = MIN_DIMENSION;
        }
        if (value > MAX_DIMENSION) {
            log.warn("Image is so large. Maximal {} is {}px, but \"{}\" given.", name, MAX_DIMENSION, value);
            found.add(oversized);
        }
        return value;
    }

    private static Integer toInteger(String name, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        String s = value.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, "Parameter \"" + name + "\" must be a number, but \"" + s + "\" given.", e);
        }
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value == null) {
            return false;
        }
        String s = value.toString().trim();
        return s.equalsIgnoreCase("true") || s.equals("1");
    }

    private static ScaleMode toScaleMode(Object value) {
        if (value instanceof ScaleMode) {
            return (ScaleMode) value;
        }
        if (value == null) {
            return null;
        }
        try {
            return ScaleMode.parse(value.toString());
        } catch (IllegalArgumentException e) {
            throw new ImageGeneratorException(INVALID_PARAMETERS, e.getMessage(), e);
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isBreakPoint() {
        return breakPoint;
    }

    /**
     * @return the scale mode or null when the request does not scale
     */
    public ScaleMode getScale() {
        return scale;
    }

    /**
     * @return {@link #CROP_SMART}, a corner code or null when no crop was requested
     */
    public String getCrop() {
        return crop;
    }

    public boolean isSmartCrop() {
        return crop != null && (crop.equalsIgnoreCase(CROP_SMART) || crop.equalsIgnoreCase(CROP_SMART_ALIAS));
    }

    public Integer getPx() {
        return px;
    }

    public Integer getPy() {
        return py;
    }

    public Set<DimensionAdvisory> getAdvisories() {
        return advisories;
    }

    public boolean isOversized() {
        return advisories.contains(DimensionAdvisory.WIDTH_OVERSIZED) || advisories.contains(DimensionAdvisory.HEIGHT_OVERSIZED);
    }

    /**
     * The size token used for placeholders, eg {@code w320h240}.
     */
    public String getSizeToken() {
        return "w" + width + "h" + height;
    }

    /**
     * @return this request as a parameter map, suitable for {@link #ImageGeneratorRequest(Map)} and filename encoding
     */
    public Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("width", width);
        params.put("height", height);
        if (breakPoint) {
            params.put("breakPoint", true);
        }
        if (scale != null) {
            params.put("scale", scale);
        }
        if (crop != null) {
            params.put("crop", crop);
        }
        if (px != null) {
            params.put("px", px);
        }
        if (py != null) {
            params.put("py", py);
        }
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageGeneratorRequest)) return false;
        ImageGeneratorRequest that = (ImageGeneratorRequest) o;
        return width == that.width &&
                height == that.height &&
                breakPoint == that.breakPoint &&
                scale == that.scale &&
                Objects.equals(crop, that.crop) &&
                Objects.equals(px, that.px) &&
                Objects.equals(py, that.py);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, breakPoint, scale, crop, px, py);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("width", width)
                .add("height", height)
                .add("breakPoint", breakPoint)
                .add("scale", scale)
                .add("crop", crop)
                .add("px", px)
                .add("py", py)
                .toString();
    }
}
