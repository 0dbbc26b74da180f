package au.org.ala.imagegen.codec;

import au.org.ala.imagegen.request.ScaleMode;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Writes parameters in the grammar read by
 * {@link au.org.ala.imagegen.request.ImageGeneratorRequest#fromStringParams(String)}, always in the order
 * {@code w<width>h<height>-br-sc<mode>-c<crop>-px<px>-py<py>}. Absent and false values are left out.
 * <p>
 * Both the long keys of a request ({@code width}, {@code height}, {@code breakPoint}, {@code scale}, {@code crop},
 * {@code px}, {@code py}) and the short keys ({@code w}, {@code h}, {@code br}, {@code sc}, {@code c}) are accepted.
 */
public class DefaultParamsSerializer implements ParamsSerializer {

    public static final DefaultParamsSerializer INSTANCE = new DefaultParamsSerializer();

    @Override
    public String paramsToString(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();

        String width = value(params, "width", "w");
        if (width != null) {
            sb.append('w').append(width);
        }
        String height = value(params, "height", "h");
        if (height != null) {
            sb.append('h').append(height);
        }
        String breakPoint = value(params, "breakPoint", "br");
        if (breakPoint != null && (breakPoint.equalsIgnoreCase("true") || breakPoint.equals("1"))) {
            sb.append("-br");
        }
        Object scale = raw(params, "scale", "sc");
        if (scale != null) {
            ScaleMode mode = scale instanceof ScaleMode ? (ScaleMode) scale : ScaleMode.parse(scale.toString());
            if (mode != null) {
                sb.append("-sc").append(mode.getCode());
            }
        }
        String crop = value(params, "crop", "c");
        if (crop != null) {
            sb.append("-c").append(crop.toLowerCase(Locale.ROOT));
        }
        String px = percentage(params, "px");
        if (px != null) {
            sb.append("-px").append(px);
        }
        String py = percentage(params, "py");
        if (py != null) {
            sb.append("-py").append(py);
        }
        return sb.toString();
    }

    /**
     * A zero percentage means no focus, the same as a missing one.
     */
    private static String percentage(Map<String, ?> params, String key) {
        String v = value(params, key);
        return v == null || v.matches("0+") ? null : v;
    }

    private static Object raw(Map<String, ?> params, String... keys) {
        for (String key : keys) {
            Object v = params.get(key);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    private static String value(Map<String, ?> params, String... keys) {
        Object v = raw(params, keys);
        if (v == null) {
            return null;
        }
        String s = v.toString().trim();
        return StringUtils.isEmpty(s) ? null : s;
    }
}
