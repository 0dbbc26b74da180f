package au.org.ala.imagegen.geometry;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.util.ImageUtils;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.INVALID_CORNER_CODE;

/**
 * A two letter corner code: {@code t}op, {@code m}iddle or {@code b}ottom followed by {@code l}eft, {@code c}entre or
 * {@code r}ight.
 */
public final class Corner {

    private static final Pattern CODE = Pattern.compile("^([tmb])([lcr])$", Pattern.CASE_INSENSITIVE);

    public enum Vertical { TOP, MIDDLE, BOTTOM }

    public enum Horizontal { LEFT, CENTRE, RIGHT }

    private final Vertical vertical;
    private final Horizontal horizontal;

    public Corner(Vertical vertical, Horizontal horizontal) {
        this.vertical = vertical;
        this.horizontal = horizontal;
    }

    /**
     * @throws ImageGeneratorException with {@code INVALID_CORNER_CODE} if code is not one of the nine codes
     */
    public static Corner parse(String code) {
        Matcher m = code == null ? null : CODE.matcher(code);
        if (m == null || !m.matches()) {
            throw new ImageGeneratorException(INVALID_CORNER_CODE, "Invalid corner code \"" + code + "\".");
        }
        String v = m.group(1).toLowerCase(Locale.ROOT);
        String h = m.group(2).toLowerCase(Locale.ROOT);
        return new Corner(
                v.equals("t") ? Vertical.TOP : v.equals("m") ? Vertical.MIDDLE : Vertical.BOTTOM,
                h.equals("l") ? Horizontal.LEFT : h.equals("c") ? Horizontal.CENTRE : Horizontal.RIGHT);
    }

    public Vertical getVertical() {
        return vertical;
    }

    public Horizontal getHorizontal() {
        return horizontal;
    }

    public int topOffset(int originalHeight, int cropHeight) {
        switch (vertical) {
            case MIDDLE: return ImageUtils.round((originalHeight - cropHeight) / 2.0);
            case BOTTOM: return originalHeight - cropHeight;
            default: return 0;
        }
    }

    public int leftOffset(int originalWidth, int cropWidth) {
        switch (horizontal) {
            case CENTRE: return ImageUtils.round((originalWidth - cropWidth) / 2.0);
            case RIGHT: return originalWidth - cropWidth;
            default: return 0;
        }
    }

    @Override
    public String toString() {
        return vertical + "_" + horizontal;
    }
}
