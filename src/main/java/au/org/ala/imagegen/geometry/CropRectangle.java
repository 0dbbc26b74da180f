package au.org.ala.imagegen.geometry;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * An absolute crop rectangle in source image pixels, given by two opposite corners.
 * <pre>
 * +----------------> X <----------------+
 * |  [x1, y1]                           |
 * v    * =================== \          v
 * Y    |                     |          Y
 * ^    \ =================== *          ^
 * |                         [x2, y2]    |
 * +----------------> X <----------------+
 * </pre>
 */
public final class CropRectangle {

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public CropRectangle(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    /**
     * Parse {@code x1,y1,x2,y2}.
     */
    public static CropRectangle parse(String s) {
        if (s == null) throw new IllegalArgumentException("Crop rectangle string is null");
        String[] parts = s.trim().split("\\s*,\\s*");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid crop rectangle string: " + s);
        }
        try {
            return new CropRectangle(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]), Integer.parseInt(parts[3]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in crop rectangle string: " + s, e);
        }
    }

    public int getX1() { return x1; }
    public int getY1() { return y1; }
    public int getX2() { return x2; }
    public int getY2() { return y2; }

    public int getWidth() {
        return Math.abs(x2 - x1);
    }

    public int getHeight() {
        return Math.abs(y2 - y1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CropRectangle)) return false;
        CropRectangle that = (CropRectangle) o;
        return x1 == that.x1 && y1 == that.y1 && x2 == that.x2 && y2 == that.y2;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("x1", x1)
                .add("y1", y1)
                .add("x2", x2)
                .add("y2", y2)
                .toString();
    }
}
