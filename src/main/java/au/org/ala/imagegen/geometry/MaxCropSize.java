package au.org.ala.imagegen.geometry;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * The largest crop window with the requested aspect ratio that fits inside an image.
 */
public final class MaxCropSize {

    private final int needleWidth;
    private final int needleHeight;
    private final double needleRatio;

    public MaxCropSize(int needleWidth, int needleHeight, double needleRatio) {
        this.needleWidth = needleWidth;
        this.needleHeight = needleHeight;
        this.needleRatio = needleRatio;
    }

    public int getNeedleWidth() {
        return needleWidth;
    }

    public int getNeedleHeight() {
        return needleHeight;
    }

    public double getNeedleRatio() {
        return needleRatio;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaxCropSize)) return false;
        MaxCropSize that = (MaxCropSize) o;
        return needleWidth == that.needleWidth &&
                needleHeight == that.needleHeight &&
                Double.compare(that.needleRatio, needleRatio) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(needleWidth, needleHeight, needleRatio);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("needleWidth", needleWidth)
                .add("needleHeight", needleHeight)
                .add("needleRatio", needleRatio)
                .toString();
    }
}
