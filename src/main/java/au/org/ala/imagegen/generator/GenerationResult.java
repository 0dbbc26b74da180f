package au.org.ala.imagegen.generator;

import com.google.common.base.MoreObjects;

import java.nio.file.Path;

public class GenerationResult {

    public enum Status { GENERATED, PLACEHOLDER }

    private final Status _status;
    private final Path _target;
    private final int _width;
    private final int _height;
    private final String _sizeToken;
    private final Path _placeholder;

    private GenerationResult(Status status, Path target, int width, int height, String sizeToken, Path placeholder) {
        _status = status;
        _target = target;
        _width = width;
        _height = height;
        _sizeToken = sizeToken;
        _placeholder = placeholder;
    }

    public static GenerationResult generated(Path target, int width, int height) {
        return new GenerationResult(Status.GENERATED, target, width, height, null, null);
    }

    /**
     * @param placeholder the rendered placeholder, or null if rendering failed
     */
    public static GenerationResult placeholder(Path target, String sizeToken, Path placeholder) {
        return new GenerationResult(Status.PLACEHOLDER, target, 0, 0, sizeToken, placeholder);
    }

    public Status getStatus() {
        return _status;
    }

    public boolean isGenerated() {
        return _status == Status.GENERATED;
    }

    public Path getTarget() {
        return _target;
    }

    public int getWidth() {
        return _width;
    }

    public int getHeight() {
        return _height;
    }

    public String getSizeToken() {
        return _sizeToken;
    }

    public Path getPlaceholder() {
        return _placeholder;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", _status)
                .add("target", _target)
                .add("width", _width)
                .add("height", _height)
                .add("sizeToken", _sizeToken)
                .add("placeholder", _placeholder)
                .omitNullValues()
                .toString();
    }
}
