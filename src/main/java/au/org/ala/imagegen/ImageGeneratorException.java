package au.org.ala.imagegen;

/**
 * Fatal error raised while building a request or generating an image. The {@link ErrorCode} tells callers which
 * part of the input was at fault.
 */
public class ImageGeneratorException extends RuntimeException {

    public enum ErrorCode {
        INVALID_PARAMETERS,
        INVALID_URL,
        INVALID_CORNER_CODE,
        UNSUPPORTED_FORMAT,
        CAPABILITY_UNAVAILABLE,
        UNDEFINED_BREAKPOINT,
        SOURCE_NOT_FOUND,
        TARGET_EXISTS,
        DECODE_FAILURE,
        ENCODE_FAILURE
    }

    private final ErrorCode errorCode;

    public ImageGeneratorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ImageGeneratorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
