package au.org.ala.imagegen.request;

/**
 * Scale strategy of a request:
 * "r" - ratio
 * "c" - cover
 * "a" - absolute
 */
public enum ScaleMode {
    RATIO('r'),
    COVER('c'),
    ABSOLUTE('a');

    private final char code;

    ScaleMode(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    /**
     * Parse a scale token. Accepts the single letter codes used in filenames and the full names, case-insensitive.
     *
     * @return the scale mode or null if the token is null or blank
     * @throws IllegalArgumentException if the token is not a known scale mode
     */
    public static ScaleMode parse(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String in = s.trim().toLowerCase();
        switch (in) {
            case "r":
            case "ratio":
                return RATIO;
            case "c":
            case "cover":
                return COVER;
            case "a":
            case "absolute":
                return ABSOLUTE;
            default:
                throw new IllegalArgumentException("Unknown scale mode: " + s);
        }
    }
}
