package au.org.ala.imagegen.geometry;

/**
 * How corner codes are turned into crop offsets.
 */
public enum CornerAnchorMode {
    /** anchor at the corner named by the code, eg {@code br} crops the bottom right */
    INTENDED,
    /**
     * Byte-compatible with derivatives made by older generators, which anchored every corner code at the top left.
     * Use it only while a cache of such derivatives has to stay consistent.
     */
    LEGACY
}
