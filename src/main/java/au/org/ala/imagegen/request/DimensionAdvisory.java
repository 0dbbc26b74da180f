package au.org.ala.imagegen.request;

/**
 * Non-fatal conditions noticed while normalising the requested dimensions.
 */
public enum DimensionAdvisory {
    /** width was raised to the minimum */
    WIDTH_BELOW_MINIMUM,
    /** height was raised to the minimum */
    HEIGHT_BELOW_MINIMUM,
    /** width is above the recommended maximum and was kept as given */
    WIDTH_OVERSIZED,
    /** height is above the recommended maximum and was kept as given */
    HEIGHT_OVERSIZED
}
