package au.org.ala.imagegen.geometry;

/**
 * How {@link GeneratorImage#resize(Integer, Integer, ResizeMode)} maps an image onto a requested box.
 */
public enum ResizeMode {
    /** keep the aspect ratio and fit inside the box, enlarging if needed */
    FIT,
    /** keep the aspect ratio and cover the box, the result may exceed the box in one axis */
    FILL,
    /** cover the box, then crop the overflow around the centre so the result is exactly the box */
    EXACT,
    /** ignore the aspect ratio and stretch to exactly the box */
    STRETCH,
    /** ignore the aspect ratio but never enlarge either axis beyond the source */
    SHRINK_ONLY_STRETCH
}
