package au.org.ala.imagegen.codec;

import java.util.Map;

/**
 * Turns generation parameters into the canonical string embedded in filenames. Implementations must be deterministic:
 * equal parameters always give the same string.
 */
public interface ParamsSerializer {

    /**
     * @return the canonical parameter string, or an empty string when there is nothing to encode
     */
    String paramsToString(Map<String, ?> params);

}
