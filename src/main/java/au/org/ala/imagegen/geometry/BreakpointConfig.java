package au.org.ala.imagegen.geometry;

import java.util.Map;

/**
 * Source of the breakpoint table: width threshold to crop rectangle.
 */
public interface BreakpointConfig {

    Map<Integer, CropRectangle> getCropPoints();

}
