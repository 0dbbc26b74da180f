package au.org.ala.imagegen.request;

import au.org.ala.imagegen.ImageGeneratorException;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.HashMap;
import java.util.Map;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.INVALID_PARAMETERS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@RunWith(JUnit4.class)
public class ImageGeneratorRequestTest {

    @Test
    public void testParseFullString() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w320h240-br-scc-ctl-px40-py60");
        assertEquals(320, request.getWidth());
        assertEquals(240, request.getHeight());
        assertTrue(request.isBreakPoint());
        assertEquals(ScaleMode.COVER, request.getScale());
        assertEquals("tl", request.getCrop());
        assertEquals(Integer.valueOf(40), request.getPx());
        assertEquals(Integer.valueOf(60), request.getPy());
        assertTrue(request.getAdvisories().isEmpty());
    }

    @Test
    public void testSmartCropAlias() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w320h240-csmt");
        assertEquals("smt", request.getCrop());
        assertTrue(request.isSmartCrop());
        assertTrue(ImageGeneratorRequest.fromStringParams("w320h240-csmart").isSmartCrop());
        assertFalse(ImageGeneratorRequest.fromStringParams("w320h240-cbr").isSmartCrop());
    }

    @Test
    public void testDefaults() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w100h100");
        assertFalse(request.isBreakPoint());
        assertNull(request.getScale());
        assertNull(request.getCrop());
        assertNull(request.getPx());
        assertNull(request.getPy());
    }

    @Test
    public void testCaseInsensitiveTokens() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("W200H150-SCA-PX10");
        assertEquals(200, request.getWidth());
        assertEquals(150, request.getHeight());
        assertEquals(ScaleMode.ABSOLUTE, request.getScale());
        assertEquals(Integer.valueOf(10), request.getPx());
    }

    @Test
    public void testHeightOnlyIsMissingWidth() {
        try {
            ImageGeneratorRequest.fromStringParams("h240");
            fail("width is mandatory");
        } catch (ImageGeneratorException e) {
            assertEquals(INVALID_PARAMETERS, e.getErrorCode());
        }
    }

    @Test
    public void testZeroCountsAsAbsent() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w100h100-px0-py25");
        assertNull(request.getPx());
        assertEquals(Integer.valueOf(25), request.getPy());
        try {
            ImageGeneratorRequest.fromStringParams("w0h100");
            fail("zero width counts as missing");
        } catch (ImageGeneratorException e) {
            assertEquals(INVALID_PARAMETERS, e.getErrorCode());
        }
    }

    @Test
    public void testUnknownTokensIgnored() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w100h100-zz-foo");
        assertEquals(100, request.getWidth());
        assertNull(request.getCrop());
    }

    @Test
    public void testFloorClamp() {
        ImageGeneratorRequest request = new ImageGeneratorRequest(ImmutableMap.of("width", 10, "height", "5"));
        assertEquals(16, request.getWidth());
        assertEquals(16, request.getHeight());
        assertTrue(request.getAdvisories().contains(DimensionAdvisory.WIDTH_BELOW_MINIMUM));
        assertTrue(request.getAdvisories().contains(DimensionAdvisory.HEIGHT_BELOW_MINIMUM));
        assertFalse(request.isOversized());
    }

    @Test
    public void testOversizedIsFlaggedNotClamped() {
        ImageGeneratorRequest request = new ImageGeneratorRequest(ImmutableMap.of("width", 4000, "height", 100));
        assertEquals(4000, request.getWidth());
        assertTrue(request.isOversized());
        assertTrue(request.getAdvisories().contains(DimensionAdvisory.WIDTH_OVERSIZED));
        assertFalse(request.getAdvisories().contains(DimensionAdvisory.HEIGHT_OVERSIZED));
    }

    @Test
    public void testMapRequiresDimensions() {
        try {
            new ImageGeneratorRequest(ImmutableMap.of("width", 100));
            fail("height is mandatory");
        } catch (ImageGeneratorException e) {
            assertEquals(INVALID_PARAMETERS, e.getErrorCode());
        }
    }

    @Test
    public void testMapRejectsNonNumbers() {
        try {
            new ImageGeneratorRequest(ImmutableMap.of("width", "wide", "height", 100));
            fail("width must be numeric");
        } catch (ImageGeneratorException e) {
            assertEquals(INVALID_PARAMETERS, e.getErrorCode());
        }
    }

    @Test
    public void testMapScaleNames() {
        assertEquals(ScaleMode.RATIO, new ImageGeneratorRequest(ImmutableMap.of("width", 100, "height", 100, "scale", "ratio")).getScale());
        assertEquals(ScaleMode.COVER, new ImageGeneratorRequest(ImmutableMap.of("width", 100, "height", 100, "scale", "c")).getScale());
        assertEquals(ScaleMode.ABSOLUTE, new ImageGeneratorRequest(ImmutableMap.of("width", 100, "height", 100, "scale", ScaleMode.ABSOLUTE)).getScale());
        try {
            new ImageGeneratorRequest(ImmutableMap.of("width", 100, "height", 100, "scale", "x"));
            fail("unknown scale");
        } catch (ImageGeneratorException e) {
            assertEquals(INVALID_PARAMETERS, e.getErrorCode());
        }
    }

    @Test
    public void testFromParamsDispatch() {
        Map<String, Object> params = new HashMap<>();
        params.put("width", 50);
        params.put("height", 60);
        params.put("crop", "mc");
        assertEquals(new ImageGeneratorRequest(params), ImageGeneratorRequest.fromParams(params));
        assertEquals(ImageGeneratorRequest.fromStringParams("w50h60-cmc"), ImageGeneratorRequest.fromParams("w50h60-cmc"));
        try {
            ImageGeneratorRequest.fromParams(42);
            fail("unsupported type");
        } catch (ImageGeneratorException e) {
            assertEquals(INVALID_PARAMETERS, e.getErrorCode());
        }
    }

    @Test
    public void testFromParamsAcceptsAnyKeyType() {
        Map<Object, Object> params = new HashMap<>();
        params.put("width", 50);
        params.put("height", 60);
        params.put(new StringBuilder("crop"), "mc");
        ImageGeneratorRequest request = ImageGeneratorRequest.fromParams(params);
        assertEquals(ImageGeneratorRequest.fromStringParams("w50h60-cmc"), request);
    }

    @Test
    public void testMapNormalisedLikeString() {
        Map<String, Object> params = new HashMap<>();
        params.put("width", 100);
        params.put("height", 80);
        params.put("crop", " BR ");
        params.put("px", 0);
        params.put("py", 25);
        ImageGeneratorRequest request = new ImageGeneratorRequest(params);
        assertEquals("br", request.getCrop());
        assertNull(request.getPx());
        assertEquals(Integer.valueOf(25), request.getPy());
        assertEquals(ImageGeneratorRequest.fromStringParams("w100h80-cbr-px0-py25"), request);
    }

    @Test
    public void testToParamsRebuildsEqualRequest() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w320h240-br-scr-cbl-py30");
        assertEquals(request, new ImageGeneratorRequest(request.toParams()));
        assertEquals("w320h240", request.getSizeToken());
    }
}
