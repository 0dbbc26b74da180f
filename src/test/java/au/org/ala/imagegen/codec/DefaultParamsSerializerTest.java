package au.org.ala.imagegen.codec;

import au.org.ala.imagegen.request.ImageGeneratorRequest;
import au.org.ala.imagegen.request.ScaleMode;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;

@RunWith(JUnit4.class)
public class DefaultParamsSerializerTest {

    private final DefaultParamsSerializer serializer = DefaultParamsSerializer.INSTANCE;

    @Test
    public void testCanonicalOrder() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("py", 30);
        params.put("crop", "TL");
        params.put("scale", ScaleMode.RATIO);
        params.put("breakPoint", true);
        params.put("height", 240);
        params.put("width", 320);
        params.put("px", 10);
        assertEquals("w320h240-br-scr-ctl-px10-py30", serializer.paramsToString(params));
    }

    @Test
    public void testShortKeys() {
        assertEquals("w100h50-br-scc-csmart", serializer.paramsToString(ImmutableMap.of("w", 100, "h", 50, "br", "1", "sc", "cover", "c", "smart")));
    }

    @Test
    public void testAbsentAndFalseValuesOmitted() {
        assertEquals("w100h50", serializer.paramsToString(ImmutableMap.of("width", 100, "height", 50, "breakPoint", false, "crop", "")));
        assertEquals("", serializer.paramsToString(Collections.emptyMap()));
    }

    @Test
    public void testRequestParamsParseBack() {
        ImageGeneratorRequest request = ImageGeneratorRequest.fromStringParams("w320h240-csmt-px40");
        String canonical = serializer.paramsToString(request.toParams());
        assertEquals("w320h240-csmt-px40", canonical);
        assertEquals(request, ImageGeneratorRequest.fromStringParams(canonical));
    }
}
