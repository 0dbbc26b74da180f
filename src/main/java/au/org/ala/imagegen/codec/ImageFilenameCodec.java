package au.org.ala.imagegen.codec;

import au.org.ala.imagegen.ImageGeneratorException;
import au.org.ala.imagegen.request.ImageGeneratorRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static au.org.ala.imagegen.ImageGeneratorException.ErrorCode.INVALID_URL;

/**
 * Encodes generation parameters into image URLs and filenames, and decodes them again.
 * <p>
 * An encoded name looks like {@code <prefix><basename>__<params>_<hash6>.<suffix>}, eg
 * {@code /img/photo__w320h240-csmart_1a2b3c.jpg}. Encoding an already encoded name replaces the previous block.
 */
public class ImageFilenameCodec {

    private static final Logger log = LoggerFactory.getLogger(ImageFilenameCodec.class);

    public static final String INVALID_IMAGE = "#INVALID_IMAGE#";
    public static final String PLACEHOLDER_NAME = "placeholder.png";

    private static final Pattern ENCODED_PATTERN = Pattern.compile(
            "^(?<prefix>.*/)?(?<filename>.+?)(__[^_]*?_[a-z0-9]{" + HashGenerator.HASH_LENGTH + "})(?<suffix>\\.[^.]+)$");
    private static final Pattern URL_PATTERN = Pattern.compile("(?<prefix>.*/)?(?<filename>[\\w._-]+)\\.(?<suffix>.+)$");
    private static final Pattern PARAMS_PATTERN = Pattern.compile(
            "__(?<params>[^_]*?)_(?<hash>[a-z0-9]{" + HashGenerator.HASH_LENGTH + "})\\.[^.]+$");

    private final String baseUrl;
    private final ParamsSerializer paramsSerializer;
    private final HashGenerator hashGenerator;

    public ImageFilenameCodec(String baseUrl) {
        this(baseUrl, DefaultParamsSerializer.INSTANCE, Md5HashGenerator.INSTANCE);
    }

    public ImageFilenameCodec(String baseUrl, ParamsSerializer paramsSerializer, HashGenerator hashGenerator) {
        this.baseUrl = StringUtils.removeEnd(Objects.requireNonNullElse(baseUrl, ""), "/");
        this.paramsSerializer = Objects.requireNonNull(paramsSerializer, "paramsSerializer must not be null");
        this.hashGenerator = Objects.requireNonNull(hashGenerator, "hashGenerator must not be null");
    }

    /**
     * Fill in the URL of an image (it can also be relative) with parameters so that the path is valid for the
     * generator.
     *
     * @param url    The image URL or filename. Null, empty or {@link #INVALID_IMAGE} is replaced by the placeholder URL.
     * @param params The generation parameters, see {@link DefaultParamsSerializer}
     * @return the URL with the encoded parameter block before its suffix
     * @throws ImageGeneratorException with {@code INVALID_URL} if the URL has no recognisable filename and suffix
     */
    public String encodeFilename(String url, Map<String, ?> params) {
        if (StringUtils.isEmpty(url) || INVALID_IMAGE.equals(url)) {
            url = baseUrl + "/" + PLACEHOLDER_NAME;
        } else {
            url = stripParams(url);
        }

        Matcher parser = URL_PATTERN.matcher(url);
        if (parser.find()) {
            String param = paramsSerializer.paramsToString(params);
            String prefix = Objects.toString(parser.group("prefix"), "");
            return prefix + parser.group("filename")
                    + (param.isEmpty() ? "" : "__" + param + "_" + hashGenerator.generateHash(param))
                    + "." + parser.group("suffix");
        }

        throw new ImageGeneratorException(INVALID_URL, "Invalid URL \"" + url + "\" given.");
    }

    public String encodeFilename(String url, ImageGeneratorRequest request) {
        return encodeFilename(url, request.toParams());
    }

    /**
     * @return the URL with a previously encoded parameter block removed, or the URL itself if it carries none
     */
    public String stripParams(String url) {
        Matcher parser = ENCODED_PATTERN.matcher(url);
        if (parser.matches()) {
            return Objects.toString(parser.group("prefix"), "") + parser.group("filename") + parser.group("suffix");
        }
        return url;
    }

    /**
     * @return the raw parameter string of an encoded filename, eg {@code w320h240-csmart}
     * @throws ImageGeneratorException with {@code INVALID_URL} if the filename has no parameter block or its hash does
     * not match the parameters
     */
    public String extractParams(String filename) {
        Matcher parser = PARAMS_PATTERN.matcher(Objects.requireNonNull(filename, "filename must not be null"));
        if (!parser.find()) {
            throw new ImageGeneratorException(INVALID_URL, "Filename \"" + filename + "\" does not contain encoded parameters.");
        }
        String params = parser.group("params");
        String expected = hashGenerator.generateHash(params);
        if (!expected.equals(parser.group("hash"))) {
            log.debug("Hash mismatch for {}: expected {}", filename, expected);
            throw new ImageGeneratorException(INVALID_URL, "Filename \"" + filename + "\" has an invalid parameter hash.");
        }
        return params;
    }

    /**
     * Decode the request embedded in a generated filename.
     */
    public ImageGeneratorRequest decodeFilename(String filename) {
        return ImageGeneratorRequest.fromStringParams(extractParams(filename));
    }

}
