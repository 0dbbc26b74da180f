package au.org.ala.imagegen.generator;

import au.org.ala.imagegen.codec.ImageFilenameCodec;
import au.org.ala.imagegen.geometry.CentreSmartCropper;
import au.org.ala.imagegen.request.ImageGeneratorRequest;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Generates one derivative from the command line. The transform parameters are decoded from the target file name,
 * eg {@code photo__w320h240-csmt_1a2b3c.jpg}.
 */
public class LocalImageGenerator {

    public static void main(String[] args) {
        if (args.length < 2) {
            usage();
            System.exit(0);
        }

        Path source = Paths.get(args[0]);
        Path target = Paths.get(args[1]).toAbsolutePath();

        ImageGeneratorConfig config = ImageGeneratorConfig.load();
        ImageFilenameCodec codec = new ImageFilenameCodec(config.getBaseUrl());
        Path placeholderDir = target.getParent() != null ? target.getParent() : Paths.get(".");
        ImageGenerator generator = new ImageGenerator(config, CentreSmartCropper.INSTANCE, DefaultOptimizer.INSTANCE,
                new PlaceholderImageWriter(placeholderDir));
        try {
            ImageGeneratorRequest request = codec.decodeFilename(target.getFileName().toString());
            long start = System.currentTimeMillis();
            GenerationResult result = generator.generate(request, source, target);
            long end = System.currentTimeMillis();
            if (result.isGenerated()) {
                System.out.printf("Generated %s (%dx%d) in %s%n", result.getTarget(), result.getWidth(), result.getHeight(), Duration.ofMillis(end - start));
            } else {
                System.out.printf("Source %s is not a valid image, placeholder: %s%n", source, result.getPlaceholder());
            }
        } catch (Exception ex) {
            ex.printStackTrace();
            error("Generation failed: " + ex.getMessage());
        }
    }

    private static void usage() {
        System.out.println("LocalImageGenerator <source> <target>");
    }

    private static void error(String message) {
        System.err.println(message);
        System.exit(-1);
    }
}
