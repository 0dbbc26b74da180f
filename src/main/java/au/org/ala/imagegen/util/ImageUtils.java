package au.org.ala.imagegen.util;

import au.org.ala.imagegen.format.ImageFormat;
import org.imgscalr.Scalr;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

public class ImageUtils {

    public static BufferedImage scale(BufferedImage src, int destWidth, int destHeight) {
        return Scalr.resize(src, Scalr.Method.QUALITY, Scalr.Mode.FIT_EXACT, destWidth, destHeight, Scalr.OP_ANTIALIAS);
    }

    public static BufferedImage crop(BufferedImage src, int left, int top, int width, int height) {
        return Scalr.crop(src, left, top, width, height);
    }

    /**
     * Round half away from zero.
     */
    public static int round(double value) {
        return (int) (Math.signum(value) * Math.floor(Math.abs(value) + 0.5));
    }

    /**
     * Paint onto an opaque image so that formats without an alpha channel don't pick up odd colouration.
     */
    public static BufferedImage toOpaque(BufferedImage src) {
        if (!src.getColorModel().hasAlpha() && src.getType() != BufferedImage.TYPE_CUSTOM) {
            return src;
        }
        BufferedImage opaque = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics g = opaque.getGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return opaque;
    }

    /**
     * Encode an image to a file.
     *
     * @param quality JPEG quality between 0 and 100, or null for the writer default. Ignored for lossless formats.
     * @throws IOException if there is no writer for the format or writing fails
     */
    public static void write(BufferedImage image, ImageFormat format, Path path, Integer quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new IIOException("No ImageIO writer for format: " + format.getFormatName());
        }
        ImageWriter writer = writers.next();
        BufferedImage output = format == ImageFormat.JPEG ? toOpaque(image) : image;
        try (OutputStream os = Files.newOutputStream(path);
             ImageOutputStream ios = ImageIO.createImageOutputStream(os)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (quality != null && format == ImageFormat.JPEG && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(Math.max(0, Math.min(100, quality)) / 100f);
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(output, null, null), param);
        } finally {
            writer.dispose();
            if (output != image) {
                output.flush();
            }
        }
    }

}
