package com.slicereport.core.image;

import com.slicereport.logging.AppLogger;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Re-encodes raster slices as JPEG under a byte ceiling by stepping the quality down.
 * <p>
 * The quality sequence is fixed (95, 90, 85, ...), so a given source always lands on the same
 * encoding for the same codec.
 */
public class ImageNormalizer {

    public static final long DEFAULT_MAX_BYTES = 512_000L;
    public static final int DEFAULT_MIN_QUALITY = 10;
    public static final int START_QUALITY = 95;
    public static final int QUALITY_STEP = 5;
    public static final String TARGET_EXTENSION = ".jpg";

    private static final Logger LOGGER = AppLogger.get();

    public NormalizedImage normalize(Path source) throws IOException {
        return normalize(source, targetFor(source, source.toAbsolutePath().getParent()),
            DEFAULT_MAX_BYTES, DEFAULT_MIN_QUALITY);
    }

    /**
     * Decodes {@code source}, flattens it to RGB and writes the first encoding that fits
     * {@code maxBytes} to {@code target}. When even {@code minQuality} is too large the smallest
     * encoding reached is written and reported with {@code withinLimit == false}.
     * The source file is never deleted; when {@code target} equals {@code source} it is overwritten.
     *
     * @throws IOException when the source cannot be decoded or the target cannot be written
     */
    public NormalizedImage normalize(Path source, Path target, long maxBytes, int minQuality) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        if (minQuality < 1 || minQuality > START_QUALITY) {
            throw new IllegalArgumentException("minQuality must be within 1-" + START_QUALITY + ": " + minQuality);
        }

        BufferedImage rgb = toRgb(decode(source));

        byte[] best = null;
        int bestQuality = START_QUALITY;
        int attempts = 0;
        for (int quality = START_QUALITY; quality >= minQuality; quality -= QUALITY_STEP) {
            byte[] encoded = encodeJpeg(rgb, quality);
            attempts++;
            if (best == null || encoded.length < best.length) {
                best = encoded;
                bestQuality = quality;
            }
            if (encoded.length <= maxBytes) {
                break;
            }
        }

        boolean withinLimit = best.length <= maxBytes;
        if (target.toAbsolutePath().getParent() != null) {
            Files.createDirectories(target.toAbsolutePath().getParent());
        }
        Files.write(target, best);
        if (!withinLimit) {
            LOGGER.warning("Could not bring " + source.getFileName() + " under " + maxBytes
                + " bytes; using quality " + bestQuality + " (" + best.length + " bytes)");
        }
        return new NormalizedImage(target, best.length, bestQuality, withinLimit, attempts);
    }

    /**
     * Same base name as {@code source} with a {@code .jpg} extension, placed in {@code directory}.
     */
    public static Path targetFor(Path source, Path directory) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return directory.resolve(base + TARGET_EXTENSION);
    }

    static BufferedImage decode(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new IOException("Missing: " + source);
        }
        BufferedImage image = ImageIO.read(source.toFile());
        if (image == null) {
            throw new IOException("No image decoder for " + source);
        }
        return image;
    }

    /**
     * Drops alpha and palettes by compositing onto a white canvas; JPEG has no transparency.
     */
    static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    static byte[] encodeJpeg(BufferedImage rgb, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = new MemoryCacheImageOutputStream(baos)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality / 100f);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgb, null, null), param);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }
}
