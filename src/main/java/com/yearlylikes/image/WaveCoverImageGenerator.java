package com.yearlylikes.image;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Random;

/**
 * Draws layered sine waves in an analogous palette on a dark background.
 * The random source is seeded from the FNV-1a hash of the playlist name.
 */
public class WaveCoverImageGenerator implements CoverImageGenerator {

    static final int WIDTH = 640;
    static final int HEIGHT = 640;
    private static final int WAVES = 7;
    private static final float JPEG_QUALITY = 0.85f;

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    @Override
    public byte[] generateForPlaylist(String name) throws IOException {
        Random rng = new Random(fnv1a64(name == null ? "" : name));
        Color[] palette = analogousPalette(rng);

        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
            g.setColor(new Color(0.1f, 0.1f, 0.15f));
            g.fillRect(0, 0, WIDTH, HEIGHT);

            for (int i = 0; i < WAVES; i++) {
                g.setColor(palette[rng.nextInt(palette.length)]);

                double lineWidth = 2 + rng.nextDouble() * 15;
                double amplitude = 50 + rng.nextDouble() * 100;
                double frequency = 0.5 + rng.nextDouble() * 2;
                double yOffset = HEIGHT / 2.0 + (rng.nextDouble() - 0.5) * 300;

                Path2D.Double wave = new Path2D.Double();
                for (int x = 0; x < WIDTH; x++) {
                    double y = yOffset + Math.sin((double) x / WIDTH * Math.PI * 2 * frequency) * amplitude;
                    if (x == 0) {
                        wave.moveTo(x, y);
                    } else {
                        wave.lineTo(x, y);
                    }
                }
                g.setStroke(new BasicStroke((float) lineWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
                g.draw(wave);
            }
        } finally {
            g.dispose();
        }

        return encodeJpeg(image);
    }

    static long fnv1a64(String text) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static Color[] analogousPalette(Random rng) {
        float baseHue = rng.nextFloat() * 360f;
        float saturation = 0.6f;
        float value = 0.9f;
        return new Color[]{
                Color.getHSBColor(baseHue / 360f, saturation, value),
                Color.getHSBColor(((baseHue + 25f) % 360f) / 360f, saturation, value),
                Color.getHSBColor(((baseHue + 335f) % 360f) / 360f, saturation, value)
        };
    }

    private static byte[] encodeJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(JPEG_QUALITY);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
