package com.starscape.parkfaces.support;

import com.starscape.parkfaces.features.extraction.domain.BoundingBox;
import com.starscape.parkfaces.features.extraction.domain.DetectedFace;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Helpers for building test images and faces.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Create a small JPEG with a gradient fill.
     */
    public static byte[] createJpeg(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        for (int y = 0; y < height; y++) {
            int colorValue = (int) (255 * ((double) y / height));
            g.setColor(new Color(colorValue, colorValue, colorValue));
            g.drawLine(0, y, width, y);
        }
        g.dispose();
        return write(image, "jpg");
    }

    public static byte[] createPng(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(0, 0, width, height);
        g.setColor(Color.WHITE);
        g.fillOval(width / 4, height / 4, width / 2, height / 2);
        g.dispose();
        return write(image, "png");
    }

    public static DetectedFace face(float... embedding) {
        return new DetectedFace(embedding, new BoundingBox(10, 20, 64, 64));
    }

    private static byte[] write(BufferedImage image, String format) {
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, format, out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
