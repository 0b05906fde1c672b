package com.project.lepidoptera.landmarks.render;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.exceptions.LandmarkException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;

/** Rendering surface backed by an ARGB image, one image pixel per mask cell. */
public class BufferedImageSurface implements RenderingSurface {
    private static final Color MASK_OBJECT_COLOR = new Color(0, 180, 255);
    private static final Color MASK_BACKGROUND   = new Color(0, 0, 0);
    private static final float[] DASH = {4f, 4f};

    private BufferedImage image;
    private String title = "";

    public BufferedImageSurface(int width, int height) {
        this.image = blank(Math.max(1, width), Math.max(1, height));
    }

    @Override
    public void setTitle(String title) {
        this.title = title == null ? "" : title;
    }

    @Override
    public void showMask(BinaryMask mask) {
        BufferedImage canvas = blank(Math.max(1, mask.width()), Math.max(1, mask.height()));
        int objectARGB = 0xFF000000 | MASK_OBJECT_COLOR.getRGB();
        for (int r = 0; r < mask.height(); r++) {
            for (int c = 0; c < mask.width(); c++) {
                if (mask.get(r, c)) canvas.setRGB(c, r, objectARGB);
            }
        }
        image = canvas;
    }

    @Override
    public void drawVerticalLine(int col, Color color, boolean dashed) {
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(color);
            g.setStroke(dashed
                    ? new BasicStroke(1f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f, DASH, 0f)
                    : new BasicStroke(1f));
            g.drawLine(col, 0, col, image.getHeight() - 1);
        } finally {
            g.dispose();
        }
    }

    @Override
    public void scatter(List<Point> points, Color color, int markerSize) {
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(color);
            int half = markerSize / 2;
            for (Point p : points) {
                g.fillOval(p.col() - half, p.row() - half, markerSize, markerSize);
            }
        } finally {
            g.dispose();
        }
    }

    public String title() {
        return title;
    }

    public BufferedImage image() {
        return image;
    }

    public byte[] toPng() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new LandmarkException("Failed to encode overlay", e);
        }
    }

    private static BufferedImage blank(int w, int h) {
        BufferedImage canvas = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = canvas.createGraphics();
        graphics.setColor(MASK_BACKGROUND);
        graphics.fillRect(0, 0, w, h);
        graphics.dispose();
        return canvas;
    }
}
