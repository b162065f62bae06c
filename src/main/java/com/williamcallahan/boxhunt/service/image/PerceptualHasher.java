/**
 * Average-hash fingerprinting of decoded images
 *
 * @author William Callahan
 *
 * Features:
 * - Downsamples to an 8x8 grayscale grid by block averaging
 * - Sets one bit per cell brighter than the grid mean, row-major, most significant bit first
 * - Tolerant to re-encoding and mild rescaling
 */
package com.williamcallahan.boxhunt.service.image;

import com.williamcallahan.boxhunt.model.PerceptualHash;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

@Component
public class PerceptualHasher {

    static final int GRID = 8;

    public PerceptualHash hash(BufferedImage image) {
        BufferedImage source = image;
        if (image.getWidth() < GRID || image.getHeight() < GRID) {
            source = upscaleToGrid(image);
        }
        double[] cells = cellLuminance(source);

        double mean = 0;
        for (double cell : cells) {
            mean += cell;
        }
        mean /= cells.length;

        long bits = 0L;
        for (double cell : cells) {
            bits = (bits << 1) | (cell > mean ? 1L : 0L);
        }
        return new PerceptualHash(bits);
    }

    private static double[] cellLuminance(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[] cells = new double[GRID * GRID];
        for (int cy = 0; cy < GRID; cy++) {
            int y0 = cy * height / GRID;
            int y1 = (cy + 1) * height / GRID;
            for (int cx = 0; cx < GRID; cx++) {
                int x0 = cx * width / GRID;
                int x1 = (cx + 1) * width / GRID;
                double sum = 0;
                for (int y = y0; y < y1; y++) {
                    for (int x = x0; x < x1; x++) {
                        sum += luminance(image.getRGB(x, y));
                    }
                }
                cells[cy * GRID + cx] = sum / ((long) (x1 - x0) * (y1 - y0));
            }
        }
        return cells;
    }

    // ITU-R 601-2 luma, the same weights used for "L" mode conversion
    private static double luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return r * 0.299 + g * 0.587 + b * 0.114;
    }

    private static BufferedImage upscaleToGrid(BufferedImage image) {
        BufferedImage scaled = new BufferedImage(GRID, GRID, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = scaled.createGraphics();
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2d.drawImage(image, 0, 0, GRID, GRID, null);
        g2d.dispose();
        return scaled;
    }
}
