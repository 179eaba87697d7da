package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MosaicTile;
import com.project.image.mosaic.DTOs.TileRectangle;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Paints tiles onto the mosaic canvas. Each tile is rendered into a scratch image of
 * its own size and then copied into its rectangle, so tiles with disjoint rectangles
 * can be composited from different threads.
 */
@Service
public class Compositor {

    public BufferedImage createCanvas(int width, int height) {
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    }

    public void render(BufferedImage canvas, MosaicTile tile) {
        TileRectangle r = tile.rectangle();
        if (r.isEmpty()) return;
        BufferedImage rendered = renderTile(tile);
        int[] pixels = rendered.getRGB(0, 0, r.width(), r.height(), null, 0, r.width());
        canvas.setRGB(r.left(), r.top(), r.width(), r.height(), pixels, 0, r.width());
    }

    BufferedImage renderTile(MosaicTile tile) {
        TileRectangle r = tile.rectangle();
        BufferedImage out = new BufferedImage(r.width(), r.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = out.createGraphics();
        try {
            if (tile.isFlatFill()) {
                ColorMetrics c = tile.targetColor();
                graphics.setColor(new Color(c.red(), c.green(), c.blue()));
                graphics.fillRect(0, 0, r.width(), r.height());
                return out;
            }
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(tile.selectedSeed().thumbnail(), 0, 0, r.width(), r.height(), null);
        } finally {
            graphics.dispose();
        }
        applyOverlay(out, tile.overlayColor());
        return out;
    }

    /** Source-over of a uniform color: each channel moves toward the wash by alpha/255. */
    static void applyOverlay(BufferedImage image, ColorMetrics overlay) {
        if (overlay == null || overlay.alpha() == 0) return;
        final int a = overlay.alpha(), keep = 255 - a;
        final int washR = overlay.red() * a, washG = overlay.green() * a, washB = overlay.blue() * a;
        final int w = image.getWidth(), h = image.getHeight();
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int p = row[x];
                int r = (washR + ((p >> 16) & 0xFF) * keep + 127) / 255;
                int g = (washG + ((p >> 8) & 0xFF) * keep + 127) / 255;
                int b = (washB + (p & 0xFF) * keep + 127) / 255;
                row[x] = 0xFF000000 | (r << 16) | (g << 8) | b;
            }
            image.setRGB(0, y, w, 1, row, 0, w);
        }
    }
}
