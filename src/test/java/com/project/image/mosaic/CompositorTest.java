package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MosaicTile;
import com.project.image.mosaic.DTOs.TileCoordinate;
import com.project.image.mosaic.DTOs.TileRectangle;
import com.project.image.mosaic.service.Compositor;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.*;

class CompositorTest {
    private final Compositor compositor = new Compositor();

    @Test
    void render_flatFill_paintsOpaqueTargetColorInsideRectangleOnly() {
        BufferedImage canvas = compositor.createCanvas(20, 10);
        MosaicTile tile = new MosaicTile(new TileCoordinate(1, 0), new TileRectangle(10, 0, 10, 10),
                ColorMetrics.rgb(10, 20, 30), null, ColorMetrics.NEUTRAL, 0);

        compositor.render(canvas, tile);

        assertThat(canvas.getRGB(15, 5) & 0xFFFFFF).isEqualTo(0x0A141E);
        assertThat(canvas.getRGB(5, 5) & 0xFFFFFF).isZero();
    }

    @Test
    void render_seedScaledToRectangleAndOverlayBlended() {
        BufferedImage canvas = compositor.createCanvas(30, 30);
        ColorMetrics white = ColorMetrics.rgb(255, 255, 255);
        MosaicTile tile = new MosaicTile(new TileCoordinate(0, 0), new TileRectangle(0, 0, 30, 30),
                ColorMetrics.rgb(0, 0, 0), Seeds.record("white.png", white),
                new ColorMetrics(0, 0, 0, 210), 0);

        compositor.render(canvas, tile);

        // 255 * (1 - 210/255) = 45
        int p = canvas.getRGB(29, 29);
        assertThat((p >> 16) & 0xFF).isEqualTo(45);
        assertThat(p & 0xFF).isEqualTo(45);
    }

    @Test
    void render_transparentOverlay_leavesSeedPixels() {
        BufferedImage canvas = compositor.createCanvas(8, 8);
        MosaicTile tile = new MosaicTile(new TileCoordinate(0, 0), new TileRectangle(0, 0, 8, 8),
                ColorMetrics.rgb(0, 0, 0), Seeds.record("blue.png", ColorMetrics.rgb(0, 0, 255)),
                new ColorMetrics(255, 0, 0, 0), 0);

        compositor.render(canvas, tile);

        assertThat(canvas.getRGB(4, 4) & 0xFFFFFF).isEqualTo(0x0000FF);
    }
}
