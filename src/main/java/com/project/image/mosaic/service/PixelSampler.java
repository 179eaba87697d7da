package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.TileRectangle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Average and dominant color of an image region. Regions larger than
 * {@code targetSampleCount} pixels are read with a fixed stride over their row-major
 * pixel index, which bounds the cost per region.
 */
@Service
public class PixelSampler {
    public static final int DEFAULT_TARGET_SAMPLE_COUNT = 10_000;

    private final int targetSampleCount;

    @Autowired
    public PixelSampler(@Value("${app.mosaic.sample.target-count:10000}") int targetSampleCount) {
        if (targetSampleCount < 1) {
            throw new IllegalArgumentException("targetSampleCount must be >= 1");
        }
        this.targetSampleCount = targetSampleCount;
    }

    public PixelSampler() {
        this(DEFAULT_TARGET_SAMPLE_COUNT);
    }

    public int sampleRate(long pixelCount) {
        return (int) Math.max(1, pixelCount / targetSampleCount);
    }

    public ColorMetrics averageColor(BufferedImage image) {
        return averageColor(image, new TileRectangle(0, 0, image.getWidth(), image.getHeight()));
    }

    /** Opaque average of the region, or {@link ColorMetrics#NEUTRAL} for an empty region. */
    public ColorMetrics averageColor(BufferedImage image, TileRectangle region) {
        if (region.isEmpty()) return ColorMetrics.NEUTRAL;

        final int w = region.width(), h = region.height();
        final long pixelCount = region.area();
        long r = 0, g = 0, b = 0, count = 0;

        if (pixelCount <= targetSampleCount) {
            int[] argb = new int[w];
            for (int y = 0; y < h; y++) {
                image.getRGB(region.left(), region.top() + y, w, 1, argb, 0, w);
                for (int p : argb) {
                    r += (p >> 16) & 0xFF;
                    g += (p >> 8) & 0xFF;
                    b += p & 0xFF;
                }
            }
            count = pixelCount;
        } else {
            int step = sampleRate(pixelCount);
            for (long i = 0; i < pixelCount; i += step) {
                int p = image.getRGB(region.left() + (int) (i % w), region.top() + (int) (i / w));
                r += (p >> 16) & 0xFF;
                g += (p >> 8) & 0xFF;
                b += p & 0xFF;
                count++;
            }
        }
        return ColorMetrics.rgb((int) (r / count), (int) (g / count), (int) (b / count));
    }

    public ColorMetrics dominantColor(BufferedImage image) {
        return dominantColor(image, new TileRectangle(0, 0, image.getWidth(), image.getHeight()));
    }

    /**
     * Most frequent sampled RGB value. Ties go to the value met first in scan order,
     * which the insertion-ordered map preserves.
     */
    public ColorMetrics dominantColor(BufferedImage image, TileRectangle region) {
        if (region.isEmpty()) return ColorMetrics.NEUTRAL;

        final int w = region.width();
        final long pixelCount = region.area();
        int step = sampleRate(pixelCount);

        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (long i = 0; i < pixelCount; i += step) {
            int rgb = image.getRGB(region.left() + (int) (i % w), region.top() + (int) (i / w)) & 0xFFFFFF;
            counts.merge(rgb, 1, Integer::sum);
        }

        int best = 0, bestCount = -1;
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                bestCount = e.getValue();
                best = e.getKey();
            }
        }
        return ColorMetrics.fromArgb(0xFF000000 | best);
    }
}
