package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.SeedImageRecord;

import java.awt.Color;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** In-memory seed records for matcher tests. */
final class Seeds {

    private Seeds() {
    }

    static SeedImageRecord record(String name, ColorMetrics color) {
        return new SeedImageRecord(Path.of("seeds", name), 16, 16, color, color,
                color.brightness(), color.saturation(),
                TestImages.solid(4, 4, new Color(color.red(), color.green(), color.blue())));
    }

    static SeedCatalog catalog(ColorMetrics... colors) {
        List<SeedImageRecord> records = new ArrayList<>();
        for (int i = 0; i < colors.length; i++) {
            records.add(record(String.format("seed%02d.png", i), colors[i]));
        }
        return new SeedCatalog(Path.of("seeds"), records, List.of());
    }
}
