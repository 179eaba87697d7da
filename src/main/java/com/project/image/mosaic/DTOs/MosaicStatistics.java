package com.project.image.mosaic.DTOs;

import java.time.Duration;
import java.util.Map;

/**
 * Per-run counters. On a cancelled or failed run the counters reflect the work done
 * before the run stopped.
 *
 * @param tilesStarted          match+compose units that began work
 * @param sampleFailures        tiles whose color had to be replaced by the neutral color
 * @param outOfToleranceTiles   tiles where the matcher fell back past its tolerance
 * @param seedUsage             times each seed file was placed, keyed by path
 */
public record MosaicStatistics(
        int columns,
        int rows,
        int totalTiles,
        int tilesAnalyzed,
        int tilesStarted,
        int tilesRendered,
        int sampleFailures,
        int outOfToleranceTiles,
        int seedsLoaded,
        int seedsSkipped,
        int uniqueSeedsUsed,
        String mostUsedSeedPath,
        int mostUsedSeedCount,
        double averageColorDistance,
        Map<String, Integer> seedUsage,
        Duration elapsed
) {
    public MosaicStatistics {
        seedUsage = seedUsage == null ? Map.of() : Map.copyOf(seedUsage);
    }

    public static MosaicStatistics empty() {
        return new MosaicStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, 0, 0.0, Map.of(), Duration.ZERO);
    }
}
