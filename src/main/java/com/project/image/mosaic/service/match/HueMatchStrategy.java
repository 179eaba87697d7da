package com.project.image.mosaic.service.match;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.MatchStrategyType;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.SeedImageRecord;

/**
 * Scores records by circular hue difference plus weighted saturation and brightness
 * differences. The photo shown on the tile is picked at random from the catalog and
 * washed with the target color; the hue match only decides whether the tile counts as
 * within tolerance.
 */
public class HueMatchStrategy implements MatchStrategy {
    private final double hueTolerance;
    private final double saturationWeight;
    private final double brightnessWeight;
    private final int overlayAlpha;

    /**
     * @param saturationWeight percentage, 0-100
     * @param brightnessWeight percentage, 0-100
     */
    public HueMatchStrategy(double hueTolerance, int saturationWeight, int brightnessWeight, int overlayAlpha) {
        this.hueTolerance = hueTolerance;
        this.saturationWeight = saturationWeight / 100.0;
        this.brightnessWeight = brightnessWeight / 100.0;
        this.overlayAlpha = overlayAlpha;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.HUE;
    }

    public double score(ColorMetrics target, SeedImageRecord seed) {
        ColorMetrics candidate = seed.averageColor();
        return target.hueDistanceTo(candidate)
                + Math.abs(target.saturation() - candidate.saturation()) * saturationWeight
                + Math.abs(target.brightness() - candidate.brightness()) * brightnessWeight;
    }

    /**
     * The reported distance is the hue distance of the displayed image. The weighted
     * score only ranks the records inside {@code hueTolerance}; whether one exists decides
     * {@code withinTolerance}.
     */
    @Override
    public MatchResult select(ColorMetrics target, SeedCatalog catalog, MatchState state) {
        if (catalog.isEmpty()) {
            throw new IllegalStateException("Seed catalog is empty");
        }
        SeedImageRecord bestMatch = bestWithinTolerance(target, catalog);
        SeedImageRecord displayed = catalog.get(state.nextInt(catalog.size()));
        return new MatchResult(displayed, target.hueDistanceTo(displayed.averageColor()),
                target.withAlpha(overlayAlpha), bestMatch != null);
    }

    /** Lowest-scoring record within the hue tolerance, or null when there is none. */
    public SeedImageRecord bestWithinTolerance(ColorMetrics target, SeedCatalog catalog) {
        SeedImageRecord best = null;
        double bestScore = Double.MAX_VALUE;
        for (SeedImageRecord seed : catalog.records()) {
            if (target.hueDistanceTo(seed.averageColor()) > hueTolerance) continue;
            double s = score(target, seed);
            if (s < bestScore) {
                bestScore = s;
                best = seed;
            }
        }
        return best;
    }
}
