package com.project.image.mosaic.service.match;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.MatchStrategyType;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.SeedImageRecord;

/**
 * Nearest average color in RGB space. Records farther than {@code tolerance} are only
 * used when nothing closer exists, and the tile is then reported as out of tolerance.
 * In flat-fill mode no photo is drawn at all.
 */
public class ColorMatchStrategy implements MatchStrategy {
    private final double tolerance;
    private final boolean flatColorFill;
    private final int overlayAlpha;

    public ColorMatchStrategy(double tolerance, boolean flatColorFill, int overlayAlpha) {
        this.tolerance = tolerance;
        this.flatColorFill = flatColorFill;
        this.overlayAlpha = overlayAlpha;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.COLOR;
    }

    @Override
    public boolean requiresCatalog() {
        return !flatColorFill;
    }

    @Override
    public MatchResult select(ColorMetrics target, SeedCatalog catalog, MatchState state) {
        if (flatColorFill) {
            return new MatchResult(null, 0.0, ColorMetrics.NEUTRAL, true);
        }
        SeedImageRecord best = null;
        double bestDistance = Double.MAX_VALUE;
        for (SeedImageRecord seed : catalog.records()) {
            double d = target.distanceTo(seed.averageColor());
            if (d < bestDistance) {
                bestDistance = d;
                best = seed;
            }
        }
        if (best == null) {
            throw new IllegalStateException("Seed catalog is empty");
        }
        return new MatchResult(best, bestDistance, target.withAlpha(overlayAlpha), bestDistance <= tolerance);
    }
}
