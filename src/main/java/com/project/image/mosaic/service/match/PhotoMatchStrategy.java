package com.project.image.mosaic.service.match;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.MatchStrategyType;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.SeedImageRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Nearest average color with a penalty for repeated use. With repetition avoidance on,
 * records at their reuse limit or among the last {@value MatchState#RECENT_WINDOW}
 * selections are skipped unless that would leave nothing to choose from.
 */
public class PhotoMatchStrategy implements MatchStrategy {
    private final int similarityThreshold;
    private final boolean avoidRepetition;
    private final int maxImageReuse;
    private final double repetitionPenalty;
    private final int overlayAlpha;

    public PhotoMatchStrategy(int similarityThreshold, boolean avoidRepetition, int maxImageReuse,
                              double repetitionPenalty, int overlayAlpha) {
        this.similarityThreshold = similarityThreshold;
        this.avoidRepetition = avoidRepetition;
        this.maxImageReuse = maxImageReuse;
        this.repetitionPenalty = repetitionPenalty;
        this.overlayAlpha = overlayAlpha;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.PHOTO;
    }

    /** 100 for identical colors, 0 at the largest possible RGB distance. */
    public static double similarity(double distance) {
        return (1.0 - distance / ColorMetrics.MAX_DISTANCE) * 100.0;
    }

    @Override
    public MatchResult select(ColorMetrics target, SeedCatalog catalog, MatchState state) {
        if (catalog.isEmpty()) {
            throw new IllegalStateException("Seed catalog is empty");
        }
        // selection and bookkeeping must not interleave with another tile's
        synchronized (state) {
            List<SeedImageRecord> candidates = avoidRepetition ? available(catalog, state) : catalog.records();

            List<SeedImageRecord> similar = new ArrayList<>();
            for (SeedImageRecord seed : candidates) {
                if (similarity(target.distanceTo(seed.averageColor())) >= similarityThreshold) {
                    similar.add(seed);
                }
            }
            boolean withinThreshold = !similar.isEmpty();
            if (withinThreshold) candidates = similar;

            SeedImageRecord best = null;
            double bestScore = Double.MAX_VALUE;
            double bestDistance = 0;
            for (SeedImageRecord seed : candidates) {
                double d = target.distanceTo(seed.averageColor());
                double s = avoidRepetition ? d + state.usageOf(seed) * repetitionPenalty : d;
                if (s < bestScore) {
                    bestScore = s;
                    bestDistance = d;
                    best = seed;
                }
            }
            state.recordUse(best);
            return new MatchResult(best, bestDistance, target.withAlpha(overlayAlpha), withinThreshold);
        }
    }

    private List<SeedImageRecord> available(SeedCatalog catalog, MatchState state) {
        List<SeedImageRecord> result = new ArrayList<>();
        for (SeedImageRecord seed : catalog.records()) {
            if (maxImageReuse > 0 && state.usageOf(seed) >= maxImageReuse) continue;
            if (state.isRecent(seed)) continue;
            result.add(seed);
        }
        return result.isEmpty() ? catalog.records() : result;
    }
}
