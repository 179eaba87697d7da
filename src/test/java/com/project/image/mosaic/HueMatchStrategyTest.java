package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.SeedImageRecord;
import com.project.image.mosaic.service.match.HueMatchStrategy;
import com.project.image.mosaic.service.match.MatchState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HueMatchStrategyTest {
    private static final ColorMetrics RED = ColorMetrics.rgb(255, 0, 0);

    private final SeedCatalog catalog = Seeds.catalog(
            ColorMetrics.rgb(255, 128, 0),  // hue ~30
            ColorMetrics.rgb(255, 0, 40),   // hue ~351
            ColorMetrics.rgb(0, 0, 255));   // hue 240

    @Test
    void select_distanceIsHueDistanceOfDisplayedImage() {
        HueMatchStrategy strategy = new HueMatchStrategy(15, 50, 30, 210);
        MatchState state = new MatchState(3L);

        for (int i = 0; i < 20; i++) {
            MatchResult result = strategy.select(RED, catalog, state);

            assertThat(result.withinTolerance()).isTrue();
            assertThat(result.distance()).isCloseTo(RED.hueDistanceTo(result.seed().averageColor()), within(1e-9));
        }
    }

    @Test
    void select_displayedImageFarFromTarget_reportsItsOwnHueDistance() {
        SeedCatalog blueOnly = Seeds.catalog(ColorMetrics.rgb(0, 0, 255));

        MatchResult result = new HueMatchStrategy(15, 0, 0, 210).select(RED, blueOnly, new MatchState(3L));

        assertThat(result.withinTolerance()).isFalse();
        assertThat(result.distance()).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void select_toleranceExcludesEverything_notWithinTolerance() {
        HueMatchStrategy strategy = new HueMatchStrategy(1, 0, 0, 210);

        MatchResult result = strategy.select(RED, catalog, new MatchState(3L));

        assertThat(result.withinTolerance()).isFalse();
        assertThat(result.distance()).isCloseTo(RED.hueDistanceTo(result.seed().averageColor()), within(1e-9));
    }

    @Test
    void bestWithinTolerance_lowestScoreInsideHueTolerance() {
        HueMatchStrategy strategy = new HueMatchStrategy(15, 0, 0, 210);

        assertThat(strategy.bestWithinTolerance(RED, catalog)).isSameAs(catalog.get(1));
        assertThat(new HueMatchStrategy(1, 0, 0, 210).bestWithinTolerance(RED, catalog)).isNull();
    }

    @Test
    void score_weightsAddSaturationAndBrightnessDifferences() {
        HueMatchStrategy noWeights = new HueMatchStrategy(360, 0, 0, 0);
        HueMatchStrategy fullWeights = new HueMatchStrategy(360, 100, 100, 0);
        SeedImageRecord gray = Seeds.record("gray.png", ColorMetrics.rgb(128, 128, 128));

        double expectedExtra = Math.abs(RED.saturation() - gray.averageColor().saturation())
                + Math.abs(RED.brightness() - gray.averageColor().brightness());

        assertThat(fullWeights.score(RED, gray) - noWeights.score(RED, gray)).isCloseTo(expectedExtra, within(1e-9));
    }

    @Test
    void select_overlayIsTargetColorWithConfiguredAlpha() {
        MatchResult result = new HueMatchStrategy(15, 50, 30, 210).select(RED, catalog, new MatchState(3L));

        assertThat(result.overlayColor()).isEqualTo(new ColorMetrics(255, 0, 0, 210));
        assertThat(result.seed()).isIn(catalog.records());
    }

    @Test
    void select_sameRandomSeed_sameDisplayedImages() {
        HueMatchStrategy strategy = new HueMatchStrategy(15, 50, 30, 210);

        List<SeedImageRecord> first = displayed(strategy, new MatchState(42L), 30);
        List<SeedImageRecord> second = displayed(strategy, new MatchState(42L), 30);

        assertThat(first).isEqualTo(second);
        assertThat(new HashSet<>(first)).hasSizeGreaterThan(1);
    }

    private List<SeedImageRecord> displayed(HueMatchStrategy strategy, MatchState state, int tiles) {
        List<SeedImageRecord> out = new ArrayList<>();
        for (int i = 0; i < tiles; i++) {
            out.add(strategy.select(RED, catalog, state).seed());
        }
        return out;
    }
}
