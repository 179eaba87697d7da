package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.service.match.ColorMatchStrategy;
import com.project.image.mosaic.service.match.MatchState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ColorMatchStrategyTest {
    private final SeedCatalog catalog = Seeds.catalog(
            ColorMetrics.rgb(255, 0, 0), ColorMetrics.rgb(0, 255, 0), ColorMetrics.rgb(0, 0, 255));

    @Test
    void select_picksNearestWithinTolerance() {
        ColorMatchStrategy strategy = new ColorMatchStrategy(60, false, 210);

        MatchResult result = strategy.select(ColorMetrics.rgb(10, 240, 20), catalog, new MatchState(1L));

        assertThat(result.seed()).isSameAs(catalog.get(1));
        assertThat(result.withinTolerance()).isTrue();
        assertThat(result.overlayColor()).isEqualTo(new ColorMetrics(10, 240, 20, 210));
    }

    @Test
    void select_exactColorInCatalog_distanceZero() {
        MatchResult result = new ColorMatchStrategy(0, false, 210)
                .select(ColorMetrics.rgb(0, 0, 255), catalog, new MatchState(1L));

        assertThat(result.seed()).isSameAs(catalog.get(2));
        assertThat(result.distance()).isZero();
        assertThat(result.withinTolerance()).isTrue();
    }

    @Test
    void select_nothingWithinTolerance_fallsBackToNearest() {
        ColorMatchStrategy strategy = new ColorMatchStrategy(5, false, 210);

        MatchResult result = strategy.select(ColorMetrics.rgb(200, 60, 60), catalog, new MatchState(1L));

        assertThat(result.seed()).isSameAs(catalog.get(0));
        assertThat(result.withinTolerance()).isFalse();
        assertThat(result.distance()).isGreaterThan(5);
    }

    @Test
    void select_equalDistance_firstRecordWins() {
        SeedCatalog twins = Seeds.catalog(ColorMetrics.rgb(100, 100, 100), ColorMetrics.rgb(100, 100, 100));

        MatchResult result = new ColorMatchStrategy(30, false, 0)
                .select(ColorMetrics.rgb(100, 100, 100), twins, new MatchState(1L));

        assertThat(result.seed()).isSameAs(twins.get(0));
    }

    @Test
    void select_flatFill_drawsNoSeed() {
        ColorMatchStrategy strategy = new ColorMatchStrategy(30, true, 210);

        MatchResult result = strategy.select(ColorMetrics.rgb(1, 2, 3), SeedCatalog.empty(null), new MatchState(1L));

        assertThat(strategy.requiresCatalog()).isFalse();
        assertThat(result.seed()).isNull();
    }
}
