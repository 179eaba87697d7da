package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.ColorMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ColorMetricsTest {

    @Test
    void distanceTo_blackToWhite_isMaximum() {
        double d = ColorMetrics.rgb(0, 0, 0).distanceTo(ColorMetrics.rgb(255, 255, 255));
        assertThat(d).isCloseTo(ColorMetrics.MAX_DISTANCE, within(0.01));
    }

    @Test
    void distanceTo_isSymmetricAndZeroForSameColor() {
        ColorMetrics a = ColorMetrics.rgb(10, 200, 30);
        ColorMetrics b = ColorMetrics.rgb(90, 20, 250);

        assertThat(a.distanceTo(b)).isEqualTo(b.distanceTo(a));
        assertThat(a.distanceTo(a)).isZero();
    }

    @Test
    void hue_primaryColors() {
        assertThat(ColorMetrics.rgb(255, 0, 0).hue()).isEqualTo(0.0);
        assertThat(ColorMetrics.rgb(0, 255, 0).hue()).isEqualTo(120.0);
        assertThat(ColorMetrics.rgb(0, 0, 255).hue()).isEqualTo(240.0);
        assertThat(ColorMetrics.rgb(128, 128, 128).hue()).isEqualTo(0.0);
    }

    @Test
    void hueDistanceTo_wrapsAroundTheCircle() {
        ColorMetrics nearRedLow = ColorMetrics.rgb(255, 0, 17);   // ~356
        ColorMetrics nearRedHigh = ColorMetrics.rgb(255, 17, 0);  // ~4

        assertThat(nearRedLow.hueDistanceTo(nearRedHigh)).isLessThan(10.0);
        assertThat(ColorMetrics.rgb(255, 0, 0).hueDistanceTo(ColorMetrics.rgb(0, 255, 255))).isEqualTo(180.0);
    }

    @Test
    void hueDistanceTo_isSymmetricAcrossZero() {
        ColorMetrics ten = ColorMetrics.rgb(255, 43, 0);      // ~10
        ColorMetrics threeFifty = ColorMetrics.rgb(255, 0, 43); // ~350

        assertThat(ten.hueDistanceTo(threeFifty)).isCloseTo(2 * ten.hue(), within(1e-9));
        assertThat(ten.hueDistanceTo(threeFifty)).isEqualTo(threeFifty.hueDistanceTo(ten));
        assertThat(ten.hueDistanceTo(threeFifty)).isLessThan(21.0);
    }

    @Test
    void saturationAndBrightness_inUnitRange() {
        assertThat(ColorMetrics.rgb(255, 0, 0).saturation()).isEqualTo(1.0);
        assertThat(ColorMetrics.rgb(0, 0, 0).saturation()).isZero();
        assertThat(ColorMetrics.rgb(255, 255, 255).brightness()).isCloseTo(1.0, within(1e-9));
        assertThat(ColorMetrics.rgb(0, 0, 0).brightness()).isZero();
    }

    @Test
    void argb_roundTripKeepsAlpha() {
        ColorMetrics c = new ColorMetrics(1, 2, 3, 210);
        assertThat(ColorMetrics.fromArgb(c.toArgb())).isEqualTo(c);
        assertThat(c.toHex()).isEqualTo("#010203");
    }

    @Test
    void constructor_rejectsOutOfRangeChannel() {
        assertThatThrownBy(() -> ColorMetrics.rgb(256, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
