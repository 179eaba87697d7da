package com.project.image.mosaic.DTOs;

/**
 * An RGBA color with the derived values the matchers score on.
 * Channels are 0-255; hue is in degrees, saturation and brightness in [0,1].
 */
public record ColorMetrics(int red, int green, int blue, int alpha) {

    /** sqrt(3 * 255^2), the largest possible RGB distance. */
    public static final double MAX_DISTANCE = 441.67;

    /** Returned for empty or unreadable regions. */
    public static final ColorMetrics NEUTRAL = new ColorMetrics(0, 0, 0, 0);

    public ColorMetrics {
        if (outOfRange(red) || outOfRange(green) || outOfRange(blue) || outOfRange(alpha)) {
            throw new IllegalArgumentException(
                    "Color channels must be within 0-255: " + red + "," + green + "," + blue + "," + alpha);
        }
    }

    public static ColorMetrics rgb(int red, int green, int blue) {
        return new ColorMetrics(red, green, blue, 255);
    }

    public static ColorMetrics fromArgb(int argb) {
        return new ColorMetrics((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
    }

    public int toArgb() {
        return (alpha << 24) | (red << 16) | (green << 8) | blue;
    }

    public ColorMetrics withAlpha(int newAlpha) {
        return new ColorMetrics(red, green, blue, newAlpha);
    }

    public double hue() {
        int max = Math.max(red, Math.max(green, blue));
        int min = Math.min(red, Math.min(green, blue));
        if (max == min) return 0; // gray

        double delta = max - min;
        double hue;
        if (max == red) {
            hue = ((green - blue) / delta) % 6;
        } else if (max == green) {
            hue = (blue - red) / delta + 2;
        } else {
            hue = (red - green) / delta + 4;
        }
        hue *= 60;
        return hue < 0 ? hue + 360 : hue;
    }

    public double saturation() {
        int max = Math.max(red, Math.max(green, blue));
        int min = Math.min(red, Math.min(green, blue));
        if (max == 0) return 0;
        return 1.0 - (min / (double) max);
    }

    /** Perceived brightness (Rec. 601 luma). */
    public double brightness() {
        return (0.299 * red + 0.587 * green + 0.114 * blue) / 255.0;
    }

    public double distanceTo(ColorMetrics other) {
        int dr = red - other.red, dg = green - other.green, db = blue - other.blue;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    /** Circular hue difference, never more than 180 degrees. */
    public double hueDistanceTo(ColorMetrics other) {
        double diff = Math.abs(hue() - other.hue());
        return Math.min(diff, 360 - diff);
    }

    public String toHex() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }

    private static boolean outOfRange(int channel) {
        return channel < 0 || channel > 255;
    }
}
