package com.project.image.mosaic.DTOs;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Immutable parameters of one mosaic run. Strategy-specific fields are ignored by
 * the strategies they don't apply to. {@code outputPath} may be null, in which case
 * the mosaic is only returned in memory. With {@code createThumbnail} a reduced copy
 * is returned as well, and saved next to the output when there is one.
 */
public record MosaicRequest(
        @NotBlank(message = "Master image path is required")
        String masterImagePath,
        String seedDirectory,
        String outputPath,
        @NotNull(message = "Match strategy is required")
        MatchStrategyType strategy,
        @Min(value = 1, message = "Tile width must be between 1 and 1000")
        @Max(value = 1000, message = "Tile width must be between 1 and 1000")
        int tileWidth,
        @Min(value = 1, message = "Tile height must be between 1 and 1000")
        @Max(value = 1000, message = "Tile height must be between 1 and 1000")
        int tileHeight,
        @DecimalMin(value = "0.0", message = "Color tolerance cannot be negative")
        @DecimalMax(value = "441.67", message = "Color tolerance cannot exceed 441.67")
        double colorTolerance,
        boolean flatColorFill,
        @DecimalMin(value = "0.0", message = "Hue tolerance must be between 0 and 360")
        @DecimalMax(value = "360.0", message = "Hue tolerance must be between 0 and 360")
        double hueTolerance,
        @Min(value = 0, message = "Saturation weight must be between 0 and 100")
        @Max(value = 100, message = "Saturation weight must be between 0 and 100")
        int saturationWeight,
        @Min(value = 0, message = "Brightness weight must be between 0 and 100")
        @Max(value = 100, message = "Brightness weight must be between 0 and 100")
        int brightnessWeight,
        @Min(value = 0, message = "Similarity threshold must be between 0 and 100")
        @Max(value = 100, message = "Similarity threshold must be between 0 and 100")
        int similarityThreshold,
        boolean avoidRepetition,
        @Min(value = 0, message = "Max image reuse cannot be negative")
        int maxImageReuse,
        @DecimalMin(value = "0.0", message = "Repetition penalty cannot be negative")
        double repetitionPenalty,
        @Min(value = 0, message = "Overlay opacity must be between 0 and 100")
        @Max(value = 100, message = "Overlay opacity must be between 0 and 100")
        int overlayOpacity,
        Long randomSeed,
        @NotNull(message = "Output format is required")
        ImageFormat outputFormat,
        @Min(value = 1, message = "Quality must be between 1 and 100")
        @Max(value = 100, message = "Quality must be between 1 and 100")
        int quality,
        boolean createThumbnail,
        @Min(value = 1, message = "Thumbnail width must be between 1 and 10000")
        @Max(value = 10000, message = "Thumbnail width must be between 1 and 10000")
        int thumbnailMaxWidth,
        @Min(value = 1, message = "Thumbnail height must be between 1 and 10000")
        @Max(value = 10000, message = "Thumbnail height must be between 1 and 10000")
        int thumbnailMaxHeight
) {

    public static final int DEFAULT_TILE_SIZE = 40;
    /** Alpha 210 of the legacy color wash. */
    public static final int DEFAULT_OVERLAY_OPACITY = 82;
    public static final int DEFAULT_THUMBNAIL_MAX_WIDTH = 800;
    public static final int DEFAULT_THUMBNAIL_MAX_HEIGHT = 600;

    public static Builder builder(MatchStrategyType strategy) {
        return new Builder(strategy);
    }

    public Builder toBuilder() {
        return new Builder(strategy)
                .masterImagePath(masterImagePath)
                .seedDirectory(seedDirectory)
                .outputPath(outputPath)
                .tileSize(tileWidth, tileHeight)
                .colorTolerance(colorTolerance)
                .flatColorFill(flatColorFill)
                .hueTolerance(hueTolerance)
                .saturationWeight(saturationWeight)
                .brightnessWeight(brightnessWeight)
                .similarityThreshold(similarityThreshold)
                .avoidRepetition(avoidRepetition)
                .maxImageReuse(maxImageReuse)
                .repetitionPenalty(repetitionPenalty)
                .overlayOpacity(overlayOpacity)
                .randomSeed(randomSeed)
                .outputFormat(outputFormat)
                .quality(quality)
                .createThumbnail(createThumbnail)
                .thumbnailMaxSize(thumbnailMaxWidth, thumbnailMaxHeight);
    }

    /** True when the run needs a seed catalog at all. */
    public boolean usesSeedImages() {
        return !(strategy == MatchStrategyType.COLOR && flatColorFill);
    }

    public int overlayAlpha() {
        return Math.round(overlayOpacity * 255 / 100f);
    }

    public static final class Builder {
        private final MatchStrategyType strategy;
        private String masterImagePath;
        private String seedDirectory;
        private String outputPath;
        private int tileWidth = DEFAULT_TILE_SIZE;
        private int tileHeight = DEFAULT_TILE_SIZE;
        private double colorTolerance = 30.0;
        private boolean flatColorFill;
        private double hueTolerance = 15.0;
        private int saturationWeight = 50;
        private int brightnessWeight = 30;
        private int similarityThreshold = 75;
        private boolean avoidRepetition = true;
        private int maxImageReuse = 3;
        private double repetitionPenalty = 10.0;
        private int overlayOpacity = DEFAULT_OVERLAY_OPACITY;
        private Long randomSeed;
        private ImageFormat outputFormat = ImageFormat.JPEG;
        private int quality = 85;
        private boolean createThumbnail = true;
        private int thumbnailMaxWidth = DEFAULT_THUMBNAIL_MAX_WIDTH;
        private int thumbnailMaxHeight = DEFAULT_THUMBNAIL_MAX_HEIGHT;

        private Builder(MatchStrategyType strategy) {
            this.strategy = strategy;
        }

        public Builder masterImagePath(String v) { this.masterImagePath = v; return this; }
        public Builder seedDirectory(String v) { this.seedDirectory = v; return this; }
        public Builder outputPath(String v) { this.outputPath = v; return this; }
        public Builder tileSize(int width, int height) { this.tileWidth = width; this.tileHeight = height; return this; }
        public Builder colorTolerance(double v) { this.colorTolerance = v; return this; }
        public Builder flatColorFill(boolean v) { this.flatColorFill = v; return this; }
        public Builder hueTolerance(double v) { this.hueTolerance = v; return this; }
        public Builder saturationWeight(int v) { this.saturationWeight = v; return this; }
        public Builder brightnessWeight(int v) { this.brightnessWeight = v; return this; }
        public Builder similarityThreshold(int v) { this.similarityThreshold = v; return this; }
        public Builder avoidRepetition(boolean v) { this.avoidRepetition = v; return this; }
        public Builder maxImageReuse(int v) { this.maxImageReuse = v; return this; }
        public Builder repetitionPenalty(double v) { this.repetitionPenalty = v; return this; }
        public Builder overlayOpacity(int v) { this.overlayOpacity = v; return this; }
        public Builder randomSeed(Long v) { this.randomSeed = v; return this; }
        public Builder outputFormat(ImageFormat v) { this.outputFormat = v; return this; }
        public Builder quality(int v) { this.quality = v; return this; }
        public Builder createThumbnail(boolean v) { this.createThumbnail = v; return this; }
        public Builder thumbnailMaxSize(int width, int height) { this.thumbnailMaxWidth = width; this.thumbnailMaxHeight = height; return this; }

        public MosaicRequest build() {
            return new MosaicRequest(masterImagePath, seedDirectory, outputPath, strategy,
                    tileWidth, tileHeight, colorTolerance, flatColorFill,
                    hueTolerance, saturationWeight, brightnessWeight,
                    similarityThreshold, avoidRepetition, maxImageReuse, repetitionPenalty,
                    overlayOpacity, randomSeed, outputFormat, quality,
                    createThumbnail, thumbnailMaxWidth, thumbnailMaxHeight);
        }
    }
}
