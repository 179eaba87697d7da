package com.project.image.mosaic.runner;

import com.project.image.mosaic.DTOs.ImageFormat;
import com.project.image.mosaic.DTOs.MatchStrategyType;
import com.project.image.mosaic.DTOs.MosaicRequest;
import com.project.image.mosaic.DTOs.MosaicRunResult;
import com.project.image.mosaic.DTOs.MosaicStatus;
import com.project.image.mosaic.service.CancellationSignal;
import com.project.image.mosaic.service.MosaicOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Runs one mosaic when the application is started with
 * {@code --master=<image> --seeds=<dir> --output=<file>}. Without {@code --master} it does nothing.
 */
@Component
public class MosaicCommandLineRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MosaicCommandLineRunner.class);

    private final MosaicOrchestrator orchestrator;
    private volatile MosaicRunResult lastResult;

    public MosaicCommandLineRunner(MosaicOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("master")) {
            log.debug("No --master argument, nothing to do");
            return;
        }
        MosaicRequest request;
        try {
            request = toRequest(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return;
        }

        lastResult = orchestrator.run(request, progress -> {
            if (progress.maximum() > 0) {
                log.info("{} {}/{} ({}%)", progress.status(), progress.current(), progress.maximum(),
                        Math.round(progress.percent()));
            } else {
                log.info("{}: {}", progress.status(), progress.message());
            }
        }, new CancellationSignal());

        if (lastResult.status() == MosaicStatus.COMPLETED) {
            log.info("Mosaic written to {}", lastResult.outputPath());
            if (lastResult.previewPath() != null) {
                log.info("Preview written to {}", lastResult.previewPath());
            }
        } else {
            log.error("Mosaic run ended with {}: {}", lastResult.status(),
                    lastResult.error() == null ? "-" : lastResult.error().getMessage());
        }
    }

    public MosaicRunResult getLastResult() {
        return lastResult;
    }

    public static MosaicRequest toRequest(ApplicationArguments args) {
        MatchStrategyType strategy = MatchStrategyType.PHOTO;
        String s = option(args, "strategy");
        if (s != null) {
            try {
                strategy = MatchStrategyType.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown strategy: " + s);
            }
        }
        MosaicRequest.Builder builder = MosaicRequest.builder(strategy)
                .masterImagePath(option(args, "master"))
                .seedDirectory(option(args, "seeds"))
                .outputPath(option(args, "output"));

        String width = option(args, "tile-width");
        String height = option(args, "tile-height");
        builder.tileSize(width == null ? MosaicRequest.DEFAULT_TILE_SIZE : parseInt("tile-width", width),
                height == null ? MosaicRequest.DEFAULT_TILE_SIZE : parseInt("tile-height", height));

        String quality = option(args, "quality");
        if (quality != null) builder.quality(parseInt("quality", quality));

        String format = option(args, "format");
        if (format != null) {
            builder.outputFormat(ImageFormat.parse(format));
        } else if (option(args, "output") != null) {
            ImageFormat.fromFileName(option(args, "output")).ifPresent(builder::outputFormat);
        }
        if (args.containsOption("flat")) builder.flatColorFill(true);
        if (args.containsOption("no-thumbnail")) builder.createThumbnail(false);

        String thumbWidth = option(args, "thumbnail-width");
        String thumbHeight = option(args, "thumbnail-height");
        builder.thumbnailMaxSize(
                thumbWidth == null ? MosaicRequest.DEFAULT_THUMBNAIL_MAX_WIDTH : parseInt("thumbnail-width", thumbWidth),
                thumbHeight == null ? MosaicRequest.DEFAULT_THUMBNAIL_MAX_HEIGHT : parseInt("thumbnail-height", thumbHeight));

        String seed = option(args, "random-seed");
        if (seed != null) builder.randomSeed(Long.parseLong(seed.trim()));
        return builder.build();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + value);
        }
    }
}
