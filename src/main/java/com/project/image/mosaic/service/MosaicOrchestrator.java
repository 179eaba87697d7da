package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.MosaicProgress;
import com.project.image.mosaic.DTOs.MosaicRequest;
import com.project.image.mosaic.DTOs.MosaicRunResult;
import com.project.image.mosaic.DTOs.MosaicStatistics;
import com.project.image.mosaic.DTOs.MosaicStatus;
import com.project.image.mosaic.DTOs.MosaicTile;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.TileCoordinate;
import com.project.image.mosaic.DTOs.TileGrid;
import com.project.image.mosaic.DTOs.TileRectangle;
import com.project.image.mosaic.exceptions.MosaicException;
import com.project.image.mosaic.exceptions.MosaicRenderException;
import com.project.image.mosaic.exceptions.MosaicValidationException;
import com.project.image.mosaic.exceptions.NoUsableSeedImagesException;
import com.project.image.mosaic.service.match.MatchState;
import com.project.image.mosaic.service.match.MatchStrategies;
import com.project.image.mosaic.service.match.MatchStrategy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one mosaic from request to image: validate, load the master and the seed
 * catalog, sample every tile, then match and composite every tile, and finally save.
 * Tile work runs on a fixed pool created per run and shut down when the run ends.
 */
@Service
public class MosaicOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(MosaicOrchestrator.class);

    public static final int DEFAULT_UPDATES_PER_PHASE = 100;

    private final ImageCodecService codec;
    private final SeedCatalogService seedCatalogService;
    private final PixelSampler sampler;
    private final Compositor compositor;
    private final Validator validator;
    private final int maxWorkers;
    private final int updatesPerPhase;

    @Autowired
    public MosaicOrchestrator(ImageCodecService codec,
                              SeedCatalogService seedCatalogService,
                              PixelSampler sampler,
                              Compositor compositor,
                              Validator validator,
                              @Value("${app.mosaic.max-workers:0}") int maxWorkers,
                              @Value("${app.mosaic.progress.updates-per-phase:100}") int updatesPerPhase) {
        this.codec = codec;
        this.seedCatalogService = seedCatalogService;
        this.sampler = sampler;
        this.compositor = compositor;
        this.validator = validator;
        this.maxWorkers = maxWorkers > 0 ? maxWorkers : Runtime.getRuntime().availableProcessors();
        this.updatesPerPhase = Math.max(1, updatesPerPhase);
    }

    public MosaicOrchestrator(ImageCodecService codec,
                              SeedCatalogService seedCatalogService,
                              PixelSampler sampler,
                              Compositor compositor,
                              int maxWorkers,
                              int updatesPerPhase) {
        this(codec, seedCatalogService, sampler, compositor, defaultValidator(), maxWorkers, updatesPerPhase);
    }

    public MosaicRunResult run(MosaicRequest request) {
        return run(request, ProgressSink.NONE, CancellationSignal.none());
    }

    /**
     * Never throws for validation, resource, decode or render failures, nor for
     * cancellation; those end up in the returned result's status and error.
     */
    public MosaicRunResult run(MosaicRequest request, ProgressSink sink, CancellationSignal signal) {
        final long started = System.nanoTime();
        final RunCounters counters = new RunCounters();
        final ProgressSink progress = sink == null ? ProgressSink.NONE : sink;
        final CancellationSignal cancellation = signal == null ? CancellationSignal.none() : signal;
        MatchState state = null;

        report(progress, MosaicStatus.PENDING, "Queued");
        try {
            report(progress, MosaicStatus.INITIALIZING, "Validating request");
            validate(request);
            state = new MatchState(request.randomSeed());
            MatchStrategy strategy = MatchStrategies.forRequest(request);

            Path masterPath = Paths.get(request.masterImagePath());
            BufferedImage master = codec.loadImage(masterPath);
            log.info("Master image {} loaded ({}x{})", masterPath, master.getWidth(), master.getHeight());

            Path outputPath = request.outputPath() == null ? null : Paths.get(request.outputPath());
            if (outputPath != null) {
                codec.ensureDiskSpace(outputPath, codec.estimateRequiredBytes(master.getWidth(), master.getHeight()));
            }
            TileGrid grid = TileGrid.of(master.getWidth(), master.getHeight(), request.tileWidth(), request.tileHeight());
            counters.grid = grid;
            cancellation.throwIfCancellationRequested();

            SeedCatalog catalog = loadCatalog(request, strategy, progress, cancellation);
            counters.seedsLoaded = catalog.size();
            counters.seedsSkipped = catalog.skippedCount();

            ColorMetrics[] targets = analyze(master, grid, progress, cancellation, counters);
            cancellation.throwIfCancellationRequested();

            BufferedImage canvas = compositor.createCanvas(grid.imageWidth(), grid.imageHeight());
            MosaicTile[] tiles = composite(canvas, grid, targets, strategy, catalog, state, progress, cancellation, counters);
            cancellation.throwIfCancellationRequested();

            Path saved = null;
            if (outputPath != null) {
                report(progress, MosaicStatus.SAVING, "Saving " + outputPath);
                saved = codec.save(canvas, outputPath, request.outputFormat(), request.quality());
            }

            BufferedImage preview = null;
            Path previewPath = null;
            if (request.createThumbnail()) {
                preview = codec.createPreview(canvas, request.thumbnailMaxWidth(), request.thumbnailMaxHeight());
                if (saved != null) {
                    previewPath = savePreview(preview, saved, request);
                }
            }

            List<MosaicTile> tileList = Arrays.asList(tiles);
            MosaicStatistics statistics = counters.toStatistics(tileList, elapsed(started));
            log.info("Mosaic completed: {} tiles, {} unique seed(s), {} out of tolerance, {} ms",
                    statistics.totalTiles(), statistics.uniqueSeedsUsed(), statistics.outOfToleranceTiles(),
                    statistics.elapsed().toMillis());
            report(progress, MosaicStatus.COMPLETED, "Completed");
            return MosaicRunResult.completed(canvas, saved, preview, previewPath, tileList, statistics);

        } catch (CancellationException e) {
            log.info("Mosaic run cancelled after {} tile(s) started", counters.tilesStarted.get());
            report(progress, MosaicStatus.CANCELLED, "Cancelled");
            return MosaicRunResult.cancelled(counters.toStatistics(List.of(), elapsed(started)));

        } catch (MosaicValidationException e) {
            log.warn("Mosaic request rejected: {}", e.getErrors());
            return fail(progress, e, counters, started);

        } catch (MosaicException e) {
            log.error("Mosaic run failed: {}", e.getMessage(), e);
            return fail(progress, e, counters, started);

        } catch (RuntimeException | OutOfMemoryError e) {
            MosaicRenderException wrapped = new MosaicRenderException("Unexpected failure during mosaic run", e);
            log.error("Mosaic run failed: {}", wrapped.getMessage(), e);
            return fail(progress, wrapped, counters, started);
        }
    }

    /**
     * Bean constraints plus the checks that need the file system.
     *
     * @throws MosaicValidationException listing every problem found
     */
    public void validate(MosaicRequest request) {
        if (request == null) {
            throw new MosaicValidationException("Mosaic request is required");
        }
        List<String> errors = new ArrayList<>();
        for (ConstraintViolation<MosaicRequest> violation : validator.validate(request)) {
            errors.add(violation.getMessage());
        }
        errors.sort(null);

        String master = request.masterImagePath();
        if (master != null && !master.isBlank() && !Files.isRegularFile(Paths.get(master))) {
            errors.add("Master image does not exist: " + master);
        }
        if (request.usesSeedImages()) {
            String seeds = request.seedDirectory();
            if (seeds == null || seeds.isBlank()) {
                errors.add("Seed directory is required");
            } else if (!Files.isDirectory(Paths.get(seeds))) {
                errors.add("Seed directory does not exist: " + seeds);
            }
        }
        if (!errors.isEmpty()) {
            throw new MosaicValidationException(errors);
        }
    }

    private SeedCatalog loadCatalog(MosaicRequest request, MatchStrategy strategy,
                                    ProgressSink progress, CancellationSignal cancellation) {
        if (!strategy.requiresCatalog()) {
            log.debug("Flat color fill, no seed images loaded");
            return SeedCatalog.empty(null);
        }
        Path directory = Paths.get(request.seedDirectory());
        report(progress, MosaicStatus.LOADING_SEEDS, "Loading seed images from " + directory);
        SeedCatalog catalog = seedCatalogService.load(directory, seedCatalogService.defaultOptions(), cancellation);
        if (catalog.isEmpty()) {
            throw new NoUsableSeedImagesException(directory.toString(), catalog.skippedCount());
        }
        return catalog;
    }

    private ColorMetrics[] analyze(BufferedImage master, TileGrid grid, ProgressSink sink,
                                   CancellationSignal cancellation, RunCounters counters) {
        List<TileCoordinate> coordinates = grid.coordinates();
        ColorMetrics[] targets = new ColorMetrics[coordinates.size()];
        PhaseProgress progress = new PhaseProgress(sink, MosaicStatus.ANALYZING_MASTER, coordinates.size(), updatesPerPhase);
        report(sink, MosaicStatus.ANALYZING_MASTER, "Sampling " + coordinates.size() + " tiles");

        List<Callable<Void>> tasks = new ArrayList<>(coordinates.size());
        for (int i = 0; i < coordinates.size(); i++) {
            final int index = i;
            tasks.add(() -> {
                if (cancellation.isCancellationRequested()) return null;
                TileCoordinate coordinate = coordinates.get(index);
                try {
                    targets[index] = sampler.averageColor(master, grid.rectangleAt(coordinate));
                } catch (RuntimeException e) {
                    log.warn("Sampling tile {} failed, using neutral color: {}", coordinate, e.toString());
                    targets[index] = ColorMetrics.NEUTRAL;
                    counters.sampleFailures.incrementAndGet();
                }
                counters.tilesAnalyzed.incrementAndGet();
                progress.step();
                return null;
            });
        }
        execute(tasks);
        progress.finish();
        log.debug("Sampled {} of {} tiles", counters.tilesAnalyzed.get(), coordinates.size());
        return targets;
    }

    private MosaicTile[] composite(BufferedImage canvas, TileGrid grid, ColorMetrics[] targets,
                                   MatchStrategy strategy, SeedCatalog catalog, MatchState state,
                                   ProgressSink sink, CancellationSignal cancellation, RunCounters counters) {
        List<TileCoordinate> coordinates = grid.coordinates();
        MosaicTile[] tiles = new MosaicTile[coordinates.size()];
        PhaseProgress progress = new PhaseProgress(sink, MosaicStatus.MATCHING_AND_COMPOSITING, coordinates.size(), updatesPerPhase);
        report(sink, MosaicStatus.MATCHING_AND_COMPOSITING, "Matching " + coordinates.size() + " tiles with " + strategy.type());

        List<Callable<Void>> tasks = new ArrayList<>(coordinates.size());
        for (int i = 0; i < coordinates.size(); i++) {
            final int index = i;
            tasks.add(() -> {
                if (cancellation.isCancellationRequested()) return null;
                counters.tilesStarted.incrementAndGet();
                TileCoordinate coordinate = coordinates.get(index);
                TileRectangle rectangle = grid.rectangleAt(coordinate);
                String seedPath = null;
                try {
                    MatchResult match = strategy.select(targets[index], catalog, state);
                    seedPath = match.seed() == null ? null : match.seed().key();
                    MosaicTile tile = new MosaicTile(coordinate, rectangle, targets[index],
                            match.seed(), match.overlayColor(), match.distance());
                    compositor.render(canvas, tile);
                    tiles[index] = tile;
                    if (!match.withinTolerance()) counters.outOfTolerance.incrementAndGet();
                } catch (RuntimeException | OutOfMemoryError e) {
                    throw new MosaicRenderException("Failed to render tile", seedPath, coordinate, e);
                }
                counters.tilesRendered.incrementAndGet();
                progress.step();
                return null;
            });
        }
        execute(tasks);
        progress.finish();
        return tiles;
    }

    /** Runs the tasks on a fresh pool and rethrows the first failure. */
    private void execute(List<Callable<Void>> tasks) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxWorkers, Math.max(1, tasks.size())));
        try {
            List<Future<Void>> futures = new ArrayList<>(tasks.size());
            for (Callable<Void> task : tasks) {
                futures.add(pool.submit(task));
            }
            for (Future<Void> future : futures) {
                try {
                    future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while waiting for tiles");
                } catch (ExecutionException e) {
                    futures.forEach(f -> f.cancel(false));
                    Throwable cause = e.getCause();
                    if (cause instanceof MosaicException) throw (MosaicException) cause;
                    if (cause instanceof CancellationException) throw (CancellationException) cause;
                    throw new MosaicRenderException("Tile worker failed", cause);
                }
            }
        } finally {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /** A preview that cannot be written does not fail the run; the mosaic itself is already saved. */
    private Path savePreview(BufferedImage preview, Path saved, MosaicRequest request) {
        Path target = ImageCodecService.previewPathFor(saved, request.outputFormat());
        try {
            return codec.save(preview, target, request.outputFormat(), request.quality());
        } catch (MosaicException e) {
            log.warn("Preview could not be saved to {}: {}", target, e.getMessage(), e);
            return null;
        }
    }

    private MosaicRunResult fail(ProgressSink progress, MosaicException error, RunCounters counters, long started) {
        report(progress, MosaicStatus.FAILED, error.getMessage());
        return MosaicRunResult.failed(error, counters.toStatistics(List.of(), elapsed(started)));
    }

    private static void report(ProgressSink sink, MosaicStatus status, String message) {
        try {
            sink.report(MosaicProgress.status(status, message));
        } catch (RuntimeException e) {
            log.warn("Progress sink failed on {}", status, e);
        }
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static Validator defaultValidator() {
        return DefaultValidation.FACTORY.getValidator();
    }

    /** One factory for every orchestrator built outside Spring, created on first use. */
    private static final class DefaultValidation {
        static final ValidatorFactory FACTORY = Validation.buildDefaultValidatorFactory();
    }

    private static final class RunCounters {
        volatile TileGrid grid;
        volatile int seedsLoaded;
        volatile int seedsSkipped;
        final AtomicInteger tilesAnalyzed = new AtomicInteger();
        final AtomicInteger tilesStarted = new AtomicInteger();
        final AtomicInteger tilesRendered = new AtomicInteger();
        final AtomicInteger sampleFailures = new AtomicInteger();
        final AtomicInteger outOfTolerance = new AtomicInteger();

        /** Seed usage is counted from the rendered tiles, so workers never contend on it. */
        MosaicStatistics toStatistics(List<MosaicTile> tiles, Duration elapsed) {
            Map<String, Integer> usage = new TreeMap<>();
            for (MosaicTile tile : tiles) {
                if (tile == null || tile.selectedSeed() == null) continue;
                usage.merge(tile.selectedSeed().key(), 1, Integer::sum);
            }
            String mostUsed = null;
            int mostUsedCount = 0;
            for (Map.Entry<String, Integer> e : usage.entrySet()) {
                if (e.getValue() > mostUsedCount) {
                    mostUsed = e.getKey();
                    mostUsedCount = e.getValue();
                }
            }
            double distanceSum = 0;
            int matched = 0;
            for (MosaicTile tile : tiles) {
                if (tile == null || tile.isFlatFill()) continue;
                distanceSum += tile.colorDistance();
                matched++;
            }
            return new MosaicStatistics(
                    grid == null ? 0 : grid.columns(),
                    grid == null ? 0 : grid.rows(),
                    grid == null ? 0 : grid.tileCount(),
                    tilesAnalyzed.get(), tilesStarted.get(), tilesRendered.get(),
                    sampleFailures.get(), outOfTolerance.get(),
                    seedsLoaded, seedsSkipped, usage.size(),
                    mostUsed, mostUsedCount,
                    matched == 0 ? 0.0 : distanceSum / matched,
                    usage, elapsed);
        }
    }
}
