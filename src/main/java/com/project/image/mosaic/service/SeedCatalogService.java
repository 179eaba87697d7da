package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.SeedCatalog;
import com.project.image.mosaic.DTOs.SeedImageRecord;
import com.project.image.mosaic.DTOs.SeedLoadOptions;
import com.project.image.mosaic.exceptions.ImageDecodeException;
import com.project.image.mosaic.exceptions.MosaicException;
import com.project.image.mosaic.exceptions.MosaicValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link SeedCatalog} from a directory tree. Files are decoded in parallel;
 * only a thumbnail of each survives the load.
 */
@Service
public class SeedCatalogService {
    private static final Logger log = LoggerFactory.getLogger(SeedCatalogService.class);

    private final ImageCodecService codec;
    private final PixelSampler sampler;
    private final SeedLoadOptions defaultOptions;

    @Autowired
    public SeedCatalogService(ImageCodecService codec,
                              PixelSampler sampler,
                              @Value("${app.mosaic.seed.max-workers:0}") int maxWorkers,
                              @Value("${app.mosaic.seed.thumbnail-size:200}") int thumbnailSize) {
        this.codec = codec;
        this.sampler = sampler;
        this.defaultOptions = new SeedLoadOptions(
                maxWorkers > 0 ? maxWorkers : Runtime.getRuntime().availableProcessors(), thumbnailSize);
    }

    public SeedCatalogService(ImageCodecService codec, PixelSampler sampler) {
        this.codec = codec;
        this.sampler = sampler;
        this.defaultOptions = SeedLoadOptions.defaults();
    }

    public SeedLoadOptions defaultOptions() {
        return defaultOptions;
    }

    public SeedCatalog load(Path directory) {
        return load(directory, defaultOptions, CancellationSignal.none());
    }

    /**
     * @throws MosaicValidationException if {@code directory} is not a directory
     * @throws CancellationException     if the signal fires before all files are processed
     */
    public SeedCatalog load(Path directory, SeedLoadOptions options, CancellationSignal signal) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new MosaicValidationException("Seed directory does not exist: " + directory);
        }
        List<Path> files = listCandidates(directory);
        log.info("Loading {} seed image(s) from {} with {} worker(s)", files.size(), directory, options.maxWorkers());

        List<SeedImageRecord> records = Collections.synchronizedList(new ArrayList<>());
        List<Path> skipped = Collections.synchronizedList(new ArrayList<>());

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.maxWorkers(), Math.max(1, files.size())));
        try {
            List<Future<?>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> {
                    if (signal.isCancellationRequested()) return;
                    try {
                        records.add(analyze(file, options.thumbnailSize()));
                    } catch (ImageDecodeException e) {
                        log.warn("Skipping seed image: {}", e.getMessage());
                        skipped.add(file);
                    } catch (RuntimeException | OutOfMemoryError e) {
                        log.warn("Skipping seed image {}: {}", file, e.toString());
                        skipped.add(file);
                    }
                }));
            }
            for (Future<?> f : futures) {
                await(f);
            }
        } finally {
            pool.shutdownNow();
        }
        signal.throwIfCancellationRequested();

        List<SeedImageRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(SeedImageRecord::filePath));
        List<Path> skippedSorted = new ArrayList<>(skipped);
        Collections.sort(skippedSorted);

        log.info("Seed catalog ready: {} usable, {} skipped", sorted.size(), skippedSorted.size());
        return new SeedCatalog(directory, sorted, skippedSorted);
    }

    SeedImageRecord analyze(Path file, int thumbnailSize) {
        BufferedImage full = codec.loadImage(file);
        ColorMetrics average = sampler.averageColor(full);
        ColorMetrics dominant = sampler.dominantColor(full);
        BufferedImage thumbnail = thumbnail(full, thumbnailSize);
        return new SeedImageRecord(file, full.getWidth(), full.getHeight(), average, dominant,
                average.brightness(), average.saturation(), thumbnail);
    }

    private List<Path> listCandidates(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(codec::hasSupportedExtension)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MosaicException("Failed to list seed directory " + directory, e);
        }
    }

    private static BufferedImage thumbnail(BufferedImage src, int maxSide) {
        int w = src.getWidth(), h = src.getHeight();
        double scale = Math.min(1.0, maxSide / (double) Math.max(w, h));
        int tw = Math.max(1, (int) Math.round(w * scale));
        int th = Math.max(1, (int) Math.round(h * scale));

        BufferedImage thumb = new BufferedImage(tw, th, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = thumb.createGraphics();
        graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        graphics.drawImage(src, 0, 0, tw, th, null);
        graphics.dispose();
        return thumb;
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while loading seed images");
        } catch (ExecutionException e) {
            throw new MosaicException("Seed loading failed", e.getCause());
        }
    }
}
