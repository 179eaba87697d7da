package com.project.image.mosaic.DTOs;

import com.project.image.mosaic.exceptions.MosaicException;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a run. Only a COMPLETED result carries an image (and a preview, when one
 * was requested); a FAILED one carries the error. {@code tiles} is in row-major order.
 */
public record MosaicRunResult(
        MosaicStatus status,
        BufferedImage outputImage,
        Path outputPath,
        BufferedImage preview,
        Path previewPath,
        MosaicException error,
        List<MosaicTile> tiles,
        MosaicStatistics statistics
) {
    public MosaicRunResult {
        tiles = tiles == null ? List.of() : List.copyOf(tiles);
        statistics = statistics == null ? MosaicStatistics.empty() : statistics;
    }

    public static MosaicRunResult completed(BufferedImage image, Path outputPath,
                                            BufferedImage preview, Path previewPath,
                                            List<MosaicTile> tiles, MosaicStatistics statistics) {
        return new MosaicRunResult(MosaicStatus.COMPLETED, image, outputPath, preview, previewPath, null, tiles, statistics);
    }

    public static MosaicRunResult failed(MosaicException error, MosaicStatistics statistics) {
        return new MosaicRunResult(MosaicStatus.FAILED, null, null, null, null, error, List.of(), statistics);
    }

    public static MosaicRunResult cancelled(MosaicStatistics statistics) {
        return new MosaicRunResult(MosaicStatus.CANCELLED, null, null, null, null, null, List.of(), statistics);
    }

    public boolean isSuccessful() {
        return status == MosaicStatus.COMPLETED;
    }
}
