package com.project.image.mosaic.DTOs;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of loading a seed directory: usable records in file-path order, plus the
 * files that were found but could not be decoded.
 */
public record SeedCatalog(Path source, List<SeedImageRecord> records, List<Path> skippedFiles) {

    public SeedCatalog {
        records = List.copyOf(records);
        skippedFiles = List.copyOf(skippedFiles);
    }

    public static SeedCatalog empty(Path source) {
        return new SeedCatalog(source, List.of(), List.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int skippedCount() {
        return skippedFiles.size();
    }

    public SeedImageRecord get(int index) {
        return records.get(index);
    }
}
