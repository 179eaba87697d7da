package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.MosaicProgress;

/**
 * Receives progress updates of a run. Called from worker threads, never concurrently
 * with itself.
 */
@FunctionalInterface
public interface ProgressSink {
    ProgressSink NONE = progress -> { };

    void report(MosaicProgress progress);
}
