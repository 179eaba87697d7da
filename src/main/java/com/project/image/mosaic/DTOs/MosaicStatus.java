package com.project.image.mosaic.DTOs;

public enum MosaicStatus {
    PENDING,
    INITIALIZING,
    LOADING_SEEDS,
    ANALYZING_MASTER,
    MATCHING_AND_COMPOSITING,
    SAVING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
