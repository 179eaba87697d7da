package com.project.image.mosaic.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag shared between a caller and a running mosaic. */
public final class CancellationSignal {
    private final AtomicBoolean requested = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        requested.set(true);
    }

    public boolean isCancellationRequested() {
        return requested.get();
    }

    public void throwIfCancellationRequested() {
        if (requested.get()) {
            throw new CancellationException("Mosaic run cancelled");
        }
    }
}
