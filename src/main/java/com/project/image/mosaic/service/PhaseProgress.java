package com.project.image.mosaic.service;

import com.project.image.mosaic.DTOs.MosaicProgress;
import com.project.image.mosaic.DTOs.MosaicStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts completed units of one phase and forwards every {@code interval}-th count to
 * the sink. An update that finds another one in flight is dropped, as is one that
 * arrives after a higher count was already delivered, so the sink never sees
 * {@code current} go backwards. The final count is always delivered, by
 * {@link #finish()} if not earlier.
 */
public final class PhaseProgress {
    private static final Logger log = LoggerFactory.getLogger(PhaseProgress.class);

    private final ProgressSink sink;
    private final MosaicStatus status;
    private final int total;
    private final int interval;
    private final AtomicInteger completed = new AtomicInteger();
    private final ReentrantLock delivering = new ReentrantLock();
    // guarded by delivering
    private int lastDelivered;

    public PhaseProgress(ProgressSink sink, MosaicStatus status, int total, int updatesPerPhase) {
        this.sink = sink;
        this.status = status;
        this.total = total;
        this.interval = Math.max(1, (int) Math.ceil(total / (double) Math.max(1, updatesPerPhase)));
    }

    public int interval() {
        return interval;
    }

    public int completed() {
        return completed.get();
    }

    public void step() {
        int n = completed.incrementAndGet();
        if (n % interval != 0 && n != total) return;
        if (!delivering.tryLock()) return;
        try {
            deliver(n);
        } finally {
            delivering.unlock();
        }
    }

    /** Delivers the current count unless it already went out. */
    public void finish() {
        delivering.lock();
        try {
            deliver(completed.get());
        } finally {
            delivering.unlock();
        }
    }

    private void deliver(int n) {
        if (n <= lastDelivered) return;
        lastDelivered = n;
        try {
            sink.report(new MosaicProgress(status, n, total, status + " " + n + "/" + total));
        } catch (RuntimeException e) {
            log.warn("Progress sink failed at {} {}/{}", status, n, total, e);
        }
    }
}
