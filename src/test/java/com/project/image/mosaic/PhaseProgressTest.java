package com.project.image.mosaic;

import com.project.image.mosaic.DTOs.MosaicProgress;
import com.project.image.mosaic.DTOs.MosaicStatus;
import com.project.image.mosaic.service.PhaseProgress;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class PhaseProgressTest {

    @Test
    void interval_spreadsUpdatesOverPhase() {
        assertThat(new PhaseProgress(p -> { }, MosaicStatus.ANALYZING_MASTER, 10_000, 100).interval()).isEqualTo(100);
        assertThat(new PhaseProgress(p -> { }, MosaicStatus.ANALYZING_MASTER, 9, 100).interval()).isEqualTo(1);
        assertThat(new PhaseProgress(p -> { }, MosaicStatus.ANALYZING_MASTER, 250, 100).interval()).isEqualTo(3);
    }

    @Test
    void step_singleThread_deliversEveryIntervalAndLastCount() {
        List<Integer> seen = new ArrayList<>();
        PhaseProgress progress = new PhaseProgress(p -> seen.add(p.current()), MosaicStatus.ANALYZING_MASTER, 10, 4);

        for (int i = 0; i < 10; i++) progress.step();
        progress.finish();

        assertThat(seen).containsExactly(3, 6, 9, 10);
    }

    @Test
    void step_manyThreads_currentNeverGoesBackwards() throws Exception {
        int total = 20_000;
        int threads = 8;
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        PhaseProgress progress = new PhaseProgress(p -> seen.add(p.current()),
                MosaicStatus.MATCHING_AND_COMPOSITING, total, total);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < total / threads; i++) progress.step();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }
        progress.finish();

        assertThat(seen).isNotEmpty();
        assertThat(seen).isSorted().doesNotHaveDuplicates();
        assertThat(seen.get(seen.size() - 1)).isEqualTo(total);
        assertThat(progress.completed()).isEqualTo(total);
    }

    @Test
    void finish_afterFinalCountDelivered_sendsNothingMore() {
        List<MosaicProgress> seen = new ArrayList<>();
        PhaseProgress progress = new PhaseProgress(seen::add, MosaicStatus.ANALYZING_MASTER, 2, 100);

        progress.step();
        progress.step();
        progress.finish();

        assertThat(seen).extracting(MosaicProgress::current).containsExactly(1, 2);
        assertThat(seen.get(1).maximum()).isEqualTo(2);
    }

    @Test
    void step_failingSink_keepsCounting() {
        PhaseProgress progress = new PhaseProgress(p -> {
            throw new IllegalStateException("sink down");
        }, MosaicStatus.ANALYZING_MASTER, 3, 100);

        assertThatCode(() -> {
            progress.step();
            progress.step();
            progress.finish();
        }).doesNotThrowAnyException();
        assertThat(progress.completed()).isEqualTo(2);
    }
}
