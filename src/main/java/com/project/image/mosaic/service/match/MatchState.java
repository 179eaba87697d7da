package com.project.image.mosaic.service.match;

import com.project.image.mosaic.DTOs.SeedImageRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Mutable state of one run, shared by all tile workers: usage counts, the window of
 * recent selections and the random source. Callers that need a read-then-update to be
 * atomic hold this object's monitor.
 */
public final class MatchState {
    public static final int RECENT_WINDOW = 20;

    private final Map<String, Integer> usage = new HashMap<>();
    private final Deque<String> recent = new ArrayDeque<>();
    private final Random random;

    public MatchState(Long randomSeed) {
        this.random = randomSeed == null ? new Random() : new Random(randomSeed);
    }

    public synchronized int usageOf(SeedImageRecord seed) {
        return usage.getOrDefault(seed.key(), 0);
    }

    public synchronized boolean isRecent(SeedImageRecord seed) {
        return recent.contains(seed.key());
    }

    /** Counts one placement of {@code seed} and moves it to the newest end of the window. */
    public synchronized void recordUse(SeedImageRecord seed) {
        String key = seed.key();
        usage.merge(key, 1, Integer::sum);
        recent.remove(key);
        recent.addLast(key);
        while (recent.size() > RECENT_WINDOW) {
            recent.removeFirst();
        }
    }

    public synchronized int nextInt(int bound) {
        return random.nextInt(bound);
    }

    public synchronized Map<String, Integer> usageSnapshot() {
        return Map.copyOf(usage);
    }

    public synchronized int recentCount() {
        return recent.size();
    }
}
