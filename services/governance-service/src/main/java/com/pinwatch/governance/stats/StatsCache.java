package com.pinwatch.governance.stats;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Single-entry, age-based cache for the aggregate statistics. Writes to the store never
 * invalidate it. Concurrent misses may recompute in parallel; the last result stored wins.
 */
public class StatsCache {

    public static final String CACHE_METRIC = "governance.stats.cache";

    private final Duration ttl;
    private final Counter hits;
    private final Counter misses;
    private final AtomicReference<Entry> current = new AtomicReference<>();

    public StatsCache(Duration ttl, MeterRegistry meterRegistry) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.hits = meterRegistry.counter(CACHE_METRIC, "result", "hit");
        this.misses = meterRegistry.counter(CACHE_METRIC, "result", "miss");
    }

    public StatsSnapshot get(Instant now, Supplier<StatsSnapshot> loader) {
        Entry entry = current.get();
        if (entry != null && !isStale(entry.computedAt(), now, ttl)) {
            hits.increment();
            return entry.snapshot();
        }
        misses.increment();
        StatsSnapshot fresh = loader.get();
        current.set(new Entry(fresh, now));
        return fresh;
    }

    public Duration ttl() {
        return ttl;
    }

    public static boolean isStale(Instant computedAt, Instant now, Duration ttl) {
        return Duration.between(computedAt, now).compareTo(ttl) >= 0;
    }

    private record Entry(StatsSnapshot snapshot, Instant computedAt) {
    }
}
