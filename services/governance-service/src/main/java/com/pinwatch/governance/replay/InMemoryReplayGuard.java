package com.pinwatch.governance.replay;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryReplayGuard implements ReplayGuard {

    private final Duration window;
    private final Duration pendingLease;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryReplayGuard(Duration window, Duration pendingLease) {
        this.window = Objects.requireNonNull(window, "window");
        this.pendingLease = Objects.requireNonNull(pendingLease, "pendingLease");
    }

    @Override
    public ReplayAdmission admit(String deliveryId, Instant now) {
        Objects.requireNonNull(deliveryId, "deliveryId");
        ReplayAdmission[] admission = new ReplayAdmission[1];
        // compute locks only the bin holding this key
        entries.compute(deliveryId, (id, entry) -> {
            if (entry == null || entry.isExpired(now)) {
                admission[0] = ReplayAdmission.ADMITTED;
                return new Entry(now.plus(pendingLease), false);
            }
            admission[0] = entry.committed() ? ReplayAdmission.DUPLICATE : ReplayAdmission.IN_FLIGHT;
            return entry;
        });
        return admission[0];
    }

    @Override
    public void commit(String deliveryId, Instant now) {
        entries.put(deliveryId, new Entry(now.plus(window), true));
    }

    @Override
    public void release(String deliveryId) {
        entries.remove(deliveryId);
    }

    @Override
    public int sweep(Instant now) {
        int before = entries.size();
        entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return Math.max(0, before - entries.size());
    }

    int size() {
        return entries.size();
    }

    private record Entry(Instant expiresAt, boolean committed) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
