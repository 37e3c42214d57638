package com.pinwatch.governance.replay;

import java.time.Instant;

/**
 * Suppresses repeated webhook deliveries inside a sliding window.
 *
 * <p>{@link #admit} atomically reserves a delivery id for a pending lease. The reservation
 * becomes a window-long mark only through {@link #commit}, once the delivery is durably
 * handled; {@link #release} drops it so that a redelivery is processed again. An attempt that
 * dies without either call loses its reservation when the lease runs out. Implementations must
 * never block admits of different ids on each other.
 */
public interface ReplayGuard {

    ReplayAdmission admit(String deliveryId, Instant now);

    /**
     * Marks an admitted id as handled. Repeats are reported as duplicates until the window,
     * counted from {@code now}, has elapsed.
     */
    void commit(String deliveryId, Instant now);

    void release(String deliveryId);

    /**
     * Evicts expired marks and lapsed reservations.
     *
     * @return number of evicted entries
     */
    int sweep(Instant now);
}
