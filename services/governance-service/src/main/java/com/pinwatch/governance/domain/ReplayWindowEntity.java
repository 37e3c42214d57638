package com.pinwatch.governance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Mapping of the shared replay table so that schema management creates it. Reads and writes go
 * through {@code JdbcReplayGuard}.
 */
@Entity
@Table(name = "replay_window")
public class ReplayWindowEntity {

    @Id
    @Column(name = "delivery_id", nullable = false, updatable = false)
    private String deliveryId;

    @Column(name = "seen_at", nullable = false)
    private Instant seenAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "state", nullable = false, length = 16)
    private String state;

    public String getDeliveryId() {
        return deliveryId;
    }

    public Instant getSeenAt() {
        return seenAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getState() {
        return state;
    }
}
