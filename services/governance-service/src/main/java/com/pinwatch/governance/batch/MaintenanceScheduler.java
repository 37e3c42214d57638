package com.pinwatch.governance.batch;

import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.replay.ReplayGuard;
import com.pinwatch.governance.store.RunStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MaintenanceScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ReplayGuard replayGuard;
    private final RunStore runStore;
    private final GovernanceProperties properties;
    private final Clock clock;

    public MaintenanceScheduler(ReplayGuard replayGuard, RunStore runStore, GovernanceProperties properties, Clock clock) {
        this.replayGuard = replayGuard;
        this.runStore = runStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${governance.replay-sweep-interval-ms:60000}")
    public void sweepReplayWindow() {
        try {
            int evicted = replayGuard.sweep(clock.instant());
            if (evicted > 0) {
                LOGGER.debug("Evicted {} expired replay entries", evicted);
            }
        } catch (DataAccessException ex) {
            LOGGER.warn("Replay window sweep failed: {}", ex.getMessage());
        }
    }

    // also runs after every recorded run
    @Scheduled(fixedDelayString = "${governance.retention-sweep-interval-ms:600000}")
    public void enforceRetention() {
        try {
            runStore.prune(properties.getRetentionCount());
        } catch (DataAccessException ex) {
            LOGGER.warn("Retention sweep failed: {}", ex.getMessage());
        }
    }
}
