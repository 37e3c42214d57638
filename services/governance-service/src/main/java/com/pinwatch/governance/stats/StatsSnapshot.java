package com.pinwatch.governance.stats;

import java.time.Instant;
import java.util.List;

public record StatsSnapshot(
    long totalRuns,
    long totalFindings,
    long pinnedFindings,
    long unpinnedFindings,
    List<RepositoryStats> perRepository,
    List<ActionStats> perAction,
    Instant computedAt
) {
    public StatsSnapshot {
        perRepository = List.copyOf(perRepository);
        perAction = List.copyOf(perAction);
    }
}
