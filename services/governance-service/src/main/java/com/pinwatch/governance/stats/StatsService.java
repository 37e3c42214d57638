package com.pinwatch.governance.stats;

import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.repository.FindingRepository;
import com.pinwatch.governance.repository.RunRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

@Service
public class StatsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatsService.class);

    static final Comparator<ActionStats> ACTION_ORDER = Comparator
        .comparingLong(ActionStats::occurrences).reversed()
        .thenComparing(ActionStats::actionId);

    static final Comparator<RepositoryStats> REPOSITORY_ORDER = Comparator
        .comparingLong(RepositoryStats::runs).reversed()
        .thenComparing(RepositoryStats::repository);

    private final RunRepository runRepository;
    private final FindingRepository findingRepository;
    private final StatsCache statsCache;
    private final GovernanceProperties properties;
    private final Clock clock;

    public StatsService(
        RunRepository runRepository,
        FindingRepository findingRepository,
        StatsCache statsCache,
        GovernanceProperties properties,
        Clock clock
    ) {
        this.runRepository = runRepository;
        this.findingRepository = findingRepository;
        this.statsCache = statsCache;
        this.properties = properties;
        this.clock = clock;
    }

    public StatsSnapshot getStats() {
        Instant now = clock.instant();
        return statsCache.get(now, () -> compute(now));
    }

    StatsSnapshot compute(Instant computedAt) {
        LOGGER.debug("Recomputing governance stats");
        List<RepositoryStats> perRepository = new ArrayList<>();
        // top entries only; the totals below are counted over the whole store
        for (Object[] row : runRepository.aggregateByRepository(PageRequest.of(0, properties.getStatsRepositoryLimit()))) {
            perRepository.add(new RepositoryStats((String) row[0], number(row[1]), number(row[2])));
        }
        perRepository.sort(REPOSITORY_ORDER);

        List<ActionStats> perAction = new ArrayList<>();
        for (Object[] row : findingRepository.aggregateByAction(PageRequest.of(0, properties.getStatsActionLimit()))) {
            perAction.add(new ActionStats((String) row[0], number(row[1]), number(row[2]), number(row[3])));
        }
        perAction.sort(ACTION_ORDER);

        return new StatsSnapshot(
            runRepository.count(),
            findingRepository.count(),
            findingRepository.countByPinned(true),
            findingRepository.countByPinned(false),
            perRepository,
            perAction,
            computedAt
        );
    }

    private static long number(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
