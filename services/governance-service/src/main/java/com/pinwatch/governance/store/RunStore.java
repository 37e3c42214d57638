package com.pinwatch.governance.store;

import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.ActionReference;
import com.pinwatch.governance.domain.FindingEntity;
import com.pinwatch.governance.domain.NewRun;
import com.pinwatch.governance.domain.RunEntity;
import com.pinwatch.governance.domain.ScanFailure;
import com.pinwatch.governance.domain.ScanFailureEntity;
import com.pinwatch.governance.repository.FindingRepository;
import com.pinwatch.governance.repository.OffsetLimitRequest;
import com.pinwatch.governance.repository.RunRepository;
import com.pinwatch.governance.repository.ScanFailureRepository;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Durable record of processed events. A run and its findings are written in one transaction, so
 * readers never see a run with a partial finding set.
 */
@Service
public class RunStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunStore.class);
    private static final int PRUNE_BATCH = 500;

    private final RunRepository runRepository;
    private final FindingRepository findingRepository;
    private final ScanFailureRepository scanFailureRepository;
    private final GovernanceProperties properties;
    private final Clock clock;

    public RunStore(
        RunRepository runRepository,
        FindingRepository findingRepository,
        ScanFailureRepository scanFailureRepository,
        GovernanceProperties properties,
        Clock clock
    ) {
        this.runRepository = runRepository;
        this.findingRepository = findingRepository;
        this.scanFailureRepository = scanFailureRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public RunEntity createRun(NewRun newRun, List<ActionReference> findings, List<ScanFailure> failures) {
        Instant now = clock.instant();
        RunEntity run = runRepository.save(RunEntity.of(newRun, findings.size(), failures.size(), now));
        findingRepository.saveAllAndFlush(findings.stream()
            .map(reference -> FindingEntity.of(run.getId(), reference))
            .toList());
        scanFailureRepository.saveAllAndFlush(failures.stream()
            .map(failure -> ScanFailureEntity.of(run.getId(), failure, now))
            .toList());
        return run;
    }

    public PageResult<RunEntity> listRuns(RunFilter filter, int limit, long offset) {
        int effectiveLimit = clampLimit(limit, properties.getRunsMaxLimit());
        long effectiveOffset = Math.max(0, offset);
        List<RunEntity> items = runRepository.search(
            filter.repository(),
            filter.branch(),
            OffsetLimitRequest.of(effectiveOffset, effectiveLimit)
        );
        long total = runRepository.countMatching(filter.repository(), filter.branch());
        return PageResult.of(items, effectiveLimit, effectiveOffset, total);
    }

    public PageResult<FindingEntity> listFindings(FindingFilter filter, int limit, long offset) {
        int effectiveLimit = clampLimit(limit, properties.getFindingsMaxLimit());
        long effectiveOffset = Math.max(0, offset);
        List<FindingEntity> items = findingRepository.search(
            filter.runId(),
            filter.repository(),
            filter.branch(),
            filter.workflowPath(),
            filter.actionId(),
            OffsetLimitRequest.of(effectiveOffset, effectiveLimit)
        );
        long total = findingRepository.countMatching(
            filter.runId(),
            filter.repository(),
            filter.branch(),
            filter.workflowPath(),
            filter.actionId()
        );
        return PageResult.of(items, effectiveLimit, effectiveOffset, total);
    }

    public boolean existsByDeliveryId(String deliveryId) {
        return runRepository.existsByDeliveryId(deliveryId);
    }

    public Optional<RunEntity> getRun(Long runId) {
        return runRepository.findById(runId);
    }

    public List<FindingEntity> getRunFindings(Long runId) {
        return findingRepository.findByRunIdOrderByIdAsc(runId);
    }

    public List<ScanFailureEntity> getRunFailures(Long runId) {
        return scanFailureRepository.findByRunIdOrderByIdAsc(runId);
    }

    /**
     * Deletes every run older than the newest {@code retentionCount}, with its findings and scan
     * failures. A non-positive count disables pruning.
     *
     * @return number of deleted runs
     */
    @Transactional
    public int prune(int retentionCount) {
        if (retentionCount <= 0) {
            return 0;
        }
        int deleted = 0;
        while (true) {
            List<Long> expired = runRepository.findIdsNewestFirst(OffsetLimitRequest.of(retentionCount, PRUNE_BATCH));
            if (expired.isEmpty()) {
                break;
            }
            findingRepository.deleteByRunIdIn(expired);
            scanFailureRepository.deleteByRunIdIn(expired);
            deleted += runRepository.deleteByIdIn(expired);
            if (expired.size() < PRUNE_BATCH) {
                break;
            }
        }
        if (deleted > 0) {
            LOGGER.info("Pruned {} runs beyond retention count {}", deleted, retentionCount);
        }
        return deleted;
    }

    static int clampLimit(int requested, int max) {
        return Math.max(1, Math.min(requested, Math.max(1, max)));
    }
}
