package com.pinwatch.governance.controller;

import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.RunEntity;
import com.pinwatch.governance.domain.ScanFailureEntity;
import com.pinwatch.governance.store.FindingFilter;
import com.pinwatch.governance.store.PageResult;
import com.pinwatch.governance.store.RunFilter;
import com.pinwatch.governance.store.RunStore;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/runs")
public class RunsController {

    private final RunStore runStore;
    private final GovernanceProperties properties;

    public RunsController(RunStore runStore, GovernanceProperties properties) {
        this.runStore = runStore;
        this.properties = properties;
    }

    @GetMapping
    public PageResult<RunResponse> list(
        @RequestParam(required = false) String repository,
        @RequestParam(required = false) String branch,
        @RequestParam(required = false) Integer limit,
        @RequestParam(defaultValue = "0") long offset
    ) {
        int requested = limit == null ? properties.getRunsDefaultLimit() : limit;
        return runStore.listRuns(new RunFilter(repository, branch), requested, offset).map(RunResponse::from);
    }

    @GetMapping("/{runId}")
    public RunDetailResponse get(@PathVariable Long runId) {
        RunEntity run = runStore.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        List<RunDetailResponse.FailureItem> failures = runStore.getRunFailures(runId)
            .stream()
            .map(this::toFailureItem)
            .toList();
        return new RunDetailResponse(RunResponse.from(run), failures);
    }

    @GetMapping("/{runId}/findings")
    public PageResult<FindingResponse> findings(
        @PathVariable Long runId,
        @RequestParam(required = false) String repository,
        @RequestParam(required = false) String branch,
        @RequestParam(required = false) String workflow,
        @RequestParam(required = false) String action,
        @RequestParam(required = false) Integer limit,
        @RequestParam(defaultValue = "0") long offset
    ) {
        int requested = limit == null ? properties.getFindingsDefaultLimit() : limit;
        FindingFilter filter = new FindingFilter(runId, repository, branch, workflow, action);
        return runStore.listFindings(filter, requested, offset).map(FindingResponse::from);
    }

    private RunDetailResponse.FailureItem toFailureItem(ScanFailureEntity entity) {
        return new RunDetailResponse.FailureItem(
            entity.getWorkflowPath(),
            entity.getFailureCode().name(),
            entity.getFailureReason(),
            entity.getCreatedAt()
        );
    }
}
