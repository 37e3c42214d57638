package com.pinwatch.governance.controller;

import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.store.FindingFilter;
import com.pinwatch.governance.store.PageResult;
import com.pinwatch.governance.store.RunStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/findings")
public class FindingsController {

    private final RunStore runStore;
    private final GovernanceProperties properties;

    public FindingsController(RunStore runStore, GovernanceProperties properties) {
        this.runStore = runStore;
        this.properties = properties;
    }

    @GetMapping
    public PageResult<FindingResponse> list(
        @RequestParam(required = false) Long runId,
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
}
