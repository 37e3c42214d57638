package com.pinwatch.governance.store;

public record FindingFilter(Long runId, String repository, String branch, String workflowPath, String actionId) {

    public FindingFilter {
        repository = RunFilter.blankToNull(repository);
        branch = RunFilter.blankToNull(branch);
        workflowPath = RunFilter.blankToNull(workflowPath);
        actionId = RunFilter.blankToNull(actionId);
    }

    public static FindingFilter none() {
        return new FindingFilter(null, null, null, null, null);
    }

    public FindingFilter withRunId(Long id) {
        return new FindingFilter(id, repository, branch, workflowPath, actionId);
    }
}
