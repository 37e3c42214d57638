package com.pinwatch.governance.report;

import com.pinwatch.governance.client.AccessTokenProvider;
import com.pinwatch.governance.client.CheckRunPublisher;
import com.pinwatch.governance.client.CheckRunSummary;
import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.ActionReference;
import com.pinwatch.governance.domain.RunEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Posts a check run summarising a persisted run back to GitHub. Runs on the reporting executor
 * after the run is committed; failures are logged and counted and never reach the caller.
 */
@Component
public class FindingsReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FindingsReporter.class);

    public static final String FAILURE_METRIC = "governance.report.failures";
    public static final String PUBLISHED_METRIC = "governance.report.published";

    private final CheckRunPublisher publisher;
    private final AccessTokenProvider accessTokenProvider;
    private final GovernanceProperties properties;
    private final MeterRegistry meterRegistry;

    public FindingsReporter(
        CheckRunPublisher publisher,
        AccessTokenProvider accessTokenProvider,
        GovernanceProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.publisher = publisher;
        this.accessTokenProvider = accessTokenProvider;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Async("reportingExecutor")
    public CompletableFuture<ReportOutcome> report(RunEntity run, List<ActionReference> findings) {
        if (!properties.isReportingEnabled()) {
            return CompletableFuture.completedFuture(ReportOutcome.SKIPPED);
        }
        if (run.getHeadSha() == null || accessTokenProvider.tokenFor(run.getRepository()).isEmpty()) {
            LOGGER.debug("Skipping report for run {}: no head commit or no access token", run.getId());
            return CompletableFuture.completedFuture(ReportOutcome.SKIPPED);
        }
        try {
            publisher.publish(run.getRepository(), run.getHeadSha(), summarize(run, findings));
            meterRegistry.counter(PUBLISHED_METRIC).increment();
            return CompletableFuture.completedFuture(ReportOutcome.PUBLISHED);
        } catch (RuntimeException ex) {
            meterRegistry.counter(FAILURE_METRIC).increment();
            LOGGER.warn("Reporting run {} to {}@{} failed: {}", run.getId(), run.getRepository(), run.getHeadSha(), ex.getMessage());
            return CompletableFuture.completedFuture(ReportOutcome.FAILED);
        }
    }

    CheckRunSummary summarize(RunEntity run, List<ActionReference> findings) {
        long pinned = findings.stream().filter(ActionReference::pinned).count();
        long internal = findings.stream().filter(ActionReference::internal).count();
        List<ActionReference> unpinnedExternal = findings.stream()
            .filter(f -> !f.pinned() && !f.internal())
            .toList();

        StringBuilder summary = new StringBuilder()
            .append("Workflows scanned: ").append(run.getWorkflowsScanned()).append('\n')
            .append("References: ").append(findings.size())
            .append(" (pinned ").append(pinned)
            .append(", unpinned ").append(findings.size() - pinned)
            .append(", internal ").append(internal).append(")\n");
        if (run.getFailedFiles() > 0) {
            summary.append("Files that could not be scanned: ").append(run.getFailedFiles()).append('\n');
        }
        if (!unpinnedExternal.isEmpty()) {
            summary.append("\nUnpinned external references:\n");
            for (ActionReference reference : unpinnedExternal) {
                summary.append("- `").append(reference.actionId()).append('@').append(reference.ref()).append("` in ")
                    .append(reference.workflowPath());
                if (reference.lineNumber() != null) {
                    summary.append(':').append(reference.lineNumber());
                }
                summary.append('\n');
            }
        }

        String title = unpinnedExternal.isEmpty()
            ? "All external actions are pinned"
            : unpinnedExternal.size() + " unpinned external action reference" + (unpinnedExternal.size() == 1 ? "" : "s");
        String conclusion = unpinnedExternal.isEmpty() ? "success" : "neutral";
        return new CheckRunSummary(properties.getCheckRunName(), conclusion, title, summary.toString());
    }
}
