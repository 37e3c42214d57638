package com.pinwatch.governance.scan;

import com.pinwatch.governance.client.WorkflowContentSource;
import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.ChangedFile;
import com.pinwatch.governance.domain.EventKind;
import com.pinwatch.governance.domain.ScanFailure;
import com.pinwatch.governance.domain.ScanFailureCode;
import com.pinwatch.governance.domain.WebhookEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selects the added or modified workflow definitions of an event and fetches their content. A
 * file that cannot be fetched is recorded as a failure and the remaining files are still scanned.
 */
@Component
public class WorkflowDiffScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowDiffScanner.class);

    private final WorkflowContentSource contentSource;
    private final String workflowsDirectory;

    public WorkflowDiffScanner(WorkflowContentSource contentSource, GovernanceProperties properties) {
        this.contentSource = contentSource;
        String directory = properties.getWorkflowsDirectory() == null ? "" : properties.getWorkflowsDirectory().trim();
        this.workflowsDirectory = directory.isEmpty() || directory.endsWith("/") ? directory : directory + "/";
    }

    public ScanResult scan(WebhookEvent event) {
        List<ScanFailure> failures = new ArrayList<>();
        List<ChangedFile> changedFiles = changedFiles(event, failures);

        List<String> paths = changedFiles.stream()
            .filter(file -> file.status().isPresentAfterChange())
            .map(ChangedFile::path)
            .filter(this::isWorkflowDefinition)
            .distinct()
            .toList();
        if (paths.isEmpty()) {
            return new ScanResult(List.of(), failures);
        }

        String ref = event.headSha() != null ? event.headSha() : event.branch();
        List<ScannedWorkflow> workflows = new ArrayList<>();
        for (String path : paths) {
            if (ref == null) {
                failures.add(ScanFailure.of(path, ScanFailureCode.FETCH_ERROR, "event carries no commit or branch to fetch from"));
                continue;
            }
            try {
                Optional<String> content = contentSource.fetchFile(event.repository(), ref, path);
                if (content.isPresent()) {
                    workflows.add(new ScannedWorkflow(path, content.get()));
                } else {
                    failures.add(ScanFailure.of(path, ScanFailureCode.NOT_FOUND, "not found at " + ref));
                }
            } catch (RuntimeException ex) {
                LOGGER.warn("Fetching {} from {}@{} failed: {}", path, event.repository(), ref, ex.getMessage());
                failures.add(ScanFailure.of(path, ScanFailureCode.FETCH_ERROR, ex.getMessage()));
            }
        }
        return new ScanResult(workflows, failures);
    }

    boolean isWorkflowDefinition(String path) {
        if (path == null || !path.startsWith(workflowsDirectory)) {
            return false;
        }
        String name = path.substring(workflowsDirectory.length());
        if (name.isEmpty() || name.contains("/")) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }

    private List<ChangedFile> changedFiles(WebhookEvent event, List<ScanFailure> failures) {
        if (event.kind() != EventKind.PULL_REQUEST || event.pullRequestNumber() == null) {
            return event.changedFiles();
        }
        try {
            return contentSource.listPullRequestFiles(event.repository(), event.pullRequestNumber());
        } catch (RuntimeException ex) {
            LOGGER.warn("Listing files of {}#{} failed: {}", event.repository(), event.pullRequestNumber(), ex.getMessage());
            failures.add(ScanFailure.of(null, ScanFailureCode.FETCH_ERROR, ex.getMessage()));
            return List.of();
        }
    }
}
