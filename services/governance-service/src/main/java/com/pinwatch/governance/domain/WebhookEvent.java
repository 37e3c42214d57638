package com.pinwatch.governance.domain;

import java.util.List;
import java.util.Set;

/**
 * Typed view of an inbound webhook payload. {@code changedFiles} is empty for event kinds that
 * carry no file list and for payloads whose shape was not recognised. Pull request events carry
 * the PR number instead; their files are listed through the GitHub API.
 */
public record WebhookEvent(
    EventKind kind,
    String action,
    String repository,
    String branch,
    String headSha,
    Integer pullRequestNumber,
    List<ChangedFile> changedFiles
) {
    private static final Set<String> SCANNED_PULL_REQUEST_ACTIONS = Set.of("opened", "synchronize", "reopened");

    public WebhookEvent {
        changedFiles = changedFiles == null ? List.of() : List.copyOf(changedFiles);
    }

    /**
     * Pushes are always scanned; pull requests only when their head commit changed.
     */
    public boolean isScannable() {
        return switch (kind) {
            case PUSH -> true;
            case PULL_REQUEST -> action != null && SCANNED_PULL_REQUEST_ACTIONS.contains(action);
            case OTHER -> false;
        };
    }

    public static WebhookEvent unrecognized(EventKind kind, String repository) {
        return new WebhookEvent(kind, null, repository, null, null, null, List.of());
    }
}
