package com.pinwatch.governance.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.pinwatch.governance.domain.ChangedFile;
import com.pinwatch.governance.domain.EventKind;
import com.pinwatch.governance.domain.FileChangeStatus;
import com.pinwatch.governance.domain.WebhookEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns a GitHub webhook body into a {@link WebhookEvent}. Shapes that are not understood yield
 * an event without changed files instead of guessed field paths.
 */
@Component
public class WebhookEventParser {

    private static final String BRANCH_PREFIX = "refs/heads/";
    private static final String NULL_SHA = "0000000000000000000000000000000000000000";

    public WebhookEvent parse(String eventHeader, JsonNode root) {
        EventKind kind = EventKind.fromHeader(eventHeader);
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Webhook body must be a JSON object");
        }
        if (kind == EventKind.OTHER) {
            return WebhookEvent.unrecognized(kind, repositoryName(root.path("repository")));
        }

        String repository = repositoryName(root.path("repository"));
        if (repository.isBlank()) {
            throw new MalformedPayloadException("Webhook payload has no repository");
        }
        return kind == EventKind.PUSH ? parsePush(root, repository) : parsePullRequest(root, repository);
    }

    private WebhookEvent parsePush(JsonNode root, String repository) {
        String branch = branchOf(text(root.get("ref")));
        String headSha = text(root.get("after"));
        if (root.path("deleted").asBoolean(false) || headSha.isBlank() || NULL_SHA.equals(headSha)) {
            return new WebhookEvent(EventKind.PUSH, null, repository, branch, null, null, List.of());
        }

        JsonNode commits = root.path("commits");
        if (!commits.isArray()) {
            return new WebhookEvent(EventKind.PUSH, null, repository, branch, headSha, null, List.of());
        }
        // later commits override earlier ones for the same path
        Map<String, FileChangeStatus> finalStatus = new LinkedHashMap<>();
        for (JsonNode commit : commits) {
            collect(commit.path("added"), FileChangeStatus.ADDED, finalStatus);
            collect(commit.path("modified"), FileChangeStatus.MODIFIED, finalStatus);
            collect(commit.path("removed"), FileChangeStatus.REMOVED, finalStatus);
        }
        List<ChangedFile> files = new ArrayList<>();
        finalStatus.forEach((path, status) -> files.add(new ChangedFile(path, status)));
        return new WebhookEvent(EventKind.PUSH, null, repository, branch, headSha, null, files);
    }

    private WebhookEvent parsePullRequest(JsonNode root, String repository) {
        String action = text(root.get("action"));
        JsonNode pullRequest = root.path("pull_request");
        JsonNode number = root.has("number") ? root.get("number") : pullRequest.get("number");
        if (!pullRequest.isObject() || number == null || !number.canConvertToInt()) {
            return new WebhookEvent(EventKind.PULL_REQUEST, emptyToNull(action), repository, null, null, null, List.of());
        }
        JsonNode head = pullRequest.path("head");
        return new WebhookEvent(
            EventKind.PULL_REQUEST,
            emptyToNull(action),
            repository,
            emptyToNull(text(head.get("ref"))),
            emptyToNull(text(head.get("sha"))),
            number.asInt(),
            List.of()
        );
    }

    private void collect(JsonNode paths, FileChangeStatus status, Map<String, FileChangeStatus> into) {
        if (!paths.isArray()) {
            return;
        }
        for (JsonNode path : paths) {
            String value = text(path);
            if (!value.isBlank()) {
                into.remove(value);
                into.put(value, status);
            }
        }
    }

    private String repositoryName(JsonNode repository) {
        String fullName = text(repository.get("full_name"));
        if (!fullName.isBlank()) {
            return fullName;
        }
        String owner = text(repository.path("owner").get("login"));
        String name = text(repository.get("name"));
        return owner.isBlank() || name.isBlank() ? "" : owner + "/" + name;
    }

    static String branchOf(String ref) {
        if (ref == null || !ref.startsWith(BRANCH_PREFIX) || ref.length() == BRANCH_PREFIX.length()) {
            return null;
        }
        return ref.substring(BRANCH_PREFIX.length());
    }

    private String text(JsonNode node) {
        return node == null || node.isNull() || !node.isValueNode() ? "" : node.asText("").trim();
    }

    private String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
