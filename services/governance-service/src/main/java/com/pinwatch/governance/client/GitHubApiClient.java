package com.pinwatch.governance.client;

import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.ChangedFile;
import com.pinwatch.governance.domain.FileChangeStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Component
public class GitHubApiClient implements WorkflowContentSource, CheckRunPublisher {

    private static final MediaType RAW = MediaType.parseMediaType("application/vnd.github.raw");
    private static final MediaType JSON = MediaType.parseMediaType("application/vnd.github+json");
    private static final int MAX_SUMMARY_CHARS = 65_000;
    private static final int FILES_PER_PAGE = 100;
    private static final int MAX_FILE_PAGES = 30;

    private final WebClient githubWebClient;
    private final AccessTokenProvider accessTokenProvider;
    private final Duration fetchTimeout;
    private final Duration reportTimeout;

    public GitHubApiClient(
        @Qualifier("githubWebClient") WebClient githubWebClient,
        AccessTokenProvider accessTokenProvider,
        GovernanceProperties properties
    ) {
        this.githubWebClient = githubWebClient;
        this.accessTokenProvider = accessTokenProvider;
        this.fetchTimeout = properties.getFetchTimeout();
        this.reportTimeout = properties.getReportTimeout();
    }

    @Override
    public Optional<String> fetchFile(String repository, String ref, String path) {
        try {
            String body = githubWebClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/repos/" + repository + "/contents/" + path)
                    .queryParam("ref", ref)
                    .build())
                .accept(RAW)
                .headers(headers -> authorize(headers, repository))
                .retrieve()
                .bodyToMono(String.class)
                .block(fetchTimeout);
            return Optional.ofNullable(body);
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new ContentFetchException("GitHub returned " + ex.getStatusCode().value() + " for " + path, ex);
        } catch (RuntimeException ex) {
            throw new ContentFetchException("Failed to fetch " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<ChangedFile> listPullRequestFiles(String repository, int pullRequestNumber) {
        Map<String, ChangedFile> files = new LinkedHashMap<>();
        try {
            for (int page = 1; page <= MAX_FILE_PAGES; page++) {
                int currentPage = page;
                PullRequestFile[] batch = githubWebClient.get()
                    .uri(uriBuilder -> uriBuilder
                        .path("/repos/" + repository + "/pulls/" + pullRequestNumber + "/files")
                        .queryParam("per_page", FILES_PER_PAGE)
                        .queryParam("page", currentPage)
                        .build())
                    .accept(JSON)
                    .headers(headers -> authorize(headers, repository))
                    .retrieve()
                    .bodyToMono(PullRequestFile[].class)
                    .block(fetchTimeout);
                if (batch == null || batch.length == 0) {
                    break;
                }
                for (PullRequestFile file : batch) {
                    files.put(file.filename(), new ChangedFile(file.filename(), FileChangeStatus.fromApiStatus(file.status())));
                }
                if (batch.length < FILES_PER_PAGE) {
                    break;
                }
            }
        } catch (RuntimeException ex) {
            throw new ContentFetchException("Failed to list files of pull request #" + pullRequestNumber + ": " + ex.getMessage(), ex);
        }
        return new ArrayList<>(files.values());
    }

    @Override
    public void publish(String repository, String headSha, CheckRunSummary summary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", summary.name());
        payload.put("head_sha", headSha);
        payload.put("status", "completed");
        payload.put("conclusion", summary.conclusion());
        payload.put("output", Map.of(
            "title", summary.title(),
            "summary", truncate(summary.summary(), MAX_SUMMARY_CHARS)
        ));

        githubWebClient.post()
            .uri(uriBuilder -> uriBuilder.path("/repos/" + repository + "/check-runs").build())
            .accept(JSON)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> authorize(headers, repository))
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .block(reportTimeout);
    }

    private void authorize(HttpHeaders headers, String repository) {
        accessTokenProvider.tokenFor(repository).ifPresent(headers::setBearerAuth);
    }

    private String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
