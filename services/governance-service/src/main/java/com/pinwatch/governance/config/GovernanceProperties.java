package com.pinwatch.governance.config;

import com.pinwatch.governance.replay.ReplayBackend;
import com.pinwatch.governance.replay.ReplayFailurePolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    private String webhookSecret;
    private boolean allowUnsignedWebhooks = false;
    @NotNull
    private Duration replayWindow = Duration.ofSeconds(300);
    @NotNull
    private ReplayBackend replayBackend = ReplayBackend.LOCAL;
    @NotNull
    private ReplayFailurePolicy replayFailurePolicy = ReplayFailurePolicy.FAIL_OPEN;
    @NotNull
    private Duration replayPendingLease = Duration.ofSeconds(60);
    private long replaySweepIntervalMs = 60_000;
    @NotNull
    private Duration statsCacheTtl = Duration.ofSeconds(15);
    @Positive
    private int statsRepositoryLimit = 50;
    @Positive
    private int statsActionLimit = 100;
    @Positive
    private int runsDefaultLimit = 20;
    @Positive
    private int runsMaxLimit = 200;
    @Positive
    private int findingsDefaultLimit = 100;
    @Positive
    private int findingsMaxLimit = 500;
    private int retentionCount = 1000;
    private long retentionSweepIntervalMs = 600_000;
    private List<String> internalNamespaces = new ArrayList<>();
    @NotBlank
    private String workflowsDirectory = ".github/workflows/";
    @NotBlank
    private String githubApiUrl = "https://api.github.com";
    private String githubToken;
    private String userAgent = "pinwatch-governance/0.1";
    @NotNull
    private Duration fetchTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration reportTimeout = Duration.ofSeconds(10);
    private boolean reportingEnabled = true;
    private String checkRunName = "Action pinning";
    private int maxInMemoryMb = 4;

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public boolean isAllowUnsignedWebhooks() {
        return allowUnsignedWebhooks;
    }

    public void setAllowUnsignedWebhooks(boolean allowUnsignedWebhooks) {
        this.allowUnsignedWebhooks = allowUnsignedWebhooks;
    }

    public Duration getReplayWindow() {
        return replayWindow;
    }

    public void setReplayWindow(Duration replayWindow) {
        this.replayWindow = replayWindow;
    }

    public ReplayBackend getReplayBackend() {
        return replayBackend;
    }

    public void setReplayBackend(ReplayBackend replayBackend) {
        this.replayBackend = replayBackend;
    }

    public ReplayFailurePolicy getReplayFailurePolicy() {
        return replayFailurePolicy;
    }

    public void setReplayFailurePolicy(ReplayFailurePolicy replayFailurePolicy) {
        this.replayFailurePolicy = replayFailurePolicy;
    }

    public Duration getReplayPendingLease() {
        return replayPendingLease;
    }

    public void setReplayPendingLease(Duration replayPendingLease) {
        this.replayPendingLease = replayPendingLease;
    }

    public long getReplaySweepIntervalMs() {
        return replaySweepIntervalMs;
    }

    public void setReplaySweepIntervalMs(long replaySweepIntervalMs) {
        this.replaySweepIntervalMs = replaySweepIntervalMs;
    }

    public Duration getStatsCacheTtl() {
        return statsCacheTtl;
    }

    public void setStatsCacheTtl(Duration statsCacheTtl) {
        this.statsCacheTtl = statsCacheTtl;
    }

    public int getStatsRepositoryLimit() {
        return statsRepositoryLimit;
    }

    public void setStatsRepositoryLimit(int statsRepositoryLimit) {
        this.statsRepositoryLimit = statsRepositoryLimit;
    }

    public int getStatsActionLimit() {
        return statsActionLimit;
    }

    public void setStatsActionLimit(int statsActionLimit) {
        this.statsActionLimit = statsActionLimit;
    }

    public int getRunsDefaultLimit() {
        return runsDefaultLimit;
    }

    public void setRunsDefaultLimit(int runsDefaultLimit) {
        this.runsDefaultLimit = runsDefaultLimit;
    }

    public int getRunsMaxLimit() {
        return runsMaxLimit;
    }

    public void setRunsMaxLimit(int runsMaxLimit) {
        this.runsMaxLimit = runsMaxLimit;
    }

    public int getFindingsDefaultLimit() {
        return findingsDefaultLimit;
    }

    public void setFindingsDefaultLimit(int findingsDefaultLimit) {
        this.findingsDefaultLimit = findingsDefaultLimit;
    }

    public int getFindingsMaxLimit() {
        return findingsMaxLimit;
    }

    public void setFindingsMaxLimit(int findingsMaxLimit) {
        this.findingsMaxLimit = findingsMaxLimit;
    }

    public int getRetentionCount() {
        return retentionCount;
    }

    public void setRetentionCount(int retentionCount) {
        this.retentionCount = retentionCount;
    }

    public long getRetentionSweepIntervalMs() {
        return retentionSweepIntervalMs;
    }

    public void setRetentionSweepIntervalMs(long retentionSweepIntervalMs) {
        this.retentionSweepIntervalMs = retentionSweepIntervalMs;
    }

    public List<String> getInternalNamespaces() {
        return internalNamespaces;
    }

    public void setInternalNamespaces(List<String> internalNamespaces) {
        this.internalNamespaces = internalNamespaces;
    }

    public String getWorkflowsDirectory() {
        return workflowsDirectory;
    }

    public void setWorkflowsDirectory(String workflowsDirectory) {
        this.workflowsDirectory = workflowsDirectory;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public void setGithubApiUrl(String githubApiUrl) {
        this.githubApiUrl = githubApiUrl;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public void setGithubToken(String githubToken) {
        this.githubToken = githubToken;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public Duration getReportTimeout() {
        return reportTimeout;
    }

    public void setReportTimeout(Duration reportTimeout) {
        this.reportTimeout = reportTimeout;
    }

    public boolean isReportingEnabled() {
        return reportingEnabled;
    }

    public void setReportingEnabled(boolean reportingEnabled) {
        this.reportingEnabled = reportingEnabled;
    }

    public String getCheckRunName() {
        return checkRunName;
    }

    public void setCheckRunName(String checkRunName) {
        this.checkRunName = checkRunName;
    }

    public int getMaxInMemoryMb() {
        return maxInMemoryMb;
    }

    public void setMaxInMemoryMb(int maxInMemoryMb) {
        this.maxInMemoryMb = maxInMemoryMb;
    }
}
