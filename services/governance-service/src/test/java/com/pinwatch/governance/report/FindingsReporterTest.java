package com.pinwatch.governance.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pinwatch.governance.client.CheckRunSummary;
import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.ActionReference;
import com.pinwatch.governance.domain.NewRun;
import com.pinwatch.governance.domain.RunEntity;
import com.pinwatch.governance.support.FakeGitHub;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FindingsReporterTest {

    private static final String SHA = "6dcb09b5b57875f334f61aebed695e2e4193db5e";

    private final FakeGitHub gitHub = new FakeGitHub();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private GovernanceProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GovernanceProperties();
        properties.setGithubToken("token");
    }

    @Test
    void publishesNeutralCheckWhenExternalActionIsUnpinned() {
        FindingsReporter reporter = reporter(Optional.of("token"));
        List<ActionReference> findings = List.of(
            reference("actions/checkout", "v4", false, false, 7),
            reference("internalorg/build", "main", false, true, 9),
            reference("actions/cache", "b4ffde65f46336ab88eb53be808477a3936bae11", true, false, 11)
        );

        ReportOutcome outcome = reporter.report(run(SHA, 3, 0), findings).join();

        assertEquals(ReportOutcome.PUBLISHED, outcome);
        assertEquals(1, gitHub.published().size());
        FakeGitHub.Published published = gitHub.published().get(0);
        assertEquals("octo/app", published.repository());
        assertEquals(SHA, published.headSha());
        CheckRunSummary summary = published.summary();
        assertEquals("neutral", summary.conclusion());
        assertEquals("1 unpinned external action reference", summary.title());
        assertTrue(summary.summary().contains("`actions/checkout@v4` in .github/workflows/ci.yml:7"));
        assertEquals(1.0, meterRegistry.counter(FindingsReporter.PUBLISHED_METRIC).count());
    }

    @Test
    void concludesSuccessWhenEverythingExternalIsPinned() {
        FindingsReporter reporter = reporter(Optional.of("token"));

        CheckRunSummary summary = reporter.summarize(run(SHA, 1, 1),
            List.of(reference("internalorg/build", "main", false, true, 3)));

        assertEquals("success", summary.conclusion());
        assertEquals("All external actions are pinned", summary.title());
        assertTrue(summary.summary().contains("Files that could not be scanned: 1"));
    }

    @Test
    void publisherFailureIsCountedAndNotPropagated() {
        gitHub.failPublishing(true);
        FindingsReporter reporter = reporter(Optional.of("token"));

        ReportOutcome outcome = reporter.report(run(SHA, 1, 0), List.of()).join();

        assertEquals(ReportOutcome.FAILED, outcome);
        assertEquals(1.0, meterRegistry.counter(FindingsReporter.FAILURE_METRIC).count());
    }

    @Test
    void skipsWithoutTokenOrHeadCommit() {
        assertEquals(ReportOutcome.SKIPPED, reporter(Optional.empty()).report(run(SHA, 1, 0), List.of()).join());
        assertEquals(ReportOutcome.SKIPPED, reporter(Optional.of("token")).report(run(null, 0, 0), List.of()).join());
        assertTrue(gitHub.published().isEmpty());
    }

    @Test
    void skipsWhenReportingIsDisabled() {
        properties.setReportingEnabled(false);

        assertEquals(ReportOutcome.SKIPPED, reporter(Optional.of("token")).report(run(SHA, 1, 0), List.of()).join());
    }

    private FindingsReporter reporter(Optional<String> token) {
        return new FindingsReporter(gitHub, repository -> token, properties, meterRegistry);
    }

    private static RunEntity run(String headSha, int workflows, int failedFiles) {
        NewRun newRun = new NewRun("d-1", "push", "octo/app", "main", headSha, workflows);
        return RunEntity.of(newRun, 0, failedFiles, Instant.parse("2025-03-01T10:00:00Z"));
    }

    private static ActionReference reference(String action, String ref, boolean pinned, boolean internal, int line) {
        return new ActionReference(".github/workflows/ci.yml", action, ref, pinned, internal, line, "- uses: " + action + "@" + ref);
    }
}
