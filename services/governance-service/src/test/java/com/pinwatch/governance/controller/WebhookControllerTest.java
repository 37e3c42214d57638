package com.pinwatch.governance.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pinwatch.governance.replay.ReplayGuard;
import com.pinwatch.governance.support.IntegrationTestSupport;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

class WebhookControllerTest extends IntegrationTestSupport {

    private static final String SECRET = "test-secret";
    private static final String REPO = "octo/app";
    private static final String SHA = "6dcb09b5b57875f334f61aebed695e2e4193db5e";
    private static final String PINNED = "8e5e7e5ab8b370d6c329ec480221332ada57f0ab";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ReplayGuard replayGuard;

    @Test
    void pushWithWorkflowChangeRecordsFindingsAndUpdatesStats() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/ci.yml", """
            jobs:
              build:
                runs-on: ubuntu-latest
                steps:
                  - uses: actions/checkout@v4
                  - uses: orgname/action@%s
            """.formatted(PINNED));

        MvcResult result = mockMvc.perform(webhook("push", UUID.randomUUID().toString(), pushBody(".github/workflows/ci.yml")))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("accepted"))
            .andExpect(jsonPath("$.workflowsScanned").value(1))
            .andExpect(jsonPath("$.findingsCount").value(2))
            .andExpect(jsonPath("$.failedFiles").value(0))
            .andReturn();
        long runId = runIdOf(result);

        mockMvc.perform(get("/runs/{runId}/findings", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.items", hasSize(2)));

        mockMvc.perform(get("/findings").param("action", "actions/checkout"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[0].ref").value("v4"))
            .andExpect(jsonPath("$.items[0].pinned").value(false))
            .andExpect(jsonPath("$.items[0].internal").value(false))
            .andExpect(jsonPath("$.items[0].line").value(5));

        clock.advance(Duration.ofHours(1));
        mockMvc.perform(get("/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalRuns").value(1))
            .andExpect(jsonPath("$.totalFindings").value(2))
            .andExpect(jsonPath("$.pinnedFindings").value(1))
            .andExpect(jsonPath("$.unpinnedFindings").value(1))
            .andExpect(jsonPath("$.perAction[0].actionId").value("actions/checkout"))
            .andExpect(jsonPath("$.perAction[0].unpinned").value(1))
            .andExpect(jsonPath("$.perAction[1].actionId").value("orgname/action"))
            .andExpect(jsonPath("$.perAction[1].pinned").value(1));
    }

    @Test
    void redeliveryWithinWindowIsSuppressed() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/ci.yml", "jobs:\n  b:\n    steps:\n      - uses: actions/checkout@v4\n");
        String deliveryId = UUID.randomUUID().toString();
        String body = pushBody(".github/workflows/ci.yml");

        mockMvc.perform(webhook("push", deliveryId, body)).andExpect(status().isAccepted());
        clock.advance(Duration.ofSeconds(30));
        mockMvc.perform(webhook("push", deliveryId, body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("duplicate"));

        assertEquals(1, runRepository.count());
        assertEquals(1, findingRepository.count());
    }

    @Test
    void redeliveryOfUnfinishedAttemptIsRefusedWithConflict() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/ci.yml", "jobs:\n  b:\n    steps:\n      - uses: actions/checkout@v4\n");
        String deliveryId = UUID.randomUUID().toString();
        String body = pushBody(".github/workflows/ci.yml");
        replayGuard.admit(deliveryId, clock.instant());

        mockMvc.perform(webhook("push", deliveryId, body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("in_progress"));
        assertEquals(0, runRepository.count());

        replayGuard.release(deliveryId);
        mockMvc.perform(webhook("push", deliveryId, body))
            .andExpect(status().isAccepted());
        assertEquals(1, runRepository.count());
    }

    @Test
    void deliveryOutlivingWindowIsStillNotRecordedTwice() throws Exception {
        String deliveryId = UUID.randomUUID().toString();
        String body = pushBody("README.md");

        mockMvc.perform(webhook("push", deliveryId, body)).andExpect(status().isAccepted());
        clock.advance(Duration.ofMinutes(10));
        mockMvc.perform(webhook("push", deliveryId, body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("duplicate"));

        assertEquals(1, runRepository.count());
    }

    @Test
    void wrongSignatureIsRejectedWithoutSideEffects() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/ci.yml", "jobs: {}");
        String body = pushBody(".github/workflows/ci.yml");

        mockMvc.perform(post("/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body)
                .header("X-GitHub-Event", "push")
                .header("X-GitHub-Delivery", UUID.randomUUID().toString())
                .header("X-Hub-Signature-256", "sha256=" + sign("wrong-secret", body)))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("unauthorized"));

        mockMvc.perform(post("/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body)
                .header("X-GitHub-Event", "push")
                .header("X-GitHub-Delivery", UUID.randomUUID().toString()))
            .andExpect(status().isUnauthorized());

        assertEquals(0, runRepository.count());
        assertEquals(0, fakeGitHub.fetchedPaths().size());
    }

    @Test
    void internalNamespaceReferenceIsFlaggedInternal() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/build.yaml", """
            jobs:
              build:
                steps:
                  - uses: internalorg/build-tools@main
            """);

        mockMvc.perform(webhook("push", UUID.randomUUID().toString(), pushBody(".github/workflows/build.yaml")))
            .andExpect(status().isAccepted());

        mockMvc.perform(get("/findings"))
            .andExpect(jsonPath("$.items[0].action").value("internalorg/build-tools"))
            .andExpect(jsonPath("$.items[0].pinned").value(false))
            .andExpect(jsonPath("$.items[0].internal").value(true));
    }

    @Test
    void listingLimitIsClampedToMaximum() throws Exception {
        mockMvc.perform(get("/findings").param("limit", "10000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(500))
            .andExpect(jsonPath("$.count").value(0))
            .andExpect(jsonPath("$.items", hasSize(0)));

        mockMvc.perform(get("/runs").param("limit", "10000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(200));
    }

    @Test
    void unreadableWorkflowIsRecordedAsFailureOnTheRun() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/ok.yml", "jobs:\n  b:\n    steps:\n      - uses: actions/checkout@v4\n");
        fakeGitHub.putFile(REPO, ".github/workflows/broken.yml", "jobs: [unclosed\n  - {");

        MvcResult result = mockMvc.perform(webhook("push", UUID.randomUUID().toString(),
                pushBody(".github/workflows/ok.yml", ".github/workflows/broken.yml", ".github/workflows/missing.yml")))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.workflowsScanned").value(1))
            .andExpect(jsonPath("$.findingsCount").value(1))
            .andExpect(jsonPath("$.failedFiles").value(2))
            .andReturn();

        mockMvc.perform(get("/runs/{runId}", runIdOf(result)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.run.failedFiles").value(2))
            .andExpect(jsonPath("$.failures", hasSize(2)))
            .andExpect(jsonPath("$.failures[0].workflow").value(".github/workflows/missing.yml"))
            .andExpect(jsonPath("$.failures[0].code").value("NOT_FOUND"))
            .andExpect(jsonPath("$.failures[1].workflow").value(".github/workflows/broken.yml"))
            .andExpect(jsonPath("$.failures[1].code").value("PARSE_ERROR"));
    }

    @Test
    void oversizedReferenceFailsOnlyItsOwnFile() throws Exception {
        fakeGitHub.putFile(REPO, ".github/workflows/ok.yml", "jobs:\n  b:\n    steps:\n      - uses: actions/checkout@v4\n");
        fakeGitHub.putFile(REPO, ".github/workflows/long.yml",
            "jobs:\n  b:\n    steps:\n      - uses: actions/setup-node@feature/" + "x".repeat(600) + "\n");

        MvcResult result = mockMvc.perform(webhook("push", UUID.randomUUID().toString(),
                pushBody(".github/workflows/ok.yml", ".github/workflows/long.yml")))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.workflowsScanned").value(1))
            .andExpect(jsonPath("$.findingsCount").value(1))
            .andExpect(jsonPath("$.failedFiles").value(1))
            .andReturn();

        mockMvc.perform(get("/runs/{runId}", runIdOf(result)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.failures", hasSize(1)))
            .andExpect(jsonPath("$.failures[0].workflow").value(".github/workflows/long.yml"))
            .andExpect(jsonPath("$.failures[0].code").value("PARSE_ERROR"));
        assertEquals(1, runRepository.count());
    }

    @Test
    void longSingleLineWorkflowIsStoredWithTruncatedRawLines() throws Exception {
        StringBuilder steps = new StringBuilder();
        for (int i = 0; i < 80; i++) {
            steps.append(i == 0 ? "" : ", ").append("{uses: actions/checkout@v4, name: checkout-step-").append(i).append('}');
        }
        fakeGitHub.putFile(REPO, ".github/workflows/flow.yml", "{jobs: {b: {steps: [" + steps + "]}}}\n");

        MvcResult result = mockMvc.perform(webhook("push", UUID.randomUUID().toString(), pushBody(".github/workflows/flow.yml")))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.findingsCount").value(80))
            .andExpect(jsonPath("$.failedFiles").value(0))
            .andReturn();

        MvcResult findings = mockMvc.perform(get("/runs/{runId}/findings", runIdOf(result)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(80))
            .andExpect(jsonPath("$.items[0].line").value(1))
            .andReturn();
        JsonNode first = objectMapper.readTree(findings.getResponse().getContentAsString()).get("items").get(0);
        assertEquals(2000, first.get("raw").asText().length());
    }

    @Test
    void pingIsIgnoredAndMalformedRequestsAreRejected() throws Exception {
        mockMvc.perform(webhook("ping", UUID.randomUUID().toString(), "{\"zen\":\"Speak like a human.\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ignored"));

        mockMvc.perform(webhook("push", UUID.randomUUID().toString(), "{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        String body = pushBody("README.md");
        mockMvc.perform(post("/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body)
                .header("X-GitHub-Event", "push")
                .header("X-Hub-Signature-256", "sha256=" + sign(SECRET, body)))
            .andExpect(status().isBadRequest());

        assertEquals(0, runRepository.count());
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/runs/{runId}", 987654))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));

        mockMvc.perform(get("/runs/not-a-number"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void healthReportsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    private MockHttpServletRequestBuilder webhook(String event, String deliveryId, String body) throws Exception {
        return post("/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body)
            .header("X-GitHub-Event", event)
            .header("X-GitHub-Delivery", deliveryId)
            .header("X-Hub-Signature-256", "sha256=" + sign(SECRET, body));
    }

    private String pushBody(String... modified) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
            "ref", "refs/heads/main",
            "after", SHA,
            "repository", Map.of("full_name", REPO),
            "commits", List.of(Map.of(
                "added", List.of(),
                "modified", List.of(modified),
                "removed", List.of()
            ))
        ));
    }

    private long runIdOf(MvcResult result) throws Exception {
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("runId").asLong();
    }

    private static String sign(String secret, String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }
}
