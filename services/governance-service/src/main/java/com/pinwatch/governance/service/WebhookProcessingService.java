package com.pinwatch.governance.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pinwatch.governance.config.GovernanceProperties;
import com.pinwatch.governance.domain.ActionReference;
import com.pinwatch.governance.domain.NewRun;
import com.pinwatch.governance.domain.RunEntity;
import com.pinwatch.governance.domain.ScanFailure;
import com.pinwatch.governance.domain.ScanFailureCode;
import com.pinwatch.governance.domain.WebhookEvent;
import com.pinwatch.governance.extract.ActionReferenceExtractor;
import com.pinwatch.governance.replay.ReplayAdmission;
import com.pinwatch.governance.replay.ReplayGuard;
import com.pinwatch.governance.report.FindingsReporter;
import com.pinwatch.governance.scan.MalformedPayloadException;
import com.pinwatch.governance.scan.ScanResult;
import com.pinwatch.governance.scan.ScannedWorkflow;
import com.pinwatch.governance.scan.WebhookEventParser;
import com.pinwatch.governance.scan.WorkflowDiffScanner;
import com.pinwatch.governance.security.WebhookAuthenticationException;
import com.pinwatch.governance.security.WebhookSignatureVerifier;
import com.pinwatch.governance.store.RunStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Webhook pipeline: signature check, payload parse, replay check, diff scan, extraction,
 * persistence, retention pruning and finally the asynchronous report hand-off.
 *
 * <p>The replay reservation taken by {@link ReplayGuard#admit} is committed only once the run is
 * stored. It is released when persistence fails, and a redelivery that meets a reservation
 * still in flight is refused with {@link DeliveryInProgressException} rather than reported as a
 * duplicate, so the delivery stays retryable until its run exists.
 */
@Service
public class WebhookProcessingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookProcessingService.class);

    static final String EVENTS_METRIC = "governance.webhook.events";

    private final WebhookSignatureVerifier signatureVerifier;
    private final ReplayGuard replayGuard;
    private final WebhookEventParser eventParser;
    private final WorkflowDiffScanner diffScanner;
    private final ActionReferenceExtractor extractor;
    private final RunStore runStore;
    private final FindingsReporter findingsReporter;
    private final GovernanceProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public WebhookProcessingService(
        WebhookSignatureVerifier signatureVerifier,
        ReplayGuard replayGuard,
        WebhookEventParser eventParser,
        WorkflowDiffScanner diffScanner,
        ActionReferenceExtractor extractor,
        RunStore runStore,
        FindingsReporter findingsReporter,
        GovernanceProperties properties,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.signatureVerifier = signatureVerifier;
        this.replayGuard = replayGuard;
        this.eventParser = eventParser;
        this.diffScanner = diffScanner;
        this.extractor = extractor;
        this.runStore = runStore;
        this.findingsReporter = findingsReporter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public WebhookOutcome handle(WebhookDelivery delivery) {
        String deliveryId = delivery.deliveryId() == null ? "" : delivery.deliveryId().trim();
        String eventType = delivery.eventType() == null ? "unknown" : delivery.eventType().trim().toLowerCase(Locale.ROOT);
        MDC.put("deliveryId", deliveryId);
        try {
            if (!signatureVerifier.verify(delivery.body(), delivery.signature())) {
                throw new WebhookAuthenticationException("Invalid webhook signature");
            }
            if (deliveryId.isEmpty()) {
                throw new MalformedPayloadException("Missing delivery id");
            }
            WebhookEvent event = eventParser.parse(eventType, readJson(delivery.body()));

            ReplayAdmission admission = replayGuard.admit(deliveryId, clock.instant());
            if (admission == ReplayAdmission.DUPLICATE) {
                LOGGER.info("Suppressed repeated delivery {} ({})", deliveryId, eventType);
                count("duplicate");
                return WebhookOutcome.duplicate(deliveryId, eventType);
            }
            if (admission == ReplayAdmission.IN_FLIGHT) {
                if (runStore.existsByDeliveryId(deliveryId)) {
                    count("duplicate");
                    return WebhookOutcome.duplicate(deliveryId, eventType);
                }
                LOGGER.info("Delivery {} ({}) is still in flight", deliveryId, eventType);
                count("in_flight");
                throw new DeliveryInProgressException(deliveryId);
            }
            if (!event.isScannable()) {
                LOGGER.debug("Ignoring {} event{}", eventType, event.action() == null ? "" : " action " + event.action());
                replayGuard.commit(deliveryId, clock.instant());
                count("ignored");
                return WebhookOutcome.ignored(deliveryId, eventType);
            }

            Processed processed;
            try {
                processed = process(deliveryId, event);
            } catch (DataIntegrityViolationException conflict) {
                if (runStore.existsByDeliveryId(deliveryId)) {
                    replayGuard.commit(deliveryId, clock.instant());
                    count("duplicate");
                    return WebhookOutcome.duplicate(deliveryId, eventType);
                }
                replayGuard.release(deliveryId);
                count("failed");
                throw conflict;
            } catch (RuntimeException fatal) {
                replayGuard.release(deliveryId);
                count("failed");
                throw fatal;
            }
            replayGuard.commit(deliveryId, clock.instant());
            if (processed.duplicate()) {
                count("duplicate");
                return WebhookOutcome.duplicate(deliveryId, eventType);
            }

            RunEntity run = processed.run();
            prune();
            handOffReport(run, processed.findings());
            count("accepted");
            LOGGER.info("Recorded run {} for {} ({}): {} workflows, {} findings, {} failed files",
                run.getId(), run.getRepository(), eventType, run.getWorkflowsScanned(), run.getFindingsCount(), run.getFailedFiles());
            return new WebhookOutcome(
                ProcessingStatus.ACCEPTED,
                deliveryId,
                eventType,
                run.getId(),
                run.getWorkflowsScanned(),
                run.getFindingsCount(),
                run.getFailedFiles()
            );
        } catch (WebhookAuthenticationException ex) {
            count("rejected");
            throw ex;
        } catch (MalformedPayloadException ex) {
            count("malformed");
            throw ex;
        } finally {
            MDC.remove("deliveryId");
        }
    }

    private Processed process(String deliveryId, WebhookEvent event) {
        // an id outliving the replay window is still a duplicate once its run exists
        if (runStore.existsByDeliveryId(deliveryId)) {
            return Processed.alreadyRecorded();
        }
        ScanResult scan = diffScanner.scan(event);
        List<ScanFailure> failures = new ArrayList<>(scan.failures());
        List<ActionReference> findings = new ArrayList<>();
        int workflowsScanned = 0;
        for (ScannedWorkflow workflow : scan.workflows()) {
            try {
                findings.addAll(extractor.extract(workflow.path(), workflow.content()));
                workflowsScanned++;
            } catch (RuntimeException ex) {
                LOGGER.warn("Could not extract references from {}: {}", workflow.path(), ex.getMessage());
                failures.add(ScanFailure.of(workflow.path(), ScanFailureCode.PARSE_ERROR, ex.getMessage()));
            }
        }
        NewRun newRun = new NewRun(
            deliveryId,
            event.kind().wireName(),
            event.repository(),
            event.branch(),
            event.headSha(),
            workflowsScanned
        );
        RunEntity run = runStore.createRun(newRun, findings, failures);
        return new Processed(run, findings, false);
    }

    private void prune() {
        try {
            runStore.prune(properties.getRetentionCount());
        } catch (RuntimeException ex) {
            LOGGER.warn("Retention pruning failed; it is retried after the next run: {}", ex.getMessage());
        }
    }

    private void handOffReport(RunEntity run, List<ActionReference> findings) {
        try {
            findingsReporter.report(run, findings);
        } catch (TaskRejectedException ex) {
            meterRegistry.counter(FindingsReporter.FAILURE_METRIC).increment();
            LOGGER.warn("Report for run {} not scheduled: {}", run.getId(), ex.getMessage());
        }
    }

    private JsonNode readJson(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MalformedPayloadException("Empty webhook body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new MalformedPayloadException("Webhook body is not valid JSON", ex);
        }
    }

    private void count(String outcome) {
        meterRegistry.counter(EVENTS_METRIC, "outcome", outcome).increment();
    }

    private record Processed(RunEntity run, List<ActionReference> findings, boolean duplicate) {

        static Processed alreadyRecorded() {
            return new Processed(null, List.of(), true);
        }
    }
}
