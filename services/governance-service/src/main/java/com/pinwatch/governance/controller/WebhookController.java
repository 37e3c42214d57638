package com.pinwatch.governance.controller;

import com.pinwatch.governance.service.ProcessingStatus;
import com.pinwatch.governance.service.WebhookDelivery;
import com.pinwatch.governance.service.WebhookOutcome;
import com.pinwatch.governance.service.WebhookProcessingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    static final String DELIVERY_HEADER = "X-GitHub-Delivery";
    static final String EVENT_HEADER = "X-GitHub-Event";

    private final WebhookProcessingService processingService;

    public WebhookController(WebhookProcessingService processingService) {
        this.processingService = processingService;
    }

    @PostMapping("/webhook")
    public ResponseEntity<WebhookResponse> receive(
        @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
        @RequestHeader(value = DELIVERY_HEADER, required = false) String deliveryId,
        @RequestHeader(value = EVENT_HEADER, required = false) String event,
        @RequestBody(required = false) byte[] body
    ) {
        WebhookOutcome outcome = processingService.handle(new WebhookDelivery(body, signature, deliveryId, event));
        WebhookResponse response = WebhookResponse.from(outcome);
        if (outcome.status() == ProcessingStatus.ACCEPTED) {
            return ResponseEntity.accepted().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
