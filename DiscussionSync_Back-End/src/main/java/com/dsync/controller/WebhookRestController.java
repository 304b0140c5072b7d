package com.dsync.controller;

import com.dsync.repo.domain.Discussion;
import com.dsync.repo.domain.SyncResult;
import com.dsync.service.SyncOrchestrator;
import com.dsync.service.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Receives GitHub webhook deliveries. New discussions and new discussion comments trigger a
 * discussion-side sync; every other delivery is acknowledged and ignored.
 */
@RestController
public class WebhookRestController {

    private static final Logger log = LoggerFactory.getLogger(WebhookRestController.class);

    private static final Set<String> HANDLED_EVENTS = Set.of("discussion", "discussion_comment");

    @Autowired
    private SyncOrchestrator syncOrchestrator;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @Autowired
    private ObjectMapper objectMapper;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String event,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody(required = false) byte[] payload) {

        byte[] body = payload == null ? new byte[0] : payload;
        if (!signatureVerifier.verify(body, signature)) {
            log.warn("Rejected webhook delivery with an invalid signature (event {})", event);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response("rejected", "invalid signature"));
        }

        if (event == null || !HANDLED_EVENTS.contains(event)) {
            log.debug("Ignoring webhook event {}", event);
            return ResponseEntity.ok(response("ignored", "event " + event + " is not handled"));
        }

        JsonNode root = parse(body);
        String action = root.path("action").asText("");
        if (!"created".equals(action)) {
            log.debug("Ignoring webhook event {} with action {}", event, action);
            return ResponseEntity.ok(response("ignored", "action " + action + " is not handled"));
        }

        Discussion discussion = toDiscussion(root.path("discussion"));
        log.info("Webhook {} created for discussion #{}", event, discussion.getNumber());

        SyncResult result = syncOrchestrator.syncDiscussionSide(discussion);
        Map<String, Object> response = response(result.getStatus().name(), null);
        response.put("discussion", discussion.getNumber());
        response.put("direction", result.getDirection().name());
        response.put("pushed", result.getPushedCount());
        response.put("counterpartCreated", result.isCounterpartCreated());
        return ResponseEntity.ok(response);
    }

    private JsonNode parse(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new WebhookPayloadException("Webhook payload is not a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new WebhookPayloadException("Webhook payload is not valid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Maps the {@code discussion} object of a delivery. Body, author and category may be absent.
     */
    static Discussion toDiscussion(JsonNode node) {
        if (!node.isObject()) {
            throw new WebhookPayloadException("Webhook payload has no discussion");
        }
        String id = node.path("node_id").asText(null);
        if (id == null || id.isBlank()) {
            throw new WebhookPayloadException("Webhook discussion has no node_id");
        }
        if (!node.path("number").canConvertToInt()) {
            throw new WebhookPayloadException("Webhook discussion " + id + " has no number");
        }
        String title = node.path("title").asText(null);
        if (title == null) {
            throw new WebhookPayloadException("Webhook discussion " + id + " has no title");
        }

        Discussion discussion = new Discussion(
                id,
                node.path("number").asInt(),
                title,
                node.path("body").asText(""),
                node.path("user").path("login").asText("ghost"),
                node.path("category").path("name").asText(null));
        discussion.setUrl(node.path("html_url").asText(null));
        return discussion;
    }

    private static Map<String, Object> response(String status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", status);
        if (message != null) {
            response.put("message", message);
        }
        return response;
    }
}
