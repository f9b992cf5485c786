package dev.gitfeed.controller;

import dev.gitfeed.domain.valueobject.WebhookEvent;
import dev.gitfeed.normalize.EventValidator;
import dev.gitfeed.normalize.NormalizationResult;
import dev.gitfeed.normalize.WebhookEventNormalizer;
import dev.gitfeed.service.EventIngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * GitHub webhook receiver. Normalizes push and pull_request notifications and stores
 * them; every other event type is acknowledged with 200 and dropped so GitHub does
 * not mark the delivery as failed.
 */
@RestController
@RequestMapping("/webhook")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    private final WebhookEventNormalizer normalizer;
    private final EventValidator validator;
    private final EventIngestionService ingestionService;
    private final ObjectMapper objectMapper;

    public WebhookController(WebhookEventNormalizer normalizer,
                             EventValidator validator,
                             EventIngestionService ingestionService,
                             ObjectMapper objectMapper) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.ingestionService = ingestionService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestBody(required = false) String rawBody) {

        if (isEmptyPayload(rawBody))
            return ResponseEntity.badRequest().body(Map.of("error", "No payload received"));

        NormalizationResult result = normalizer.normalize(eventType, rawBody);
        switch (result.status()) {
            case UNSUPPORTED:
                return ResponseEntity.ok(Map.of("message", "Event type not supported or ignored"));
            case PARSE_FAILURE:
                log.warn("Rejected {} webhook: {}", eventType, result.reason());
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid payload"));
            default:
                break;
        }

        WebhookEvent event = result.event();
        if (!validator.isSupportedAction(event.action())) {
            log.warn("Normalized {} webhook carries unsupported action {}", eventType, event.action());
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid action type"));
        }

        WebhookEvent stored = ingestionService.store(event);
        return ResponseEntity.ok(Map.of("message", "Event stored successfully", "event", stored));
    }

    /** Blank bodies, JSON {@code null} and empty objects or arrays carry nothing to store. */
    private boolean isEmptyPayload(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return true;
        }
        try {
            JsonNode node = objectMapper.readTree(rawBody);
            return node == null || node.isNull() || node.isMissingNode()
                    || ((node.isObject() || node.isArray()) && node.isEmpty());
        } catch (JacksonException e) {
            // Not JSON at all; the normalizer reports it as an invalid payload.
            log.debug("Body is not JSON: {}", e.getOriginalMessage());
            return false;
        }
    }
}
