package dev.gitfeed.controller;

import dev.gitfeed.domain.valueobject.WebhookEvent;
import dev.gitfeed.service.EventFeedService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;

/**
 * Polling feed. Clients pass the timestamp of the newest event they have seen as
 * {@code since}; omit it for the full history.
 */
@RestController
@RequestMapping("/webhook")
public class EventFeedController {
    private final EventFeedService feedService;
    public EventFeedController(EventFeedService feedService) { this.feedService = feedService; }

    @GetMapping("/events")
    public ResponseEntity<List<WebhookEvent>> getEvents(@RequestParam(required = false) String since) {
        return ResponseEntity.ok(feedService.poll(since));
    }
}
