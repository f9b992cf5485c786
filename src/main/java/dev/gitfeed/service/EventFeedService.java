package dev.gitfeed.service;

import dev.gitfeed.domain.entity.StoredEvent;
import dev.gitfeed.domain.valueobject.FeedCursorQuery;
import dev.gitfeed.domain.valueobject.WebhookEvent;
import dev.gitfeed.repository.StoredEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class EventFeedService {
    private static final Logger log = LoggerFactory.getLogger(EventFeedService.class);
    private final StoredEventRepository repository;
    public EventFeedService(StoredEventRepository repository) { this.repository = repository; }

    public List<WebhookEvent> poll(String since) {
        return poll(FeedCursorQuery.of(since));
    }

    public List<WebhookEvent> poll(FeedCursorQuery query) {
        List<WebhookEvent> events = repository.findAll(query.toSpecification(), query.sort()).stream()
                .map(StoredEvent::toEvent)
                .toList();
        log.debug("Feed poll since={} returned {} events", query.cursor().orElse("<start>"), events.size());
        return events;
    }
}
