package dev.gitfeed.service;

import dev.gitfeed.domain.entity.StoredEvent;
import dev.gitfeed.domain.valueobject.WebhookEvent;
import dev.gitfeed.repository.StoredEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Command-side service. Appends normalized events; nothing is ever updated or
 * deduplicated here.
 */
@Service
public class EventIngestionService {
    private static final Logger log = LoggerFactory.getLogger(EventIngestionService.class);
    static final String STORED_METRIC = "gitfeed.events.stored";

    private final StoredEventRepository repository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public EventIngestionService(StoredEventRepository repository, MeterRegistry meterRegistry, Clock clock) {
        this.repository = repository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Transactional
    public WebhookEvent store(WebhookEvent event) {
        StoredEvent saved = repository.save(StoredEvent.from(event, clock.instant()));
        Counter.builder(STORED_METRIC)
                .tag("action", event.action().name())
                .register(meterRegistry)
                .increment();
        log.info("Stored {} {} by {} ({} → {}) at {}", event.action(), event.requestId(),
                event.author(), event.fromBranch(), event.toBranch(), event.timestamp());
        return saved.toEvent();
    }
}
