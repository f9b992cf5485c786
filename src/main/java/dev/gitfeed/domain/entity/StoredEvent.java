package dev.gitfeed.domain.entity;

import dev.gitfeed.domain.enums.EventAction;
import dev.gitfeed.domain.valueobject.WebhookEvent;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted form of a {@link WebhookEvent}. Append-only: rows are inserted once and
 * never updated, so there are no mutators and no {@code @Version}.
 *
 * <p>The identity column breaks ties between events sharing a timestamp (insertion
 * order) and never leaves the service.
 */
@Entity
@Table(name = "webhook_events", indexes = {
        @Index(name = "idx_webhook_events_timestamp", columnList = "event_timestamp, id")
})
public class StoredEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", nullable = false, length = 64)
    private String requestId;

    @Column(nullable = false)
    private String author;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventAction action;

    @Column(name = "from_branch", nullable = false)
    private String fromBranch;

    @Column(name = "to_branch", nullable = false)
    private String toBranch;

    @Column(name = "event_timestamp", nullable = false, updatable = false, length = 20)
    private String timestamp;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    protected StoredEvent() {
    }

    public static StoredEvent from(WebhookEvent event, Instant receivedAt) {
        StoredEvent e = new StoredEvent();
        e.requestId = event.requestId();
        e.author = event.author();
        e.action = event.action();
        e.fromBranch = event.fromBranch();
        e.toBranch = event.toBranch();
        e.timestamp = event.timestamp();
        e.receivedAt = receivedAt;
        return e;
    }

    /** Wire view without the storage identity. */
    public WebhookEvent toEvent() {
        return new WebhookEvent(requestId, author, action, fromBranch, toBranch, timestamp);
    }

    public Long getId() {
        return id;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public EventAction getAction() {
        return action;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }
}
