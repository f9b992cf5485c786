package dev.gitfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GitFeed: GitHub webhook normalizer with a polling feed.
 *
 * <p>Architecture overview:
 * <pre>
 * GitHub Webhook → WebhookController → WebhookEventNormalizer (classify + extract)
 *   → EventValidator → EventIngestionService → webhook_events
 * Client poll → EventFeedController → EventFeedService (FeedCursorQuery) → webhook_events
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>One canonical record for push, PR opened and PR merged notifications</li>
 *   <li>Fixed-width UTC timestamps, so the feed cursor is a plain string comparison</li>
 *   <li>Unsupported event types are acknowledged and dropped, never stored</li>
 * </ul>
 */
@SpringBootApplication
public class GitFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(GitFeedApplication.class, args);
    }
}
