package dev.gitfeed.normalize;

import dev.gitfeed.domain.enums.EventAction;
import dev.gitfeed.domain.valueobject.WebhookEvent;
import dev.gitfeed.normalize.NormalizationResult.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Field extraction for push and pull_request payloads. Payloads carry explicit
 * timestamps except where the clock fallback itself is under test.
 */
class WebhookEventNormalizerTest {

    private static final String NOW = "2025-03-01T12:00:00Z";

    private WebhookEventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse(NOW), ZoneOffset.UTC);
        normalizer = new WebhookEventNormalizer(JsonMapper.builder().build(),
                new EventClassifier(), new TimestampNormalizer(clock));
    }

    private WebhookEvent normalized(String eventType, String body) {
        NormalizationResult result = normalizer.normalize(eventType, body);
        assertThat(result.status()).isEqualTo(Status.NORMALIZED);
        return result.event();
    }

    @Nested
    @DisplayName("push")
    class Push {

        @Test
        @DisplayName("maps a full push payload")
        void fullPayload() {
            WebhookEvent event = normalized("push", """
                    {
                      "ref": "refs/heads/main",
                      "pusher": { "name": "octocat", "email": "octo@example.com" },
                      "commits": [ { "id": "abc1234def5678", "author": { "name": "alice" } } ],
                      "head_commit": {
                        "id": "abc1234def5678abc1234def5678abc1234def56",
                        "timestamp": "2024-05-01T10:15:30+05:30"
                      },
                      "repository": { "full_name": "octocat/hello-world", "pushed_at": 1714538730 }
                    }
                    """);

            assertThat(event).isEqualTo(new WebhookEvent("abc1234", "octocat", EventAction.PUSH,
                    "main", "main", "2024-05-01T04:45:30Z"));
        }

        @Test
        @DisplayName("branch prefix is stripped for both branches")
        void stripsBranchPrefix() {
            WebhookEvent event = normalized("push", push("\"ref\": \"refs/heads/feature/login\""));

            assertThat(event.fromBranch()).isEqualTo("feature/login");
            assertThat(event.toBranch()).isEqualTo("feature/login");
        }

        @Test
        @DisplayName("tag refs pass through verbatim")
        void tagRefPassesThrough() {
            WebhookEvent event = normalized("push", push("\"ref\": \"refs/tags/v1.2.0\""));

            assertThat(event.fromBranch()).isEqualTo("refs/tags/v1.2.0");
            assertThat(event.toBranch()).isEqualTo("refs/tags/v1.2.0");
        }

        @Test
        @DisplayName("missing ref gives empty branches")
        void missingRef() {
            WebhookEvent event = normalized("push", push("\"pusher\": { \"name\": \"octocat\" }"));

            assertThat(event.fromBranch()).isEmpty();
            assertThat(event.toBranch()).isEmpty();
        }

        @Test
        @DisplayName("author falls back to the first commit author when pusher is missing")
        void authorFromFirstCommit() {
            WebhookEvent event = normalized("push", push("""
                    "commits": [ { "author": { "name": "alice" } }, { "author": { "name": "bob" } } ]
                    """));

            assertThat(event.author()).isEqualTo("alice");
        }

        @Test
        @DisplayName("a pusher literally named Unknown triggers the commit-author fallback")
        void unknownPusherFallsBack() {
            WebhookEvent event = normalized("push", push("""
                    "pusher": { "name": "Unknown" },
                    "commits": [ { "author": { "name": "alice" } } ]
                    """));

            assertThat(event.author()).isEqualTo("alice");
        }

        @Test
        @DisplayName("no pusher and no commits resolves to the Unknown sentinel")
        void unresolvedAuthorIsSentinel() {
            WebhookEvent event = normalized("push", push("\"commits\": []"));

            assertThat(event.author()).isEqualTo(WebhookEvent.UNKNOWN_AUTHOR);
        }

        @Test
        @DisplayName("a commit author literally named Unknown is kept as the real value")
        void literalUnknownCommitAuthor() {
            WebhookEvent event = normalized("push", push("""
                    "pusher": { "name": "Unknown" },
                    "commits": [ { "author": { "name": "Unknown" } } ]
                    """));

            // Indistinguishable from the sentinel on the wire.
            assertThat(event.author()).isEqualTo("Unknown");
        }

        @Test
        @DisplayName("request id is the 7-char short hash; shorter ids are kept whole")
        void requestIdIsShortHash() {
            assertThat(normalized("push", push("\"head_commit\": { \"id\": \"0123456789abcdef\" }")).requestId())
                    .isEqualTo("0123456");
            assertThat(normalized("push", push("\"head_commit\": { \"id\": \"abc\" }")).requestId())
                    .isEqualTo("abc");
            assertThat(normalized("push", push("\"ref\": \"refs/heads/main\"")).requestId())
                    .isEmpty();
        }

        @Test
        @DisplayName("timestamp falls back to repository.pushed_at (epoch seconds)")
        void timestampFromPushedAtEpoch() {
            WebhookEvent event = normalized("push", push("""
                    "head_commit": { "id": "0123456789" },
                    "repository": { "pushed_at": 1704067200 }
                    """));

            assertThat(event.timestamp()).isEqualTo("2024-01-01T00:00:00Z");
        }

        @Test
        @DisplayName("timestamp falls back to repository.pushed_at (ISO string)")
        void timestampFromPushedAtString() {
            WebhookEvent event = normalized("push", push("""
                    "repository": { "pushed_at": "2024-01-01T08:00:00+08:00" }
                    """));

            assertThat(event.timestamp()).isEqualTo("2024-01-01T00:00:00Z");
        }

        @Test
        @DisplayName("timestamp falls back to the clock when no source is present")
        void timestampFromClock() {
            WebhookEvent event = normalized("push", push("\"ref\": \"refs/heads/main\""));

            assertThat(event.timestamp()).isEqualTo(NOW);
        }

        private String push(String fields) {
            return "{" + fields + "}";
        }
    }

    @Nested
    @DisplayName("pull_request")
    class PullRequests {

        @Test
        @DisplayName("opened PR uses created_at and head/base refs")
        void openedPullRequest() {
            WebhookEvent event = normalized("pull_request", """
                    {
                      "action": "opened",
                      "pull_request": {
                        "number": 42,
                        "user": { "login": "octocat" },
                        "head": { "ref": "feature/cool", "sha": "abc123" },
                        "base": { "ref": "main" },
                        "merged": false,
                        "created_at": "2024-04-01T09:00:00Z",
                        "updated_at": "2024-04-02T09:00:00Z"
                      }
                    }
                    """);

            assertThat(event).isEqualTo(new WebhookEvent("42", "octocat", EventAction.PULL_REQUEST,
                    "feature/cool", "main", "2024-04-01T09:00:00Z"));
        }

        @Test
        @DisplayName("merged PR uses merged_at")
        void mergedPullRequest() {
            WebhookEvent event = normalized("pull_request", pr("closed", """
                    "merged": true,
                    "created_at": "2024-04-01T09:00:00Z",
                    "updated_at": "2024-04-03T09:00:00Z",
                    "merged_at": "2024-04-02T18:30:00-04:00"
                    """));

            assertThat(event.action()).isEqualTo(EventAction.MERGE);
            assertThat(event.timestamp()).isEqualTo("2024-04-02T22:30:00Z");
            assertThat(event.requestId()).isEqualTo("42");
        }

        @Test
        @DisplayName("merged PR without merged_at falls back to updated_at")
        void mergedFallsBackToUpdatedAt() {
            WebhookEvent event = normalized("pull_request", pr("closed", """
                    "merged": true,
                    "merged_at": null,
                    "updated_at": "2024-04-03T09:00:00Z"
                    """));

            assertThat(event.timestamp()).isEqualTo("2024-04-03T09:00:00Z");
        }

        @Test
        @DisplayName("merged PR without merged_at or updated_at falls back to the clock")
        void mergedFallsBackToClock() {
            WebhookEvent event = normalized("pull_request", pr("closed", "\"merged\": true"));

            assertThat(event.timestamp()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("closed without merge is PULL_REQUEST timed by created_at")
        void closedUnmerged() {
            WebhookEvent event = normalized("pull_request", pr("closed", """
                    "merged": false,
                    "created_at": "2024-04-01T09:00:00Z",
                    "updated_at": "2024-04-03T09:00:00Z"
                    """));

            assertThat(event.action()).isEqualTo(EventAction.PULL_REQUEST);
            assertThat(event.timestamp()).isEqualTo("2024-04-01T09:00:00Z");
        }

        @Test
        @DisplayName("missing user, branches and number use defaults")
        void missingFields() {
            WebhookEvent event = normalized("pull_request", """
                    { "action": "opened", "pull_request": { "created_at": "2024-04-01T09:00:00Z" } }
                    """);

            assertThat(event.author()).isEqualTo("Unknown");
            assertThat(event.fromBranch()).isEmpty();
            assertThat(event.toBranch()).isEmpty();
            assertThat(event.requestId()).isEmpty();
        }

        @Test
        @DisplayName("missing pull_request object reads like an empty one")
        void missingPullRequestObject() {
            WebhookEvent event = normalized("pull_request", "{ \"action\": \"opened\" }");

            assertThat(event).isEqualTo(new WebhookEvent("", "Unknown", EventAction.PULL_REQUEST, "", "", NOW));
        }

        private String pr(String action, String extraFields) {
            return """
                    {
                      "action": "%s",
                      "pull_request": {
                        "number": 42,
                        "user": { "login": "octocat" },
                        "head": { "ref": "feature/cool" },
                        "base": { "ref": "main" },
                        %s
                      }
                    }
                    """.formatted(action, extraFields);
        }
    }

    @Nested
    @DisplayName("failures and ignored events")
    class Outcomes {

        @Test
        @DisplayName("unsupported event types are skipped without reading the body")
        void unsupportedType() {
            NormalizationResult result = normalizer.normalize("issues", "this is not json");

            assertThat(result.status()).isEqualTo(Status.UNSUPPORTED);
            assertThat(result.event()).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{ not json",
                "[1, 2, 3]",
                "{ \"commits\": \"abc\" }",
                "{ \"head_commit\": \"abc123\" }",
                "{ \"pusher\": [\"octocat\"] }"
        })
        @DisplayName("malformed push payloads are parse failures")
        void malformedPush(String body) {
            NormalizationResult result = normalizer.normalize("push", body);

            assertThat(result.status()).isEqualTo(Status.PARSE_FAILURE);
            assertThat(result.event()).isNull();
        }

        @Test
        @DisplayName("wrong nested pull_request shape is a parse failure")
        void malformedPullRequest() {
            NormalizationResult result = normalizer.normalize("pull_request",
                    "{ \"action\": \"opened\", \"pull_request\": { \"head\": \"feature\" } }");

            assertThat(result.status()).isEqualTo(Status.PARSE_FAILURE);
        }

        @Test
        @DisplayName("JSON null body is a parse failure")
        void nullBody() {
            assertThat(normalizer.normalize("push", "null").status()).isEqualTo(Status.PARSE_FAILURE);
        }

        @Test
        @DisplayName("same payload normalizes to identical events")
        void deterministicWithExplicitTimestamps() {
            String body = """
                    {
                      "ref": "refs/heads/main",
                      "pusher": { "name": "octocat" },
                      "head_commit": { "id": "0123456789", "timestamp": "2024-01-01T00:00:00Z" }
                    }
                    """;

            assertThat(normalizer.normalize("push", body)).isEqualTo(normalizer.normalize("push", body));
        }
    }
}
