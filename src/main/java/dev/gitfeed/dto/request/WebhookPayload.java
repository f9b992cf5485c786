package dev.gitfeed.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Union of the GitHub push and pull_request payload fields this service reads.
 * Each event populates only its own subset; everything else stays null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        String action,
        String ref,
        Pusher pusher,
        List<Commit> commits,
        @JsonProperty("head_commit") Commit headCommit,
        Repository repository,
        @JsonProperty("pull_request") PullRequest pullRequest
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pusher(String name) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Commit(String id, String timestamp, CommitAuthor author) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitAuthor(String name) {}
    /** {@code pushedAt} is epoch seconds in push payloads and an ISO string elsewhere. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("pushed_at") Object pushedAt) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Long number, User user, Branch head, Branch base, Boolean merged,
                              @JsonProperty("created_at") String createdAt,
                              @JsonProperty("updated_at") String updatedAt,
                              @JsonProperty("merged_at") String mergedAt) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String login) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Branch(String ref) {}
}
