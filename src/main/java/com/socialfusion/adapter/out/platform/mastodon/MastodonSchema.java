package com.socialfusion.adapter.out.platform.mastodon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The parts of the Mastodon client API payloads this service reads.
 */
public final class MastodonSchema {

    private MastodonSchema() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Account(
        String id,
        String username,
        String acct,
        String url
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
        String id,
        @JsonProperty("created_at") Instant createdAt,
        Account account,
        String content,
        String url,
        @JsonProperty("in_reply_to_id") String inReplyToId,
        @JsonProperty("in_reply_to_account_id") String inReplyToAccountId,
        Status reblog,
        Quote quote,
        @JsonProperty("replies_count") int repliesCount,
        @JsonProperty("reblogs_count") int reblogsCount,
        @JsonProperty("favourites_count") int favouritesCount,
        Boolean favourited,
        Boolean reblogged
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Quote(
        String state,
        @JsonProperty("quoted_status") Status quotedStatus
    ) {}

    /**
     * Response of {@code GET /api/v1/statuses/:id/context}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Context(
        List<Status> ancestors,
        List<Status> descendants
    ) {}

    /**
     * One page of {@code GET /api/v1/accounts/:id/following}; {@code nextMaxId} comes from the Link header.
     */
    public record FollowingPage(
        List<Account> accounts,
        String nextMaxId
    ) {}
}
