package com.socialfusion.adapter.out.platform.bluesky;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * The parts of the {@code app.bsky.*} XRPC lexicons this service reads.
 */
public final class BlueskySchema {

    private BlueskySchema() {}

    static final String THREAD_VIEW_POST = "app.bsky.feed.defs#threadViewPost";
    static final String NOT_FOUND_POST = "app.bsky.feed.defs#notFoundPost";
    static final String BLOCKED_POST = "app.bsky.feed.defs#blockedPost";
    static final String REASON_REPOST = "app.bsky.feed.defs#reasonRepost";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProfileView(
        String did,
        String handle,
        String displayName
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StrongRef(
        String uri,
        String cid
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReplyRef(
        StrongRef root,
        StrongRef parent
    ) {}

    /**
     * The {@code app.bsky.feed.post} record embedded in a post view.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PostRecord(
        String text,
        Instant createdAt,
        ReplyRef reply
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Viewer(
        String like,
        String repost
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PostView(
        String uri,
        String cid,
        ProfileView author,
        PostRecord record,
        JsonNode embed,
        int likeCount,
        int repostCount,
        int replyCount,
        Instant indexedAt,
        Viewer viewer
    ) {}

    /**
     * Node of a {@code getPostThread} response. Only {@code threadViewPost} nodes carry a post;
     * deleted and blocked posts appear as nodes of their own type.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThreadNode(
        @JsonProperty("$type") String type,
        PostView post,
        ThreadNode parent,
        List<ThreadNode> replies,
        String uri
    ) {
        public boolean isPost() {
            return post != null && (type == null || THREAD_VIEW_POST.equals(type));
        }

        public boolean isNotFound() {
            return NOT_FOUND_POST.equals(type);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThreadResponse(
        ThreadNode thread
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Reason(
        @JsonProperty("$type") String type,
        ProfileView by,
        Instant indexedAt
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FeedReplyRef(
        PostView root,
        PostView parent
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FeedItem(
        PostView post,
        Reason reason,
        FeedReplyRef reply
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimelineResponse(
        List<FeedItem> feed,
        String cursor
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FollowsResponse(
        List<ProfileView> follows,
        String cursor
    ) {}
}
