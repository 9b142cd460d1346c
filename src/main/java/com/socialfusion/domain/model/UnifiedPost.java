package com.socialfusion.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Platform-neutral view of a post.
 * <p>
 * Boosts and reposts own their target through {@code originalPost}, which is an already built
 * immutable value. Nothing points back at the boost, so no cycle can form while timelines merge.
 * {@code sourceAccountId} names the linked account whose timeline delivered the post; platform
 * ids such as Mastodon status ids are only meaningful on that account's server, which
 * {@code server} names for platforms whose ids are not globally unique.
 */
public record UnifiedPost(
    String id,
    Platform platform,
    UserIdentity author,
    String content,
    Instant createdAt,
    PostCounts counts,
    boolean liked,
    boolean reposted,
    Optional<UnifiedPost> originalPost,
    Optional<String> platformSpecificId,
    Optional<String> quotedPostRef,
    Optional<ReplyReference> replyTo,
    Optional<String> sourceAccountId,
    Optional<String> server
) {
    public UnifiedPost {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(author, "author");
        content = content == null ? "" : content;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        counts = counts == null ? PostCounts.ZERO : counts;
        originalPost = originalPost == null ? Optional.empty() : originalPost;
        platformSpecificId = platformSpecificId == null ? Optional.empty() : platformSpecificId.filter(s -> !s.isBlank());
        quotedPostRef = quotedPostRef == null ? Optional.empty() : quotedPostRef;
        replyTo = replyTo == null ? Optional.empty() : replyTo;
        sourceAccountId = sourceAccountId == null ? Optional.empty() : sourceAccountId;
        server = server == null ? Optional.empty() : server.filter(s -> !s.isBlank());
    }

    public boolean isReply() {
        return replyTo.isPresent();
    }

    public boolean isRepost() {
        return originalPost.isPresent();
    }

    /**
     * Key shared by every post of one conversation: the root id when known, else this post's own id,
     * qualified with the issuing server where ids are only unique per server.
     */
    public String threadKey() {
        String anchor = replyTo.flatMap(ReplyReference::rootId)
            .or(() -> platformSpecificId)
            .orElse(id);
        String prefix = platform.name().toLowerCase() + ":";
        return server.map(host -> prefix + host + ":" + anchor).orElse(prefix + anchor);
    }

    public static Builder builder(String id, Platform platform, UserIdentity author) {
        return new Builder(id, platform, author);
    }

    public static final class Builder {
        private final String id;
        private final Platform platform;
        private final UserIdentity author;
        private String content = "";
        private Instant createdAt = Instant.EPOCH;
        private PostCounts counts = PostCounts.ZERO;
        private boolean liked;
        private boolean reposted;
        private UnifiedPost originalPost;
        private String platformSpecificId;
        private String quotedPostRef;
        private ReplyReference replyTo;
        private String sourceAccountId;
        private String server;

        private Builder(String id, Platform platform, UserIdentity author) {
            this.id = id;
            this.platform = platform;
            this.author = author;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder counts(PostCounts counts) {
            this.counts = counts;
            return this;
        }

        public Builder liked(boolean liked) {
            this.liked = liked;
            return this;
        }

        public Builder reposted(boolean reposted) {
            this.reposted = reposted;
            return this;
        }

        public Builder originalPost(UnifiedPost originalPost) {
            this.originalPost = originalPost;
            return this;
        }

        public Builder platformSpecificId(String platformSpecificId) {
            this.platformSpecificId = platformSpecificId;
            return this;
        }

        public Builder quotedPostRef(String quotedPostRef) {
            this.quotedPostRef = quotedPostRef;
            return this;
        }

        public Builder replyTo(ReplyReference replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder sourceAccountId(String sourceAccountId) {
            this.sourceAccountId = sourceAccountId;
            return this;
        }

        public Builder server(String server) {
            this.server = server;
            return this;
        }

        public UnifiedPost build() {
            return new UnifiedPost(id, platform, author, content, createdAt, counts, liked, reposted,
                Optional.ofNullable(originalPost), Optional.ofNullable(platformSpecificId),
                Optional.ofNullable(quotedPostRef), Optional.ofNullable(replyTo),
                Optional.ofNullable(sourceAccountId), Optional.ofNullable(server));
        }
    }
}
