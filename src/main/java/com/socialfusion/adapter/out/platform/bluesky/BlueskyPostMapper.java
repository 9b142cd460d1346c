package com.socialfusion.adapter.out.platform.bluesky;

import com.fasterxml.jackson.databind.JsonNode;
import com.socialfusion.application.service.IdentityNormalizer;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.PlatformAccount;
import com.socialfusion.domain.model.PostCounts;
import com.socialfusion.domain.model.ReplyReference;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps timeline feed items to {@link UnifiedPost}. AT URIs are globally unique and serve as
 * both the unified id and the platform id. A reply record always names its root, so root id
 * and root author are known for every Bluesky reply.
 */
@Component
public class BlueskyPostMapper {

    private static final String EMBED_RECORD = "app.bsky.embed.record#view";
    private static final String EMBED_RECORD_WITH_MEDIA = "app.bsky.embed.recordWithMedia#view";

    private final IdentityNormalizer identityNormalizer;

    public BlueskyPostMapper(IdentityNormalizer identityNormalizer) {
        this.identityNormalizer = identityNormalizer;
    }

    public UnifiedPost toUnifiedPost(BlueskySchema.FeedItem item, LinkedAccount source) {
        UnifiedPost post = toUnifiedPost(item.post(), item.reply(), source);
        BlueskySchema.Reason reason = item.reason();
        if (reason == null || !BlueskySchema.REASON_REPOST.equals(reason.type()) || reason.by() == null) {
            return post;
        }
        UserIdentity reposter = identityOf(reason.by());
        return UnifiedPost.builder("repost:" + reposter.value() + ":" + post.id(), Platform.BLUESKY, reposter)
            .createdAt(reason.indexedAt() != null ? reason.indexedAt() : post.createdAt())
            .originalPost(post)
            .reposted(post.reposted())
            .sourceAccountId(source.id())
            .build();
    }

    private UnifiedPost toUnifiedPost(BlueskySchema.PostView view, BlueskySchema.FeedReplyRef feedReply, LinkedAccount source) {
        UserIdentity author = identityOf(view.author());
        BlueskySchema.PostRecord record = view.record();
        UnifiedPost.Builder builder = UnifiedPost.builder(view.uri(), Platform.BLUESKY, author)
            .createdAt(record != null && record.createdAt() != null ? record.createdAt() : view.indexedAt())
            .counts(new PostCounts(view.likeCount(), view.repostCount(), view.replyCount()))
            .liked(view.viewer() != null && view.viewer().like() != null)
            .reposted(view.viewer() != null && view.viewer().repost() != null)
            .platformSpecificId(view.uri())
            .sourceAccountId(source.id());
        if (record != null) {
            builder.content(record.text());
            replyReference(record.reply(), feedReply).ifPresent(builder::replyTo);
        }
        quotedUri(view.embed()).ifPresent(builder::quotedPostRef);
        return builder.build();
    }

    public UserIdentity identityOf(BlueskySchema.ProfileView profile) {
        if (profile == null) {
            return identityNormalizer.normalize(null, Platform.BLUESKY);
        }
        return identityNormalizer.normalize(PlatformAccount.of(profile.did(), profile.handle()), Platform.BLUESKY);
    }

    private Optional<ReplyReference> replyReference(BlueskySchema.ReplyRef reply, BlueskySchema.FeedReplyRef feedReply) {
        if (reply == null || reply.parent() == null || reply.parent().uri() == null) {
            return Optional.empty();
        }
        String rootUri = reply.root() != null ? reply.root().uri() : null;
        UserIdentity rootAuthor = null;
        if (feedReply != null && feedReply.root() != null && feedReply.root().author() != null) {
            rootAuthor = identityOf(feedReply.root().author());
        } else {
            rootAuthor = didOf(rootUri)
                .map(did -> identityNormalizer.normalize(PlatformAccount.of(did, null), Platform.BLUESKY))
                .orElse(null);
        }
        return Optional.of(ReplyReference.of(reply.parent().uri(), rootUri, rootAuthor));
    }

    /**
     * The repository DID of an {@code at://did/collection/rkey} URI.
     */
    static Optional<String> didOf(String atUri) {
        if (atUri == null || !atUri.startsWith("at://")) {
            return Optional.empty();
        }
        String rest = atUri.substring("at://".length());
        int slash = rest.indexOf('/');
        String authority = slash < 0 ? rest : rest.substring(0, slash);
        return authority.startsWith("did:") ? Optional.of(authority) : Optional.empty();
    }

    private static Optional<String> quotedUri(JsonNode embed) {
        if (embed == null || embed.isNull()) {
            return Optional.empty();
        }
        String type = embed.path("$type").asText("");
        JsonNode record = switch (type) {
            case EMBED_RECORD -> embed.path("record");
            case EMBED_RECORD_WITH_MEDIA -> embed.path("record").path("record");
            default -> null;
        };
        if (record == null || !record.hasNonNull("uri")) {
            return Optional.empty();
        }
        return Optional.of(record.get("uri").asText());
    }
}
