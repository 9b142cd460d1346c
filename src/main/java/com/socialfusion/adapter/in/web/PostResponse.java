package com.socialfusion.adapter.in.web;

import com.socialfusion.domain.model.ReplyReference;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;

import java.time.Instant;

public record PostResponse(
    String id,
    String platform,
    String author,
    String content,
    Instant createdAt,
    int likes,
    int reposts,
    int replies,
    boolean liked,
    boolean reposted,
    String inReplyTo,
    String threadRootAuthor,
    String quotedPost,
    PostResponse repostOf
) {
    public static PostResponse from(UnifiedPost post) {
        return new PostResponse(
            post.id(),
            post.platform().name().toLowerCase(),
            post.author().value(),
            post.content(),
            post.createdAt(),
            post.counts().likes(),
            post.counts().reposts(),
            post.counts().replies(),
            post.liked(),
            post.reposted(),
            post.replyTo().map(ReplyReference::parentId).orElse(null),
            post.replyTo().flatMap(ReplyReference::rootAuthor).map(UserIdentity::value).orElse(null),
            post.quotedPostRef().orElse(null),
            post.originalPost().map(PostResponse::from).orElse(null)
        );
    }
}
