package com.socialfusion.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * What a reply points at. Only the parent id is guaranteed; root id and root author are
 * filled in when the platform exposes them (Bluesky does, Mastodon never does).
 */
public record ReplyReference(
    String parentId,
    Optional<String> rootId,
    Optional<UserIdentity> rootAuthor
) {
    public ReplyReference {
        Objects.requireNonNull(parentId, "parentId");
        rootId = rootId == null ? Optional.empty() : rootId;
        rootAuthor = rootAuthor == null ? Optional.empty() : rootAuthor;
    }

    public static ReplyReference toParent(String parentId) {
        return new ReplyReference(parentId, Optional.empty(), Optional.empty());
    }

    public static ReplyReference of(String parentId, String rootId, UserIdentity rootAuthor) {
        return new ReplyReference(parentId, Optional.ofNullable(rootId), Optional.ofNullable(rootAuthor));
    }
}
