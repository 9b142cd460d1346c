package com.socialfusion.domain.model;

import java.util.Set;

/**
 * Following list of one linked account as fetched.
 *
 * @param complete false when paging stopped at the page limit before the platform ran out of pages
 */
public record FollowingList(Set<UserIdentity> identities, boolean complete) {

    public FollowingList {
        identities = Set.copyOf(identities);
    }

    public static FollowingList complete(Set<UserIdentity> identities) {
        return new FollowingList(identities, true);
    }

    public static FollowingList truncated(Set<UserIdentity> identities) {
        return new FollowingList(identities, false);
    }
}
