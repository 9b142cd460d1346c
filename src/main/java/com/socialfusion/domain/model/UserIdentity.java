package com.socialfusion.domain.model;

import java.util.Objects;

/**
 * Platform-qualified identity of an account.
 * Two identities are equal only when both value and platform match, so the same person
 * on two platforms is two different identities.
 *
 * @param value platform-native key: {@code user@instance} on Mastodon, a DID (or handle) on Bluesky
 */
public record UserIdentity(String value, Platform platform) {

    public UserIdentity {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(platform, "platform");
    }

    public static UserIdentity mastodon(String acct) {
        return new UserIdentity(acct, Platform.MASTODON);
    }

    public static UserIdentity bluesky(String didOrHandle) {
        return new UserIdentity(didOrHandle, Platform.BLUESKY);
    }

    @Override
    public String toString() {
        return platform.name().toLowerCase() + ":" + value;
    }
}
