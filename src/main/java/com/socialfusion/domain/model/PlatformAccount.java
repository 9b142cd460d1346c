package com.socialfusion.domain.model;

/**
 * Account fields every platform client can supply once it has decoded its native payload.
 *
 * @param id     platform-native id: Mastodon numeric id, Bluesky DID
 * @param handle Mastodon {@code acct} (bare for accounts local to {@code host}), Bluesky handle
 * @param host   instance host the payload came from, used to qualify local Mastodon handles
 */
public record PlatformAccount(String id, String handle, String host) {

    public static PlatformAccount of(String id, String handle) {
        return new PlatformAccount(id, handle, null);
    }
}
