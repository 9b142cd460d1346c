package com.socialfusion.domain.model;

import java.util.Objects;

/**
 * An account the user has connected. Credentials are supplied from outside (configuration);
 * this service never stores them.
 *
 * @param id             stable local id, used as the following-cache key
 * @param platformUserId Mastodon numeric account id or Bluesky DID
 * @param serverUrl      instance base URL (Mastodon) or app view / PDS base URL (Bluesky)
 */
public record LinkedAccount(
    String id,
    Platform platform,
    String handle,
    String platformUserId,
    String serverUrl,
    String accessToken
) {
    public LinkedAccount {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(platform, "platform");
    }

    @Override
    public String toString() {
        // keep the token out of logs
        return "LinkedAccount[" + id + ", " + platform + ", " + handle + "]";
    }
}
