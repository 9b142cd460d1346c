package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.domain.model.LinkedAccount;

import java.util.List;

/**
 * Raw Mastodon client API calls. Implementations throw
 * {@link org.springframework.web.client.RestClientException} on transport, status and decoding failures.
 */
public interface MastodonApiClient {

    MastodonSchema.Context getContext(LinkedAccount account, String statusId);

    MastodonSchema.FollowingPage getFollowing(LinkedAccount account, String maxId, int limit);

    List<MastodonSchema.Status> getHomeTimeline(LinkedAccount account, int limit);
}
