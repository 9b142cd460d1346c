package com.socialfusion.adapter.out.platform.bluesky;

import com.socialfusion.domain.model.LinkedAccount;

/**
 * Read-only XRPC calls against the app view configured for a linked account.
 * Failures surface as {@link org.springframework.web.client.RestClientException}.
 */
public interface BlueskyApiClient {

    BlueskySchema.ThreadResponse getPostThread(LinkedAccount account, String postUri);

    BlueskySchema.FollowsResponse getFollows(LinkedAccount account, String actor, String cursor, int limit);

    BlueskySchema.TimelineResponse getTimeline(LinkedAccount account, int limit);
}
