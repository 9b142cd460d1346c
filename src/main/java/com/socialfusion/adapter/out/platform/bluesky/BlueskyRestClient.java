package com.socialfusion.adapter.out.platform.bluesky;

import com.socialfusion.domain.model.LinkedAccount;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class BlueskyRestClient implements BlueskyApiClient {

    // the whole conversation is needed, not just what a client would render
    static final int THREAD_DEPTH = 100;
    static final int THREAD_PARENT_HEIGHT = 100;

    private final RestClient restClient;

    public BlueskyRestClient(RestClient platformRestClient) {
        this.restClient = platformRestClient;
    }

    @Override
    public BlueskySchema.ThreadResponse getPostThread(LinkedAccount account, String postUri) {
        return restClient.get()
            .uri(xrpc(account, "app.bsky.feed.getPostThread")
                .queryParam("uri", "{uri}")
                .queryParam("depth", THREAD_DEPTH)
                .queryParam("parentHeight", THREAD_PARENT_HEIGHT)
                .buildAndExpand(postUri)
                .encode()
                .toUri())
            .headers(h -> authorize(h, account))
            .retrieve()
            .body(BlueskySchema.ThreadResponse.class);
    }

    @Override
    public BlueskySchema.FollowsResponse getFollows(LinkedAccount account, String actor, String cursor, int limit) {
        UriComponentsBuilder uri = xrpc(account, "app.bsky.graph.getFollows")
            .queryParam("actor", "{actor}")
            .queryParam("limit", limit);
        if (cursor != null) {
            uri.queryParam("cursor", "{cursor}");
        }
        return restClient.get()
            .uri(uri.buildAndExpand(cursor == null ? new Object[] {actor} : new Object[] {actor, cursor}).encode().toUri())
            .headers(h -> authorize(h, account))
            .retrieve()
            .body(BlueskySchema.FollowsResponse.class);
    }

    @Override
    public BlueskySchema.TimelineResponse getTimeline(LinkedAccount account, int limit) {
        return restClient.get()
            .uri(xrpc(account, "app.bsky.feed.getTimeline").queryParam("limit", limit).build().toUri())
            .headers(h -> authorize(h, account))
            .retrieve()
            .body(BlueskySchema.TimelineResponse.class);
    }

    private static UriComponentsBuilder xrpc(LinkedAccount account, String method) {
        return UriComponentsBuilder.fromUriString(account.serverUrl() + "/xrpc/" + method);
    }

    private static void authorize(HttpHeaders headers, LinkedAccount account) {
        if (account.accessToken() != null && !account.accessToken().isBlank()) {
            headers.setBearerAuth(account.accessToken());
        }
    }
}
