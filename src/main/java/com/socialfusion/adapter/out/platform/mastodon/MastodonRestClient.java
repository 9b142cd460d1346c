package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.domain.model.LinkedAccount;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class MastodonRestClient implements MastodonApiClient {

    private static final ParameterizedTypeReference<List<MastodonSchema.Account>> ACCOUNT_LIST =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<MastodonSchema.Status>> STATUS_LIST =
        new ParameterizedTypeReference<>() {};

    // <https://host/api/v1/accounts/1/following?max_id=123>; rel="next"
    private static final Pattern NEXT_MAX_ID = Pattern.compile("<[^>]*[?&]max_id=([^&>]+)[^>]*>\\s*;\\s*rel=\"next\"");

    private final RestClient restClient;

    public MastodonRestClient(RestClient platformRestClient) {
        this.restClient = platformRestClient;
    }

    @Override
    public MastodonSchema.Context getContext(LinkedAccount account, String statusId) {
        return restClient.get()
            .uri(account.serverUrl() + "/api/v1/statuses/{id}/context", statusId)
            .headers(h -> authorize(h, account))
            .retrieve()
            .body(MastodonSchema.Context.class);
    }

    @Override
    public MastodonSchema.FollowingPage getFollowing(LinkedAccount account, String maxId, int limit) {
        UriComponentsBuilder uri = UriComponentsBuilder
            .fromUriString(account.serverUrl() + "/api/v1/accounts/{id}/following")
            .queryParam("limit", limit);
        if (maxId != null) {
            uri.queryParam("max_id", maxId);
        }

        ResponseEntity<List<MastodonSchema.Account>> response = restClient.get()
            .uri(uri.buildAndExpand(account.platformUserId()).toUri())
            .headers(h -> authorize(h, account))
            .retrieve()
            .toEntity(ACCOUNT_LIST);

        List<MastodonSchema.Account> accounts = response.getBody() == null ? List.of() : response.getBody();
        return new MastodonSchema.FollowingPage(accounts, nextMaxId(response.getHeaders().getFirst(HttpHeaders.LINK)));
    }

    @Override
    public List<MastodonSchema.Status> getHomeTimeline(LinkedAccount account, int limit) {
        List<MastodonSchema.Status> statuses = restClient.get()
            .uri(account.serverUrl() + "/api/v1/timelines/home?limit={limit}", limit)
            .headers(h -> authorize(h, account))
            .retrieve()
            .body(STATUS_LIST);
        return statuses == null ? List.of() : statuses;
    }

    static String nextMaxId(String linkHeader) {
        if (linkHeader == null) {
            return null;
        }
        Matcher matcher = NEXT_MAX_ID.matcher(linkHeader);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static void authorize(HttpHeaders headers, LinkedAccount account) {
        if (account.accessToken() != null && !account.accessToken().isBlank()) {
            headers.setBearerAuth(account.accessToken());
        }
    }
}
