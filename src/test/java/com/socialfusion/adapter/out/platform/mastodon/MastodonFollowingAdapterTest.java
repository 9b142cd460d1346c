package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.application.service.IdentityNormalizer;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.FollowingList;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UserIdentity;
import com.socialfusion.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("MastodonFollowingAdapter")
class MastodonFollowingAdapterTest {

    private static final LinkedAccount ACCOUNT =
        new LinkedAccount("m1", Platform.MASTODON, "me", "42", "https://example.social", null);
    private static final String FOLLOWING_URL = "https://example.social/api/v1/accounts/42/following?limit=80";

    private MockRestServiceServer server;
    private AppProperties appProperties;
    private MastodonFollowingAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        appProperties = new AppProperties();
        adapter = new MastodonFollowingAdapter(new MastodonRestClient(builder.build()),
            new MastodonPostMapper(new IdentityNormalizer()), appProperties);
    }

    @Test
    @DisplayName("Should follow the Link header across pages")
    void shouldPaginate() {
        HttpHeaders firstPage = new HttpHeaders();
        firstPage.add(HttpHeaders.LINK,
            "<https://example.social/api/v1/accounts/42/following?max_id=55>; rel=\"next\", "
                + "<https://example.social/api/v1/accounts/42/following?since_id=99>; rel=\"prev\"");
        server.expect(requestTo(FOLLOWING_URL))
            .andRespond(withSuccess("[{\"id\":\"1\",\"acct\":\"alice\"}]", MediaType.APPLICATION_JSON).headers(firstPage));
        server.expect(requestTo(FOLLOWING_URL + "&max_id=55"))
            .andRespond(withSuccess("[{\"id\":\"2\",\"acct\":\"bob@other.host\"}]", MediaType.APPLICATION_JSON));

        Result<FollowingList, ResolutionError> result = adapter.fetchFollowing(ACCOUNT);

        assertEquals(Set.of(UserIdentity.mastodon("alice@example.social"), UserIdentity.mastodon("bob@other.host")),
            result.getOrThrow().identities());
        assertTrue(result.getOrThrow().complete());
        server.verify();
    }

    @Test
    @DisplayName("Should stop at the configured page limit and flag the list as incomplete")
    void shouldStopAtMaxPages() {
        appProperties.getFollowing().setMaxPages(1);
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LINK, "<https://example.social/api/v1/accounts/42/following?max_id=55>; rel=\"next\"");
        server.expect(requestTo(FOLLOWING_URL))
            .andRespond(withSuccess("[{\"id\":\"1\",\"acct\":\"alice\"}]", MediaType.APPLICATION_JSON).headers(headers));

        Result<FollowingList, ResolutionError> result = adapter.fetchFollowing(ACCOUNT);

        assertEquals(1, result.getOrThrow().identities().size());
        assertFalse(result.getOrThrow().complete());
        server.verify();
    }

    @Test
    @DisplayName("Should fail the whole list when a page fails")
    void shouldFailOnError() {
        server.expect(requestTo(FOLLOWING_URL)).andRespond(withUnauthorizedRequest());

        Result<FollowingList, ResolutionError> result = adapter.fetchFollowing(ACCOUNT);

        assertInstanceOf(ResolutionError.Network.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should parse next max_id from Link header")
    void shouldParseNextMaxId() {
        assertEquals("55", MastodonRestClient.nextMaxId("<https://h/api?limit=80&max_id=55>; rel=\"next\""));
        assertNull(MastodonRestClient.nextMaxId("<https://h/api?since_id=1>; rel=\"prev\""));
        assertNull(MastodonRestClient.nextMaxId(null));
    }
}
