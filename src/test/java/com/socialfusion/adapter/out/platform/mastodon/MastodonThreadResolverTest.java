package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.adapter.out.platform.AccountSelector;
import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.application.service.IdentityNormalizer;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.ThreadParticipants;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import com.socialfusion.support.TestPosts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("MastodonThreadResolver")
class MastodonThreadResolverTest {

    private static final LinkedAccount ACCOUNT =
        new LinkedAccount("m1", Platform.MASTODON, "me", "42", "https://example.social", "secret");
    private static final UserIdentity AUTHOR = UserIdentity.mastodon("carol@example.social");
    private static final String CONTEXT_URL = "https://example.social/api/v1/statuses/200/context";

    private MockRestServiceServer server;
    private MastodonThreadResolver resolver;
    private final UnifiedPost reply = TestPosts.replyToParent("200", AUTHOR, "150");

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        LinkedAccountRepository repository = mock(LinkedAccountRepository.class);
        when(repository.findById("m1")).thenReturn(Optional.of(ACCOUNT));
        when(repository.findByPlatform(Platform.MASTODON)).thenReturn(List.of(ACCOUNT));
        resolver = new MastodonThreadResolver(new MastodonRestClient(builder.build()),
            new MastodonPostMapper(new IdentityNormalizer()), new AccountSelector(repository));
    }

    @Test
    @DisplayName("Should collect ancestor and descendant authors plus the post author")
    void shouldCollectParticipants() {
        server.expect(requestTo(CONTEXT_URL))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header("Authorization", "Bearer secret"))
            .andRespond(withSuccess("""
                {
                  "ancestors": [
                    {"id": "100", "account": {"id": "1", "acct": "alice"}, "content": "root"},
                    {"id": "150", "account": {"id": "2", "acct": "Bob@Other.Host"}, "in_reply_to_id": "100"}
                  ],
                  "descendants": [
                    {"id": "300", "account": {"id": "1", "acct": "alice"}, "in_reply_to_id": "200"}
                  ]
                }
                """, MediaType.APPLICATION_JSON));

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(reply);

        assertTrue(result.isSuccess());
        assertEquals(Set.of(AUTHOR, UserIdentity.mastodon("alice@example.social"), UserIdentity.mastodon("bob@other.host")),
            result.getOrThrow().identities());
        assertEquals(Optional.of(UserIdentity.mastodon("alice@example.social")), result.getOrThrow().rootAuthor());
        server.verify();
    }

    @Test
    @DisplayName("Should leave the root author unknown when the context has no ancestors")
    void shouldLeaveRootAuthorUnknownWithoutAncestors() {
        server.expect(requestTo(CONTEXT_URL))
            .andRespond(withSuccess("{\"ancestors\": [], \"descendants\": []}", MediaType.APPLICATION_JSON));

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(reply);

        assertEquals(Set.of(AUTHOR), result.getOrThrow().identities());
        assertTrue(result.getOrThrow().rootAuthor().isEmpty());
    }

    @Test
    @DisplayName("Should report a deleted status as not found")
    void shouldMapNotFound() {
        server.expect(requestTo(CONTEXT_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(reply);

        assertInstanceOf(ResolutionError.NotFound.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should report server errors as network errors")
    void shouldMapServerError() {
        server.expect(requestTo(CONTEXT_URL)).andRespond(withServerError());

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(reply);

        assertInstanceOf(ResolutionError.Network.class, result.errorOrNull());
        assertEquals("NETWORK_ERROR", result.errorOrNull().code());
    }

    @Test
    @DisplayName("Should report unparseable bodies as decode errors")
    void shouldMapMalformedJson() {
        server.expect(requestTo(CONTEXT_URL)).andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(reply);

        assertInstanceOf(ResolutionError.Decode.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should report a context without lists as a decode error")
    void shouldRejectIncompleteContext() {
        server.expect(requestTo(CONTEXT_URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(reply);

        assertInstanceOf(ResolutionError.Decode.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should refuse posts from another platform without calling out")
    void shouldRejectForeignPost() {
        UnifiedPost bluesky = TestPosts.replyToParent("at://x", UserIdentity.bluesky("did:plc:x"), "at://p");

        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(bluesky);

        assertInstanceOf(ResolutionError.NotFound.class, result.errorOrNull());
        server.verify();
    }
}
