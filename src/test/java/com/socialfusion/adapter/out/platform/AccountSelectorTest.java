package com.socialfusion.adapter.out.platform;

import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.ReplyReference;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AccountSelector")
class AccountSelectorTest {

    private static final LinkedAccount ONE = new LinkedAccount("m1", Platform.MASTODON, "me", "1", "https://one.social", null);
    private static final LinkedAccount TWO = new LinkedAccount("m2", Platform.MASTODON, "me", "2", "https://two.social", null);
    private static final UserIdentity AUTHOR = UserIdentity.mastodon("alice@two.social");

    @Mock
    private LinkedAccountRepository repository;

    private AccountSelector selector;

    @BeforeEach
    void setUp() {
        when(repository.findById("m1")).thenReturn(Optional.of(ONE));
        when(repository.findById("m2")).thenReturn(Optional.of(TWO));
        when(repository.findByPlatform(Platform.MASTODON)).thenReturn(List.of(ONE, TWO));
        selector = new AccountSelector(repository);
    }

    private static UnifiedPost.Builder reply(String server) {
        return UnifiedPost.builder("mastodon:" + server + ":5", Platform.MASTODON, AUTHOR)
            .platformSpecificId("5")
            .server(server)
            .replyTo(ReplyReference.toParent("4"));
    }

    @Test
    @DisplayName("Should prefer the account that delivered the post")
    void shouldUseSourceAccount() {
        assertEquals(Optional.of(TWO), selector.accountFor(reply("two.social").sourceAccountId("m2").build()));
    }

    @Test
    @DisplayName("Should fall back to an account on the server that issued the post id")
    void shouldFallBackToSameServer() {
        assertEquals(Optional.of(TWO), selector.accountFor(reply("two.social").build()));
    }

    @Test
    @DisplayName("Should find no account when none is on the post's server")
    void shouldNotUseAccountOnOtherServer() {
        assertTrue(selector.accountFor(reply("three.social").build()).isEmpty());
    }

    @Test
    @DisplayName("Should take any account of the platform when ids are not server-scoped")
    void shouldUseAnyAccountWithoutServer() {
        UnifiedPost post = UnifiedPost.builder("x", Platform.MASTODON, AUTHOR).platformSpecificId("5").build();

        assertEquals(Optional.of(ONE), selector.accountFor(post));
    }
}
