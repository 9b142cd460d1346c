package com.socialfusion.domain.model;

import com.socialfusion.support.TestPosts;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UnifiedPostTest {

    private static final UserIdentity ALICE = UserIdentity.mastodon("alice@example.social");

    @Test
    void shouldUseRootIdAsThreadKeyWhenKnown() {
        UnifiedPost post = TestPosts.reply("200", ALICE, "100", null);

        assertEquals("mastodon:example.social:100", post.threadKey());
    }

    @Test
    void shouldFallBackToOwnIdWhenRootUnknown() {
        UnifiedPost post = TestPosts.replyToParent("200", ALICE, "150");

        assertEquals("mastodon:example.social:200", post.threadKey());
    }

    @Test
    void shouldFallBackToUnifiedIdWithoutPlatformId() {
        UnifiedPost post = UnifiedPost.builder("local-1", Platform.BLUESKY, UserIdentity.bluesky("did:plc:abc")).build();

        assertEquals("bluesky:local-1", post.threadKey());
    }

    @Test
    void shouldTreatBlankPlatformIdAsMissing() {
        UnifiedPost post = UnifiedPost.builder("x", Platform.MASTODON, ALICE).platformSpecificId("  ").build();

        assertEquals(Optional.empty(), post.platformSpecificId());
    }

    @Test
    void shouldDistinguishReplyFromRepost() {
        UnifiedPost original = TestPosts.topLevel("1", ALICE);
        UnifiedPost boost = UnifiedPost.builder("boost", Platform.MASTODON, UserIdentity.mastodon("bob@example.social"))
            .originalPost(original)
            .build();

        assertTrue(boost.isRepost());
        assertFalse(boost.isReply());
        assertTrue(TestPosts.replyToParent("2", ALICE, "1").isReply());
    }

    @Test
    void shouldDefaultMissingFields() {
        UnifiedPost post = new UnifiedPost("id", Platform.MASTODON, ALICE, null, null, null, false, false,
            null, null, null, null, null, null);

        assertEquals("", post.content());
        assertEquals(PostCounts.ZERO, post.counts());
        assertTrue(post.replyTo().isEmpty());
    }
}
