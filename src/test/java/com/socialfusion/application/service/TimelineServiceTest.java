package com.socialfusion.application.service;

import com.socialfusion.application.port.in.FilterTimelineUseCase;
import com.socialfusion.application.port.in.GetFollowedAccountsUseCase;
import com.socialfusion.application.port.out.HomeTimelinePort;
import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Page;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import com.socialfusion.support.TestPosts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TimelineService.
 * Tests merging of per-account timelines and hand-off to the reply filter.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("TimelineService")
class TimelineServiceTest {

    private static final LinkedAccount MASTO = new LinkedAccount("m1", Platform.MASTODON, "me", "1", "https://one.social", "t");
    private static final LinkedAccount BSKY = new LinkedAccount("b1", Platform.BLUESKY, "me", "did:plc:me", "https://bsky.example", "t");
    private static final UserIdentity ALICE = UserIdentity.mastodon("alice@one.social");
    private static final UserIdentity CAROL = UserIdentity.bluesky("did:plc:carol");

    @Mock
    private LinkedAccountRepository linkedAccountRepository;

    @Mock
    private HomeTimelinePort mastodonTimeline;

    @Mock
    private HomeTimelinePort blueskyTimeline;

    @Mock
    private GetFollowedAccountsUseCase followedAccounts;

    @Mock
    private FilterTimelineUseCase feedFilter;

    private ExecutorService executor;
    private TimelineService timelineService;

    @BeforeEach
    void setUp() {
        when(mastodonTimeline.platform()).thenReturn(Platform.MASTODON);
        when(blueskyTimeline.platform()).thenReturn(Platform.BLUESKY);
        when(linkedAccountRepository.findAll()).thenReturn(List.of(MASTO, BSKY));
        when(followedAccounts.getFollowedAccounts(anyList())).thenReturn(Set.of(ALICE));
        executor = Executors.newFixedThreadPool(4);
        timelineService = new TimelineService(linkedAccountRepository, List.of(mastodonTimeline, blueskyTimeline),
            followedAccounts, feedFilter, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static UnifiedPost at(UnifiedPost post, int minutes) {
        return UnifiedPost.builder(post.id(), post.platform(), post.author())
            .createdAt(TestPosts.T0.plus(Duration.ofMinutes(minutes)))
            .platformSpecificId(post.platformSpecificId().orElse(null))
            .build();
    }

    @Nested
    @DisplayName("getTimeline")
    class GetTimelineTests {

        @Test
        @DisplayName("Should merge timelines newest first and filter them")
        void shouldMergeAndFilter() {
            UnifiedPost m1 = at(TestPosts.topLevel("1", ALICE), 1);
            UnifiedPost m3 = at(TestPosts.topLevel("3", ALICE), 3);
            UnifiedPost b2 = at(TestPosts.topLevel("at://did:plc:carol/app.bsky.feed.post/2", CAROL), 2);
            when(mastodonTimeline.fetchHomeTimeline(MASTO, 10)).thenReturn(Result.success(List.of(m1, m3)));
            when(blueskyTimeline.fetchHomeTimeline(BSKY, 10)).thenReturn(Result.success(List.of(b2)));
            when(feedFilter.filterTimelineAsync(eq(List.of(m3, b2, m1)), eq(Set.of(ALICE))))
                .thenReturn(CompletableFuture.completedFuture(List.of(m3, m1)));

            Page<UnifiedPost> page = timelineService.getTimeline(10);

            assertEquals(List.of(m3, m1), page.data());
            assertEquals(3, page.considered());
            assertEquals(1, page.filteredOut());
        }

        @Test
        @DisplayName("Should still serve other accounts when one timeline fails")
        void shouldSkipFailedTimeline() {
            UnifiedPost m1 = at(TestPosts.topLevel("1", ALICE), 1);
            when(mastodonTimeline.fetchHomeTimeline(MASTO, 10)).thenReturn(Result.success(List.of(m1)));
            when(blueskyTimeline.fetchHomeTimeline(BSKY, 10))
                .thenReturn(Result.failure(new ResolutionError.Network(Platform.BLUESKY, "HTTP 502")));
            when(feedFilter.filterTimelineAsync(anyList(), anySet()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(invocation.getArgument(0)));

            Page<UnifiedPost> page = timelineService.getTimeline(10);

            assertEquals(List.of(m1), page.data());
        }

        @Test
        @DisplayName("Should return empty page without linked accounts")
        void shouldReturnEmptyWithoutAccounts() {
            when(linkedAccountRepository.findAll()).thenReturn(List.of());

            Page<UnifiedPost> page = timelineService.getTimeline(10);

            assertTrue(page.data().isEmpty());
            verifyNoInteractions(feedFilter);
        }

        @Test
        @DisplayName("Should cancel a running pass when a newer refresh starts")
        void shouldSupersedeRunningPass() throws Exception {
            UnifiedPost m1 = at(TestPosts.topLevel("1", ALICE), 1);
            when(mastodonTimeline.fetchHomeTimeline(eq(MASTO), anyInt())).thenReturn(Result.success(List.of(m1)));
            when(blueskyTimeline.fetchHomeTimeline(eq(BSKY), anyInt())).thenReturn(Result.success(List.of()));
            CompletableFuture<List<UnifiedPost>> slowPass = new CompletableFuture<>();
            when(feedFilter.filterTimelineAsync(anyList(), anySet()))
                .thenReturn(slowPass)
                .thenReturn(CompletableFuture.completedFuture(List.of()));

            ExecutorService caller = Executors.newSingleThreadExecutor();
            try {
                Future<Page<UnifiedPost>> first = caller.submit(() -> timelineService.getTimeline(10));
                await().atMost(Duration.ofSeconds(2))
                    .untilAsserted(() -> verify(feedFilter, times(1)).filterTimelineAsync(anyList(), anySet()));
                // let the first refresh register its pass before the second one starts
                Thread.sleep(100);

                Page<UnifiedPost> second = timelineService.getTimeline(10);
                Page<UnifiedPost> superseded = first.get(2, TimeUnit.SECONDS);

                assertTrue(slowPass.isCancelled());
                assertEquals(List.of(m1), superseded.data());
                assertEquals(List.of(), second.data());
            } finally {
                caller.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("mergePosts")
    class MergePostsTests {

        @Test
        @DisplayName("Should drop duplicate ids and apply the limit")
        void shouldDeduplicateAndLimit() {
            UnifiedPost a = at(TestPosts.topLevel("1", ALICE), 1);
            UnifiedPost b = at(TestPosts.topLevel("2", ALICE), 2);
            UnifiedPost c = at(TestPosts.topLevel("3", ALICE), 3);

            List<UnifiedPost> merged = TimelineService.mergePosts(List.of(a, b, a, c), 2);

            assertEquals(List.of(c, b), merged);
        }
    }
}
