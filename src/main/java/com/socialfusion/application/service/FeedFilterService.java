package com.socialfusion.application.service;

import com.socialfusion.application.port.in.FilterTimelineUseCase;
import com.socialfusion.application.port.in.ReplyFilteringSettingsUseCase;
import com.socialfusion.application.port.out.ExpiringCache;
import com.socialfusion.application.port.out.MetricsPort;
import com.socialfusion.application.port.out.ThreadParticipantResolver;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.FilterDecision;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.ReplyReference;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.ThreadParticipants;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import com.socialfusion.infrastructure.config.AppProperties;
import com.socialfusion.infrastructure.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides per post whether a reply is shown.
 * <ol>
 *   <li>Filtering switched off: include.</li>
 *   <li>Not a reply: include. Whether unfollowed authors' top-level posts belong in the feed is
 *       decided while the timeline is built, not here.</li>
 *   <li>Followed author continuing a thread they started: include, without any lookup when the
 *       post names its root author, else once the resolved thread does.</li>
 *   <li>Otherwise include iff the whole thread has at least {@code min-followed-participants}
 *       distinct followed participants.</li>
 * </ol>
 * Any failure to learn the participants includes the post. Filtering may over-include but must
 * never hide content because of an error.
 */
@Service
public class FeedFilterService implements FilterTimelineUseCase, ReplyFilteringSettingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedFilterService.class);

    private final Map<Platform, ThreadParticipantResolver> resolvers;
    private final ExpiringCache<String, ThreadParticipants> participantCache;
    private final Executor executor;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    private final AtomicBoolean replyFilteringEnabled;
    private final ConcurrentMap<String, CompletableFuture<Result<ThreadParticipants, ResolutionError>>> inFlight =
        new ConcurrentHashMap<>();

    public FeedFilterService(
            List<ThreadParticipantResolver> resolvers,
            @Qualifier(CacheConfig.THREAD_PARTICIPANTS) ExpiringCache<String, ThreadParticipants> participantCache,
            @Qualifier("feedExecutor") Executor executor,
            AppProperties appProperties,
            MetricsPort metrics) {
        Map<Platform, ThreadParticipantResolver> byPlatform = new EnumMap<>(Platform.class);
        for (ThreadParticipantResolver resolver : resolvers) {
            byPlatform.put(resolver.platform(), resolver);
        }
        this.resolvers = byPlatform;
        this.participantCache = participantCache;
        this.executor = executor;
        this.appProperties = appProperties;
        this.metrics = metrics;
        this.replyFilteringEnabled = new AtomicBoolean(appProperties.getFilter().isReplyFilteringEnabled());
    }

    @Override
    public boolean isReplyFilteringEnabled() {
        return replyFilteringEnabled.get();
    }

    @Override
    public void setReplyFilteringEnabled(boolean enabled) {
        boolean previous = replyFilteringEnabled.getAndSet(enabled);
        if (previous != enabled) {
            log.info("Reply filtering {}", enabled ? "enabled" : "disabled");
        }
    }

    @Override
    public FilterDecision shouldInclude(UnifiedPost post, Set<UserIdentity> followed) {
        return decide(post, followed, new FilterPass()).join();
    }

    @Override
    public List<UnifiedPost> filterTimeline(List<UnifiedPost> posts, Set<UserIdentity> followed) {
        return filterTimelineAsync(posts, followed).join();
    }

    @Override
    public CompletableFuture<List<UnifiedPost>> filterTimelineAsync(List<UnifiedPost> posts, Set<UserIdentity> followed) {
        if (posts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        FilterPass pass = new FilterPass();
        List<CompletableFuture<FilterDecision>> decisions = new ArrayList<>(posts.size());
        for (UnifiedPost post : posts) {
            decisions.add(decide(post, followed, pass));
        }

        CompletableFuture<List<UnifiedPost>> filtered = CompletableFuture
            .allOf(decisions.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> collectIncluded(posts, decisions));

        filtered.whenComplete((result, error) -> {
            if (unwrap(error) instanceof CancellationException) {
                pass.cancel();
                decisions.forEach(decision -> decision.cancel(false));
                log.debug("Filter pass cancelled with {} posts", posts.size());
            }
        });
        return filtered;
    }

    private List<UnifiedPost> collectIncluded(List<UnifiedPost> posts, List<CompletableFuture<FilterDecision>> decisions) {
        List<UnifiedPost> included = new ArrayList<>(posts.size());
        for (int i = 0; i < posts.size(); i++) {
            if (decisions.get(i).join().include()) {
                included.add(posts.get(i));
            }
        }
        log.info("Filter pass completed: considered={}, included={}, filteredOut={}",
            posts.size(), included.size(), posts.size() - included.size());
        return included;
    }

    private CompletableFuture<FilterDecision> decide(UnifiedPost post, Set<UserIdentity> followed, FilterPass pass) {
        if (!replyFilteringEnabled.get()) {
            return CompletableFuture.completedFuture(report(post, FilterDecision.topLevel()));
        }
        if (!post.isReply()) {
            return CompletableFuture.completedFuture(report(post, FilterDecision.topLevel()));
        }
        if (isSelfReplyFromFollowed(post, followed)) {
            return CompletableFuture.completedFuture(report(post, FilterDecision.selfReply()));
        }

        String threadKey = post.threadKey();
        long started = System.nanoTime();
        return participantsFor(post, threadKey, pass)
            .thenApply(result -> {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                if (result.isFailure()) {
                    log.warn("Thread resolution failed, including post {}: {} ({})",
                        post.id(), result.errorOrNull().message(), result.errorOrNull().code());
                    return report(post, FilterDecision.failOpen(threadKey, elapsed));
                }
                return report(post, judge(post, result.getOrThrow(), followed, threadKey, elapsed));
            })
            .exceptionally(error -> {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException cancellation && pass.isCancelled()) {
                    throw cancellation;
                }
                log.warn("Unexpected error while filtering post {}, including it", post.id(), cause);
                return report(post, FilterDecision.failOpen(threadKey, Duration.ofNanos(System.nanoTime() - started)));
            });
    }

    /**
     * Root author is compared, not the immediate parent: a followed user's thread that someone
     * else replied into still counts as continuation when the root author posts again. Posts that
     * do not name their root author are checked again once the thread is resolved.
     */
    private boolean isSelfReplyFromFollowed(UnifiedPost post, Set<UserIdentity> followed) {
        if (!followed.contains(post.author())) {
            return false;
        }
        Optional<UserIdentity> rootAuthor = post.replyTo().flatMap(ReplyReference::rootAuthor);
        return rootAuthor.isPresent() && rootAuthor.get().equals(post.author());
    }

    private FilterDecision judge(UnifiedPost post, ThreadParticipants participants, Set<UserIdentity> followed,
                                 String threadKey, Duration elapsed) {
        if (followed.contains(post.author()) && participants.isStartedBy(post.author())) {
            return FilterDecision.selfReply(threadKey, elapsed);
        }
        int followedCount = participants.countFollowed(followed);
        if (followedCount >= appProperties.getFilter().getMinFollowedParticipants()) {
            return FilterDecision.enoughFollowed(threadKey, elapsed);
        }
        log.debug("Thread {} has {} followed of {} participants", threadKey, followedCount, participants.size());
        return FilterDecision.filteredOut(threadKey, elapsed);
    }

    private CompletableFuture<Result<ThreadParticipants, ResolutionError>> participantsFor(
            UnifiedPost post, String threadKey, FilterPass pass) {
        Optional<ThreadParticipants> cached = participantCache.get(threadKey);
        metrics.recordCacheLookup(participantCache.name(), cached.isPresent());
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(Result.success(cached.get()));
        }

        ThreadParticipantResolver resolver = resolvers.get(post.platform());
        if (resolver == null) {
            return CompletableFuture.completedFuture(
                Result.failure(new ResolutionError.NotFound(post.platform(), "no resolver configured")));
        }

        // Callers for the same thread share one running resolution. The resolution starts
        // outside compute so its completion can remove the entry again.
        CompletableFuture<Result<ThreadParticipants, ResolutionError>> created = new CompletableFuture<>();
        CompletableFuture<Result<ThreadParticipants, ResolutionError>> shared = inFlight.compute(threadKey,
            (key, running) -> running != null && !running.isDone() ? running : created);
        if (shared == created) {
            startResolution(threadKey, post, resolver, pass, created);
        }
        return shared;
    }

    private void startResolution(String threadKey, UnifiedPost post, ThreadParticipantResolver resolver,
                                 FilterPass pass, CompletableFuture<Result<ThreadParticipants, ResolutionError>> target) {
        Duration timeout = appProperties.getFilter().getResolutionTimeout();
        try {
            CompletableFuture
                .supplyAsync(() -> resolveAndCache(threadKey, post, resolver, pass), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        return Result.failure(new ResolutionError.Network(post.platform(), "timed out after " + timeout));
                    }
                    log.warn("Resolver for {} threw instead of returning an error", post.platform(), cause);
                    return Result.failure(new ResolutionError.Network(post.platform(), String.valueOf(cause)));
                })
                .thenAccept(result -> settle(threadKey, target, result));
        } catch (RejectedExecutionException e) {
            log.warn("Resolution of thread {} rejected by executor", threadKey);
            settle(threadKey, target, Result.failure(new ResolutionError.Network(post.platform(), "executor saturated")));
        }
    }

    private void settle(String threadKey, CompletableFuture<Result<ThreadParticipants, ResolutionError>> target,
                        Result<ThreadParticipants, ResolutionError> result) {
        inFlight.remove(threadKey, target);
        target.complete(result);
    }

    private Result<ThreadParticipants, ResolutionError> resolveAndCache(
            String threadKey, UnifiedPost post, ThreadParticipantResolver resolver, FilterPass pass) {
        long started = System.nanoTime();
        Result<ThreadParticipants, ResolutionError> result = resolver.resolveParticipants(post);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metrics.recordResolution(post.platform(), result.isSuccess(), elapsed);

        // a superseded pass may still hand its result to concurrent waiters, but never caches it
        if (result.isSuccess() && !pass.isCancelled()) {
            participantCache.put(threadKey, result.getOrThrow(), appProperties.getFilter().getThreadParticipantsTtl());
            log.debug("Resolved thread {}: {} participants in {} ms", threadKey, result.getOrThrow().size(), elapsed.toMillis());
        }
        return result;
    }

    private FilterDecision report(UnifiedPost post, FilterDecision decision) {
        metrics.recordDecision(decision.reason());
        log.debug("Filter decision: post={}, include={}, reason={}, thread={}, resolutionMs={}",
            post.id(), decision.include(), decision.reason(), decision.threadKey(), decision.resolutionElapsed().toMillis());
        return decision;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Cancellation flag shared by every resolution started for one {@code filterTimeline} call.
     */
    private static final class FilterPass {
        private final AtomicBoolean cancelled = new AtomicBoolean();

        void cancel() {
            cancelled.set(true);
        }

        boolean isCancelled() {
            return cancelled.get();
        }
    }
}
