package com.socialfusion.application.service;

import com.socialfusion.application.port.in.FilterTimelineUseCase;
import com.socialfusion.application.port.in.GetFollowedAccountsUseCase;
import com.socialfusion.application.port.in.GetTimelineUseCase;
import com.socialfusion.application.port.out.HomeTimelinePort;
import com.socialfusion.application.port.out.LinkedAccountRepository;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Page;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Assembles the unified home timeline: fetches every linked account's home timeline
 * concurrently, merges them newest first and runs the reply filter over the result.
 * <p>
 * Only the latest refresh matters. Starting a refresh cancels the filter pass of one still
 * running; the superseded caller gets its merged posts unfiltered.
 */
@Service
public class TimelineService implements GetTimelineUseCase {

    private static final Logger log = LoggerFactory.getLogger(TimelineService.class);

    private final LinkedAccountRepository linkedAccountRepository;
    private final Map<Platform, HomeTimelinePort> timelinePorts;
    private final GetFollowedAccountsUseCase followedAccounts;
    private final FilterTimelineUseCase feedFilter;
    private final Executor executor;

    private final AtomicReference<CompletableFuture<List<UnifiedPost>>> currentPass = new AtomicReference<>();

    public TimelineService(
            LinkedAccountRepository linkedAccountRepository,
            List<HomeTimelinePort> timelinePorts,
            GetFollowedAccountsUseCase followedAccounts,
            FilterTimelineUseCase feedFilter,
            @Qualifier("feedExecutor") Executor executor) {
        Map<Platform, HomeTimelinePort> byPlatform = new EnumMap<>(Platform.class);
        for (HomeTimelinePort port : timelinePorts) {
            byPlatform.put(port.platform(), port);
        }
        this.linkedAccountRepository = linkedAccountRepository;
        this.timelinePorts = byPlatform;
        this.followedAccounts = followedAccounts;
        this.feedFilter = feedFilter;
        this.executor = executor;
    }

    @Override
    public Page<UnifiedPost> getTimeline(int limit) {
        List<LinkedAccount> accounts = linkedAccountRepository.findAll();
        if (accounts.isEmpty()) {
            log.debug("No linked accounts, timeline empty");
            return Page.empty();
        }

        List<CompletableFuture<List<UnifiedPost>>> fetches = new ArrayList<>(accounts.size());
        for (LinkedAccount account : accounts) {
            fetches.add(fetchTimeline(account, limit));
        }

        // Following lookups run on the caller thread while the timeline fetches are in flight.
        Set<UserIdentity> followed = followedAccounts.getFollowedAccounts(accounts);

        List<UnifiedPost> fetched = new ArrayList<>();
        for (CompletableFuture<List<UnifiedPost>> fetch : fetches) {
            fetched.addAll(fetch.join());
        }
        List<UnifiedPost> merged = mergePosts(fetched, limit);
        if (merged.isEmpty()) {
            return Page.empty();
        }

        CompletableFuture<List<UnifiedPost>> pass = feedFilter.filterTimelineAsync(merged, followed);
        CompletableFuture<List<UnifiedPost>> previous = currentPass.getAndSet(pass);
        if (previous != null && !previous.isDone()) {
            previous.cancel(true);
            log.info("Superseded a running filter pass");
        }

        List<UnifiedPost> filtered;
        try {
            filtered = pass.join();
        } catch (CancellationException e) {
            log.info("Filter pass superseded by a newer refresh, returning {} posts unfiltered", merged.size());
            filtered = merged;
        } finally {
            currentPass.compareAndSet(pass, null);
        }

        log.info("Timeline served: accounts={}, fetched={}, merged={}, shown={}, followed={}",
            accounts.size(), fetched.size(), merged.size(), filtered.size(), followed.size());
        return Page.of(filtered, merged.size());
    }

    private CompletableFuture<List<UnifiedPost>> fetchTimeline(LinkedAccount account, int limit) {
        HomeTimelinePort port = timelinePorts.get(account.platform());
        if (port == null) {
            log.warn("No timeline adapter for {} account {}", account.platform(), account.id());
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture
            .supplyAsync(() -> port.fetchHomeTimeline(account, limit), executor)
            .handle((result, error) -> {
                if (error != null) {
                    log.warn("Timeline fetch for account {} failed unexpectedly", account.id(), error);
                    return List.of();
                }
                return unwrap(account, result);
            });
    }

    private List<UnifiedPost> unwrap(LinkedAccount account, Result<List<UnifiedPost>, ResolutionError> result) {
        if (result.isFailure()) {
            ResolutionError error = result.errorOrNull();
            log.warn("Timeline of account {} unavailable: {} ({})", account.id(), error.message(), error.code());
            return List.of();
        }
        return result.getOrThrow();
    }

    /**
     * Merge per-account timelines, newest first, dropping duplicate ids.
     */
    static List<UnifiedPost> mergePosts(List<UnifiedPost> posts, int limit) {
        Set<String> seenIds = new HashSet<>();
        return posts.stream()
            .filter(p -> seenIds.add(p.id()))
            .sorted(Comparator.comparing(UnifiedPost::createdAt).reversed().thenComparing(UnifiedPost::id))
            .limit(limit)
            .toList();
    }
}
