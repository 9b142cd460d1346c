package com.socialfusion.application.service;

import com.socialfusion.application.port.in.GetFollowedAccountsUseCase;
import com.socialfusion.application.port.out.ExpiringCache;
import com.socialfusion.application.port.out.FollowingListPort;
import com.socialfusion.application.port.out.MetricsPort;
import com.socialfusion.domain.error.FollowingError;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.FollowingList;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UserIdentity;
import com.socialfusion.infrastructure.config.AppProperties;
import com.socialfusion.infrastructure.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the union of everyone the user follows across all linked accounts.
 * One fetch per account runs concurrently; an account whose fetch fails contributes nothing
 * and the others are still returned.
 */
@Service
public class FollowingAggregatorService implements GetFollowedAccountsUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowingAggregatorService.class);

    private final Map<Platform, FollowingListPort> followingPorts;
    private final ExpiringCache<String, Set<UserIdentity>> followingCache;
    private final Executor executor;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public FollowingAggregatorService(
            List<FollowingListPort> followingPorts,
            @Qualifier(CacheConfig.FOLLOWING) ExpiringCache<String, Set<UserIdentity>> followingCache,
            @Qualifier("feedExecutor") Executor executor,
            AppProperties appProperties,
            MetricsPort metrics) {
        Map<Platform, FollowingListPort> byPlatform = new EnumMap<>(Platform.class);
        for (FollowingListPort port : followingPorts) {
            byPlatform.put(port.platform(), port);
        }
        this.followingPorts = byPlatform;
        this.followingCache = followingCache;
        this.executor = executor;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public Set<UserIdentity> getFollowedAccounts(List<LinkedAccount> linkedAccounts) {
        if (linkedAccounts.isEmpty()) {
            return Set.of();
        }

        List<CompletableFuture<Set<UserIdentity>>> fetches = new ArrayList<>(linkedAccounts.size());
        for (LinkedAccount account : linkedAccounts) {
            fetches.add(followingOf(account));
        }

        Set<UserIdentity> followed = new HashSet<>();
        for (CompletableFuture<Set<UserIdentity>> fetch : fetches) {
            followed.addAll(fetch.join());
        }

        log.debug("Aggregated {} followed identities across {} linked accounts", followed.size(), linkedAccounts.size());
        return Collections.unmodifiableSet(followed);
    }

    private CompletableFuture<Set<UserIdentity>> followingOf(LinkedAccount account) {
        Optional<Set<UserIdentity>> cached = followingCache.get(account.id());
        metrics.recordCacheLookup(followingCache.name(), cached.isPresent());
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        FollowingListPort port = followingPorts.get(account.platform());
        if (port == null) {
            return CompletableFuture.completedFuture(degrade(account,
                new ResolutionError.NotFound(account.platform(), "no following adapter for account " + account.id())));
        }

        Duration timeout = appProperties.getFollowing().getFetchTimeout();
        return CompletableFuture
            .supplyAsync(() -> port.fetchFollowing(account), executor)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((result, error) -> {
                if (error != null) {
                    return degrade(account, toResolutionError(account.platform(), error, timeout));
                }
                return accept(account, result);
            });
    }

    private Set<UserIdentity> accept(LinkedAccount account, Result<FollowingList, ResolutionError> result) {
        if (result.isFailure()) {
            return degrade(account, result.errorOrNull());
        }
        FollowingList list = result.getOrThrow();
        Set<UserIdentity> following = list.identities();
        if (!list.complete()) {
            // not cached, the next call fetches the list again
            FollowingError truncated = new FollowingError.TruncatedFollowingList(account.id(), following.size());
            metrics.incrementFollowingFetchFailures(account.platform());
            log.warn("{} ({})", truncated.message(), truncated.code());
            return following;
        }
        followingCache.put(account.id(), following, appProperties.getFollowing().getTtl());
        log.debug("Fetched {} followings for account {}", following.size(), account.id());
        return following;
    }

    private Set<UserIdentity> degrade(LinkedAccount account, ResolutionError cause) {
        FollowingError failure = new FollowingError.PartialFollowingFailure(account.id(), cause);
        metrics.incrementFollowingFetchFailures(account.platform());
        log.warn("{} ({})", failure.message(), failure.code());
        return Set.of();
    }

    private static ResolutionError toResolutionError(Platform platform, Throwable error, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return new ResolutionError.Network(platform, "timed out after " + timeout);
        }
        return new ResolutionError.Network(platform, String.valueOf(cause));
    }
}
