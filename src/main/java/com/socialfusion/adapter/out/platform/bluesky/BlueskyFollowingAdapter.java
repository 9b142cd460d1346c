package com.socialfusion.adapter.out.platform.bluesky;

import com.socialfusion.adapter.out.platform.PlatformErrors;
import com.socialfusion.application.port.out.FollowingListPort;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.FollowingList;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UserIdentity;
import com.socialfusion.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.HashSet;
import java.util.Set;

/**
 * Walks {@code app.bsky.graph.getFollows} by cursor.
 */
@Component
public class BlueskyFollowingAdapter implements FollowingListPort {

    private static final Logger log = LoggerFactory.getLogger(BlueskyFollowingAdapter.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final BlueskyApiClient client;
    private final BlueskyPostMapper mapper;
    private final AppProperties appProperties;

    public BlueskyFollowingAdapter(BlueskyApiClient client, BlueskyPostMapper mapper, AppProperties appProperties) {
        this.client = client;
        this.mapper = mapper;
        this.appProperties = appProperties;
    }

    @Override
    public Platform platform() {
        return Platform.BLUESKY;
    }

    @Override
    public Result<FollowingList, ResolutionError> fetchFollowing(LinkedAccount account) {
        String actor = account.platformUserId() != null && !account.platformUserId().isBlank()
            ? account.platformUserId()
            : account.handle();
        if (actor == null || actor.isBlank()) {
            return Result.failure(new ResolutionError.NotFound(Platform.BLUESKY, "account " + account.id() + " has neither DID nor handle"));
        }

        int pageSize = Math.min(MAX_PAGE_SIZE, appProperties.getFollowing().getPageSize());
        int maxPages = appProperties.getFollowing().getMaxPages();

        Set<UserIdentity> following = new HashSet<>();
        String cursor = null;
        int pages = 0;
        try {
            do {
                BlueskySchema.FollowsResponse page = client.getFollows(account, actor, cursor, pageSize);
                if (page == null || page.follows() == null) {
                    return Result.failure(PlatformErrors.malformed(Platform.BLUESKY, "getFollows for " + actor + " returned no follows"));
                }
                page.follows().forEach(p -> following.add(mapper.identityOf(p)));
                cursor = page.cursor();
                pages++;
            } while (cursor != null && pages < maxPages);
        } catch (RestClientException e) {
            return Result.failure(PlatformErrors.classify(Platform.BLUESKY, "follows of " + actor, e));
        }

        if (cursor != null) {
            log.debug("Following list of {} stopped at {} pages ({} accounts)", account.id(), pages, following.size());
            return Result.success(FollowingList.truncated(following));
        }
        return Result.success(FollowingList.complete(following));
    }
}
