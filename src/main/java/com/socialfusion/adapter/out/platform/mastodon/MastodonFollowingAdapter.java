package com.socialfusion.adapter.out.platform.mastodon;

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
 * Walks {@code GET /api/v1/accounts/:id/following} page by page via the Link header.
 */
@Component
public class MastodonFollowingAdapter implements FollowingListPort {

    private static final Logger log = LoggerFactory.getLogger(MastodonFollowingAdapter.class);
    private static final int MAX_PAGE_SIZE = 80;

    private final MastodonApiClient client;
    private final MastodonPostMapper mapper;
    private final AppProperties appProperties;

    public MastodonFollowingAdapter(MastodonApiClient client, MastodonPostMapper mapper, AppProperties appProperties) {
        this.client = client;
        this.mapper = mapper;
        this.appProperties = appProperties;
    }

    @Override
    public Platform platform() {
        return Platform.MASTODON;
    }

    @Override
    public Result<FollowingList, ResolutionError> fetchFollowing(LinkedAccount account) {
        if (account.platformUserId() == null || account.platformUserId().isBlank()) {
            return Result.failure(new ResolutionError.NotFound(Platform.MASTODON, "account " + account.id() + " has no platform user id"));
        }

        int pageSize = Math.min(MAX_PAGE_SIZE, appProperties.getFollowing().getPageSize());
        int maxPages = appProperties.getFollowing().getMaxPages();
        String host = MastodonPostMapper.hostOf(account);

        Set<UserIdentity> following = new HashSet<>();
        String maxId = null;
        int pages = 0;
        try {
            do {
                MastodonSchema.FollowingPage page = client.getFollowing(account, maxId, pageSize);
                page.accounts().forEach(a -> following.add(mapper.identityOf(a, host)));
                maxId = page.nextMaxId();
                pages++;
            } while (maxId != null && pages < maxPages);
        } catch (RestClientException e) {
            return Result.failure(PlatformErrors.classify(Platform.MASTODON, "following of " + account.id(), e));
        }

        if (maxId != null) {
            log.debug("Following list of {} stopped at {} pages ({} accounts)", account.id(), pages, following.size());
            return Result.success(FollowingList.truncated(following));
        }
        return Result.success(FollowingList.complete(following));
    }
}
