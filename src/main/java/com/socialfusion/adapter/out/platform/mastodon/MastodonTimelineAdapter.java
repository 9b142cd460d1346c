package com.socialfusion.adapter.out.platform.mastodon;

import com.socialfusion.adapter.out.platform.PlatformErrors;
import com.socialfusion.application.port.out.HomeTimelinePort;
import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UnifiedPost;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Objects;

@Component
public class MastodonTimelineAdapter implements HomeTimelinePort {

    private final MastodonApiClient client;
    private final MastodonPostMapper mapper;

    public MastodonTimelineAdapter(MastodonApiClient client, MastodonPostMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public Platform platform() {
        return Platform.MASTODON;
    }

    @Override
    public Result<List<UnifiedPost>, ResolutionError> fetchHomeTimeline(LinkedAccount account, int limit) {
        List<MastodonSchema.Status> statuses;
        try {
            statuses = client.getHomeTimeline(account, Math.min(limit, 40));
        } catch (RestClientException e) {
            return Result.failure(PlatformErrors.classify(Platform.MASTODON, "home timeline of " + account.id(), e));
        }
        return Result.success(statuses.stream()
            .filter(Objects::nonNull)
            .filter(s -> s.id() != null)
            .map(s -> mapper.toUnifiedPost(s, account))
            .toList());
    }
}
