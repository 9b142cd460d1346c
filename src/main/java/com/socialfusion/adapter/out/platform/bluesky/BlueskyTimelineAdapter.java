package com.socialfusion.adapter.out.platform.bluesky;

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

@Component
public class BlueskyTimelineAdapter implements HomeTimelinePort {

    private final BlueskyApiClient client;
    private final BlueskyPostMapper mapper;

    public BlueskyTimelineAdapter(BlueskyApiClient client, BlueskyPostMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public Platform platform() {
        return Platform.BLUESKY;
    }

    @Override
    public Result<List<UnifiedPost>, ResolutionError> fetchHomeTimeline(LinkedAccount account, int limit) {
        BlueskySchema.TimelineResponse response;
        try {
            response = client.getTimeline(account, Math.min(limit, 100));
        } catch (RestClientException e) {
            return Result.failure(PlatformErrors.classify(Platform.BLUESKY, "timeline of " + account.id(), e));
        }
        if (response == null || response.feed() == null) {
            return Result.failure(PlatformErrors.malformed(Platform.BLUESKY, "timeline of " + account.id() + " has no feed"));
        }
        return Result.success(response.feed().stream()
            .filter(item -> item != null && item.post() != null && item.post().uri() != null)
            .map(item -> mapper.toUnifiedPost(item, account))
            .toList());
    }
}
