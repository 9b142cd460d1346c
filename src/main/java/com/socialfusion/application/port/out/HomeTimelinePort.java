package com.socialfusion.application.port.out;

import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.LinkedAccount;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.UnifiedPost;

import java.util.List;

/**
 * Fetches the newest page of a linked account's home timeline, already normalized.
 */
public interface HomeTimelinePort {

    Platform platform();

    Result<List<UnifiedPost>, ResolutionError> fetchHomeTimeline(LinkedAccount account, int limit);
}
