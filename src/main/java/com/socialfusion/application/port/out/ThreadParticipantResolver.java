package com.socialfusion.application.port.out;

import com.socialfusion.domain.error.ResolutionError;
import com.socialfusion.domain.model.Platform;
import com.socialfusion.domain.model.Result;
import com.socialfusion.domain.model.ThreadParticipants;
import com.socialfusion.domain.model.UnifiedPost;

/**
 * Resolves who takes part in the thread of a post, one implementation per platform.
 * Implementations are stateless and do not cache; callers own caching.
 * The call blocks on network I/O.
 */
public interface ThreadParticipantResolver {

    Platform platform();

    Result<ThreadParticipants, ResolutionError> resolveParticipants(UnifiedPost post);
}
