package com.socialfusion.application.port.in;

import com.socialfusion.domain.model.FilterDecision;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.domain.model.UserIdentity;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

public interface FilterTimelineUseCase {

    /**
     * Judges a single post. Never throws for platform failures; those become fail-open decisions.
     */
    FilterDecision shouldInclude(UnifiedPost post, Set<UserIdentity> followed);

    /**
     * Filters a timeline, keeping the input order of the included posts.
     */
    List<UnifiedPost> filterTimeline(List<UnifiedPost> posts, Set<UserIdentity> followed);

    /**
     * Same as {@link #filterTimeline} but returns immediately. Cancelling the returned future
     * cancels the outstanding thread resolutions of this pass; they will not populate the cache.
     */
    CompletableFuture<List<UnifiedPost>> filterTimelineAsync(List<UnifiedPost> posts, Set<UserIdentity> followed);
}
