package com.socialfusion.domain.model;

import java.time.Duration;

/**
 * Outcome of judging one post. Reported for observability only, never persisted.
 *
 * @param threadKey         thread the decision was made for, null when no resolution was needed
 * @param resolutionElapsed time spent obtaining participants, {@link Duration#ZERO} when skipped
 */
public record FilterDecision(
    boolean include,
    FilterReason reason,
    String threadKey,
    Duration resolutionElapsed
) {
    public static FilterDecision topLevel() {
        return new FilterDecision(true, FilterReason.TOP_LEVEL, null, Duration.ZERO);
    }

    public static FilterDecision selfReply() {
        return new FilterDecision(true, FilterReason.SELF_REPLY_FROM_FOLLOWED, null, Duration.ZERO);
    }

    public static FilterDecision selfReply(String threadKey, Duration elapsed) {
        return new FilterDecision(true, FilterReason.SELF_REPLY_FROM_FOLLOWED, threadKey, elapsed);
    }

    public static FilterDecision enoughFollowed(String threadKey, Duration elapsed) {
        return new FilterDecision(true, FilterReason.THREAD_HAS_ENOUGH_FOLLOWED_PARTICIPANTS, threadKey, elapsed);
    }

    public static FilterDecision filteredOut(String threadKey, Duration elapsed) {
        return new FilterDecision(false, FilterReason.FILTERED_OUT, threadKey, elapsed);
    }

    public static FilterDecision failOpen(String threadKey, Duration elapsed) {
        return new FilterDecision(true, FilterReason.ERROR_FAIL_OPEN, threadKey, elapsed);
    }
}
