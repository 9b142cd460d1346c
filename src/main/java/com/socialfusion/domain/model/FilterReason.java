package com.socialfusion.domain.model;

public enum FilterReason {
    TOP_LEVEL,
    SELF_REPLY_FROM_FOLLOWED,
    THREAD_HAS_ENOUGH_FOLLOWED_PARTICIPANTS,
    FILTERED_OUT,
    ERROR_FAIL_OPEN
}
