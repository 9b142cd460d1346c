package com.socialfusion.admin.application.port.in;

import java.util.Map;

public interface GetStatsUseCase {

    FeedStats getStats();

    record FeedStats(
        Map<String, Integer> cacheSizes,
        long filteredOut,
        long failOpen,
        boolean replyFilteringEnabled
    ) {}
}
