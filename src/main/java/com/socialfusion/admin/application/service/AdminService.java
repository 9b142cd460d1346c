package com.socialfusion.admin.application.service;

import com.socialfusion.admin.application.port.in.ClearCachesUseCase;
import com.socialfusion.admin.application.port.in.GetStatsUseCase;
import com.socialfusion.admin.application.port.out.CacheAdminPort;
import com.socialfusion.application.port.in.ReplyFilteringSettingsUseCase;
import com.socialfusion.application.port.out.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class AdminService implements ClearCachesUseCase, GetStatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final CacheAdminPort cacheAdminPort;
    private final MetricsPort metricsPort;
    private final ReplyFilteringSettingsUseCase settings;

    public AdminService(CacheAdminPort cacheAdminPort, MetricsPort metricsPort, ReplyFilteringSettingsUseCase settings) {
        this.cacheAdminPort = cacheAdminPort;
        this.metricsPort = metricsPort;
        this.settings = settings;
    }

    @Override
    public Map<String, Integer> clearCaches() {
        log.warn("Cache clear initiated");

        Map<String, Integer> cleared = cacheAdminPort.clearAll();

        // counters describe the cached state, so they start over with it
        metricsPort.resetAll();

        log.warn("Cache clear completed: {}", cleared);
        return cleared;
    }

    @Override
    public FeedStats getStats() {
        return new FeedStats(
            cacheAdminPort.sizes(),
            metricsPort.filteredOutCount(),
            metricsPort.failOpenCount(),
            settings.isReplyFilteringEnabled()
        );
    }
}
