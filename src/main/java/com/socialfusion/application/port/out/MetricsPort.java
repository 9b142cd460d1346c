package com.socialfusion.application.port.out;

import com.socialfusion.domain.model.FilterReason;
import com.socialfusion.domain.model.Platform;

import java.time.Duration;

/**
 * Port for recording feed filter metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void recordDecision(FilterReason reason);

    void recordResolution(Platform platform, boolean success, Duration elapsed);

    void recordCacheLookup(String cacheName, boolean hit);

    void incrementFollowingFetchFailures(Platform platform);

    /**
     * Posts hidden by the filter since start (or the last reset).
     */
    long filteredOutCount();

    /**
     * Posts shown only because resolution failed.
     */
    long failOpenCount();

    /**
     * Resets all metrics to zero.
     */
    void resetAll();
}
