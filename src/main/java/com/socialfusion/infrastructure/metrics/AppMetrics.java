package com.socialfusion.infrastructure.metrics;

import com.socialfusion.application.port.out.MetricsPort;
import com.socialfusion.domain.model.FilterReason;
import com.socialfusion.domain.model.Platform;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class AppMetrics implements MetricsPort {

    private static final Logger log = LoggerFactory.getLogger(AppMetrics.class);

    private final MeterRegistry registry;
    private final List<Meter> registered = new ArrayList<>();

    private Map<FilterReason, Counter> decisions;
    private Map<Platform, Counter> followingFetchFailures;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;
        registerAllMeters();
    }

    private synchronized void registerAllMeters() {
        Map<FilterReason, Counter> decisionCounters = new EnumMap<>(FilterReason.class);
        for (FilterReason reason : FilterReason.values()) {
            Counter counter = Counter.builder("feed_filter_decisions_total")
                .description("Feed filter decisions by reason")
                .tag("reason", reason.name().toLowerCase())
                .register(registry);
            registered.add(counter);
            decisionCounters.put(reason, counter);
        }
        this.decisions = decisionCounters;

        Map<Platform, Counter> failureCounters = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            Counter counter = Counter.builder("following_fetch_failures_total")
                .description("Following-list fetches that failed and were skipped")
                .tag("platform", platform.name().toLowerCase())
                .register(registry);
            registered.add(counter);
            failureCounters.put(platform, counter);
        }
        this.followingFetchFailures = failureCounters;
    }

    @Override
    public synchronized void resetAll() {
        log.info("Resetting all feed filter metrics");
        registered.forEach(registry::remove);
        registered.clear();
        registerAllMeters();
    }

    @Override
    public void recordDecision(FilterReason reason) {
        decisions.get(reason).increment();
    }

    @Override
    public void recordResolution(Platform platform, boolean success, Duration elapsed) {
        Counter counter = Counter.builder("thread_resolutions_total")
            .description("Thread participant resolutions issued to platforms")
            .tag("platform", platform.name().toLowerCase())
            .tag("outcome", success ? "success" : "failure")
            .register(registry);
        counter.increment();

        Timer timer = Timer.builder("thread_resolution_duration_seconds")
            .description("Time taken to resolve thread participants")
            .tag("platform", platform.name().toLowerCase())
            .register(registry);
        timer.record(elapsed);
    }

    @Override
    public void recordCacheLookup(String cacheName, boolean hit) {
        registry.counter("participant_cache_lookups_total",
            "cache", cacheName,
            "result", hit ? "hit" : "miss").increment();
    }

    @Override
    public void incrementFollowingFetchFailures(Platform platform) {
        followingFetchFailures.get(platform).increment();
    }

    @Override
    public long filteredOutCount() {
        return (long) decisions.get(FilterReason.FILTERED_OUT).count();
    }

    @Override
    public long failOpenCount() {
        return (long) decisions.get(FilterReason.ERROR_FAIL_OPEN).count();
    }
}
