package com.socialfusion.adapter.out.cache;

import com.socialfusion.application.port.out.ExpiringCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically drops expired entries so caches of threads nobody scrolls back to do not linger.
 */
@Component
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final List<ExpiringCache<?, ?>> caches;

    public CacheSweeper(List<ExpiringCache<?, ?>> caches) {
        this.caches = caches;
    }

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval:PT60S}", initialDelayString = "${app.cache.sweep-interval:PT60S}")
    public void sweep() {
        for (ExpiringCache<?, ?> cache : caches) {
            int purged = cache.purgeExpired();
            if (purged > 0) {
                log.debug("Purged {} expired entries from {} ({} remaining)", purged, cache.name(), cache.size());
            }
        }
    }
}
