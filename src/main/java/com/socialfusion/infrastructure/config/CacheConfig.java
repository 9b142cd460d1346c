package com.socialfusion.infrastructure.config;

import com.socialfusion.adapter.out.cache.InMemoryExpiringCache;
import com.socialfusion.application.port.out.ExpiringCache;
import com.socialfusion.domain.model.ThreadParticipants;
import com.socialfusion.domain.model.UserIdentity;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;

@Configuration
public class CacheConfig {

    public static final String THREAD_PARTICIPANTS = "threadParticipants";
    public static final String FOLLOWING = "following";

    /**
     * Thread participants keyed by thread key.
     */
    @Bean(name = THREAD_PARTICIPANTS)
    public ExpiringCache<String, ThreadParticipants> threadParticipantCache(Clock clock) {
        return new InMemoryExpiringCache<>(THREAD_PARTICIPANTS, clock);
    }

    /**
     * Following sets keyed by linked account id.
     */
    @Bean(name = FOLLOWING)
    public ExpiringCache<String, Set<UserIdentity>> followingCache(Clock clock) {
        return new InMemoryExpiringCache<>(FOLLOWING, clock);
    }
}
