package com.socialfusion.infrastructure.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

@Configuration
@EnableScheduling
public class ConcurrencyConfig {

    /**
     * Pool running thread resolutions, following fetches and timeline fetches. All of them
     * block on HTTP, so the pool is sized for I/O rather than CPU.
     */
    @Bean(name = "feedExecutor")
    public ThreadPoolTaskExecutor feedExecutor(AppProperties appProperties) {
        int poolSize = Math.max(1, appProperties.getExecutor().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("feed-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Carries requestId into worker threads so resolution logs stay correlated.
    private static TaskDecorator mdcPropagatingDecorator() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    task.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
