package com.socialfusion.infrastructure.config;

import com.socialfusion.domain.model.Platform;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Filter filter = new Filter();
    private Following following = new Following();
    private Cache cache = new Cache();
    private Executor executor = new Executor();
    private Http http = new Http();
    private Timeline timeline = new Timeline();
    private List<Account> accounts = new ArrayList<>();

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Following getFollowing() {
        return following;
    }

    public void setFollowing(Following following) {
        this.following = following;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public void setTimeline(Timeline timeline) {
        this.timeline = timeline;
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<Account> accounts) {
        this.accounts = accounts;
    }

    public static class Filter {
        private boolean replyFilteringEnabled = true;
        private Duration threadParticipantsTtl = Duration.ofMinutes(5);
        private int minFollowedParticipants = 2;
        private Duration resolutionTimeout = Duration.ofSeconds(8);

        public boolean isReplyFilteringEnabled() {
            return replyFilteringEnabled;
        }

        public void setReplyFilteringEnabled(boolean replyFilteringEnabled) {
            this.replyFilteringEnabled = replyFilteringEnabled;
        }

        public Duration getThreadParticipantsTtl() {
            return threadParticipantsTtl;
        }

        public void setThreadParticipantsTtl(Duration threadParticipantsTtl) {
            this.threadParticipantsTtl = threadParticipantsTtl;
        }

        public int getMinFollowedParticipants() {
            return minFollowedParticipants;
        }

        public void setMinFollowedParticipants(int minFollowedParticipants) {
            this.minFollowedParticipants = minFollowedParticipants;
        }

        public Duration getResolutionTimeout() {
            return resolutionTimeout;
        }

        public void setResolutionTimeout(Duration resolutionTimeout) {
            this.resolutionTimeout = resolutionTimeout;
        }
    }

    public static class Following {
        private Duration ttl = Duration.ofMinutes(10);
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int maxPages = 20;
        private int pageSize = 80;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Cache {
        private Duration sweepInterval = Duration.ofSeconds(60);

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Executor {
        private int poolSize = 8;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(8);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Timeline {
        private int defaultPageSize = 40;
        private int maxPageSize = 100;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    public static class Account {
        private String id;
        private Platform platform;
        private String handle;
        private String platformUserId;
        private String serverUrl;
        private String accessToken;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Platform getPlatform() {
            return platform;
        }

        public void setPlatform(Platform platform) {
            this.platform = platform;
        }

        public String getHandle() {
            return handle;
        }

        public void setHandle(String handle) {
            this.handle = handle;
        }

        public String getPlatformUserId() {
            return platformUserId;
        }

        public void setPlatformUserId(String platformUserId) {
            this.platformUserId = platformUserId;
        }

        public String getServerUrl() {
            return serverUrl;
        }

        public void setServerUrl(String serverUrl) {
            this.serverUrl = serverUrl;
        }

        public String getAccessToken() {
            return accessToken;
        }

        public void setAccessToken(String accessToken) {
            this.accessToken = accessToken;
        }
    }
}
