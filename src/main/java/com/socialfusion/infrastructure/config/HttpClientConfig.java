package com.socialfusion.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.List;

@Configuration
public class HttpClientConfig {

    /**
     * Shared client for Mastodon and Bluesky calls. Server URLs differ per linked account, so
     * no base URL is set here.
     */
    @Bean
    public RestClient platformRestClient(RestClient.Builder builder, AppProperties appProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(appProperties.getHttp().getConnectTimeout());
        requestFactory.setReadTimeout(appProperties.getHttp().getReadTimeout());
        return builder
            .requestFactory(requestFactory)
            .defaultHeaders(headers -> headers.setAccept(List.of(MediaType.APPLICATION_JSON)))
            .build();
    }
}
