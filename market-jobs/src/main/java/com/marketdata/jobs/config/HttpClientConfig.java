package com.marketdata.jobs.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate shared by the upstream provider and analytics adapters.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, JobsProperties properties) {
        return builder
                .setConnectTimeout(properties.getUpstream().getConnectTimeout())
                .setReadTimeout(properties.getUpstream().getReadTimeout())
                .build();
    }
}
