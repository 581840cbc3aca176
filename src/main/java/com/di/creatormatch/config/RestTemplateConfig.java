package com.di.creatormatch.config;

import com.di.creatormatch.agent.gateway.GatewayProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    /**
     * RestTemplate for the metrics provider; timeouts come from {@code creatormatch.gateway.*}.
     */
    @Bean
    @Qualifier("metricsRestTemplate")
    public RestTemplate metricsRestTemplate(RestTemplateBuilder builder, GatewayProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
