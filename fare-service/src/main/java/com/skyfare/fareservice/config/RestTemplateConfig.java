package com.skyfare.fareservice.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One RestTemplate per timeout class: metadata calls (token exchange, reference data)
 * and search calls (offers, pricing, transfers).
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate metadataRestTemplate(RestTemplateBuilder builder, AmadeusProperties properties) {
        return build(builder, properties.getTimeouts().getConnect(), properties.getTimeouts().getMetadata());
    }

    @Bean
    public RestTemplate searchRestTemplate(RestTemplateBuilder builder, AmadeusProperties properties) {
        return build(builder, properties.getTimeouts().getConnect(), properties.getTimeouts().getSearch());
    }

    private RestTemplate build(RestTemplateBuilder builder, Duration connectTimeout, Duration readTimeout) {
        return builder
                .requestFactory(() -> {
                    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
                    factory.setConnectTimeout(connectTimeout);
                    factory.setReadTimeout(readTimeout);
                    return factory;
                })
                .build();
    }
}
