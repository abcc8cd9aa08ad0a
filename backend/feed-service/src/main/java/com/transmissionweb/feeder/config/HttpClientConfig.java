package com.transmissionweb.feeder.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    /**
     * Client for the Transmission RPC endpoint. Connect and read share the RPC timeout.
     */
    @Bean
    public RestTemplate transmissionRestTemplate(RestTemplateBuilder builder, TransmissionProperties properties) {
        return builder
                .setConnectTimeout(properties.getTimeout())
                .setReadTimeout(properties.getTimeout())
                .build();
    }

    /**
     * Client for feed documents.
     */
    @Bean
    public RestTemplate feedRestTemplate(RestTemplateBuilder builder, FeederProperties properties) {
        return builder
                .setConnectTimeout(properties.getFetch().getConnectTimeout())
                .setReadTimeout(properties.getFetch().getTimeout())
                .defaultHeader("User-Agent", properties.getFetch().getUserAgent())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
