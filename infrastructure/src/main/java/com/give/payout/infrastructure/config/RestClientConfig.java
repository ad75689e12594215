package com.give.payout.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    /**
     * RestTemplate for the beneficiary registry, with timeouts so a hung
     * registry cannot hold the ledger lock indefinitely
     */
    @Bean(name = "registryRestTemplate")
    public RestTemplate registryRestTemplate(RestTemplateBuilder builder,
                                             @Value("${app.registry.connect-timeout:PT2S}") Duration connectTimeout,
                                             @Value("${app.registry.read-timeout:PT3S}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
