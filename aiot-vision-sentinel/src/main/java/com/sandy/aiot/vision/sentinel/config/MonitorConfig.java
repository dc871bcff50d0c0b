package com.sandy.aiot.vision.sentinel.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class MonitorConfig {

    /** Every "now" in the engines goes through this clock; all stored timestamps are UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder,
                                            @Value("${monitor.notify.webhook-timeout-ms:10000}") long timeoutMs) {
        log.info("Webhook client timeout={}ms", timeoutMs);
        return builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }
}
