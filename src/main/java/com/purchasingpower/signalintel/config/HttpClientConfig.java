package com.purchasingpower.signalintel.config;

import io.netty.channel.ChannelOption;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Transport timeouts applied to every provider WebClient. There is no request-wide
 * cancellation, so these timeouts bound the latency of each external call.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public WebClientCustomizer providerTimeoutCustomizer(HttpTimeouts timeouts) {
        log.info("✅ Provider HTTP timeouts: connect={}ms, response={}ms",
                timeouts.getConnectTimeoutMs(), timeouts.getResponseTimeoutMs());

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeouts.getConnectTimeoutMs())
                .responseTimeout(Duration.ofMillis(timeouts.getResponseTimeoutMs()));

        return builder -> builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                        .build());
    }

    @Data
    @ConfigurationProperties(prefix = "app.http")
    public static class HttpTimeouts {
        private int connectTimeoutMs = 5000;
        private long responseTimeoutMs = 20000;
    }
}
