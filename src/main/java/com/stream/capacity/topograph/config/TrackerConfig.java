package com.stream.capacity.topograph.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * HTTP client for the topology tracker service.
 * Reads the base address from application.yml; a missing address stops the application from starting.
 */
@Configuration
@Slf4j
public class TrackerConfig {

    static final String TRACKER_URL_PROPERTY = "topograph.tracker.url";

    @Value("${" + TRACKER_URL_PROPERTY + ":}")
    private String trackerUrl;

    @Value("${topograph.tracker.timeout:30s}")
    private Duration timeout;

    @Bean
    public WebClient trackerWebClient(WebClient.Builder webClientBuilder) {
        String baseUrl = EndpointResolver.require(TRACKER_URL_PROPERTY, trackerUrl);
        log.info("[tracker] Using topology tracker at: {}", baseUrl);

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
                .responseTimeout(timeout);

        return webClientBuilder
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
