package com.dealbot.client.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for provider and indexer calls.
 *
 * Retrieval probes build their own connectors per attempt (see ProbeHttpClient) because proxy and
 * protocol version change between attempts.
 */
@Configuration
public class WebClientConfig {

    // Piece status and indexer responses are small; uploads stream the payload in the request body
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(
            @Value("${dealbot.http.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${dealbot.http.http-request-timeout-ms:600000}") long requestTimeoutMs) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofMillis(requestTimeoutMs))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .followRedirect(true);

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
