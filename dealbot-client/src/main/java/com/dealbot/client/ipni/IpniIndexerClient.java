package com.dealbot.client.ipni;

import com.dealbot.client.http.HttpRequestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks up which providers the IPNI indexer knows for a CID.
 */
@Component
@Slf4j
public class IpniIndexerClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String indexerUrl;

    public IpniIndexerClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            @Value("${dealbot.ipni.indexer-url:https://filecoinpin.contact}") String indexerUrl) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.indexerUrl = indexerUrl.endsWith("/") ? indexerUrl.substring(0, indexerUrl.length() - 1) : indexerUrl;
    }

    /**
     * Returns every provider multiaddr advertised for {@code cid}; empty when the indexer has no record.
     */
    public List<String> findProviderAddrs(String cid, Duration timeout) {
        String url = indexerUrl + "/cid/" + cid;
        String body;
        try {
            body = webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 404) {
                return List.of();
            }
            throw HttpRequestException.fromStatus(e.getStatusCode().value(), url);
        } catch (Exception e) {
            throw new HttpRequestException("IPNI lookup failed: " + e.getMessage(), 0, true, e);
        }
        return extractProviderAddrs(body);
    }

    List<String> extractProviderAddrs(String body) {
        List<String> addrs = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return addrs;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            for (JsonNode multihashResult : root.path("MultihashResults")) {
                for (JsonNode providerResult : multihashResult.path("ProviderResults")) {
                    for (JsonNode addr : providerResult.path("Provider").path("Addrs")) {
                        addrs.add(addr.asText());
                    }
                }
            }
        } catch (Exception e) {
            throw new HttpRequestException("Failed to parse IPNI response: " + e.getMessage(), 200, false, e);
        }
        return addrs;
    }
}
