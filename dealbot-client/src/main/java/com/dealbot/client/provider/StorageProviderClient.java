package com.dealbot.client.provider;

import com.dealbot.client.http.CancellableRequests;
import com.dealbot.client.http.HttpRequestException;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.util.LogFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Client for a storage provider's PDP endpoints: piece upload and piece status.
 */
@Component
@Slf4j
public class StorageProviderClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration uploadTimeout;
    private final Duration statusTimeout;

    public StorageProviderClient(
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            @Value("${dealbot.http.http-request-timeout-ms:600000}") long uploadTimeoutMs,
            @Value("${dealbot.ipni.status-request-timeout-ms:10000}") long statusTimeoutMs) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.uploadTimeout = Duration.ofMillis(uploadTimeoutMs);
        this.statusTimeout = Duration.ofMillis(statusTimeoutMs);
    }

    /**
     * Uploads one piece. The request is abandoned, closing its connection, when {@code signal} fires.
     *
     * @throws CancelledException if the signal fires before the provider answers
     */
    public PieceUploadResponse uploadPiece(
            ProviderInfo provider,
            String pieceName,
            byte[] data,
            Map<String, String> dataSetMetadata,
            Map<String, String> pieceMetadata,
            CancellationSignal signal) {
        signal.throwIfCancelled();
        long startTime = System.currentTimeMillis();
        String url = provider.normalizedServiceUrl() + "/pdp/piece";

        log.info("[PROVIDER] Uploading piece | sp={} | name={} | bytes={}",
            LogFormat.abbreviate(provider.getAddress()), pieceName, data.length);

        try {
            Mono<PieceUploadResponse> upload = webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header("X-Piece-Name", pieceName)
                .header("X-Data-Set-Metadata", toJson(dataSetMetadata))
                .header("X-Piece-Metadata", toJson(pieceMetadata))
                .bodyValue(data)
                .retrieve()
                .bodyToMono(PieceUploadResponse.class)
                .timeout(uploadTimeout);
            PieceUploadResponse response = CancellableRequests.race(upload, signal).block();

            if (response == null || response.getPieceCid() == null || response.getPieceCid().isBlank()) {
                throw new HttpRequestException("Provider returned no piece CID", 200, false);
            }

            log.info("[PROVIDER] Piece uploaded | sp={} | pieceCid={} | durationMs={}",
                LogFormat.abbreviate(provider.getAddress()), LogFormat.abbreviate(response.getPieceCid()),
                System.currentTimeMillis() - startTime);
            return response;

        } catch (WebClientResponseException e) {
            log.error("[PROVIDER] Upload rejected | sp={} | statusCode={} | durationMs={} | error={}",
                LogFormat.abbreviate(provider.getAddress()), e.getStatusCode().value(),
                System.currentTimeMillis() - startTime, e.getResponseBodyAsString());
            throw HttpRequestException.fromStatus(e.getStatusCode().value(), url);
        } catch (HttpRequestException | CancelledException e) {
            throw e;
        } catch (WebClientRequestException e) {
            log.error("[PROVIDER] Upload connection failed | sp={} | error={}",
                LogFormat.abbreviate(provider.getAddress()), e.getMessage());
            throw new HttpRequestException("Upload connection failed: " + e.getMessage(), 0, true, e);
        } catch (Exception e) {
            log.error("[PROVIDER] Upload failed | sp={} | durationMs={} | error={}",
                LogFormat.abbreviate(provider.getAddress()), System.currentTimeMillis() - startTime, e.getMessage(), e);
            throw new HttpRequestException("Upload failed: " + e.getMessage(), 0, true, e);
        }
    }

    public PieceStatusResponse getPieceStatus(String serviceUrl, String pieceCid) {
        String base = serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
        String url = base + "/pdp/piece/" + pieceCid + "/status";
        try {
            PieceStatusResponse status = webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(PieceStatusResponse.class)
                .timeout(statusTimeout)
                .block();
            if (status == null) {
                throw new HttpRequestException("Empty piece status response", 200, true);
            }
            return status;
        } catch (WebClientResponseException e) {
            throw HttpRequestException.fromStatus(e.getStatusCode().value(), url);
        } catch (HttpRequestException e) {
            throw e;
        } catch (Exception e) {
            throw new HttpRequestException("Piece status request failed: " + e.getMessage(), 0, true, e);
        }
    }

    private String toJson(Map<String, String> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }
}
