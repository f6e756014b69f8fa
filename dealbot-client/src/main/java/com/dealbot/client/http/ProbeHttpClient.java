package com.dealbot.client.http;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.constants.ProbeDefaults;
import com.dealbot.common.util.LogFormat;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientRequest;
import reactor.netty.transport.ProxyProvider;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Instrumented HTTP fetch used by retrieval probes.
 *
 * HTTP/1.1 requests are bounded by a single inactivity timeout. HTTP/2 requests must see response
 * headers within the connect timeout and finish the whole transfer within the (much longer) HTTP/2
 * request timeout. Every fetch races the cancellation signal; losing the race cancels the exchange,
 * which closes the underlying connection.
 */
@Component
@Slf4j
public class ProbeHttpClient {

    private final int connectTimeoutMs;
    private final long httpRequestTimeoutMs;
    private final long http2RequestTimeoutMs;

    public ProbeHttpClient(
            @Value("${dealbot.http.connect-timeout-ms:10000}") int connectTimeoutMs,
            @Value("${dealbot.http.http-request-timeout-ms:600000}") long httpRequestTimeoutMs,
            @Value("${dealbot.http.http2-request-timeout-ms:600000}") long http2RequestTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.httpRequestTimeoutMs = httpRequestTimeoutMs;
        this.http2RequestTimeoutMs = http2RequestTimeoutMs;
    }

    public HttpFetchResult fetch(HttpFetchRequest request, CancellationSignal signal) {
        signal.throwIfCancelled();

        long startNanos = System.nanoTime();
        AtomicLong headersNanos = new AtomicLong();
        AtomicLong firstByteNanos = new AtomicLong();
        AtomicInteger statusCode = new AtomicInteger();
        AtomicBoolean headersReceived = new AtomicBoolean();
        String maskedProxy = LogFormat.maskProxy(request.getProxyUrl());

        log.debug("[HTTP] Starting request | url={} | method={} | httpVersion={} | proxy={}",
            request.getUrl(), request.getMethod(), request.getHttpVersion().getLabel(), maskedProxy);

        WebClient client = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(buildHttpClient(request)))
            .build();

        Mono<byte[]> exchange = client.method(HttpMethod.valueOf(request.getMethod()))
            .uri(URI.create(request.getUrl()))
            .headers(h -> {
                h.set("User-Agent", ProbeDefaults.USER_AGENT);
                request.getHeaders().forEach(h::set);
            })
            .httpRequest(clientRequest -> applyInactivityTimeout(clientRequest, request.getHttpVersion()))
            .exchangeToMono(response -> {
                headersNanos.set(System.nanoTime());
                headersReceived.set(true);
                statusCode.set(response.statusCode().value());
                if (!response.statusCode().is2xxSuccessful()) {
                    return response.releaseBody()
                        .then(Mono.error(HttpRequestException.fromStatus(response.statusCode().value(), request.getUrl())));
                }
                return readBody(response, firstByteNanos);
            });

        if (request.getHttpVersion() == HttpVersion.HTTP_2) {
            exchange = Mono.firstWithSignal(exchange, headerWatchdog(headersReceived))
                .timeout(Duration.ofMillis(http2RequestTimeoutMs));
        }

        Mono<byte[]> cancellable = CancellableRequests.race(exchange, signal);

        byte[] body;
        try {
            body = cancellable.block();
        } catch (CancelledException | HttpRequestException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(e, request);
        }

        long endNanos = System.nanoTime();
        long totalMs = nanosToMillis(endNanos - startNanos);
        byte[] data = body != null ? body : new byte[0];

        long ttfbMs;
        if (firstByteNanos.get() > 0) {
            ttfbMs = nanosToMillis(firstByteNanos.get() - startNanos);
        } else if (headersNanos.get() > 0) {
            ttfbMs = nanosToMillis(headersNanos.get() - startNanos);
        } else {
            ttfbMs = Math.round(totalMs * 0.8);
        }

        HttpMetrics metrics = HttpMetrics.builder()
            .ttfbMs(ttfbMs)
            .totalTimeMs(totalMs)
            .downloadTimeMs(Math.max(0, totalMs - ttfbMs))
            .proxyUrl(maskedProxy)
            .statusCode(statusCode.get())
            .responseSize(data.length)
            .timestamp(Instant.now())
            .httpVersion(request.getHttpVersion().getLabel())
            .build();

        log.debug("[HTTP] Request completed | url={} | status={} | bytes={} | ttfbMs={} | totalMs={}",
            request.getUrl(), metrics.getStatusCode(), data.length, ttfbMs, totalMs);

        return HttpFetchResult.builder()
            .data(data)
            .metrics(metrics)
            .build();
    }

    private Mono<byte[]> readBody(ClientResponse response, AtomicLong firstByteNanos) {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        Flux<DataBuffer> body = response.bodyToFlux(DataBuffer.class);
        return StreamUtils.writeWithBackpressure(body, sink, size -> firstByteNanos.compareAndSet(0, System.nanoTime()))
            .map(ignored -> sink.toByteArray());
    }

    private HttpClient buildHttpClient(HttpFetchRequest request) {
        URI uri = URI.create(request.getUrl());
        boolean secure = "https".equalsIgnoreCase(uri.getScheme());

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .followRedirect(true);

        if (request.getHttpVersion() == HttpVersion.HTTP_2) {
            httpClient = secure
                ? httpClient.protocol(HttpProtocol.H2, HttpProtocol.HTTP11).secure()
                : httpClient.protocol(HttpProtocol.H2C, HttpProtocol.HTTP11);
        } else {
            httpClient = httpClient.protocol(HttpProtocol.HTTP11);
        }

        if (request.getProxyUrl() != null && !request.getProxyUrl().isBlank()) {
            URI proxy = URI.create(request.getProxyUrl());
            String userInfo = proxy.getUserInfo();
            int port = proxy.getPort() > 0 ? proxy.getPort() : 8080;
            httpClient = httpClient.proxy(spec -> {
                ProxyProvider.Builder builder = spec.type(ProxyProvider.Proxy.HTTP)
                    .host(proxy.getHost())
                    .port(port);
                if (userInfo != null && userInfo.contains(":")) {
                    String[] credentials = userInfo.split(":", 2);
                    builder.username(credentials[0]).password(user -> credentials[1]);
                }
            });
        }
        return httpClient;
    }

    /**
     * HTTP/1.1: reactor-netty's response timeout is measured between reads, so it acts as one
     * inactivity timeout across headers and body. HTTP/2 relies on the header watchdog instead.
     */
    private void applyInactivityTimeout(ClientHttpRequest request, HttpVersion version) {
        Object nativeRequest = request.getNativeRequest();
        if (version == HttpVersion.HTTP_1_1 && nativeRequest instanceof HttpClientRequest) {
            ((HttpClientRequest) nativeRequest).responseTimeout(Duration.ofMillis(httpRequestTimeoutMs));
        }
    }

    private Mono<byte[]> headerWatchdog(AtomicBoolean headersReceived) {
        return Mono.delay(Duration.ofMillis(connectTimeoutMs))
            .flatMap(tick -> headersReceived.get()
                ? Mono.<byte[]>never()
                : Mono.error(new TimeoutException("headers not received within " + connectTimeoutMs + "ms")));
    }

    private RuntimeException translate(RuntimeException e, HttpFetchRequest request) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException || cause instanceof ReadTimeoutException || e instanceof ReadTimeoutException) {
            log.warn("[HTTP] Request timed out | url={} | httpVersion={} | error={}",
                request.getUrl(), request.getHttpVersion().getLabel(), cause.getMessage());
            return new HttpRequestException("Request timed out: " + request.getUrl(), 0, true, e);
        }
        if (e instanceof WebClientRequestException) {
            log.warn("[HTTP] Connection failed | url={} | proxy={} | error={}",
                request.getUrl(), LogFormat.maskProxy(request.getProxyUrl()), e.getMessage());
            return new HttpRequestException("Connection failed: " + e.getMessage(), 0, true, e);
        }
        log.error("[HTTP] Request failed | url={} | error={}", request.getUrl(), e.getMessage(), e);
        return new HttpRequestException("Request failed: " + e.getMessage(), 0, false, e);
    }

    private static long nanosToMillis(long nanos) {
        return Duration.ofNanos(nanos).toMillis();
    }
}
