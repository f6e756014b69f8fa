package com.dealbot.core.retrieval;

import com.dealbot.client.http.HttpFetchRequest;
import com.dealbot.client.http.HttpFetchResult;
import com.dealbot.client.http.HttpMetrics;
import com.dealbot.client.http.HttpRequestException;
import com.dealbot.client.http.ProbeHttpClient;
import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.proxy.ProxyPool;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.strategy.StrategyPriority;
import com.dealbot.data.entity.Deal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetrievalStrategyServiceTest {

    private ProbeHttpClient httpClient;
    private ProxyPool proxyPool;
    private RetrievalConfig config;
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        httpClient = mock(ProbeHttpClient.class);
        proxyPool = mock(ProxyPool.class);
        when(proxyPool.nextProxy()).thenReturn(Optional.of("http://user:pw@proxy.local:3128"));
        Deal deal = Deal.builder()
            .id(UUID.randomUUID())
            .spAddress("f01234")
            .fileName("probe.bin")
            .fileSize(1024L)
            .pieceCid("bafkzcibpiece")
            .build();
        config = RetrievalConfig.builder()
            .deal(deal)
            .provider(ProviderInfo.builder().address("f01234").serviceUrl("http://sp.local").build())
            .build();
    }

    private RetrievalStrategyService service(RetrievalStrategy... strategies) {
        return new RetrievalStrategyService(List.of(strategies), httpClient, proxyPool, clock);
    }

    private static HttpFetchResult fetched(long latencyMs, int size) {
        return HttpFetchResult.builder()
            .data(new byte[size])
            .metrics(HttpMetrics.builder()
                .totalTimeMs(latencyMs)
                .ttfbMs(latencyMs / 2)
                .statusCode(200)
                .responseSize(size)
                .build())
            .build();
    }

    private static HttpFetchRequest forUrl(String fragment) {
        return argThat(request -> request != null && request.getUrl().contains(fragment));
    }

    @Test
    @DisplayName("Priorities 1, 5 and 10 with the first two failing: one success, fastest is the third")
    void summaryWithTwoFailures() {
        when(httpClient.fetch(forUrl("/high"), any()))
            .thenThrow(new HttpRequestException("HTTP 404 for http://sp.local/high", 404, false));
        when(httpClient.fetch(forUrl("/medium"), any()))
            .thenThrow(new HttpRequestException("HTTP 403 for http://sp.local/medium", 403, false));
        when(httpClient.fetch(forUrl("/low"), any())).thenReturn(fetched(120, 1024));

        RetrievalTestResult result = service(
            new StubStrategy("low", StrategyPriority.LOW),
            new StubStrategy("high", StrategyPriority.HIGH),
            new StubStrategy("medium", StrategyPriority.MEDIUM)
        ).testAllRetrievalMethods(config, CancellationSignal.none());

        assertThat(result.getResults()).extracting(RetrievalExecutionResult::getStrategyName)
            .containsExactly("high", "medium", "low");
        assertThat(result.getSummary().getTotalMethods()).isEqualTo(3);
        assertThat(result.getSummary().getFailedMethods()).isEqualTo(2);
        assertThat(result.getSummary().getSuccessfulMethods()).isEqualTo(1);
        assertThat(result.getSummary().getFastestMethod()).isEqualTo("low");
        assertThat(result.getSummary().getFastestLatency()).isEqualTo(120L);
        assertThat(result.isAborted()).isFalse();
        assertThat(result.getResults().get(0).getStatusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("The lowest-latency success across attempts is kept, with its retry count")
    void bestAttemptWins() {
        when(httpClient.fetch(forUrl("/retry"), any()))
            .thenThrow(new HttpRequestException("Connection failed: reset", 0, true))
            .thenReturn(fetched(300, 10))
            .thenReturn(fetched(90, 10));
        StubStrategy strategy = new StubStrategy("retry", StrategyPriority.HIGH);
        strategy.retry = new RetryConfig(3, Duration.ZERO);

        RetrievalExecutionResult result = service(strategy).executeWithRetries(strategy, config, CancellationSignal.none());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLatencyMs()).isEqualTo(90);
        assertThat(result.getRetryCount()).isEqualTo(2);
        verify(httpClient, times(3)).fetch(any(), any());
    }

    @Test
    @DisplayName("A validation failure is not retried")
    void validationFailureStops() {
        when(httpClient.fetch(forUrl("/strict"), any())).thenReturn(fetched(50, 10));
        StubStrategy strategy = new StubStrategy("strict", StrategyPriority.HIGH);
        strategy.retry = new RetryConfig(3, Duration.ZERO);
        strategy.validation = ValidationResult.failed("size-check", "expected 1024 bytes, got 10");

        RetrievalExecutionResult result = service(strategy).executeWithRetries(strategy, config, CancellationSignal.none());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("size-check").contains("expected 1024 bytes");
        assertThat(result.getRetryCount()).isZero();
        verify(httpClient, times(1)).fetch(any(), any());
    }

    @Test
    @DisplayName("A non-retryable HTTP error ends the strategy after one attempt")
    void nonRetryableStops() {
        when(httpClient.fetch(forUrl("/gone"), any()))
            .thenThrow(new HttpRequestException("HTTP 404", 404, false));
        StubStrategy strategy = new StubStrategy("gone", StrategyPriority.HIGH);
        strategy.retry = new RetryConfig(2, Duration.ZERO);

        RetrievalExecutionResult result = service(strategy).executeWithRetries(strategy, config, CancellationSignal.none());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isRetryable()).isFalse();
        verify(httpClient, times(1)).fetch(any(), any());
    }

    @Test
    @DisplayName("Exhausted transient failures report the last failure")
    void exhaustedRetries() {
        when(httpClient.fetch(forUrl("/flaky"), any()))
            .thenThrow(new HttpRequestException("Request timed out: http://sp.local/flaky", 0, true));
        StubStrategy strategy = new StubStrategy("flaky", StrategyPriority.HIGH);
        strategy.retry = new RetryConfig(2, Duration.ZERO);

        RetrievalExecutionResult result = service(strategy).executeWithRetries(strategy, config, CancellationSignal.none());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isTimedOut()).isTrue();
        assertThat(result.getRetryCount()).isEqualTo(1);
        verify(httpClient, times(2)).fetch(any(), any());
    }

    @Test
    @DisplayName("Proxies are requested only by strategies that allow them")
    void proxyOnlyWhenAllowed() {
        when(httpClient.fetch(any(), any())).thenReturn(fetched(10, 1));
        StubStrategy direct = new StubStrategy("direct", StrategyPriority.HIGH);
        direct.proxy = false;

        RetrievalExecutionResult result = service(direct).executeWithRetries(direct, config, CancellationSignal.none());

        assertThat(result.getProxyUrl()).isEqualTo("direct");
        verify(proxyPool, never()).nextProxy();
        verify(httpClient).fetch(argThat(request -> request.getProxyUrl() == null), any());
    }

    @Test
    @DisplayName("A cancelled signal records every remaining method as timed out")
    void cancelledSignalAborts() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("timed out after 10000ms");

        RetrievalTestResult result = service(
            new StubStrategy("a", StrategyPriority.HIGH),
            new StubStrategy("b", StrategyPriority.LOW)
        ).testAllRetrievalMethods(config, signal);

        assertThat(result.isAborted()).isTrue();
        assertThat(result.getResults()).allSatisfy(r -> {
            assertThat(r.isTimedOut()).isTrue();
            assertThat(r.getErrorMessage()).contains("timed out after 10000ms");
        });
        verify(httpClient, never()).fetch(any(), any());
    }

    @Test
    @DisplayName("No applicable strategy is an error")
    void noApplicableStrategy() {
        StubStrategy strategy = new StubStrategy("never", StrategyPriority.HIGH);
        strategy.applicable = false;

        assertThatThrownBy(() -> service(strategy).testAllRetrievalMethods(config, CancellationSignal.none()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No retrieval methods available");
    }

    @Test
    @DisplayName("An empty result list summarizes to zeros")
    void emptySummary() {
        RetrievalTestResult.Summary summary = RetrievalStrategyService.summarize(List.of());

        assertThat(summary.getTotalMethods()).isZero();
        assertThat(summary.getFastestMethod()).isNull();
        assertThat(summary.getFastestLatency()).isNull();
    }

    private static final class StubStrategy implements RetrievalStrategy {

        private final String name;
        private final StrategyPriority priority;
        private RetryConfig retry = RetryConfig.SINGLE;
        private ValidationResult validation;
        private boolean applicable = true;
        private boolean proxy = true;

        private StubStrategy(String name, StrategyPriority priority) {
            this.name = name;
            this.priority = priority;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public ServiceType getServiceType() {
            return ServiceType.DIRECT_SP;
        }

        @Override
        public StrategyPriority getPriority() {
            return priority;
        }

        @Override
        public boolean canHandle(RetrievalConfig config) {
            return applicable;
        }

        @Override
        public RetrievalUrl constructUrl(RetrievalConfig config) {
            return RetrievalUrl.builder().url("http://sp.local/" + name).build();
        }

        @Override
        public ValidationResult validateData(byte[] data, RetrievalConfig config, CancellationSignal signal) {
            return validation;
        }

        @Override
        public RetryConfig getRetryConfig() {
            return retry;
        }

        @Override
        public boolean useProxy() {
            return proxy;
        }
    }
}
