package com.dealbot.core.retrieval;

import com.dealbot.client.http.HttpFetchRequest;
import com.dealbot.client.http.HttpFetchResult;
import com.dealbot.client.http.HttpMetrics;
import com.dealbot.client.http.HttpRequestException;
import com.dealbot.client.http.ProbeHttpClient;
import com.dealbot.client.proxy.ProxyPool;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Tries every applicable retrieval strategy for a deal, each with its own retry budget, and
 * summarizes which methods worked and which was fastest.
 */
@Service
@Slf4j
public class RetrievalStrategyService {

    private final List<RetrievalStrategy> strategies;
    private final ProbeHttpClient httpClient;
    private final ProxyPool proxyPool;
    private final Clock clock;

    public RetrievalStrategyService(List<RetrievalStrategy> strategies, ProbeHttpClient httpClient,
                                    ProxyPool proxyPool, Clock clock) {
        this.strategies = strategies.stream()
            .sorted(Comparator.comparingInt(s -> s.getPriority().getValue()))
            .toList();
        this.httpClient = httpClient;
        this.proxyPool = proxyPool;
        this.clock = clock;
        log.info("[RETRIEVAL] Strategies registered | order={}", this.strategies.stream().map(RetrievalStrategy::getName).toList());
    }

    public List<RetrievalStrategy> getApplicableStrategies(RetrievalConfig config) {
        return strategies.stream().filter(s -> s.canHandle(config)).toList();
    }

    public RetrievalTestResult testAllRetrievalMethods(RetrievalConfig config, CancellationSignal signal) {
        long startTime = System.currentTimeMillis();
        List<RetrievalStrategy> applicable = getApplicableStrategies(config);
        if (applicable.isEmpty()) {
            throw new IllegalStateException("No retrieval methods available for deal " + config.getDeal().getId());
        }

        log.info("[RETRIEVAL] Testing retrieval methods | dealId={} | methods={}",
            config.getDeal().getId(), applicable.stream().map(RetrievalStrategy::getName).toList());

        List<RetrievalExecutionResult> results = new ArrayList<>();
        boolean aborted = false;
        for (RetrievalStrategy strategy : applicable) {
            if (signal.isCancelled()) {
                aborted = true;
                results.add(abortedResult(strategy, signal.getReason()));
                continue;
            }
            try {
                results.add(executeWithRetries(strategy, config, signal));
            } catch (CancelledException e) {
                aborted = true;
                results.add(abortedResult(strategy, e.getMessage()));
            } catch (Exception e) {
                log.error("[RETRIEVAL] Strategy failed | strategy={} | dealId={} | error={}",
                    strategy.getName(), config.getDeal().getId(), e.getMessage(), e);
                results.add(RetrievalExecutionResult.builder()
                    .strategyName(strategy.getName())
                    .serviceType(strategy.getServiceType())
                    .success(false)
                    .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .startedAt(clock.instant())
                    .completedAt(clock.instant())
                    .build());
            }
        }

        RetrievalTestResult.Summary summary = summarize(results);
        log.info("[RETRIEVAL] Retrieval test completed | dealId={} | successful={}/{} | fastest={} | aborted={} | durationMs={}",
            config.getDeal().getId(), summary.getSuccessfulMethods(), summary.getTotalMethods(),
            summary.getFastestMethod(), aborted, System.currentTimeMillis() - startTime);

        return RetrievalTestResult.builder()
            .dealId(config.getDeal().getId())
            .results(results)
            .summary(summary)
            .testedAt(clock.instant())
            .aborted(aborted)
            .build();
    }

    static RetrievalTestResult.Summary summarize(List<RetrievalExecutionResult> results) {
        List<RetrievalExecutionResult> successful = results.stream().filter(RetrievalExecutionResult::isSuccess).toList();
        Optional<RetrievalExecutionResult> fastest = successful.stream()
            .min(Comparator.comparingLong(RetrievalExecutionResult::getLatencyMs));
        return RetrievalTestResult.Summary.builder()
            .totalMethods(results.size())
            .successfulMethods(successful.size())
            .failedMethods(results.size() - successful.size())
            .fastestMethod(fastest.map(RetrievalExecutionResult::getStrategyName).orElse(null))
            .fastestLatency(fastest.map(RetrievalExecutionResult::getLatencyMs).orElse(null))
            .build();
    }

    /**
     * Runs up to {@code attempts} attempts. Transient network failures and successes both move on to
     * the next attempt; validation failures and non-retryable errors end the strategy.
     * The lowest-latency success wins; otherwise the last failure is reported.
     */
    RetrievalExecutionResult executeWithRetries(RetrievalStrategy strategy, RetrievalConfig config, CancellationSignal signal) {
        RetryConfig retry = strategy.getRetryConfig();
        RetrievalUrl url = strategy.constructUrl(config);

        RetrievalExecutionResult best = null;
        RetrievalExecutionResult last = null;
        for (int attempt = 1; attempt <= retry.attempts(); attempt++) {
            signal.throwIfCancelled();
            RetrievalExecutionResult result = executeAttempt(strategy, url, config, signal)
                .toBuilder().retryCount(attempt - 1).build();
            last = result;

            if (result.isSuccess()) {
                if (best == null || result.getLatencyMs() < best.getLatencyMs()) {
                    best = result;
                }
                if (retry.attempts() > 1) {
                    log.info("[RETRIEVAL] Attempt succeeded | strategy={} | attempt={}/{} | latencyMs={} | ttfbMs={}",
                        strategy.getName(), attempt, retry.attempts(), result.getLatencyMs(), result.getTtfbMs());
                }
            } else if (!isRetryable(result)) {
                break;
            } else {
                log.warn("[RETRIEVAL] Attempt failed | strategy={} | attempt={}/{} | error={}",
                    strategy.getName(), attempt, retry.attempts(), result.getErrorMessage());
            }

            if (attempt < retry.attempts() && !retry.delay().isZero()) {
                signal.sleep(retry.delay());
            }
        }
        return best != null ? best : last;
    }

    private RetrievalExecutionResult executeAttempt(RetrievalStrategy strategy, RetrievalUrl url,
                                                    RetrievalConfig config, CancellationSignal signal) {
        String proxy = strategy.useProxy() ? proxyPool.nextProxy().orElse(null) : null;
        Instant startedAt = clock.instant();
        RetrievalExecutionResult.RetrievalExecutionResultBuilder result = RetrievalExecutionResult.builder()
            .strategyName(strategy.getName())
            .serviceType(strategy.getServiceType())
            .url(url.getUrl())
            .httpVersion(url.getHttpVersion().getLabel())
            .proxyUrl(LogFormat.maskProxy(proxy))
            .startedAt(startedAt);

        HttpFetchResult fetched;
        try {
            fetched = httpClient.fetch(HttpFetchRequest.builder()
                .url(url.getUrl())
                .method(url.getMethod())
                .headers(url.getHeaders())
                .httpVersion(url.getHttpVersion())
                .proxyUrl(proxy)
                .build(), signal);
        } catch (HttpRequestException e) {
            log.error("[RETRIEVAL] Retrieval failed | strategy={} | dealId={} | pieceCid={} | url={} | status={} | proxy={} | error={}",
                strategy.getName(), config.getDeal().getId(), LogFormat.abbreviate(config.getDeal().getPieceCid()),
                url.getUrl(), e.getStatusCode(), LogFormat.maskProxy(proxy), e.getMessage());
            return result.success(false)
                .statusCode(e.getStatusCode())
                .timedOut(e.isTimeout())
                .retryable(e.isRetryable())
                .errorMessage(e.getMessage())
                .completedAt(clock.instant())
                .build();
        }

        HttpMetrics metrics = fetched.getMetrics();
        long throughput = metrics.getTotalTimeMs() > 0
            ? Math.round(metrics.getResponseSize() / (metrics.getTotalTimeMs() / 1000.0))
            : metrics.getResponseSize();
        result.latencyMs(metrics.getTotalTimeMs())
            .ttfbMs(metrics.getTtfbMs())
            .throughputBps(throughput)
            .statusCode(metrics.getStatusCode())
            .responseSize(metrics.getResponseSize());

        ValidationResult validation;
        try {
            validation = strategy.validateData(fetched.getData(), config, signal);
        } catch (CancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[RETRIEVAL] Validation error | strategy={} | dealId={} | url={} | error={}",
                strategy.getName(), config.getDeal().getId(), url.getUrl(), e.getMessage());
            validation = ValidationResult.failed("validation-error", e.getMessage());
        }

        if (validation != null && !validation.isValid()) {
            log.warn("[RETRIEVAL] Validation failed | strategy={} | dealId={} | url={} | status={} | bytes={} | details={}",
                strategy.getName(), config.getDeal().getId(), url.getUrl(), metrics.getStatusCode(),
                metrics.getResponseSize(), validation.getDetails());
            return result.success(false)
                .validation(validation)
                .errorMessage("Validation failed (" + validation.getMethod() + "): " + validation.getDetails())
                .completedAt(clock.instant())
                .build();
        }

        return result.success(true).validation(validation).completedAt(clock.instant()).build();
    }

    private static boolean isRetryable(RetrievalExecutionResult result) {
        return result.getValidation() == null && result.isRetryable();
    }

    private RetrievalExecutionResult abortedResult(RetrievalStrategy strategy, String reason) {
        Instant now = clock.instant();
        return RetrievalExecutionResult.builder()
            .strategyName(strategy.getName())
            .serviceType(strategy.getServiceType())
            .success(false)
            .timedOut(true)
            .errorMessage("Retrieval aborted: " + reason)
            .startedAt(now)
            .completedAt(now)
            .build();
    }
}
