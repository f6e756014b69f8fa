package com.dealbot.core.retrieval;

import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.provider.ProviderRegistry;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.DealStatus;
import com.dealbot.common.constants.RetrievalStatus;
import com.dealbot.common.exception.ResourceNotFoundException;
import com.dealbot.common.util.LogFormat;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.entity.Retrieval;
import com.dealbot.data.repository.DealRepository;
import com.dealbot.data.repository.RetrievalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Retrieval probes: picks a deal, runs every retrieval method against it, and records one row per method.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

    private final DealRepository dealRepository;
    private final RetrievalRepository retrievalRepository;
    private final RetrievalStrategyService strategyService;
    private final ProviderRegistry providerRegistry;

    /**
     * Probes the provider's most recent completed deal. Empty when the provider has none yet.
     */
    public Optional<RetrievalTestResult> performRetrievals(ProviderInfo provider, Duration timeout, CancellationSignal signal) {
        Optional<Deal> deal = dealRepository.findFirstBySpAddressAndStatusOrderByCreatedAtDesc(
            provider.getAddress(), DealStatus.DEAL_CREATED);
        if (deal.isEmpty()) {
            log.info("[RETRIEVAL] No completed deal to retrieve | sp={}", LogFormat.abbreviate(provider.getAddress()));
            return Optional.empty();
        }
        try (CancellationSignal bounded = signal.childWithTimeout(timeout)) {
            return Optional.of(runAndRecord(deal.get(), provider, bounded));
        }
    }

    public RetrievalTestResult retrieveDeal(UUID dealId) {
        Deal deal = dealRepository.findById(dealId)
            .orElseThrow(() -> new ResourceNotFoundException("Deal", dealId));
        if (deal.getStatus() != DealStatus.DEAL_CREATED) {
            throw new IllegalStateException("Deal " + dealId + " is " + deal.getStatus().getValue() + ", not deal_created");
        }
        ProviderInfo provider = providerRegistry.findByAddress(deal.getSpAddress())
            .orElseThrow(() -> new IllegalStateException("Provider " + deal.getSpAddress() + " is not configured"));
        return runAndRecord(deal, provider, CancellationSignal.create());
    }

    private RetrievalTestResult runAndRecord(Deal deal, ProviderInfo provider, CancellationSignal signal) {
        RetrievalConfig config = RetrievalConfig.builder().deal(deal).provider(provider).build();
        RetrievalTestResult result = strategyService.testAllRetrievalMethods(config, signal);

        List<Retrieval> rows = result.getResults().stream()
            .map(execution -> toRetrieval(deal, execution))
            .toList();
        retrievalRepository.saveAll(rows);

        log.info("[RETRIEVAL] Retrievals recorded | dealId={} | sp={} | rows={} | successful={} | aborted={}",
            deal.getId(), LogFormat.abbreviate(provider.getAddress()), rows.size(),
            result.getSummary().getSuccessfulMethods(), result.isAborted());
        return result;
    }

    static Retrieval toRetrieval(Deal deal, RetrievalExecutionResult execution) {
        RetrievalStatus status;
        if (execution.isSuccess()) {
            status = RetrievalStatus.SUCCESS;
        } else if (execution.isTimedOut()) {
            status = RetrievalStatus.TIMEOUT;
        } else {
            status = RetrievalStatus.FAILED;
        }
        return Retrieval.builder()
            .deal(deal)
            .serviceType(execution.getServiceType())
            .retrievalEndpoint(execution.getUrl() != null ? execution.getUrl() : "")
            .status(status)
            .startedAt(execution.getStartedAt())
            .completedAt(execution.getCompletedAt())
            .latencyMs(execution.isSuccess() ? execution.getLatencyMs() : null)
            .ttfbMs(execution.isSuccess() ? execution.getTtfbMs() : null)
            .throughputBps(execution.isSuccess() ? execution.getThroughputBps() : null)
            .bytesRetrieved(execution.getResponseSize())
            .responseCode(execution.getStatusCode() > 0 ? execution.getStatusCode() : null)
            .errorMessage(execution.getErrorMessage())
            .retryCount(execution.getRetryCount() != null ? execution.getRetryCount() : 0)
            .build();
    }
}
