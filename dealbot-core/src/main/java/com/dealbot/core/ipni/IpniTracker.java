package com.dealbot.core.ipni;

import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.constants.IpniStatus;
import com.dealbot.common.util.LogFormat;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.model.ContentAddressedMetadata;
import com.dealbot.data.repository.DealRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives a deal's IPNI state from {@code pending} through provider indexing and advertisement to
 * indexer verification, stamping each transition on the deal.
 */
@Service
@Slf4j
public class IpniTracker {

    private final IpniVerificationService verificationService;
    private final DealRepository dealRepository;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration statusTimeout;
    private final Duration lookupTimeout;
    private final ExecutorService trackingExecutor;

    public IpniTracker(
            IpniVerificationService verificationService,
            DealRepository dealRepository,
            Clock clock,
            @Value("${dealbot.ipni.poll-interval-ms:2500}") long pollIntervalMs,
            @Value("${dealbot.ipni.status-timeout-ms:600000}") long statusTimeoutMs,
            @Value("${dealbot.ipni.lookup-timeout-ms:3600000}") long lookupTimeoutMs,
            @Value("${dealbot.ipni.tracker-threads:4}") int trackerThreads) {
        this.verificationService = verificationService;
        this.dealRepository = dealRepository;
        this.clock = clock;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.statusTimeout = Duration.ofMillis(statusTimeoutMs);
        this.lookupTimeout = Duration.ofMillis(lookupTimeoutMs);
        this.trackingExecutor = Executors.newFixedThreadPool(trackerThreads);
    }

    /**
     * Marks the deal pending and runs {@link #track} in the background. The deal job does not wait
     * for indexing, which can take up to an hour.
     */
    public CompletableFuture<Deal> startTracking(Deal deal, ContentAddressedMetadata metadata,
                                                 ProviderInfo provider, CancellationSignal signal) {
        deal.setIpniStatus(IpniStatus.PENDING);
        Deal saved = dealRepository.save(deal);
        return CompletableFuture.supplyAsync(() -> track(saved, metadata, provider, signal), trackingExecutor)
            .exceptionally(e -> {
                log.error("[IPNI] Tracking failed | dealId={} | error={}", saved.getId(), e.getMessage());
                return saved;
            });
    }

    public Deal track(Deal deal, ContentAddressedMetadata metadata, ProviderInfo provider, CancellationSignal signal) {
        if (deal.getIpniStatus() == null) {
            deal.setIpniStatus(IpniStatus.PENDING);
        }
        try {
            PieceMonitoringResult monitoring = verificationService.pollPieceStatus(
                provider.normalizedServiceUrl(), deal.getPieceCid(), statusTimeout, pollInterval, signal);
            applyMonitoring(deal, monitoring);

            IpniVerificationResult verification = verificationService.verifyAllCids(
                metadata.getRootCid(),
                metadata.getBlockCids() != null ? metadata.getBlockCids() : List.of(),
                provider.getMultiaddr(),
                lookupTimeout,
                signal);
            applyVerification(deal, verification);

        } catch (CancelledException e) {
            log.info("[IPNI] Tracking cancelled | dealId={} | reason={}", deal.getId(), e.getMessage());
            transition(deal, IpniStatus.FAILED);
        } catch (Exception e) {
            log.warn("[IPNI] Tracking failed | pieceCid={} | error={}", LogFormat.abbreviate(deal.getPieceCid()), e.getMessage());
            transition(deal, IpniStatus.FAILED);
        }

        Deal saved = dealRepository.save(deal);
        log.info("[IPNI] Tracking finished | pieceCid={} | status={} | verifiedCids={} | unverifiedCids={} | timeToVerifyMs={}",
            LogFormat.abbreviate(deal.getPieceCid()), saved.getIpniStatus().getValue(),
            saved.getIpniVerifiedCidsCount(), saved.getIpniUnverifiedCidsCount(), saved.getIpniTimeToVerifyMs());
        return saved;
    }

    void applyMonitoring(Deal deal, PieceMonitoringResult monitoring) {
        Instant uploadEnd = uploadEnd(deal);
        if (monitoring.isIndexed() && deal.getIpniIndexedAt() == null && transition(deal, IpniStatus.SP_INDEXED)) {
            Instant indexedAt = monitoring.getIndexedAt() != null ? monitoring.getIndexedAt() : clock.instant();
            deal.setIpniIndexedAt(indexedAt);
            deal.setIpniTimeToIndexMs(Duration.between(uploadEnd, indexedAt).toMillis());
        }
        if (monitoring.isAdvertised() && deal.getIpniAdvertisedAt() == null && transition(deal, IpniStatus.SP_ADVERTISED)) {
            Instant advertisedAt = monitoring.getAdvertisedAt() != null ? monitoring.getAdvertisedAt() : clock.instant();
            deal.setIpniAdvertisedAt(advertisedAt);
            deal.setIpniTimeToAdvertiseMs(Duration.between(uploadEnd, advertisedAt).toMillis());
        }
    }

    void applyVerification(Deal deal, IpniVerificationResult verification) {
        deal.setIpniVerifiedCidsCount(verification.getVerified());
        deal.setIpniUnverifiedCidsCount(verification.getUnverified());

        if (verification.isRootCidVerified()) {
            if (transition(deal, IpniStatus.VERIFIED)) {
                Instant verifiedAt = verification.getVerifiedAt() != null ? verification.getVerifiedAt() : clock.instant();
                deal.setIpniVerifiedAt(verifiedAt);
                deal.setIpniTimeToVerifyMs(Duration.between(uploadEnd(deal), verifiedAt).toMillis());
            }
        } else if (deal.getIpniStatus() == IpniStatus.PENDING) {
            // nothing observed at all: the provider never indexed and the indexer never resolved
            transition(deal, IpniStatus.FAILED);
        }
    }

    private boolean transition(Deal deal, IpniStatus next) {
        IpniStatus current = deal.getIpniStatus() != null ? deal.getIpniStatus() : IpniStatus.PENDING;
        if (!current.canTransitionTo(next)) {
            log.debug("[IPNI] Transition rejected | dealId={} | from={} | to={}", deal.getId(), current, next);
            return false;
        }
        deal.setIpniStatus(next);
        return true;
    }

    private Instant uploadEnd(Deal deal) {
        return deal.getUploadEndTime() != null ? deal.getUploadEndTime() : clock.instant();
    }

    @PreDestroy
    public void shutdown() {
        trackingExecutor.shutdownNow();
    }
}
