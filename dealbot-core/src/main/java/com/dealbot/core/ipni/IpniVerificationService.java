package com.dealbot.core.ipni;

import com.dealbot.client.ipni.IpniIndexerClient;
import com.dealbot.client.provider.PieceStatusResponse;
import com.dealbot.client.provider.StorageProviderClient;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a provider indexed and advertised a piece, and that the IPNI indexer resolves its CIDs
 * to that provider.
 */
@Service
@Slf4j
public class IpniVerificationService {

    static final String NOT_FOUND = "not found";
    static final String WRONG_MULTIADDR = "wrong multiaddr";
    static final String DEADLINE_EXCEEDED = "verification deadline exceeded";

    private final StorageProviderClient providerClient;
    private final IpniIndexerClient indexerClient;
    private final Clock clock;
    private final Duration perCidTimeout;
    private final Duration lookupRetryInterval;

    public IpniVerificationService(
            StorageProviderClient providerClient,
            IpniIndexerClient indexerClient,
            Clock clock,
            @Value("${dealbot.ipni.per-cid-timeout-ms:5000}") long perCidTimeoutMs,
            @Value("${dealbot.ipni.lookup-retry-interval-ms:5000}") long lookupRetryIntervalMs) {
        this.providerClient = providerClient;
        this.indexerClient = indexerClient;
        this.clock = clock;
        this.perCidTimeout = Duration.ofMillis(perCidTimeoutMs);
        this.lookupRetryInterval = Duration.ofMillis(lookupRetryIntervalMs);
    }

    /**
     * Polls the provider's piece status until it reports the piece as advertised or {@code timeout}
     * elapses. Failed status checks count as checks; polling continues.
     */
    public PieceMonitoringResult pollPieceStatus(String serviceUrl, String pieceCid, Duration timeout,
                                                 Duration interval, CancellationSignal signal) {
        Instant start = clock.instant();
        Instant deadline = start.plus(timeout);
        int checks = 0;
        boolean indexed = false;
        boolean advertised = false;
        Instant indexedAt = null;
        Instant advertisedAt = null;
        String lastStatus = "";

        while (clock.instant().isBefore(deadline)) {
            signal.throwIfCancelled();
            checks++;
            try {
                PieceStatusResponse status = providerClient.getPieceStatus(serviceUrl, pieceCid);
                lastStatus = status.getStatus();
                if (status.isIndexed() && !indexed) {
                    indexed = true;
                    indexedAt = clock.instant();
                    log.info("[IPNI] Piece indexed | pieceCid={}", LogFormat.abbreviate(pieceCid));
                }
                if (status.isAdvertised() && !advertised) {
                    advertised = true;
                    advertisedAt = clock.instant();
                    log.info("[IPNI] Piece advertised | pieceCid={}", LogFormat.abbreviate(pieceCid));
                }
                if (advertised) {
                    // advertisement implies indexing even if the provider never reported it separately
                    if (!indexed) {
                        indexed = true;
                        indexedAt = advertisedAt;
                    }
                    return PieceMonitoringResult.builder()
                        .success(true)
                        .lastStatus(lastStatus)
                        .indexed(true)
                        .advertised(true)
                        .indexedAt(indexedAt)
                        .advertisedAt(advertisedAt)
                        .checks(checks)
                        .durationMs(Duration.between(start, clock.instant()).toMillis())
                        .build();
                }
            } catch (CancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (checks % 20 == 0) {
                    log.debug("[IPNI] Status check error | pieceCid={} | checks={} | error={}",
                        LogFormat.abbreviate(pieceCid), checks, e.getMessage());
                }
            }
            signal.sleep(interval);
        }

        long durationMs = Duration.between(start, clock.instant()).toMillis();
        log.warn("[IPNI] Piece status timeout | pieceCid={} | checks={} | durationMs={} | indexed={}",
            LogFormat.abbreviate(pieceCid), checks, durationMs, indexed);
        return PieceMonitoringResult.builder()
            .success(false)
            .lastStatus(lastStatus)
            .indexed(indexed)
            .advertised(false)
            .indexedAt(indexedAt)
            .checks(checks)
            .durationMs(durationMs)
            .build();
    }

    /**
     * Looks every CID up in the indexer until all resolve to {@code expectedMultiaddr} or {@code timeout}
     * elapses. A null multiaddr accepts any provider.
     */
    public IpniVerificationResult verifyAllCids(String rootCid, List<String> blockCids, String expectedMultiaddr,
                                                Duration timeout, CancellationSignal signal) {
        Instant start = clock.instant();
        Instant deadline = start.plus(timeout);

        Map<String, IpniVerificationResult.FailedCid> pending = new LinkedHashMap<>();
        for (String cid : blockCids) {
            pending.put(cid, new IpniVerificationResult.FailedCid(cid, DEADLINE_EXCEEDED, List.of()));
        }
        if (rootCid != null) {
            pending.putIfAbsent(rootCid, new IpniVerificationResult.FailedCid(rootCid, DEADLINE_EXCEEDED, List.of()));
        }
        int total = pending.size();
        int round = 0;

        while (!pending.isEmpty() && clock.instant().isBefore(deadline)) {
            round++;
            for (String cid : new ArrayList<>(pending.keySet())) {
                signal.throwIfCancelled();
                if (!clock.instant().isBefore(deadline)) {
                    break;
                }
                IpniVerificationResult.FailedCid failure = checkCid(cid, expectedMultiaddr);
                if (failure == null) {
                    pending.remove(cid);
                } else {
                    pending.put(cid, failure);
                }
            }
            if (!pending.isEmpty() && clock.instant().isBefore(deadline)) {
                log.debug("[IPNI] Verification round incomplete | round={} | pending={} | total={}",
                    round, pending.size(), total);
                signal.sleep(lookupRetryInterval);
            }
        }

        int unverified = pending.size();
        IpniVerificationResult result = IpniVerificationResult.builder()
            .verified(total - unverified)
            .unverified(unverified)
            .total(total)
            .rootCidVerified(rootCid != null && !pending.containsKey(rootCid))
            .durationMs(Duration.between(start, clock.instant()).toMillis())
            .failedCids(List.copyOf(pending.values()))
            .verifiedAt(clock.instant())
            .build();

        if (result.isRootCidVerified()) {
            log.info("[IPNI] CIDs verified | rootCid={} | verified={}/{} | durationMs={}",
                LogFormat.abbreviate(rootCid), result.getVerified(), total, result.getDurationMs());
        } else {
            log.warn("[IPNI] Verification failed | rootCid={} | verified={}/{} | durationMs={}",
                LogFormat.abbreviate(rootCid), result.getVerified(), total, result.getDurationMs());
        }
        return result;
    }

    private IpniVerificationResult.FailedCid checkCid(String cid, String expectedMultiaddr) {
        try {
            List<String> addrs = indexerClient.findProviderAddrs(cid, perCidTimeout);
            if (addrs.isEmpty()) {
                return new IpniVerificationResult.FailedCid(cid, NOT_FOUND, List.of());
            }
            if (expectedMultiaddr != null && !expectedMultiaddr.isBlank() && !addrs.contains(expectedMultiaddr)) {
                return new IpniVerificationResult.FailedCid(cid, WRONG_MULTIADDR, addrs);
            }
            return null;
        } catch (RuntimeException e) {
            return new IpniVerificationResult.FailedCid(cid, e.getMessage(), List.of());
        }
    }
}
