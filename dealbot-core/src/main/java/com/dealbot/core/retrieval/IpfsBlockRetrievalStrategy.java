package com.dealbot.core.retrieval;

import com.dealbot.client.http.HttpFetchRequest;
import com.dealbot.client.http.HttpFetchResult;
import com.dealbot.client.http.HttpVersion;
import com.dealbot.client.http.ProbeHttpClient;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.common.constants.ProbeDefaults;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.core.packager.Cid;
import com.dealbot.core.packager.DagPbLink;
import com.dealbot.core.packager.DagPbNode;
import com.dealbot.core.strategy.StrategyPriority;
import com.dealbot.data.model.ContentAddressedMetadata;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches the root block from the provider's IPFS gateway, then walks the DAG block by block,
 * checking every block against its CID.
 */
@Component
@Slf4j
public class IpfsBlockRetrievalStrategy implements RetrievalStrategy {

    static final String METADATA_MISSING = "metadata-missing";
    static final String BLOCK_FETCH = "block-fetch";

    private static final RetryConfig RETRY = new RetryConfig(2, Duration.ofSeconds(2));

    private final ProbeHttpClient httpClient;
    private final int blockFetchConcurrency;
    private final ExecutorService blockFetchExecutor;

    public IpfsBlockRetrievalStrategy(
            ProbeHttpClient httpClient,
            @Value("${dealbot.retrieval.ipfs-block-fetch-concurrency:6}") int blockFetchConcurrency) {
        this.httpClient = httpClient;
        this.blockFetchConcurrency = Math.max(1, blockFetchConcurrency);
        this.blockFetchExecutor = Executors.newFixedThreadPool(this.blockFetchConcurrency);
    }

    @Override
    public String getName() {
        return ServiceType.IPFS_PIN.getValue();
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.IPFS_PIN;
    }

    @Override
    public StrategyPriority getPriority() {
        return StrategyPriority.MEDIUM;
    }

    @Override
    public boolean canHandle(RetrievalConfig config) {
        if (config.getProvider() == null || !config.getProvider().isIpfsEnabled()
                || config.getProvider().getServiceUrl() == null) {
            return false;
        }
        Optional<ContentAddressedMetadata> metadata = metadata(config);
        if (metadata.isEmpty() || !metadata.get().isEnabled()) {
            log.debug("[RETRIEVAL] IPFS block retrieval not available, IPNI not enabled at creation | dealId={}",
                config.getDeal().getId());
            return false;
        }
        if (metadata.get().getRootCid() == null || metadata.get().getRootCid().isBlank()) {
            log.warn("[RETRIEVAL] IPFS block retrieval not available, missing root CID | dealId={}", config.getDeal().getId());
            return false;
        }
        return true;
    }

    @Override
    public RetrievalUrl constructUrl(RetrievalConfig config) {
        String rootCid = metadata(config)
            .map(ContentAddressedMetadata::getRootCid)
            .filter(root -> !root.isBlank())
            .orElseThrow(() -> new IllegalArgumentException("Deal " + config.getDeal().getId() + " has no IPFS root CID"));
        return RetrievalUrl.builder()
            .url(blockUrl(config, rootCid))
            .headers(Map.of("Accept", ProbeDefaults.RAW_BLOCK_CONTENT_TYPE))
            .httpVersion(HttpVersion.HTTP_2)
            .build();
    }

    /**
     * Verifies the fetched root, then traverses its links breadth-first, fetching each level in
     * batches of {@code blockFetchConcurrency}. Every block failure is counted; the result is valid
     * only when none failed.
     */
    @Override
    public ValidationResult validateData(byte[] data, RetrievalConfig config, CancellationSignal signal) {
        Optional<String> root = metadata(config).map(ContentAddressedMetadata::getRootCid).filter(r -> !r.isBlank());
        if (root.isEmpty()) {
            log.warn("[RETRIEVAL] Block-fetch validation skipped, rootCID metadata missing | dealId={}",
                config.getDeal().getId());
            return ValidationResult.failed(METADATA_MISSING, "Cannot validate: rootCID metadata is missing");
        }

        Cid rootCid;
        List<Cid> rootLinks;
        try {
            rootCid = Cid.parse(root.get());
            if (!rootCid.matches(data)) {
                return ValidationResult.failed(BLOCK_FETCH, "Root block does not hash to " + root.get());
            }
            rootLinks = links(rootCid, data);
        } catch (RuntimeException e) {
            return ValidationResult.failed(BLOCK_FETCH, "Root block invalid: " + e.getMessage());
        }

        AtomicInteger verified = new AtomicInteger(1);
        AtomicInteger failed = new AtomicInteger();
        AtomicLong bytesRead = new AtomicLong(data.length);
        Set<Cid> enqueued = new HashSet<>();
        enqueued.add(rootCid);
        Queue<Cid> queue = new ArrayDeque<>();
        for (Cid link : rootLinks) {
            if (enqueued.add(link)) {
                queue.add(link);
            }
        }

        while (!queue.isEmpty()) {
            signal.throwIfCancelled();
            List<Cid> batch = new ArrayList<>(blockFetchConcurrency);
            while (!queue.isEmpty() && batch.size() < blockFetchConcurrency) {
                batch.add(queue.poll());
            }

            List<CompletableFuture<List<Cid>>> futures = batch.stream()
                .map(cid -> CompletableFuture.supplyAsync(() -> fetchBlock(config, cid, signal, bytesRead), blockFetchExecutor))
                .toList();

            for (int i = 0; i < futures.size(); i++) {
                try {
                    List<Cid> children = futures.get(i).join();
                    verified.incrementAndGet();
                    for (Cid child : children) {
                        if (enqueued.add(child)) {
                            queue.add(child);
                        }
                    }
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof CancelledException cancelled) {
                        throw cancelled;
                    }
                    failed.incrementAndGet();
                    log.warn("[RETRIEVAL] Block-fetch error | dealId={} | cid={} | error={}",
                        config.getDeal().getId(), batch.get(i), cause.getMessage());
                }
            }
        }

        int total = verified.get() + failed.get();
        if (failed.get() == 0) {
            return ValidationResult.builder()
                .valid(true)
                .method(BLOCK_FETCH)
                .details("Block-fetch validation: verified " + verified.get() + " blocks via DAG traversal")
                .bytesRead(bytesRead.get())
                .build();
        }
        String details = "Block-fetch validation failed: " + failed.get() + "/" + total
            + " blocks failed for rootCID " + root.get();
        log.warn("[RETRIEVAL] {} | dealId={}", details, config.getDeal().getId());
        return ValidationResult.builder()
            .valid(false)
            .method(BLOCK_FETCH)
            .details(details)
            .bytesRead(bytesRead.get())
            .build();
    }

    private List<Cid> fetchBlock(RetrievalConfig config, Cid cid, CancellationSignal signal, AtomicLong bytesRead) {
        HttpFetchResult result = httpClient.fetch(HttpFetchRequest.builder()
            .url(blockUrl(config, cid.toString()))
            .headers(Map.of("Accept", ProbeDefaults.RAW_BLOCK_CONTENT_TYPE))
            .httpVersion(HttpVersion.HTTP_2)
            .build(), signal);
        byte[] block = result.getData();
        if (!cid.matches(block)) {
            throw new IllegalStateException("CID hash mismatch for " + cid);
        }
        bytesRead.addAndGet(block.length);
        return links(cid, block);
    }

    private static List<Cid> links(Cid cid, byte[] block) {
        if (cid.isRaw()) {
            return List.of();
        }
        if (!cid.isDagPb()) {
            throw new IllegalStateException("Unsupported codec 0x" + Integer.toHexString(cid.getCodec()));
        }
        return DagPbNode.decode(block).links().stream().map(DagPbLink::hash).toList();
    }

    private static Optional<ContentAddressedMetadata> metadata(RetrievalConfig config) {
        if (config.getDeal() == null || config.getDeal().getMetadata() == null) {
            return Optional.empty();
        }
        return config.getDeal().getMetadata().contentAddressed();
    }

    private static String blockUrl(RetrievalConfig config, String cid) {
        return config.getProvider().normalizedServiceUrl() + "/ipfs/" + cid;
    }

    @Override
    public RetryConfig getRetryConfig() {
        return RETRY;
    }

    /** Gateway fetches always go direct. */
    @Override
    public boolean useProxy() {
        return false;
    }

    @PreDestroy
    public void shutdown() {
        blockFetchExecutor.shutdownNow();
    }
}
