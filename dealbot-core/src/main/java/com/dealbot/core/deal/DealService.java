package com.dealbot.core.deal;

import com.dealbot.client.provider.PieceUploadResponse;
import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.provider.ProviderRegistry;
import com.dealbot.client.provider.StorageProviderClient;
import com.dealbot.client.wallet.WalletAllowanceService;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.DealStatus;
import com.dealbot.common.exception.ResourceNotFoundException;
import com.dealbot.common.util.LogFormat;
import com.dealbot.core.packager.DataFile;
import com.dealbot.core.storage.DealConfiguration;
import com.dealbot.core.storage.DealPreprocessingResult;
import com.dealbot.core.storage.StorageStrategyService;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.repository.DealRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

/**
 * Creates probe deals: generate a payload, run it through the storage strategies, upload it to the
 * provider and record every phase on the {@link Deal} row.
 */
@Service
@Slf4j
public class DealService {

    static final int BATCH_SIZE = 10;

    private final DealRepository dealRepository;
    private final StorageStrategyService storageStrategyService;
    private final StorageProviderClient providerClient;
    private final WalletAllowanceService walletAllowanceService;
    private final DataFileGenerator dataFileGenerator;
    private final ProviderRegistry providerRegistry;
    private final Clock clock;
    private final String walletAddress;
    private final boolean enableIpniTesting;
    private final BooleanSupplier ipniCoin;
    private final ExecutorService batchExecutor = Executors.newFixedThreadPool(BATCH_SIZE);

    @Autowired
    public DealService(
            DealRepository dealRepository,
            StorageStrategyService storageStrategyService,
            StorageProviderClient providerClient,
            WalletAllowanceService walletAllowanceService,
            DataFileGenerator dataFileGenerator,
            ProviderRegistry providerRegistry,
            Clock clock,
            @Value("${dealbot.wallet-address:}") String walletAddress,
            @Value("${dealbot.deals.enable-ipni-testing:true}") boolean enableIpniTesting) {
        this(dealRepository, storageStrategyService, providerClient, walletAllowanceService, dataFileGenerator,
            providerRegistry, clock, walletAddress, enableIpniTesting, () -> Math.random() < 0.5);
    }

    DealService(DealRepository dealRepository, StorageStrategyService storageStrategyService,
                StorageProviderClient providerClient, WalletAllowanceService walletAllowanceService,
                DataFileGenerator dataFileGenerator, ProviderRegistry providerRegistry, Clock clock,
                String walletAddress, boolean enableIpniTesting, BooleanSupplier ipniCoin) {
        this.dealRepository = dealRepository;
        this.storageStrategyService = storageStrategyService;
        this.providerClient = providerClient;
        this.walletAllowanceService = walletAllowanceService;
        this.dataFileGenerator = dataFileGenerator;
        this.providerRegistry = providerRegistry;
        this.clock = clock;
        this.walletAddress = walletAddress;
        this.enableIpniTesting = enableIpniTesting;
        this.ipniCoin = ipniCoin;
    }

    /**
     * Configuration for the next deal against {@code provider}. With IPNI testing on, half of the
     * deals are content-addressed.
     */
    public DealConfiguration buildConfiguration(ProviderInfo provider) {
        boolean enableIpni = enableIpniTesting && provider.isIpfsEnabled() && ipniCoin.getAsBoolean();
        return DealConfiguration.builder()
            .provider(provider)
            .walletAddress(walletAddress)
            .enableIpni(enableIpni)
            .build();
    }

    public Deal createDeal(ProviderInfo provider, CancellationSignal signal) {
        return createDeal(buildConfiguration(provider), signal);
    }

    /**
     * Runs one deal end to end. Any failure after the row is persisted marks it FAILED and is
     * rethrown to the caller.
     */
    public Deal createDeal(DealConfiguration configuration, CancellationSignal signal) {
        ProviderInfo provider = configuration.getProvider();
        String spAddress = provider.getAddress();

        walletAllowanceService.ensureAllowance();
        signal.throwIfCancelled();

        DataFile dataFile = dataFileGenerator.generate();
        DealPreprocessingResult preprocessed = storageStrategyService.preprocessDeal(configuration, dataFile);
        DataFile processed = preprocessed.getProcessedData();

        Deal deal = dealRepository.save(Deal.builder()
            .spAddress(spAddress)
            .walletAddress(configuration.getWalletAddress())
            .fileName(processed.getName())
            .fileSize(processed.getSize())
            .status(DealStatus.PENDING)
            .metadata(preprocessed.getMetadata())
            .serviceTypes(new ArrayList<>(preprocessed.getAppliedServiceTypes()))
            .build());

        log.info("[DEAL] Deal started | dealId={} | spAddress={} | serviceTypes={} | size={}",
            deal.getId(), LogFormat.abbreviate(spAddress), deal.getServiceTypes(), processed.getSize());

        try {
            signal.throwIfCancelled();
            Instant uploadStart = clock.instant();
            deal.setUploadStartTime(uploadStart);

            PieceUploadResponse upload = providerClient.uploadPiece(
                provider,
                processed.getName(),
                processed.getData(),
                preprocessed.getProviderConfig().getDataSetMetadata(),
                preprocessed.getProviderConfig().getPieceMetadata(),
                signal);

            Instant uploadEnd = clock.instant();
            long ingestMs = Duration.between(uploadStart, uploadEnd).toMillis();
            deal.setPieceCid(upload.getPieceCid());
            deal.setPieceId(upload.getPieceId());
            deal.setDataSetId(upload.getDataSetId());
            deal.setPieceSize(processed.getSize());
            deal.setUploadEndTime(uploadEnd);
            deal.setIngestLatencyMs(ingestMs);
            deal.setIngestThroughputBps(processed.getSize() * 1000 / Math.max(1, ingestMs));
            deal.advanceTo(DealStatus.UPLOADED);

            if (upload.getPieceCid() == null || upload.getPieceCid().isBlank()) {
                throw new IllegalStateException("Provider did not return a piece CID");
            }

            Instant pieceAdded = clock.instant();
            deal.setTransactionHash(upload.getTransactionHash());
            deal.setPieceAddedTime(pieceAdded);
            deal.advanceTo(DealStatus.PIECE_ADDED);

            Instant confirmed = clock.instant();
            deal.setDealConfirmedTime(confirmed);
            deal.setChainLatencyMs(Duration.between(uploadEnd, confirmed).toMillis());
            deal.setDealLatencyMs(Duration.between(uploadStart, confirmed).toMillis());
            deal.advanceTo(DealStatus.DEAL_CREATED);
            deal = dealRepository.save(deal);

            log.info("[DEAL] Deal created | dealId={} | spAddress={} | pieceCid={} | ingestMs={} | dealLatencyMs={}",
                deal.getId(), LogFormat.abbreviate(spAddress), LogFormat.abbreviate(deal.getPieceCid()),
                ingestMs, deal.getDealLatencyMs());
        } catch (RuntimeException e) {
            log.error("[DEAL] Deal failed | dealId={} | spAddress={} | error={}",
                deal.getId(), LogFormat.abbreviate(spAddress), e.getMessage());
            deal.markFailed(e.getMessage());
            dealRepository.save(deal);
            throw e;
        }

        storageStrategyService.postProcessDeal(deal, configuration, signal);
        return deal;
    }

    /**
     * Creates one deal per active provider, {@value #BATCH_SIZE} providers at a time. Failed deals
     * are logged and left out of the result.
     */
    public List<Deal> createDealsForAllProviders(CancellationSignal signal) {
        List<ProviderInfo> providers = providerRegistry.getActiveProviders();
        walletAllowanceService.ensureAllowance();
        log.info("[DEAL] Creating deals for all providers | count={}", providers.size());

        List<Deal> created = new ArrayList<>();
        for (int i = 0; i < providers.size(); i += BATCH_SIZE) {
            signal.throwIfCancelled();
            List<ProviderInfo> batch = providers.subList(i, Math.min(i + BATCH_SIZE, providers.size()));
            List<CompletableFuture<Deal>> futures = batch.stream()
                .map(provider -> CompletableFuture.supplyAsync(() -> createDeal(provider, signal), batchExecutor)
                    .exceptionally(e -> {
                        log.warn("[DEAL] Batch deal failed | spAddress={} | error={}",
                            LogFormat.abbreviate(provider.getAddress()), e.getMessage());
                        return null;
                    }))
                .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            futures.stream().map(CompletableFuture::join).filter(d -> d != null).forEach(created::add);
        }

        log.info("[DEAL] Batch complete | providers={} | created={}", providers.size(), created.size());
        return created;
    }

    public Deal getDeal(UUID dealId) {
        return dealRepository.findById(dealId)
            .orElseThrow(() -> new ResourceNotFoundException("Deal", dealId));
    }

    @PreDestroy
    public void shutdown() {
        batchExecutor.shutdownNow();
    }
}
