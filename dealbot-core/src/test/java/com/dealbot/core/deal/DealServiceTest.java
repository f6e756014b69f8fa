package com.dealbot.core.deal;

import com.dealbot.client.provider.PieceUploadResponse;
import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.provider.ProviderRegistry;
import com.dealbot.client.provider.StorageProviderClient;
import com.dealbot.client.wallet.WalletAllowanceService;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.DealStatus;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.common.exception.ResourceNotFoundException;
import com.dealbot.core.storage.DirectStorageStrategy;
import com.dealbot.core.storage.StorageStrategyService;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.repository.DealRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DealServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);

    private DealRepository dealRepository;
    private StorageProviderClient providerClient;
    private WalletAllowanceService walletAllowanceService;
    private ProviderRegistry providerRegistry;
    private DealService service;

    private static ProviderInfo provider(String address) {
        return ProviderInfo.builder().address(address).serviceUrl("http://" + address + ".local").build();
    }

    private static PieceUploadResponse uploaded(String pieceCid) {
        return PieceUploadResponse.builder()
            .pieceCid(pieceCid)
            .pieceId(7L)
            .dataSetId(3L)
            .transactionHash("0xfeed")
            .build();
    }

    @BeforeEach
    void setUp() {
        dealRepository = mock(DealRepository.class);
        when(dealRepository.save(any(Deal.class))).thenAnswer(inv -> {
            Deal deal = inv.getArgument(0, Deal.class);
            if (deal.getId() == null) {
                deal.setId(UUID.randomUUID());
            }
            return deal;
        });
        providerClient = mock(StorageProviderClient.class);
        walletAllowanceService = mock(WalletAllowanceService.class);
        providerRegistry = mock(ProviderRegistry.class);
        service = service(true, false);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private DealService service(boolean ipniTesting, boolean coin) {
        return new DealService(
            dealRepository,
            new StorageStrategyService(List.of(new DirectStorageStrategy())),
            providerClient,
            walletAllowanceService,
            new DataFileGenerator(clock, List.of(2048L), new Random(5)),
            providerRegistry,
            clock,
            "0xwallet",
            ipniTesting,
            () -> coin);
    }

    @Test
    @DisplayName("A successful deal walks every status and records the uploaded piece")
    void createsDeal() {
        when(providerClient.uploadPiece(any(), anyString(), any(), anyMap(), anyMap(), any())).thenReturn(uploaded("bafkzcibpiece"));

        Deal deal = service.createDeal(provider("f01234"), CancellationSignal.none());

        assertThat(deal.getStatus()).isEqualTo(DealStatus.DEAL_CREATED);
        assertThat(deal.getPieceCid()).isEqualTo("bafkzcibpiece");
        assertThat(deal.getTransactionHash()).isEqualTo("0xfeed");
        assertThat(deal.getFileSize()).isEqualTo(2048L);
        assertThat(deal.getWalletAddress()).isEqualTo("0xwallet");
        assertThat(deal.getServiceTypes()).containsExactly(ServiceType.DIRECT_SP);
        assertThat(deal.getUploadEndTime()).isNotNull();
        assertThat(deal.getDealLatencyMs()).isZero();
        verify(walletAllowanceService).ensureAllowance();
        verify(dealRepository, atLeastOnce()).save(deal);
    }

    @Test
    @DisplayName("A provider response without a piece CID fails the deal")
    void missingPieceCidFails() {
        when(providerClient.uploadPiece(any(), anyString(), any(), anyMap(), anyMap(), any())).thenReturn(uploaded(null));

        assertThatThrownBy(() -> service.createDeal(provider("f01234"), CancellationSignal.none()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("piece CID");
        verify(dealRepository, atLeastOnce()).save(argThat(
            (Deal d) -> d != null && d.getStatus() == DealStatus.FAILED && d.getErrorMessage().contains("piece CID")));
    }

    @Test
    @DisplayName("An upload error marks the persisted deal failed and is rethrown")
    void uploadErrorFails() {
        when(providerClient.uploadPiece(any(), anyString(), any(), anyMap(), anyMap(), any()))
            .thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> service.createDeal(provider("f01234"), CancellationSignal.none()))
            .hasMessage("connection refused");
        verify(dealRepository, atLeastOnce()).save(argThat(
            (Deal d) -> d != null && d.getStatus() == DealStatus.FAILED));
    }

    @Test
    @DisplayName("IPNI is enabled only when testing is on, the provider serves IPFS and the coin lands")
    void ipniSelection() {
        ProviderInfo ipfs = provider("f01234");
        ProviderInfo noIpfs = ProviderInfo.builder().address("f05678").serviceUrl("http://x").ipfsEnabled(false).build();

        assertThat(service(true, true).buildConfiguration(ipfs).isEnableIpni()).isTrue();
        assertThat(service(true, false).buildConfiguration(ipfs).isEnableIpni()).isFalse();
        assertThat(service(false, true).buildConfiguration(ipfs).isEnableIpni()).isFalse();
        assertThat(service(true, true).buildConfiguration(noIpfs).isEnableIpni()).isFalse();
    }

    @Test
    @DisplayName("Batch creation keeps the successful deals and drops the failed ones")
    void batchDropsFailures() {
        when(providerRegistry.getActiveProviders())
            .thenReturn(List.of(provider("f01"), provider("f02"), provider("f03")));
        when(providerClient.uploadPiece(any(), anyString(), any(), anyMap(), anyMap(), any())).thenAnswer(inv -> {
            ProviderInfo target = inv.getArgument(0, ProviderInfo.class);
            if (target.getAddress().equals("f02")) {
                throw new IllegalStateException("provider down");
            }
            return uploaded("bafkzcib" + target.getAddress());
        });

        List<Deal> deals = service.createDealsForAllProviders(CancellationSignal.none());

        assertThat(deals).extracting(Deal::getSpAddress).containsExactlyInAnyOrder("f01", "f03");
        assertThat(deals).allSatisfy(d -> assertThat(d.getStatus()).isEqualTo(DealStatus.DEAL_CREATED));
    }

    @Test
    @DisplayName("Looking up an unknown deal is not found")
    void unknownDeal() {
        UUID id = UUID.randomUUID();
        when(dealRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getDeal(id)).isInstanceOf(ResourceNotFoundException.class);
    }
}
