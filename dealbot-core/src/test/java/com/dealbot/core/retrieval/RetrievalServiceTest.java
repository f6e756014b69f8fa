package com.dealbot.core.retrieval;

import com.dealbot.client.provider.ProviderInfo;
import com.dealbot.client.provider.ProviderRegistry;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.constants.DealStatus;
import com.dealbot.common.constants.RetrievalStatus;
import com.dealbot.common.constants.ServiceType;
import com.dealbot.common.exception.ResourceNotFoundException;
import com.dealbot.data.entity.Deal;
import com.dealbot.data.entity.Retrieval;
import com.dealbot.data.repository.DealRepository;
import com.dealbot.data.repository.RetrievalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RetrievalServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    private DealRepository dealRepository;
    private RetrievalRepository retrievalRepository;
    private RetrievalStrategyService strategyService;
    private ProviderRegistry providerRegistry;
    private RetrievalService service;
    private final ProviderInfo provider = ProviderInfo.builder().address("f01234").serviceUrl("http://sp.local").build();

    @BeforeEach
    void setUp() {
        dealRepository = mock(DealRepository.class);
        retrievalRepository = mock(RetrievalRepository.class);
        strategyService = mock(RetrievalStrategyService.class);
        providerRegistry = mock(ProviderRegistry.class);
        service = new RetrievalService(dealRepository, retrievalRepository, strategyService, providerRegistry);
    }

    private static Deal deal(DealStatus status) {
        return Deal.builder()
            .id(UUID.randomUUID())
            .spAddress("f01234")
            .fileName("probe.bin")
            .fileSize(100L)
            .pieceCid("bafkzcibpiece")
            .status(status)
            .build();
    }

    private static RetrievalExecutionResult execution(String name, boolean success, boolean timedOut) {
        return RetrievalExecutionResult.builder()
            .strategyName(name)
            .serviceType(ServiceType.DIRECT_SP)
            .url("http://sp.local/piece/bafkzcibpiece")
            .success(success)
            .timedOut(timedOut)
            .latencyMs(success ? 250 : 0)
            .ttfbMs(success ? 40 : 0)
            .throughputBps(success ? 400 : 0)
            .statusCode(success ? 200 : 0)
            .responseSize(success ? 100 : 0)
            .errorMessage(success ? null : "failed")
            .retryCount(1)
            .startedAt(T0)
            .completedAt(T0.plusMillis(250))
            .build();
    }

    @Test
    @DisplayName("The latest completed deal is retrieved and one row is saved per method")
    @SuppressWarnings("unchecked")
    void recordsOneRowPerMethod() {
        Deal deal = deal(DealStatus.DEAL_CREATED);
        when(dealRepository.findFirstBySpAddressAndStatusOrderByCreatedAtDesc("f01234", DealStatus.DEAL_CREATED))
            .thenReturn(Optional.of(deal));
        List<RetrievalExecutionResult> executions = List.of(
            execution("ipfs_pin", false, true),
            execution("direct_sp", true, false));
        when(strategyService.testAllRetrievalMethods(any(), any())).thenReturn(RetrievalTestResult.builder()
            .dealId(deal.getId())
            .results(executions)
            .summary(RetrievalStrategyService.summarize(executions))
            .testedAt(T0)
            .build());

        Optional<RetrievalTestResult> result = service.performRetrievals(provider, Duration.ofMinutes(5), CancellationSignal.none());

        assertThat(result).isPresent();
        ArgumentCaptor<List<Retrieval>> saved = ArgumentCaptor.forClass(List.class);
        verify(retrievalRepository).saveAll(saved.capture());
        assertThat(saved.getValue()).extracting(Retrieval::getStatus)
            .containsExactly(RetrievalStatus.TIMEOUT, RetrievalStatus.SUCCESS);
        assertThat(saved.getValue()).allSatisfy(row -> assertThat(row.getDeal()).isSameAs(deal));
    }

    @Test
    @DisplayName("A provider without completed deals is skipped")
    void noDealNoProbe() {
        when(dealRepository.findFirstBySpAddressAndStatusOrderByCreatedAtDesc("f01234", DealStatus.DEAL_CREATED))
            .thenReturn(Optional.empty());

        assertThat(service.performRetrievals(provider, Duration.ofMinutes(5), CancellationSignal.none())).isEmpty();
        verifyNoInteractions(strategyService);
        verify(retrievalRepository, never()).saveAll(any());
    }

    @Test
    @DisplayName("Successful executions map their metrics; failures keep only the error")
    void mapsExecutionToRow() {
        Deal deal = deal(DealStatus.DEAL_CREATED);

        Retrieval success = RetrievalService.toRetrieval(deal, execution("direct_sp", true, false));
        Retrieval failure = RetrievalService.toRetrieval(deal, execution("direct_sp", false, false));

        assertThat(success.getStatus()).isEqualTo(RetrievalStatus.SUCCESS);
        assertThat(success.getLatencyMs()).isEqualTo(250L);
        assertThat(success.getTtfbMs()).isEqualTo(40L);
        assertThat(success.getResponseCode()).isEqualTo(200);
        assertThat(success.getRetryCount()).isEqualTo(1);
        assertThat(failure.getStatus()).isEqualTo(RetrievalStatus.FAILED);
        assertThat(failure.getLatencyMs()).isNull();
        assertThat(failure.getResponseCode()).isNull();
        assertThat(failure.getErrorMessage()).isEqualTo("failed");
    }

    @Test
    @DisplayName("Retrieving an unknown deal is not found")
    void unknownDeal() {
        UUID id = UUID.randomUUID();
        when(dealRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.retrieveDeal(id))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining(id.toString());
    }

    @Test
    @DisplayName("Retrieving a deal that is not complete is a conflict")
    void incompleteDeal() {
        Deal deal = deal(DealStatus.UPLOADED);
        when(dealRepository.findById(deal.getId())).thenReturn(Optional.of(deal));

        assertThatThrownBy(() -> service.retrieveDeal(deal.getId()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("uploaded");
    }
}
