package com.dealbot.core.ipni;

import com.dealbot.client.ipni.IpniIndexerClient;
import com.dealbot.client.provider.PieceStatusResponse;
import com.dealbot.client.provider.StorageProviderClient;
import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import com.dealbot.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IpniVerificationServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
    private static final String SP_ADDR = "/dns/sp.local/tcp/443/https";
    private static final Duration TICK = Duration.ofMillis(1);

    private MutableClock clock;
    private StorageProviderClient providerClient;
    private IpniIndexerClient indexerClient;
    private IpniVerificationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        providerClient = mock(StorageProviderClient.class);
        indexerClient = mock(IpniIndexerClient.class);
        service = new IpniVerificationService(providerClient, indexerClient, clock, 5000, 1);
    }

    private PieceStatusResponse status(String name, boolean indexed, boolean advertised) {
        clock.advance(Duration.ofSeconds(5));
        return PieceStatusResponse.builder().pieceCid("bafkzcibpiece").status(name)
            .indexed(indexed).advertised(advertised).build();
    }

    @Test
    @DisplayName("Polling stops once the piece is advertised and records when each stage was seen")
    void pollUntilAdvertised() {
        when(providerClient.getPieceStatus("http://sp.local", "bafkzcibpiece"))
            .thenAnswer(inv -> status("stored", false, false))
            .thenAnswer(inv -> status("indexed", true, false))
            .thenAnswer(inv -> status("advertised", true, true));

        PieceMonitoringResult result = service.pollPieceStatus(
            "http://sp.local", "bafkzcibpiece", Duration.ofMinutes(10), TICK, CancellationSignal.none());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getChecks()).isEqualTo(3);
        assertThat(result.getIndexedAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(result.getAdvertisedAt()).isEqualTo(T0.plusSeconds(15));
        assertThat(result.getLastStatus()).isEqualTo("advertised");
        assertThat(result.getDurationMs()).isEqualTo(15_000L);
    }

    @Test
    @DisplayName("An advertisement without a prior index report implies indexing at the same instant")
    void advertisedImpliesIndexed() {
        when(providerClient.getPieceStatus(anyString(), anyString()))
            .thenAnswer(inv -> status("advertised", false, true));

        PieceMonitoringResult result = service.pollPieceStatus(
            "http://sp.local", "bafkzcibpiece", Duration.ofMinutes(1), TICK, CancellationSignal.none());

        assertThat(result.isIndexed()).isTrue();
        assertThat(result.getIndexedAt()).isEqualTo(result.getAdvertisedAt());
    }

    @Test
    @DisplayName("Status errors count as checks and polling gives up at the timeout")
    void pollTimesOut() {
        when(providerClient.getPieceStatus(anyString(), anyString()))
            .thenAnswer(inv -> status("stored", true, false))
            .thenAnswer(inv -> {
                clock.advance(Duration.ofSeconds(5));
                throw new IllegalStateException("502 from provider");
            })
            .thenAnswer(inv -> status("stored", true, false));

        PieceMonitoringResult result = service.pollPieceStatus(
            "http://sp.local", "bafkzcibpiece", Duration.ofSeconds(12), TICK, CancellationSignal.none());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isIndexed()).isTrue();
        assertThat(result.isAdvertised()).isFalse();
        assertThat(result.getChecks()).isEqualTo(3);
    }

    @Test
    @DisplayName("A cancelled signal stops polling before the first check")
    void pollCancelled() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("shutdown");

        assertThatThrownBy(() -> service.pollPieceStatus(
            "http://sp.local", "bafkzcibpiece", Duration.ofMinutes(1), TICK, signal))
            .isInstanceOf(CancelledException.class);
        verifyNoInteractions(providerClient);
    }

    @Test
    @DisplayName("Every CID resolving to the provider verifies the root; the root is counted once")
    void allCidsVerified() {
        when(indexerClient.findProviderAddrs(anyString(), any())).thenReturn(List.of("/ip4/10.0.0.1/tcp/1", SP_ADDR));

        IpniVerificationResult result = service.verifyAllCids(
            "bafyroot", List.of("bafyroot", "bafyleaf1", "bafyleaf2"), SP_ADDR, Duration.ofMinutes(1), CancellationSignal.none());

        assertThat(result.isRootCidVerified()).isTrue();
        assertThat(result.getTotal()).isEqualTo(3);
        assertThat(result.getVerified()).isEqualTo(3);
        assertThat(result.getUnverified()).isZero();
        assertThat(result.getFailedCids()).isEmpty();
    }

    @Test
    @DisplayName("CIDs missing in the first round are retried until the indexer resolves them")
    void resolvesInLaterRound() {
        when(indexerClient.findProviderAddrs(eq("bafyroot"), any()))
            .thenReturn(List.of())
            .thenReturn(List.of(SP_ADDR));
        when(indexerClient.findProviderAddrs(eq("bafyleaf"), any())).thenReturn(List.of(SP_ADDR));

        IpniVerificationResult result = service.verifyAllCids(
            "bafyroot", List.of("bafyleaf"), SP_ADDR, Duration.ofMinutes(1), CancellationSignal.none());

        assertThat(result.isRootCidVerified()).isTrue();
        assertThat(result.getVerified()).isEqualTo(2);
    }

    @Test
    @DisplayName("A CID advertised by another provider fails as wrong multiaddr once the deadline passes")
    void wrongMultiaddrAtDeadline() {
        when(indexerClient.findProviderAddrs(eq("bafyroot"), any())).thenReturn(List.of(SP_ADDR));
        when(indexerClient.findProviderAddrs(eq("bafyleaf"), any())).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(20));
            return List.of("/dns/other.local/tcp/443/https");
        });
        when(indexerClient.findProviderAddrs(eq("bafymissing"), any())).thenReturn(List.of());

        IpniVerificationResult result = service.verifyAllCids(
            "bafyroot", List.of("bafyleaf", "bafymissing"), SP_ADDR, Duration.ofMinutes(1), CancellationSignal.none());

        assertThat(result.isRootCidVerified()).isTrue();
        assertThat(result.getTotal()).isEqualTo(3);
        assertThat(result.getVerified()).isEqualTo(1);
        assertThat(result.getUnverified()).isEqualTo(2);
        assertThat(result.getFailedCids())
            .extracting(IpniVerificationResult.FailedCid::cid, IpniVerificationResult.FailedCid::reason)
            .containsExactlyInAnyOrder(
                tuple("bafyleaf", IpniVerificationService.WRONG_MULTIADDR),
                tuple("bafymissing", IpniVerificationService.NOT_FOUND));
        assertThat(result.getFailedCids())
            .filteredOn(f -> f.cid().equals("bafyleaf"))
            .singleElement()
            .satisfies(f -> assertThat(f.addrs()).containsExactly("/dns/other.local/tcp/443/https"));
    }

    @Test
    @DisplayName("Indexer errors are recorded per CID and without an expected multiaddr any provider counts")
    void lookupErrorsAndAnyProvider() {
        when(indexerClient.findProviderAddrs(eq("bafyroot"), any())).thenReturn(List.of("/dns/any.local/tcp/443/https"));
        when(indexerClient.findProviderAddrs(eq("bafyleaf"), any())).thenAnswer(inv -> {
            clock.advance(Duration.ofMinutes(2));
            throw new IllegalStateException("indexer unavailable");
        });

        IpniVerificationResult result = service.verifyAllCids(
            "bafyroot", List.of("bafyroot", "bafyleaf"), null, Duration.ofMinutes(1), CancellationSignal.none());

        assertThat(result.isRootCidVerified()).isTrue();
        assertThat(result.getFailedCids()).singleElement()
            .satisfies(f -> assertThat(f.reason()).isEqualTo("indexer unavailable"));
    }
}
