package com.dealbot.data.repository;

import com.dealbot.data.entity.JobMutex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JobMutexRepositoryTest extends PostgresRepositoryTest {

    private static final long TIMEOUT_SECONDS = 900;

    @Autowired
    private JobMutexRepository repository;

    private void backdate(String spAddress, long seconds) {
        jdbcTemplate.update("UPDATE job_mutex SET updated_at = now() - (? * interval '1 second') WHERE sp_address = ?",
            seconds, spAddress);
    }

    @Test
    @DisplayName("The first claim wins and a live lease blocks every other holder")
    void liveLeaseBlocks() {
        UUID first = UUID.randomUUID();

        assertThat(repository.tryAcquire("DEAL", "f01", first, "host-a", TIMEOUT_SECONDS)).isEqualTo(1);
        assertThat(repository.tryAcquire("RETRIEVAL", "f01", UUID.randomUUID(), "host-b", TIMEOUT_SECONDS)).isZero();
        assertThat(repository.tryAcquire("DEAL", "f02", UUID.randomUUID(), "host-b", TIMEOUT_SECONDS)).isEqualTo(1);

        JobMutex lease = repository.findById("f01").orElseThrow();
        assertThat(lease.getJobId()).isEqualTo(first);
        assertThat(lease.getHostname()).isEqualTo("host-a");
    }

    @Test
    @DisplayName("Concurrent claims for one provider produce exactly one holder")
    void concurrentAcquire() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String host = "host-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return repository.tryAcquire("DEAL", "f01", UUID.randomUUID(), host, TIMEOUT_SECONDS);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Integer> result : results) {
                winners += result.get(30, TimeUnit.SECONDS);
            }
            assertThat(winners).isEqualTo(1);
            assertThat(repository.count()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("A lease not renewed within the timeout is taken over in place")
    void takeoverAfterExpiry() {
        UUID stale = UUID.randomUUID();
        UUID fresh = UUID.randomUUID();
        repository.tryAcquire("DEAL", "f01", stale, "host-a", TIMEOUT_SECONDS);
        backdate("f01", TIMEOUT_SECONDS + 60);

        assertThat(repository.tryAcquire("RETRIEVAL", "f01", fresh, "host-b", TIMEOUT_SECONDS)).isEqualTo(1);

        JobMutex lease = repository.findById("f01").orElseThrow();
        assertThat(lease.getJobId()).isEqualTo(fresh);
        assertThat(lease.getHostname()).isEqualTo("host-b");
        assertThat(repository.renew(stale)).isZero();
        assertThat(repository.release(stale)).isZero();
        assertThat(repository.existsById("f01")).isTrue();
    }

    @Test
    @DisplayName("A lease renewed inside the timeout is not taken over")
    void renewedLeaseSurvives() {
        UUID holder = UUID.randomUUID();
        repository.tryAcquire("DEAL", "f01", holder, "host-a", TIMEOUT_SECONDS);
        backdate("f01", TIMEOUT_SECONDS - 60);
        Instant before = repository.findById("f01").orElseThrow().getUpdatedAt();

        assertThat(repository.renew(holder)).isEqualTo(1);

        assertThat(repository.findById("f01").orElseThrow().getUpdatedAt()).isAfter(before);
        backdate("f01", 30);
        assertThat(repository.tryAcquire("DEAL", "f01", UUID.randomUUID(), "host-b", TIMEOUT_SECONDS)).isZero();
    }

    @Test
    @DisplayName("Only the holder's job id releases the lease")
    void releaseByHolderOnly() {
        UUID holder = UUID.randomUUID();
        repository.tryAcquire("DEAL", "f01", holder, "host-a", TIMEOUT_SECONDS);

        assertThat(repository.release(UUID.randomUUID())).isZero();
        assertThat(repository.existsById("f01")).isTrue();

        assertThat(repository.release(holder)).isEqualTo(1);
        assertThat(repository.existsById("f01")).isFalse();
        assertThat(repository.tryAcquire("DEAL", "f01", UUID.randomUUID(), "host-b", TIMEOUT_SECONDS)).isEqualTo(1);
    }
}
