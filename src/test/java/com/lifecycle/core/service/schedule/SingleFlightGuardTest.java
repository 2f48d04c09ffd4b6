package com.lifecycle.core.service.schedule;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SingleFlightGuardTest {

    @Test
    void overlappingRunIsSkipped() throws Exception {
        var guard = new SingleFlightGuard("Cleanup");
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var runs = new AtomicInteger();

        CompletableFuture<Boolean> first = CompletableFuture.supplyAsync(() -> guard.runExclusive(() -> {
            runs.incrementAndGet();
            entered.countDown();
            awaitQuietly(release);
        }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(guard.isRunning()).isTrue();
        assertThat(guard.runExclusive(runs::incrementAndGet)).isFalse();
        assertThat(guard.getSkippedCount()).isEqualTo(1);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !guard.isRunning());

        assertThat(guard.runExclusive(runs::incrementAndGet)).isTrue();
        assertThat(runs).hasValue(2);
    }

    @Test
    void guardIsReleasedWhenTaskThrows() {
        var guard = new SingleFlightGuard("Archive");

        assertThatThrownBy(() -> guard.runExclusive(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(guard.isRunning()).isFalse();
        assertThat(guard.runExclusive(() -> { })).isTrue();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
