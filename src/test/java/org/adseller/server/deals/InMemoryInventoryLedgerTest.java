package org.adseller.server.deals;

import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

public class InMemoryInventoryLedgerTest {

    private InMemoryInventoryLedger target;

    @BeforeEach
    public void setUp() {
        target = new InMemoryInventoryLedger(Map.of("product-1", 1_000L));
    }

    @Test
    public void reserveShouldDecreaseAvailsWhenVolumeIsAvailable() {
        // when
        final Future<Boolean> result = target.reserve("product-1", 400L);

        // then
        assertThat(result.result()).isTrue();
        assertThat(target.getAvails("product-1")).isEqualTo(600L);
    }

    @Test
    public void reserveShouldNotChangeAvailsWhenVolumeIsNotAvailable() {
        // when
        final Future<Boolean> result = target.reserve("product-1", 1_001L);

        // then
        assertThat(result.result()).isFalse();
        assertThat(target.getAvails("product-1")).isEqualTo(1_000L);
    }

    @Test
    public void reserveShouldReturnFalseForProductWithoutAvails() {
        // when and then
        assertThat(target.reserve("unknown", 1L).result()).isFalse();
    }

    @Test
    public void reserveShouldFailOnNegativeVolume() {
        // when and then
        assertThat(target.reserve("product-1", -1L).failed()).isTrue();
    }

    @Test
    public void releaseShouldReturnVolumeToAvails() {
        // given
        target.reserve("product-1", 1_000L);

        // when
        target.release("product-1", 300L);

        // then
        assertThat(target.getAvails("product-1")).isEqualTo(300L);
    }

    @Test
    public void reserveShouldNeverOversellUnderConcurrentRequests() {
        // given
        final AtomicInteger reserved = new AtomicInteger();

        // when
        IntStream.range(0, 500).parallel().forEach(i -> {
            if (target.reserve("product-1", 3L).result()) {
                reserved.incrementAndGet();
            }
        });

        // then
        assertThat(reserved.get()).isEqualTo(333);
        assertThat(target.getAvails("product-1")).isEqualTo(1L);
    }
}
