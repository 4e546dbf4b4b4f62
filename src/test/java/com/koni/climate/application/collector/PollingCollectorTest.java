package com.koni.climate.application.collector;

import com.koni.climate.domain.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PollingCollectorTest {

    private final DeviceSource source = mock(DeviceSource.class);
    private final CollectionCycle cycle = mock(CollectionCycle.class);

    @Test
    void shouldRunCyclesUntilInterrupted() throws Exception {
        // Given
        when(source.kind()).thenReturn(SourceKind.CLOUD_THERMOSTAT);
        when(cycle.run(any(DeviceSource.class))).thenReturn(summary(false));
        PollingCollector collector = new PollingCollector(source, cycle, Duration.ofMillis(10));
        Thread thread = new Thread(collector, "collector-test");

        // When
        thread.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> collector.getCompletedCycles() >= 3);
        thread.interrupt();
        thread.join(5_000);

        // Then
        assertThat(thread.isAlive()).isFalse();
    }

    @Test
    void shouldStopWhenCycleReportsInterruption() {
        // Given
        AtomicInteger runs = new AtomicInteger();
        when(source.kind()).thenReturn(SourceKind.CLOUD_THERMOSTAT);
        when(cycle.run(any(DeviceSource.class))).thenAnswer(invocation -> summary(runs.incrementAndGet() == 2));

        // When
        new PollingCollector(source, cycle, Duration.ofMillis(1)).run();

        // Then
        assertThat(runs.get()).isEqualTo(2);
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new PollingCollector(source, cycle, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CycleSummary summary(boolean interrupted) {
        return new CycleSummary(SourceKind.CLOUD_THERMOSTAT, 0, 0, 0, 0, 0, false, interrupted);
    }
}
