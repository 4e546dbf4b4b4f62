package com.koni.climate.application.collector;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking collection loop for one source: run a cycle, sleep, repeat, until the
 * thread is interrupted. Each collector process runs exactly one of these.
 */
@Slf4j
public class PollingCollector implements Runnable {

    private final DeviceSource source;
    private final CollectionCycle cycle;
    private final Duration interval;
    private final AtomicLong completedCycles = new AtomicLong();

    public PollingCollector(DeviceSource source, CollectionCycle cycle, Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.source = source;
        this.cycle = cycle;
        this.interval = interval;
    }

    @Override
    public void run() {
        log.info("Collector for {} started, interval={}", source.kind().getTag(), interval);
        while (!Thread.currentThread().isInterrupted()) {
            CycleSummary summary = cycle.run(source);
            completedCycles.incrementAndGet();
            if (summary.isInterrupted()) {
                break;
            }
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Collector for {} stopped after {} cycles", source.kind().getTag(), completedCycles.get());
    }

    public long getCompletedCycles() {
        return completedCycles.get();
    }
}
