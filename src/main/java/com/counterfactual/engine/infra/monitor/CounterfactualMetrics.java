package com.counterfactual.engine.infra.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class CounterfactualMetrics {

    private final Counter forecastedPairs;
    private final Counter skippedPairs;
    private final Counter droppedRows;
    private final Timer runDuration;

    public CounterfactualMetrics(MeterRegistry meterRegistry) {
        this.forecastedPairs = Counter.builder("counterfactual.pairs")
                .tag("outcome", "forecast")
                .description("(entity, event) pairs forecast successfully")
                .register(meterRegistry);
        this.skippedPairs = Counter.builder("counterfactual.pairs")
                .tag("outcome", "skipped")
                .description("(entity, event) pairs skipped with a recorded reason")
                .register(meterRegistry);
        this.droppedRows = Counter.builder("counterfactual.rows.dropped")
                .description("Input rows dropped during cleaning")
                .register(meterRegistry);
        this.runDuration = Timer.builder("counterfactual.run.duration")
                .description("End-to-end engine run latency")
                .register(meterRegistry);
    }

    public void recordRun(int forecasted, int skipped, int dropped, long durationNanos) {
        forecastedPairs.increment(forecasted);
        skippedPairs.increment(skipped);
        droppedRows.increment(dropped);
        runDuration.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public double forecastedTotal() {
        return forecastedPairs.count();
    }

    public double skippedTotal() {
        return skippedPairs.count();
    }

    public double droppedTotal() {
        return droppedRows.count();
    }

    @Scheduled(fixedRateString = "${counterfactual.metrics-log-interval-ms:300000}")
    public void logSummary() {
        if (runDuration.count() == 0) return;
        log.info("[Metrics] pairs forecast={} skipped={} | rows dropped={} | run avg={}ms cnt={}",
                (long) forecastedPairs.count(), (long) skippedPairs.count(), (long) droppedRows.count(),
                String.format("%.1f", runDuration.mean(TimeUnit.MILLISECONDS)), runDuration.count());
    }
}
