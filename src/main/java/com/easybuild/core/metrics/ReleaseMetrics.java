package com.easybuild.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for release preparation.
 */
@Service
public class ReleaseMetrics {

    private final MeterRegistry registry;

    public ReleaseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStage(String stage, boolean success, long ms) {
        Timer.builder("easybuild.release.stage.duration")
                .tag("stage", stage)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordReleaseResult(String ecosystem, boolean success) {
        Counter.builder("easybuild.release.total")
                .tag("ecosystem", ecosystem)
                .tag("status", success ? "prepared" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * Counts version writes per ecosystem, including partial Xamarin updates as successes.
     */
    public void recordVersionUpdate(String ecosystem, boolean success) {
        Counter.builder("easybuild.version.updates")
                .tag("ecosystem", ecosystem)
                .tag("result", success ? "updated" : "failed")
                .register(registry)
                .increment();
    }
}
