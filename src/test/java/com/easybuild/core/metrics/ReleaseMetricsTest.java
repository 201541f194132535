package com.easybuild.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReleaseMetricsTest {

    private SimpleMeterRegistry registry;
    private ReleaseMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ReleaseMetrics(registry);
    }

    @Test
    @DisplayName("recordStage creates a timer per stage and outcome")
    void recordStage() {
        metrics.recordStage("MERGE", true, 1500);
        metrics.recordStage("MERGE", false, 20);

        var ok = registry.find("easybuild.release.stage.duration")
                .tag("stage", "MERGE").tag("outcome", "success").timer();
        var failed = registry.find("easybuild.release.stage.duration")
                .tag("stage", "MERGE").tag("outcome", "failure").timer();

        assertNotNull(ok);
        assertNotNull(failed);
        assertEquals(1, ok.count());
        assertEquals(1500.0, ok.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordReleaseResult increments the matching counter")
    void recordReleaseResult() {
        metrics.recordReleaseResult("flutter", true);
        metrics.recordReleaseResult("flutter", true);
        metrics.recordReleaseResult("xamarin", false);

        var prepared = registry.find("easybuild.release.total")
                .tag("ecosystem", "flutter").tag("status", "prepared").counter();
        var failed = registry.find("easybuild.release.total")
                .tag("ecosystem", "xamarin").tag("status", "failed").counter();

        assertNotNull(prepared);
        assertNotNull(failed);
        assertEquals(2.0, prepared.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    void recordVersionUpdate() {
        metrics.recordVersionUpdate("dotnet_maui", false);
        var counter = registry.find("easybuild.version.updates")
                .tag("ecosystem", "dotnet_maui").tag("result", "failed").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
