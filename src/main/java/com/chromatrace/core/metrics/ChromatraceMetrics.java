package com.chromatrace.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for enumeration sessions.
 */
@Service
public class ChromatraceMetrics {

    private final MeterRegistry registry;

    public ChromatraceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIterationDuration(long ms) {
        Timer.builder("chromatrace.iteration.duration")
                .description("Wall-clock time of one generate-solve-parse-filter iteration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSolutions(int count) {
        Counter.builder("chromatrace.solutions.total")
                .register(registry)
                .increment(count);
    }

    public void recordDroppedTraces(int count) {
        Counter.builder("chromatrace.traces.dropped")
                .description("Trace files that could not be decoded")
                .register(registry)
                .increment(count);
    }

    public void recordRejectedCandidates(int count) {
        Counter.builder("chromatrace.candidates.rejected")
                .description("Decoded candidates that violated the problem's constraints")
                .register(registry)
                .increment(count);
    }

    public void recordSessionResult(String status, int iterations) {
        Counter.builder("chromatrace.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
        DistributionSummary.builder("chromatrace.session.iterations")
                .register(registry)
                .record(iterations);
    }
}
