package com.lodestar.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for agent execution.
 */
@Service
public class LodestarMetrics {

    private final MeterRegistry registry;

    public LodestarMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome iteration outcome status, e.g. "ADVANCED" or "STALLED"
     */
    public void recordIterationOutcome(String outcome) {
        Counter.builder("lodestar.iterations.total")
                .description("Agent iterations by outcome")
                .tag("outcome", outcome.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordIterationDuration(long ms) {
        Timer.builder("lodestar.iteration.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordActionDuration(String action, long ms) {
        Timer.builder("lodestar.action.duration")
                .tag("action", action)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementActionFailures(String action) {
        Counter.builder("lodestar.actions.failures")
                .description("Failed action executions, including emission drift")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    /**
     * Records how many facts one iteration left in the durable state.
     */
    public void recordDurableFactCount(int count) {
        DistributionSummary.builder("lodestar.durable.facts")
                .description("Durable facts per session after each saved iteration")
                .register(registry)
                .record(count);
    }
}
