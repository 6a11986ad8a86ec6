package com.flagship.transaction_engine.observability;

import com.flagship.transaction_engine.mutation.MutationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for an engine run.
 *
 * Metrics exposed:
 * - engine.mutations: Counter tagged by kind and outcome (applied, ignored, rejected)
 * - engine.records.malformed: Counter of input rows that failed validation
 * - engine.accounts.locked: Counter of accounts locked by a chargeback
 * - engine.run.duration: Timer for a full run
 */
@Component
public class EngineMetrics {

    public static final String MUTATIONS = "engine.mutations";

    public static final String OUTCOME_APPLIED = "applied";
    public static final String OUTCOME_IGNORED = "ignored";
    public static final String OUTCOME_REJECTED = "rejected";

    private final MeterRegistry registry;

    private final Counter malformedRecords;
    private final Counter lockedAccounts;
    private final Timer runTimer;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.malformedRecords = Counter.builder("engine.records.malformed")
                .description("Number of input rows rejected before reaching an account")
                .register(registry);

        this.lockedAccounts = Counter.builder("engine.accounts.locked")
                .description("Number of accounts locked by a chargeback")
                .register(registry);

        this.runTimer = Timer.builder("engine.run.duration")
                .description("Time taken to process a full input stream")
                .register(registry);
    }

    public void recordMutation(MutationKind kind, String outcome) {
        registry.counter(MUTATIONS,
                "kind", kind.getLabel(),
                "outcome", outcome.toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordMalformedRecord() {
        malformedRecords.increment();
    }

    public void recordAccountLocked() {
        lockedAccounts.increment();
    }

    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    /**
     * Total of {@code engine.mutations} across all kinds for one outcome.
     */
    public long mutationCount(String outcome) {
        return (long) registry.find(MUTATIONS)
                .tag("outcome", outcome)
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public long malformedRecordCount() {
        return (long) malformedRecords.count();
    }

    public long lockedAccountCount() {
        return (long) lockedAccounts.count();
    }

    /**
     * One-line summary for the end-of-run log.
     */
    public String summary() {
        return String.format("applied=%d, ignored=%d, rejected=%d, malformed=%d, locked=%d",
                mutationCount(OUTCOME_APPLIED),
                mutationCount(OUTCOME_IGNORED),
                mutationCount(OUTCOME_REJECTED),
                malformedRecordCount(),
                lockedAccountCount());
    }
}
