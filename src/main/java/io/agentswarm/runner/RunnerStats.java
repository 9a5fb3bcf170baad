package io.agentswarm.runner;

import io.agentswarm.model.TriggerOutcome;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public final class RunnerStats {
    private final AtomicLong received = new AtomicLong();
    private final Map<TriggerOutcome, AtomicLong> outcomes = new EnumMap<>(TriggerOutcome.class);

    RunnerStats() {
        for (TriggerOutcome outcome : TriggerOutcome.values()) {
            outcomes.put(outcome, new AtomicLong());
        }
    }

    void received() {
        received.incrementAndGet();
    }

    void record(TriggerOutcome outcome) {
        outcomes.get(outcome).incrementAndGet();
    }

    public long count(TriggerOutcome outcome) {
        return outcomes.get(outcome).get();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                received.get(),
                count(TriggerOutcome.ACCEPTED),
                count(TriggerOutcome.SKIPPED_DEPTH),
                count(TriggerOutcome.SKIPPED_COOLDOWN),
                count(TriggerOutcome.COMPLETED),
                count(TriggerOutcome.FAILED),
                count(TriggerOutcome.CANCELLED)
        );
    }

    public record Snapshot(
            long received,
            long accepted,
            long skippedDepth,
            long skippedCooldown,
            long completed,
            long failed,
            long cancelled
    ) {
    }
}
