package io.agentswarm.observability;

import io.agentswarm.model.Event;
import io.agentswarm.model.TriggerOutcome;

public sealed interface Observation {

    long atMs();

    record Appended(Event event) implements Observation {
        @Override
        public long atMs() {
            return event.createdAtMs();
        }
    }

    record Decision(
            String agentId,
            long eventId,
            String correlationId,
            int depth,
            TriggerOutcome outcome,
            String reason,
            long atMs
    ) implements Observation {
        public Decision {
            reason = reason == null ? "" : reason;
        }
    }
}
