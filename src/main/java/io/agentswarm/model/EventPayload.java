package io.agentswarm.model;

import java.util.List;

public sealed interface EventPayload {

    EventType type();

    record ContentChanged(String path, String diff) implements EventPayload {
        public ContentChanged {
            requireText(path, "path");
        }

        public static ContentChanged of(String path) {
            return new ContentChanged(path, null);
        }

        @Override
        public EventType type() {
            return EventType.CONTENT_CHANGED;
        }
    }

    record FileSaved(String path) implements EventPayload {
        public FileSaved {
            requireText(path, "path");
        }

        @Override
        public EventType type() {
            return EventType.FILE_SAVED;
        }
    }

    record AgentMessage(String fromAgent, String toAgent, String content) implements EventPayload {
        public AgentMessage {
            requireText(fromAgent, "fromAgent");
            requireText(toAgent, "toAgent");
            content = content == null ? "" : content;
        }

        @Override
        public EventType type() {
            return EventType.AGENT_MESSAGE;
        }
    }

    record ManualTrigger(String toAgent, String reason) implements EventPayload {
        public ManualTrigger {
            requireText(toAgent, "toAgent");
            reason = reason == null ? "" : reason;
        }

        @Override
        public EventType type() {
            return EventType.MANUAL_TRIGGER;
        }
    }

    record AgentStarted(String agentId, String nodeType) implements EventPayload {
        public AgentStarted {
            requireText(agentId, "agentId");
        }

        @Override
        public EventType type() {
            return EventType.AGENT_START;
        }
    }

    record AgentCompleted(
            String agentId,
            String resultSummary,
            String response,
            List<String> changedArtifacts
    ) implements EventPayload {
        public AgentCompleted {
            requireText(agentId, "agentId");
            resultSummary = resultSummary == null ? "" : resultSummary;
            response = response == null ? "" : response;
            changedArtifacts = changedArtifacts == null ? List.of() : List.copyOf(changedArtifacts);
        }

        @Override
        public EventType type() {
            return EventType.AGENT_COMPLETE;
        }
    }

    record AgentFailed(String agentId, String error) implements EventPayload {
        public AgentFailed {
            requireText(agentId, "agentId");
            error = error == null ? "" : error;
        }

        @Override
        public EventType type() {
            return EventType.AGENT_ERROR;
        }
    }

    record AgentLifecycle(String agentId, String change) implements EventPayload {
        public static final String CREATED = "created";
        public static final String ORPHANED = "orphaned";
        public static final String UPDATED = "updated";

        public AgentLifecycle {
            requireText(agentId, "agentId");
            requireText(change, "change");
        }

        @Override
        public EventType type() {
            return EventType.AGENT_LIFECYCLE;
        }
    }

    record TriggerSkipped(String agentId, long skippedEventId, String reason) implements EventPayload {
        public TriggerSkipped {
            requireText(agentId, "agentId");
            reason = reason == null ? "" : reason;
        }

        @Override
        public EventType type() {
            return EventType.TRIGGER_SKIPPED;
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
