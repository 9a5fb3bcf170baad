package io.agentswarm.agent;

import io.agentswarm.model.Event;
import io.agentswarm.util.Jsons;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EchoExecutor implements AgentExecutor {
    @Override
    public String name() {
        return "echo";
    }

    @Override
    public TurnResult execute(TurnContext context) {
        Event trigger = context.triggerEvent();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agent", context.agentId());
        out.put("nodeType", context.nodeType());
        out.put("timestamp", Instant.now().toString());
        out.put("eventId", trigger.id());
        out.put("eventType", trigger.eventType().wireName());
        out.put("correlationId", context.correlationId());
        out.put("depth", context.depth());
        out.put("received", trigger.payload());
        String response = Jsons.toCompactJson(out);
        String summary = "echoed " + trigger.eventType().wireName() + " #" + trigger.id();
        return TurnResult.ok(summary, response, List.of());
    }
}
