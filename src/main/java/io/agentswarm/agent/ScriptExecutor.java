package io.agentswarm.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentswarm.model.Event;
import io.agentswarm.swarm.AgentState;
import io.agentswarm.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class ScriptExecutor implements AgentExecutor {
    private static final int MAX_ERROR_CHARS = 512;

    private final String name;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptExecutor(String name, List<String> command, long timeoutMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("script executor name cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script executor command cannot be empty: " + name);
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TurnResult execute(TurnContext context) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return TurnResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            CompletableFuture<byte[]> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(describe(context)).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return TurnResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(output.get(1, TimeUnit.SECONDS), StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                return TurnResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            return interpret(combined, context);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            return TurnResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private TurnResult interpret(String stdout, TurnContext context) {
        if (!stdout.startsWith("{")) {
            return TurnResult.ok(stdout);
        }
        JsonNode root;
        try {
            root = Jsons.compact().readTree(stdout);
        } catch (IOException e) {
            return TurnResult.ok(stdout);
        }
        List<String> changed = new ArrayList<>();
        for (JsonNode item : root.path("changedArtifacts")) {
            changed.add(item.asText());
        }
        for (JsonNode message : root.path("messages")) {
            String to = message.path("to").asText("");
            if (!to.isBlank()) {
                context.tools().sendMessage(to, message.path("content").asText(""), List.of());
            }
        }
        String response = root.hasNonNull("response") ? root.get("response").asText() : stdout;
        String summary = root.path("summary").asText("");
        TurnResult result = TurnResult.ok(summary, response, changed);
        Map<String, String> connections = new LinkedHashMap<>();
        root.path("connections").fields().forEachRemaining(e -> connections.put(e.getKey(), e.getValue().asText()));
        if (!connections.isEmpty()) {
            result = result.withConnections(connections);
        }
        if (root.hasNonNull("snapshotRef")) {
            result = result.withSnapshot(root.get("snapshotRef").asText());
        }
        return result;
    }

    private static Map<String, Object> describe(TurnContext context) {
        AgentState state = context.state();
        Event trigger = context.triggerEvent();
        Map<String, Object> triggerView = new LinkedHashMap<>();
        triggerView.put("id", trigger.id());
        triggerView.put("type", trigger.eventType().wireName());
        triggerView.put("payload", trigger.payload());
        triggerView.put("tags", trigger.tags());

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("agentId", state.agentId());
        view.put("nodeType", state.nodeType());
        view.put("name", state.name());
        view.put("fullName", state.fullName());
        view.put("filePath", state.filePath());
        view.put("startLine", state.startLine());
        view.put("endLine", state.endLine());
        view.put("connections", state.connections());
        view.put("correlationId", context.correlationId());
        view.put("depth", context.depth());
        view.put("trigger", triggerView);
        view.put("history", context.recentHistory());
        return view;
    }

    private static byte[] readAll(InputStream in) {
        try {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read script output", e);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
