package io.agentswarm.config;

import io.agentswarm.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record SwarmSettings(
        int maxConcurrency,
        int maxTriggerDepth,
        long triggerCooldownMs,
        int triggerQueueCapacity,
        long triggerPushTimeoutMs,
        int chatHistoryLimit,
        int summaryMaxChars,
        int observerBufferSize,
        boolean emitSkipEvents,
        String swarmId,
        Map<String, List<String>> scriptExecutors,
        long scriptTimeoutMs
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final int DEFAULT_MAX_TRIGGER_DEPTH = 5;
    public static final long DEFAULT_TRIGGER_COOLDOWN_MS = 1_000L;
    public static final int DEFAULT_TRIGGER_QUEUE_CAPACITY = 10_000;
    public static final long DEFAULT_TRIGGER_PUSH_TIMEOUT_MS = 1_000L;
    public static final int DEFAULT_CHAT_HISTORY_LIMIT = 10;
    public static final int DEFAULT_SUMMARY_MAX_CHARS = 200;
    public static final int DEFAULT_OBSERVER_BUFFER_SIZE = 256;
    public static final String DEFAULT_SWARM_ID = "swarm";
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 30_000L;

    private static final Logger log = LoggerFactory.getLogger(SwarmSettings.class);

    public SwarmSettings {
        maxConcurrency = Math.max(1, maxConcurrency);
        maxTriggerDepth = Math.max(0, maxTriggerDepth);
        triggerCooldownMs = Math.max(0L, triggerCooldownMs);
        triggerQueueCapacity = Math.max(1, triggerQueueCapacity);
        triggerPushTimeoutMs = Math.max(0L, triggerPushTimeoutMs);
        chatHistoryLimit = Math.max(0, chatHistoryLimit);
        summaryMaxChars = Math.max(16, summaryMaxChars);
        observerBufferSize = Math.max(1, observerBufferSize);
        swarmId = swarmId == null || swarmId.isBlank() ? DEFAULT_SWARM_ID : swarmId.trim();
        scriptExecutors = scriptExecutors == null ? Map.of() : Map.copyOf(scriptExecutors);
        scriptTimeoutMs = Math.max(1_000L, scriptTimeoutMs);
    }

    public static SwarmSettings defaults() {
        return new SwarmSettings(
                DEFAULT_MAX_CONCURRENCY,
                DEFAULT_MAX_TRIGGER_DEPTH,
                DEFAULT_TRIGGER_COOLDOWN_MS,
                DEFAULT_TRIGGER_QUEUE_CAPACITY,
                DEFAULT_TRIGGER_PUSH_TIMEOUT_MS,
                DEFAULT_CHAT_HISTORY_LIMIT,
                DEFAULT_SUMMARY_MAX_CHARS,
                DEFAULT_OBSERVER_BUFFER_SIZE,
                false,
                DEFAULT_SWARM_ID,
                Map.of(),
                DEFAULT_SCRIPT_TIMEOUT_MS
        );
    }

    public static SwarmSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.compact().readValue(file.toFile(), SettingsFile.class);
            SwarmSettings resolved = fromFile(raw, defaults());
            log.info("Loaded swarm settings from {}", file);
            return resolved;
        } catch (IOException e) {
            throw new IllegalStateException("Invalid swarm settings file: " + file, e);
        }
    }

    static SwarmSettings fromFile(SettingsFile file, SwarmSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new SwarmSettings(
                file.maxConcurrency() == null ? defaults.maxConcurrency() : file.maxConcurrency(),
                file.maxTriggerDepth() == null ? defaults.maxTriggerDepth() : file.maxTriggerDepth(),
                file.triggerCooldownMs() == null ? defaults.triggerCooldownMs() : file.triggerCooldownMs(),
                file.triggerQueueCapacity() == null ? defaults.triggerQueueCapacity() : file.triggerQueueCapacity(),
                file.triggerPushTimeoutMs() == null ? defaults.triggerPushTimeoutMs() : file.triggerPushTimeoutMs(),
                file.chatHistoryLimit() == null ? defaults.chatHistoryLimit() : file.chatHistoryLimit(),
                file.summaryMaxChars() == null ? defaults.summaryMaxChars() : file.summaryMaxChars(),
                file.observerBufferSize() == null ? defaults.observerBufferSize() : file.observerBufferSize(),
                file.emitSkipEvents() == null ? defaults.emitSkipEvents() : file.emitSkipEvents(),
                file.swarmId() == null ? defaults.swarmId() : file.swarmId(),
                file.scriptExecutors() == null ? defaults.scriptExecutors() : file.scriptExecutors(),
                file.scriptTimeoutMs() == null ? defaults.scriptTimeoutMs() : file.scriptTimeoutMs()
        );
    }

    public SwarmSettings withMaxConcurrency(int value) {
        return new SwarmSettings(value, maxTriggerDepth, triggerCooldownMs, triggerQueueCapacity,
                triggerPushTimeoutMs, chatHistoryLimit, summaryMaxChars, observerBufferSize, emitSkipEvents,
                swarmId, scriptExecutors, scriptTimeoutMs);
    }

    public SwarmSettings withMaxTriggerDepth(int value) {
        return new SwarmSettings(maxConcurrency, value, triggerCooldownMs, triggerQueueCapacity,
                triggerPushTimeoutMs, chatHistoryLimit, summaryMaxChars, observerBufferSize, emitSkipEvents,
                swarmId, scriptExecutors, scriptTimeoutMs);
    }

    public SwarmSettings withTriggerCooldownMs(long value) {
        return new SwarmSettings(maxConcurrency, maxTriggerDepth, value, triggerQueueCapacity,
                triggerPushTimeoutMs, chatHistoryLimit, summaryMaxChars, observerBufferSize, emitSkipEvents,
                swarmId, scriptExecutors, scriptTimeoutMs);
    }

    public SwarmSettings withTriggerQueue(int capacity, long pushTimeoutMs) {
        return new SwarmSettings(maxConcurrency, maxTriggerDepth, triggerCooldownMs, capacity,
                pushTimeoutMs, chatHistoryLimit, summaryMaxChars, observerBufferSize, emitSkipEvents,
                swarmId, scriptExecutors, scriptTimeoutMs);
    }

    public SwarmSettings withEmitSkipEvents(boolean value) {
        return new SwarmSettings(maxConcurrency, maxTriggerDepth, triggerCooldownMs, triggerQueueCapacity,
                triggerPushTimeoutMs, chatHistoryLimit, summaryMaxChars, observerBufferSize, value,
                swarmId, scriptExecutors, scriptTimeoutMs);
    }

    record SettingsFile(
            Integer maxConcurrency,
            Integer maxTriggerDepth,
            Long triggerCooldownMs,
            Integer triggerQueueCapacity,
            Long triggerPushTimeoutMs,
            Integer chatHistoryLimit,
            Integer summaryMaxChars,
            Integer observerBufferSize,
            Boolean emitSkipEvents,
            String swarmId,
            Map<String, List<String>> scriptExecutors,
            Long scriptTimeoutMs
    ) {
    }
}
