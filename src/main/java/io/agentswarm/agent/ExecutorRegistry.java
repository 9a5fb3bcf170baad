package io.agentswarm.agent;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class ExecutorRegistry {
    private final Map<String, AgentExecutor> byNodeType = new ConcurrentHashMap<>();
    private final AgentExecutor fallback;

    public ExecutorRegistry(AgentExecutor fallback) {
        this.fallback = fallback;
    }

    public void register(String nodeType, AgentExecutor executor) {
        byNodeType.put(key(nodeType), executor);
    }

    public AgentExecutor resolve(String nodeType) {
        AgentExecutor executor = nodeType == null ? null : byNodeType.get(key(nodeType));
        return executor != null ? executor : fallback;
    }

    private static String key(String nodeType) {
        return nodeType.trim().toLowerCase(Locale.ROOT);
    }
}
