package io.agentswarm.swarm;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public final class AgentLayout {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Path agentsRoot;
    private final Path workspacesRoot;

    public AgentLayout(Path agentsRoot, Path workspacesRoot) {
        this.agentsRoot = agentsRoot;
        this.workspacesRoot = workspacesRoot;
    }

    public Path agentDir(String agentId) {
        String safe = safeId(agentId);
        String shard = safe.length() >= 2 ? safe.substring(0, 2) : safe;
        return agentsRoot.resolve(shard).resolve(safe);
    }

    public Path statePath(String agentId) {
        return agentDir(agentId).resolve("state.jsonl");
    }

    public Path workspacePath(String agentId) {
        return workspacesRoot.resolve(safeId(agentId) + ".db");
    }

    // Percent-encoded so distinct ids never share a directory.
    static String safeId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        if (agentId.equals(".") || agentId.equals("..")) {
            return agentId.replace(".", "%2E");
        }
        StringBuilder out = new StringBuilder(agentId.length());
        for (byte b : agentId.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-') {
                out.append((char) c);
            } else {
                out.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return out.toString();
    }
}
