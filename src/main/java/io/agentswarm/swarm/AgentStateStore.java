package io.agentswarm.swarm;

import io.agentswarm.storage.StoreException;
import io.agentswarm.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

public final class AgentStateStore {
    private static final Logger log = LoggerFactory.getLogger(AgentStateStore.class);

    private final AgentLayout layout;
    private final Clock clock;

    public AgentStateStore(AgentLayout layout) {
        this(layout, Clock.systemUTC());
    }

    public AgentStateStore(AgentLayout layout, Clock clock) {
        this.layout = layout;
        this.clock = clock;
    }

    public AgentLayout layout() {
        return layout;
    }

    public Optional<AgentState> load(String agentId) {
        Path path = layout.statePath(agentId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read state for agent {} at {}: {}", agentId, path, e.getMessage());
            return Optional.empty();
        }
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                return Optional.of(Jsons.fromJson(line, AgentState.class));
            } catch (RuntimeException e) {
                log.warn("Corrupt state line for agent {} at {}: {}", agentId, path, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public synchronized AgentState save(AgentState state) {
        AgentState stamped = state.stamped(clock.millis());
        Path path = layout.statePath(state.agentId());
        try {
            Files.createDirectories(path.getParent());
            String line = Jsons.toCompactJson(stamped) + "\n";
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return stamped;
        } catch (IOException e) {
            throw new StoreException("Failed to save state for agent " + state.agentId(), e);
        }
    }

    public boolean exists(String agentId) {
        return Files.exists(layout.statePath(agentId));
    }
}
