package io.agentswarm.runner;

import java.util.HashMap;
import java.util.Map;

final class CascadeTracker {
    private final Map<String, Integer> inFlight = new HashMap<>();

    void enter(String cascadeId) {
        inFlight.merge(cascadeId, 1, Integer::sum);
    }

    void exit(String cascadeId) {
        Integer current = inFlight.get(cascadeId);
        if (current == null) {
            return;
        }
        if (current <= 1) {
            inFlight.remove(cascadeId);
        } else {
            inFlight.put(cascadeId, current - 1);
        }
    }

    int inFlight(String cascadeId) {
        return inFlight.getOrDefault(cascadeId, 0);
    }

    int liveCascades() {
        return inFlight.size();
    }

    void clear() {
        inFlight.clear();
    }
}
