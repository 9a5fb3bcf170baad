package io.agentswarm.swarm;

public record ReconcileSummary(int created, int orphaned, int updated, int unchanged, int total) {

    public boolean changedAnything() {
        return created + orphaned + updated > 0;
    }
}
