package io.agentswarm.agent;

import java.util.List;
import java.util.Map;

public record TurnResult(
        boolean success,
        String summary,
        String response,
        List<String> changedArtifacts,
        String snapshotRef,
        Map<String, String> connections,
        String error
) {
    public TurnResult {
        summary = summary == null ? "" : summary;
        response = response == null ? "" : response;
        changedArtifacts = changedArtifacts == null ? List.of() : List.copyOf(changedArtifacts);
        connections = connections == null ? Map.of() : Map.copyOf(connections);
    }

    public static TurnResult ok(String response) {
        return new TurnResult(true, null, response, List.of(), null, Map.of(), null);
    }

    public static TurnResult ok(String summary, String response, List<String> changedArtifacts) {
        return new TurnResult(true, summary, response, changedArtifacts, null, Map.of(), null);
    }

    public static TurnResult fail(String error) {
        return new TurnResult(false, null, null, List.of(), null, Map.of(), error);
    }

    public TurnResult withSnapshot(String ref) {
        return new TurnResult(success, summary, response, changedArtifacts, ref, connections, error);
    }

    public TurnResult withConnections(Map<String, String> newConnections) {
        return new TurnResult(success, summary, response, changedArtifacts, snapshotRef, newConnections, error);
    }
}
