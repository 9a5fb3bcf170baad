package io.agentswarm.subscription;

import io.agentswarm.model.Event;

import java.util.Optional;

public final class PatternMatcher {
    private PatternMatcher() {
    }

    public static boolean matches(SubscriptionPattern pattern, Event event) {
        if (pattern == null || event == null) {
            return false;
        }
        if (pattern.eventTypes() != null && !pattern.eventTypes().contains(event.eventType())) {
            return false;
        }
        if (pattern.fromAgents() != null) {
            Optional<String> from = event.fromAgent();
            if (from.isEmpty() || !pattern.fromAgents().contains(from.get())) {
                return false;
            }
        }
        if (pattern.toAgent() != null) {
            Optional<String> to = event.toAgent();
            if (to.isEmpty() || !pattern.toAgent().equals(to.get())) {
                return false;
            }
        }
        if (pattern.pathGlob() != null) {
            Optional<String> path = event.path();
            if (path.isEmpty() || !Globs.matches(pattern.pathGlob(), path.get())) {
                return false;
            }
        }
        if (pattern.tags() != null) {
            boolean shared = false;
            for (String tag : event.tags()) {
                if (pattern.tags().contains(tag)) {
                    shared = true;
                    break;
                }
            }
            return shared;
        }
        return true;
    }
}
