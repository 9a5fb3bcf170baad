package io.agentswarm.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.agentswarm.model.EventType;
import io.agentswarm.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"eventTypes", "fromAgents", "toAgent", "pathGlob", "tags"})
public record SubscriptionPattern(
        List<EventType> eventTypes,
        List<String> fromAgents,
        String toAgent,
        String pathGlob,
        List<String> tags
) {
    public SubscriptionPattern {
        eventTypes = sortedTypes(eventTypes);
        fromAgents = sortedText(fromAgents);
        toAgent = blankToNull(toAgent);
        pathGlob = pathGlob == null || pathGlob.isBlank() ? null : Globs.normalize(pathGlob);
        tags = sortedText(tags);
        if (eventTypes == null && fromAgents == null && toAgent == null && pathGlob == null && tags == null) {
            throw new IllegalArgumentException("Subscription pattern must constrain at least one field");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SubscriptionPattern directTo(String agentId) {
        return builder().toAgent(agentId).build();
    }

    public static SubscriptionPattern contentChangedAt(String filePath) {
        return builder().eventTypes(List.of(EventType.CONTENT_CHANGED)).pathGlob(Globs.literal(filePath)).build();
    }

    public static SubscriptionPattern fromJson(String json) {
        return Jsons.fromJson(json, SubscriptionPattern.class);
    }

    public String toJson() {
        return Jsons.toCompactJson(this);
    }

    private static List<EventType> sortedTypes(Collection<EventType> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        TreeSet<EventType> sorted = new TreeSet<>(Comparator.comparing(EventType::wireName));
        for (EventType value : values) {
            if (value != null) {
                sorted.add(value);
            }
        }
        return sorted.isEmpty() ? null : List.copyOf(sorted);
    }

    private static List<String> sortedText(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            String v = blankToNull(value);
            if (v != null) {
                sorted.add(v);
            }
        }
        return sorted.isEmpty() ? null : List.copyOf(sorted);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private final List<EventType> eventTypes = new ArrayList<>();
        private final List<String> fromAgents = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private String toAgent;
        private String pathGlob;

        private Builder() {
        }

        public Builder eventTypes(Collection<EventType> values) {
            eventTypes.addAll(values);
            return this;
        }

        public Builder eventType(EventType value) {
            eventTypes.add(value);
            return this;
        }

        public Builder fromAgents(Collection<String> values) {
            fromAgents.addAll(values);
            return this;
        }

        public Builder fromAgent(String value) {
            fromAgents.add(value);
            return this;
        }

        public Builder toAgent(String value) {
            this.toAgent = value;
            return this;
        }

        public Builder pathGlob(String value) {
            this.pathGlob = value;
            return this;
        }

        public Builder tags(Collection<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder tag(String value) {
            tags.add(value);
            return this;
        }

        public SubscriptionPattern build() {
            return new SubscriptionPattern(eventTypes, fromAgents, toAgent, pathGlob, tags);
        }
    }
}
