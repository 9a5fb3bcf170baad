package io.agentswarm.subscription;

public record Subscription(
        long id,
        String agentId,
        SubscriptionPattern pattern,
        boolean isDefault,
        long createdAtMs,
        long updatedAtMs
) {
}
