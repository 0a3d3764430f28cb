package com.neorpc.config;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

import java.util.List;

/**
 * Matches when {@code neo.client.nodes} binds to a non-empty list (comma-separated or indexed form).
 */
class NodesConfiguredCondition extends SpringBootCondition {

    static final String NODES_PROPERTY = "neo.client.nodes";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        List<String> nodes = Binder.get(context.getEnvironment())
                .bind(NODES_PROPERTY, Bindable.listOf(String.class))
                .orElse(List.of());
        if (nodes.isEmpty()) {
            return ConditionOutcome.noMatch(NODES_PROPERTY + " is not set");
        }
        return ConditionOutcome.match(NODES_PROPERTY + " has " + nodes.size() + " node(s)");
    }
}
