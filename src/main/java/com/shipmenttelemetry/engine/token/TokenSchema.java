package com.shipmenttelemetry.engine.token;

import lombok.Builder;
import lombok.Singular;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Declarative contract of one token type: required metadata keys with their semantic types,
 * required relation roles with the token type each must point at, and the lifecycle graph.
 *
 * The factory checks every variant against its schema generically.
 */
@Builder
public record TokenSchema(
    @Singular("requiredField") Map<String, FieldType> requiredMetadata,
    @Singular("requiredRelation") Map<String, TokenType> requiredRelations,
    @Singular("transition") Map<TokenState, Set<TokenState>> transitions
) {

    public boolean allowsTransition(TokenState from, TokenState to) {
        return transitions.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Whether {@code to} lies strictly after {@code from} on some path of the lifecycle graph.
     */
    public boolean isReachable(TokenState from, TokenState to) {
        Set<TokenState> visited = EnumSet.noneOf(TokenState.class);
        Deque<TokenState> pending = new ArrayDeque<>(transitions.getOrDefault(from, Set.of()));
        while (!pending.isEmpty()) {
            TokenState next = pending.poll();
            if (next == to) {
                return true;
            }
            if (visited.add(next)) {
                pending.addAll(transitions.getOrDefault(next, Set.of()));
            }
        }
        return false;
    }
}
