package com.shipmenttelemetry.engine.token;

import com.shipmenttelemetry.engine.exception.InvalidStateTransitionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Moves tokens along their type's lifecycle graph. State is the only thing that ever changes
 * on a token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenLifecycleService {

    private final TokenRegistry registry;
    private final TokenStore tokenStore;

    /**
     * Applies a transition, persists the new version and returns it. Tokens not yet known to
     * this instance are loaded from storage first.
     *
     * The registry only sees the new version once it is stored: when persisting fails the
     * token keeps its previous state and the same transition can be retried.
     *
     * @throws InvalidStateTransitionException when the lifecycle has no such edge
     * @throws com.shipmenttelemetry.engine.exception.TokenNotFoundException for an unknown id
     * @throws com.shipmenttelemetry.engine.exception.TokenPersistenceException when storage fails
     */
    public Token transition(String tokenId, TokenState target) {
        Token current = registry.find(tokenId).orElseGet(() -> tokenStore.load(tokenId));
        if (!current.tokenType().schema().allowsTransition(current.state(), target)) {
            throw new InvalidStateTransitionException(tokenId, current.state(), target);
        }
        Token next = current.withState(target);
        tokenStore.persist(next);
        registry.hydrate(next);
        log.info("Transitioned {} to {}", next.toLogString(), target);
        return next;
    }
}
