package com.shipmenttelemetry.engine.token;

import com.shipmenttelemetry.engine.exception.TokenNotFoundException;
import com.shipmenttelemetry.engine.exception.TokenValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * In-process index of the tokens this instance created or loaded.
 *
 * Relation validation resolves references here, which is what makes lineage forward-only: a
 * token can only point at ids that were registered before it was built. Only persisted tokens
 * are registered, so the index is a cache of storage and whole shipments can be evicted once
 * idle; they are loaded again on demand.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenRegistry {

    private final ConcurrentHashMap<String, Token> tokens = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> shipmentActivity = new ConcurrentHashMap<>();
    private final Clock clock;

    public Optional<Token> find(String tokenId) {
        Token token = tokens.get(tokenId);
        if (token != null) {
            touch(token.parentShipmentId());
        }
        return Optional.ofNullable(token);
    }

    /**
     * Registers a persisted token. Registering the same content twice returns the instance
     * already held; a different token under a taken id is rejected.
     */
    public Token register(Token token) {
        touch(token.parentShipmentId());
        Token existing = tokens.putIfAbsent(token.tokenId(), token);
        if (existing == null) {
            return token;
        }
        if (!existing.hasSameContent(token)) {
            throw new TokenValidationException("Token id " + token.tokenId() + " already exists with different content");
        }
        return existing;
    }

    /**
     * Fails when a different token already holds {@code token}'s id.
     */
    public void checkAvailable(Token token) {
        Token existing = tokens.get(token.tokenId());
        if (existing != null && !existing.hasSameContent(token)) {
            throw new TokenValidationException("Token id " + token.tokenId() + " already exists with different content");
        }
    }

    /**
     * Atomically replaces a registered token with {@code change} applied to it.
     */
    public Token update(String tokenId, UnaryOperator<Token> change) {
        Token updated = tokens.computeIfPresent(tokenId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new TokenNotFoundException(tokenId);
        }
        touch(updated.parentShipmentId());
        return updated;
    }

    /**
     * Merges a token read from storage or just persisted. The registry keeps whichever copy is
     * further along the lifecycle.
     */
    public Token hydrate(Token loaded) {
        touch(loaded.parentShipmentId());
        return tokens.merge(loaded.tokenId(), loaded, (current, incoming) -> {
            if (!current.hasSameContent(incoming)) {
                log.warn("Stored token {} differs from the registered copy, keeping the registered one",
                    current.tokenId());
                return current;
            }
            TokenSchema schema = current.tokenType().schema();
            return schema.isReachable(current.state(), incoming.state()) ? incoming : current;
        });
    }

    /**
     * Drops every token of shipments not used since {@code cutoff}.
     *
     * @return number of tokens evicted
     */
    public int evictIdleSince(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        shipmentActivity.forEach((shipmentId, lastUsed) -> {
            if (lastUsed.isBefore(cutoff) && shipmentActivity.remove(shipmentId, lastUsed)) {
                tokens.values().removeIf(token -> {
                    boolean idle = token.parentShipmentId().equals(shipmentId);
                    if (idle) {
                        evicted.incrementAndGet();
                    }
                    return idle;
                });
            }
        });
        return evicted.get();
    }

    public int size() {
        return tokens.size();
    }

    private void touch(String shipmentId) {
        shipmentActivity.put(shipmentId, clock.instant());
    }
}
