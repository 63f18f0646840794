package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenFactory;
import com.shipmenttelemetry.engine.token.TokenLifecycleService;
import com.shipmenttelemetry.engine.token.TokenRegistry;
import com.shipmenttelemetry.engine.token.TokenState;
import com.shipmenttelemetry.engine.token.TokenStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Token operations for callers outside the telemetry pipeline: every created or transitioned
 * token is persisted before it is registered and returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {

    private final TokenFactory tokenFactory;
    private final TokenLifecycleService lifecycleService;
    private final TokenRegistry registry;
    private final TokenStore tokenStore;

    /**
     * Relation targets created by another instance are loaded from storage before validation.
     * The token is registered only once stored, so a failed write leaves nothing behind that a
     * later token could reference.
     */
    public Token create(String tokenType, String parentShipmentId, Map<String, Object> metadata,
                        Map<String, String> relations, String signature) {
        if (relations != null) {
            relations.values().stream()
                .filter(targetId -> targetId != null && registry.find(targetId).isEmpty())
                .forEach(this::loadRelationTarget);
        }
        Token token = tokenFactory.build(tokenType, parentShipmentId, metadata, relations);
        Token signed = signature == null ? token : token.withSignature(signature);
        tokenStore.persist(signed, signature);

        Token registered = registry.register(signed);
        if (signature == null || signature.equals(registered.signature())) {
            return registered;
        }
        return registry.update(registered.tokenId(), current -> current.withSignature(signature));
    }

    public Token transition(String tokenId, TokenState target) {
        return lifecycleService.transition(tokenId, target);
    }

    public Token get(String tokenId) {
        return registry.find(tokenId).orElseGet(() -> tokenStore.load(tokenId));
    }

    public List<Token> lineage(String rootShipmentId) {
        List<Token> lineage = tokenStore.loadLineage(rootShipmentId);
        log.debug("Loaded {} tokens for shipment {}", lineage.size(), rootShipmentId);
        return lineage;
    }

    private void loadRelationTarget(String targetId) {
        if (tokenStore.find(targetId).isEmpty()) {
            log.debug("Relation target {} is not stored", targetId);
        }
    }
}
