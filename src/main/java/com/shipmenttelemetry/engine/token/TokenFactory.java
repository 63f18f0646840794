package com.shipmenttelemetry.engine.token;

import com.shipmenttelemetry.engine.exception.RelationValidationException;
import com.shipmenttelemetry.engine.exception.TokenValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The only way to bring a token into existence.
 *
 * Dispatches on the token type and checks metadata and relations against the type's
 * {@link TokenSchema}. Nothing is defaulted: a missing field fails the call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenFactory {

    private final TokenRegistry registry;
    private final TokenPayloadCodec codec;
    private final Clock clock;

    /**
     * Creates and registers a token from its type code ("ST-01", "MT-01", ...).
     *
     * @throws TokenValidationException    for an unknown type or bad metadata
     * @throws RelationValidationException for a missing or dangling relation
     */
    public Token create(String tokenType, String parentShipmentId,
                        Map<String, ?> metadata, Map<String, String> relations) {
        return register(build(tokenType, parentShipmentId, metadata, relations));
    }

    public Token create(TokenType type, String tokenId, String parentShipmentId,
                        Map<String, ?> metadata, Map<String, String> relations) {
        return register(build(type, tokenId, parentShipmentId, metadata, relations));
    }

    /**
     * Validates and builds a token without registering it. Callers that persist register the
     * token once it is stored, so an unsaved token never becomes a relation target.
     */
    public Token build(String tokenType, String parentShipmentId,
                       Map<String, ?> metadata, Map<String, String> relations) {
        TokenType type = TokenType.fromCode(tokenType)
            .orElseThrow(() -> new TokenValidationException("Unknown token_type: " + tokenType));
        return build(type, null, parentShipmentId, metadata, relations);
    }

    /**
     * Builds a token with an explicit id, or a random one when {@code tokenId} is null.
     * ST-01 tokens always take the shipment id as their token id.
     */
    public Token build(TokenType type, String tokenId, String parentShipmentId,
                       Map<String, ?> metadata, Map<String, String> relations) {
        if (parentShipmentId == null || parentShipmentId.isBlank()) {
            throw new TokenValidationException(type + " requires a parent_shipment_id");
        }
        String id = resolveTokenId(type, tokenId, parentShipmentId);
        TokenSchema schema = type.schema();

        Map<String, Object> canonicalMetadata = codec.canonicalize(metadata == null ? Map.of() : metadata);
        validateMetadata(type, schema, canonicalMetadata);

        Map<String, String> relationMap = relations == null ? Map.of() : new LinkedHashMap<>(relations);
        validateRelations(type, id, schema, parentShipmentId, relationMap);

        Token token = new Token(id, type, 1, TokenState.CREATED, parentShipmentId,
            canonicalMetadata, relationMap, null, clock.instant().truncatedTo(ChronoUnit.MILLIS));
        registry.checkAvailable(token);
        return token;
    }

    private Token register(Token token) {
        Token registered = registry.register(token);
        if (registered == token) {
            log.info("Created {}", token.toLogString());
        } else {
            log.debug("Token {} already registered, returning existing instance", token.tokenId());
        }
        return registered;
    }

    private String resolveTokenId(TokenType type, String tokenId, String parentShipmentId) {
        if (type == TokenType.ST_01) {
            if (tokenId != null && !tokenId.equals(parentShipmentId)) {
                throw new TokenValidationException("ST-01 token id must equal its shipment id");
            }
            return parentShipmentId;
        }
        return tokenId != null ? tokenId : UUID.randomUUID().toString();
    }

    private void validateMetadata(TokenType type, TokenSchema schema, Map<String, Object> metadata) {
        schema.requiredMetadata().forEach((key, fieldType) -> {
            if (!metadata.containsKey(key)) {
                throw new TokenValidationException(type + " metadata is missing required field '" + key + "'");
            }
            if (!fieldType.accepts(metadata.get(key))) {
                throw new TokenValidationException(String.format("%s metadata field '%s' must be a %s",
                    type, key, fieldType.description()));
            }
        });
    }

    private void validateRelations(TokenType type, String tokenId, TokenSchema schema,
                                   String parentShipmentId, Map<String, String> relations) {
        schema.requiredRelations().keySet().forEach(role -> {
            String target = relations.get(role);
            if (target == null || target.isBlank()) {
                throw new RelationValidationException(role, type + " is missing required relation '" + role + "'");
            }
        });

        relations.forEach((role, targetId) -> {
            if (tokenId.equals(targetId)) {
                throw new RelationValidationException(role, type + " relation '" + role + "' references the token itself");
            }
            Token target = registry.find(targetId).orElseThrow(() -> new RelationValidationException(role,
                String.format("%s relation '%s' references unknown token %s", type, role, targetId)));

            TokenType expected = schema.requiredRelations().get(role);
            if (expected != null && target.tokenType() != expected) {
                throw new RelationValidationException(role, String.format(
                    "%s relation '%s' must reference a %s token, found %s", type, role, expected, target.tokenType()));
            }
            if (!target.parentShipmentId().equals(parentShipmentId)) {
                throw new RelationValidationException(role, String.format(
                    "%s relation '%s' references token %s of shipment %s", type, role, targetId,
                    target.parentShipmentId()));
            }
        });
    }
}
