package com.shipmenttelemetry.engine.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable shipment token.
 *
 * Only {@link TokenFactory} creates tokens, after validating metadata and relations against
 * the type's schema. State changes produce a new instance with a bumped version; metadata and
 * relations never change.
 *
 * @param tokenId          Unique id. For ST-01 it equals the shipment id.
 * @param tokenType        Variant discriminant
 * @param version          Starts at 1, incremented per state transition
 * @param state            Lifecycle tag
 * @param parentShipmentId ST-01 root of the lineage
 * @param metadata         Type-specific fields in canonical JSON form
 * @param relations        Relation role to referenced token id
 * @param signature        Optional signature attached at persistence
 * @param createdAt        Creation instant, millisecond precision
 */
public record Token(
    String tokenId,
    TokenType tokenType,
    int version,
    TokenState state,
    String parentShipmentId,
    Map<String, Object> metadata,
    Map<String, String> relations,
    String signature,
    Instant createdAt
) {

    public Token {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(tokenType, "tokenType");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(parentShipmentId, "parentShipmentId");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
        relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations == null ? Map.of() : relations));
    }

    public Token withState(TokenState newState) {
        return new Token(tokenId, tokenType, version + 1, newState, parentShipmentId,
            metadata, relations, signature, createdAt);
    }

    public Token withSignature(String newSignature) {
        return new Token(tokenId, tokenType, version, state, parentShipmentId,
            metadata, relations, newSignature, createdAt);
    }

    /**
     * Same type, lineage, metadata and relations; state, version, signature and creation time
     * are ignored.
     */
    public boolean hasSameContent(Token other) {
        return tokenType == other.tokenType
            && parentShipmentId.equals(other.parentShipmentId)
            && metadata.equals(other.metadata)
            && relations.equals(other.relations);
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    public String toLogString() {
        return String.format("Token[%s %s, state=%s, v%d, root=%s]",
            tokenType, tokenId, state, version, parentShipmentId);
    }
}
