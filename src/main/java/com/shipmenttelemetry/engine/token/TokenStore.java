package com.shipmenttelemetry.engine.token;

import com.shipmenttelemetry.engine.entity.TokenRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for tokens. The only component of the pipeline that performs I/O.
 *
 * Implementations throw {@link com.shipmenttelemetry.engine.exception.TokenPersistenceException}
 * on storage failures; callers retry with the same token.
 */
public interface TokenStore {

    /**
     * Upserts by token id. A re-persist updates state, version, signature and update time
     * only; the stored metadata and relations are never rewritten.
     *
     * @param signature Signature to attach, or {@code null} to keep the stored one
     */
    TokenRecord persist(Token token, String signature);

    default TokenRecord persist(Token token) {
        return persist(token, null);
    }

    /**
     * @throws com.shipmenttelemetry.engine.exception.TokenNotFoundException when no record exists
     */
    Token load(String tokenId);

    Optional<Token> find(String tokenId);

    /**
     * Every token of a shipment, oldest first.
     */
    List<Token> loadLineage(String rootShipmentId);

    /**
     * Tokens of one type within a shipment, oldest first.
     */
    List<Token> loadLineage(String rootShipmentId, TokenType tokenType);
}
