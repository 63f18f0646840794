package com.shipmenttelemetry.engine.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.shipmenttelemetry.engine.exception.TokenPersistenceException;
import com.shipmenttelemetry.engine.exception.TokenValidationException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON codec for token metadata and relations.
 *
 * Metadata is canonicalized through the same mapper that writes the persisted payload, so a
 * token read back from storage compares equal to the one that was written: instants become
 * ISO-8601 strings and decimals stay {@link java.math.BigDecimal} with their scale.
 */
@Component
public class TokenPayloadCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public TokenPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public Map<String, Object> canonicalize(Map<String, ?> metadata) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsString(metadata), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new TokenValidationException("Token metadata is not representable as JSON", e);
        }
    }

    public String write(Token token) {
        try {
            return objectMapper.writeValueAsString(new TokenPayload(token.metadata(), token.relations()));
        } catch (JsonProcessingException e) {
            throw new TokenPersistenceException("Failed to serialize token " + token.tokenId(), e);
        }
    }

    public TokenPayload read(String tokenId, String payload) {
        try {
            return objectMapper.readValue(payload, TokenPayload.class);
        } catch (JsonProcessingException e) {
            throw new TokenPersistenceException("Stored payload of token " + tokenId + " is unreadable", e);
        }
    }

    /**
     * Serialized substance of a token. Written once, never rewritten.
     */
    public record TokenPayload(Map<String, Object> metadata, Map<String, String> relations) {
    }
}
