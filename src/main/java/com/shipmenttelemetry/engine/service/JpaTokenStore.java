package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.entity.TokenRecord;
import com.shipmenttelemetry.engine.exception.TokenNotFoundException;
import com.shipmenttelemetry.engine.exception.TokenPersistenceException;
import com.shipmenttelemetry.engine.exception.TokenValidationException;
import com.shipmenttelemetry.engine.repository.TokenRecordRepository;
import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenPayloadCodec;
import com.shipmenttelemetry.engine.token.TokenPayloadCodec.TokenPayload;
import com.shipmenttelemetry.engine.token.TokenRegistry;
import com.shipmenttelemetry.engine.token.TokenState;
import com.shipmenttelemetry.engine.token.TokenStore;
import com.shipmenttelemetry.engine.token.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link TokenStore} over the token_records table.
 *
 * Persist is an upsert by token id. The first write stores the payload; later writes move
 * state, version and signature forward and never back. Every token read is merged into the
 * {@link TokenRegistry} so relations created afterwards can resolve it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaTokenStore implements TokenStore {

    private final TokenRecordRepository repository;
    private final TokenPayloadCodec codec;
    private final TokenRegistry registry;
    private final Clock clock;

    @Override
    @Transactional
    public TokenRecord persist(Token token, String signature) {
        try {
            Instant now = clock.instant();
            TokenRecord record = repository.findById(token.tokenId())
                .map(existing -> mergeInto(existing, token, signature, now))
                .orElseGet(() -> newRecord(token, signature, now));
            // flushed here so write failures surface inside this try, not at commit
            TokenRecord saved = repository.saveAndFlush(record);
            log.debug("Persisted {} as state={} v{}", token.toLogString(), saved.getState(), saved.getVersion());
            return saved;
        } catch (DataAccessException e) {
            log.error("Failed to persist token {}", token.tokenId(), e);
            throw new TokenPersistenceException("Failed to persist token " + token.tokenId(), e);
        }
    }

    private TokenRecord newRecord(Token token, String signature, Instant now) {
        return TokenRecord.builder()
            .tokenId(token.tokenId())
            .tokenType(token.tokenType().code())
            .version(token.version())
            .state(token.state().name())
            .payload(codec.write(token))
            .rootShipmentId(token.parentShipmentId())
            .signature(signature != null ? signature : token.signature())
            .createdAt(token.createdAt())
            .updatedAt(now)
            .build();
    }

    private TokenRecord mergeInto(TokenRecord existing, Token token, String signature, Instant now) {
        if (!existing.getTokenType().equals(token.tokenType().code())) {
            throw new TokenValidationException(String.format("Token %s is stored as %s, cannot persist it as %s",
                token.tokenId(), existing.getTokenType(), token.tokenType()));
        }
        TokenState storedState = TokenState.valueOf(existing.getState());
        if (token.tokenType().schema().isReachable(storedState, token.state())) {
            existing.setState(token.state().name());
            existing.setVersion(Math.max(existing.getVersion(), token.version()));
        } else if (storedState != token.state()) {
            log.debug("Ignoring stale state {} for token {}, stored state is {}",
                token.state(), token.tokenId(), storedState);
        }
        if (signature != null) {
            existing.setSignature(signature);
        } else if (token.signature() != null) {
            existing.setSignature(token.signature());
        }
        existing.setUpdatedAt(now);
        return existing;
    }

    @Override
    @Transactional(readOnly = true)
    public Token load(String tokenId) {
        return find(tokenId).orElseThrow(() -> new TokenNotFoundException(tokenId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Token> find(String tokenId) {
        try {
            return repository.findById(tokenId).map(this::toToken).map(registry::hydrate);
        } catch (DataAccessException e) {
            throw new TokenPersistenceException("Failed to load token " + tokenId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Token> loadLineage(String rootShipmentId) {
        try {
            return repository.findByRootShipmentIdOrderByCreatedAtAscTokenIdAsc(rootShipmentId).stream()
                .map(this::toToken)
                .map(registry::hydrate)
                .toList();
        } catch (DataAccessException e) {
            throw new TokenPersistenceException("Failed to load lineage of shipment " + rootShipmentId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Token> loadLineage(String rootShipmentId, TokenType tokenType) {
        try {
            return repository.findByRootShipmentIdAndTokenTypeOrderByCreatedAtAscTokenIdAsc(rootShipmentId,
                    tokenType.code()).stream()
                .map(this::toToken)
                .map(registry::hydrate)
                .toList();
        } catch (DataAccessException e) {
            throw new TokenPersistenceException(
                "Failed to load " + tokenType + " tokens of shipment " + rootShipmentId, e);
        }
    }

    private Token toToken(TokenRecord record) {
        TokenType type = TokenType.fromCode(record.getTokenType())
            .orElseThrow(() -> new TokenPersistenceException(
                "Token " + record.getTokenId() + " has unknown stored type " + record.getTokenType(), null));
        TokenPayload payload = codec.read(record.getTokenId(), record.getPayload());
        return new Token(
            record.getTokenId(),
            type,
            record.getVersion(),
            TokenState.valueOf(record.getState()),
            record.getRootShipmentId(),
            payload.metadata(),
            payload.relations(),
            record.getSignature(),
            record.getCreatedAt()
        );
    }
}
