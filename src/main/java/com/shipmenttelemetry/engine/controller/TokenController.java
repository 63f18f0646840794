package com.shipmenttelemetry.engine.controller;

import com.shipmenttelemetry.engine.dto.TokenCreateRequest;
import com.shipmenttelemetry.engine.dto.TokenTransitionRequest;
import com.shipmenttelemetry.engine.service.TokenService;
import com.shipmenttelemetry.engine.token.Token;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tokens", description = "Shipment token creation, lifecycle and lineage")
public class TokenController {

    private final TokenService tokenService;

    @Operation(
            summary = "Create a token",
            description = "Validates metadata and relations against the token type's schema and persists " +
                    "the token. An ST-01 token takes the shipment id as its token id."
    )
    @PostMapping
    public ResponseEntity<Token> create(@Valid @RequestBody TokenCreateRequest request) {
        Token token = tokenService.create(request.tokenType(), request.parentShipmentId(),
            request.metadata(), request.relations(), request.signature());
        return ResponseEntity.status(HttpStatus.CREATED).body(token);
    }

    @Operation(summary = "Move a token along its lifecycle")
    @PostMapping("/{tokenId}/transitions")
    public ResponseEntity<Token> transition(
            @Parameter(description = "Token id") @PathVariable String tokenId,
            @Valid @RequestBody TokenTransitionRequest request) {
        return ResponseEntity.ok(tokenService.transition(tokenId, request.targetState()));
    }

    @GetMapping("/{tokenId}")
    public ResponseEntity<Token> get(@PathVariable String tokenId) {
        return ResponseEntity.ok(tokenService.get(tokenId));
    }

    @Operation(summary = "Every token of a shipment, oldest first")
    @GetMapping("/shipments/{shipmentId}/lineage")
    public ResponseEntity<Map<String, Object>> lineage(@PathVariable String shipmentId) {
        List<Token> tokens = tokenService.lineage(shipmentId);
        return ResponseEntity.ok(Map.of(
            "shipmentId", shipmentId,
            "count", tokens.size(),
            "tokens", tokens
        ));
    }
}
