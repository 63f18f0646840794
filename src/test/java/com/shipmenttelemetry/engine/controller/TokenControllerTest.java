package com.shipmenttelemetry.engine.controller;

import com.shipmenttelemetry.engine.exception.InvalidStateTransitionException;
import com.shipmenttelemetry.engine.exception.RelationValidationException;
import com.shipmenttelemetry.engine.exception.TokenNotFoundException;
import com.shipmenttelemetry.engine.service.TokenService;
import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenSchemas;
import com.shipmenttelemetry.engine.token.TokenState;
import com.shipmenttelemetry.engine.token.TokenType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.shipmenttelemetry.engine.support.TelemetryFixtures.SHIPMENT_ID;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.T0;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TokenController.class)
@Import(ApiExceptionHandler.class)
class TokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TokenService tokenService;

    @Test
    void createReturns201WithToken() throws Exception {
        when(tokenService.create(eq("ST-01"), eq(SHIPMENT_ID), anyMap(), any(), isNull()))
            .thenReturn(shipment(TokenState.CREATED, 1));

        mockMvc.perform(post("/api/tokens")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"tokenType":"ST-01","parentShipmentId":"SHP-1001",
                     "metadata":{"origin":"Chicago, IL","destination":"Evanston, IL","carrier_id":"CARRIER-7"}}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.tokenId").value(SHIPMENT_ID))
            .andExpect(jsonPath("$.tokenType").value("ST-01"))
            .andExpect(jsonPath("$.state").value("CREATED"))
            .andExpect(jsonPath("$.metadata.carrier_id").value("CARRIER-7"));
    }

    @Test
    void missingTokenTypeIsRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/tokens")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"parentShipmentId\":\"SHP-1001\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details[0]").value(startsWith("tokenType")));

        verifyNoInteractions(tokenService);
    }

    @Test
    void danglingRelationReturns422Retryable() throws Exception {
        when(tokenService.create(eq("QT-01"), eq(SHIPMENT_ID), anyMap(), anyMap(), isNull()))
            .thenThrow(new RelationValidationException(TokenSchemas.ST01_ID,
                "QT-01 relation 'st01_id' references unknown token SHP-1001"));

        mockMvc.perform(post("/api/tokens")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"tokenType":"QT-01","parentShipmentId":"SHP-1001",
                     "metadata":{"rate_amount":1850,"rate_currency":"USD","equipment_type":"DRY_VAN"},
                     "relations":{"st01_id":"SHP-1001"}}
                    """))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorKind").value("RELATION_VALIDATION"))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void transitionReturnsNewVersion() throws Exception {
        when(tokenService.transition(SHIPMENT_ID, TokenState.DISPATCHED)).thenReturn(shipment(TokenState.DISPATCHED, 2));

        mockMvc.perform(post("/api/tokens/{tokenId}/transitions", SHIPMENT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetState\":\"DISPATCHED\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("DISPATCHED"))
            .andExpect(jsonPath("$.version").value(2));
    }

    @Test
    void illegalTransitionReturns409() throws Exception {
        when(tokenService.transition(SHIPMENT_ID, TokenState.SETTLED))
            .thenThrow(new InvalidStateTransitionException(SHIPMENT_ID, TokenState.CREATED, TokenState.SETTLED));

        mockMvc.perform(post("/api/tokens/{tokenId}/transitions", SHIPMENT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetState\":\"SETTLED\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorKind").value("INVALID_STATE_TRANSITION"))
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void unknownTokenReturns404() throws Exception {
        when(tokenService.get("missing")).thenThrow(new TokenNotFoundException("missing"));

        mockMvc.perform(get("/api/tokens/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Token not found: missing"));
    }

    @Test
    void lineageListsTokens() throws Exception {
        when(tokenService.lineage(SHIPMENT_ID)).thenReturn(List.of(shipment(TokenState.CREATED, 1)));

        mockMvc.perform(get("/api/tokens/shipments/{shipmentId}/lineage", SHIPMENT_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.tokens[0].tokenId").value(SHIPMENT_ID));
    }

    private static Token shipment(TokenState state, int version) {
        return new Token(SHIPMENT_ID, TokenType.ST_01, version, state, SHIPMENT_ID,
            Map.of("origin", "Chicago, IL", "destination", "Evanston, IL", "carrier_id", "CARRIER-7"),
            Map.of(), null, T0);
    }
}
