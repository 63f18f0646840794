package com.shipmenttelemetry.engine.token;

import com.shipmenttelemetry.engine.exception.ErrorKind;
import com.shipmenttelemetry.engine.exception.RelationValidationException;
import com.shipmenttelemetry.engine.exception.TokenValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.shipmenttelemetry.engine.support.TelemetryFixtures.SHIPMENT_ID;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.T0;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.codec;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.createShipment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenFactoryTest {

    private TokenRegistry registry;
    private TokenFactory factory;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(T0.plusNanos(123_456), ZoneOffset.UTC);
        registry = new TokenRegistry(clock);
        factory = new TokenFactory(registry, codec(), clock);
    }

    @Test
    void shipmentTokenIsItsOwnRoot() {
        Token shipment = createShipment(factory, SHIPMENT_ID);

        assertThat(shipment.tokenId()).isEqualTo(SHIPMENT_ID);
        assertThat(shipment.tokenType()).isEqualTo(TokenType.ST_01);
        assertThat(shipment.state()).isEqualTo(TokenState.CREATED);
        assertThat(shipment.version()).isEqualTo(1);
        assertThat(shipment.createdAt()).isEqualTo(T0);
        assertThat(registry.find(SHIPMENT_ID)).contains(shipment);
    }

    @Test
    void rejectsUnknownTokenTypeAndCreatesNothing() {
        assertThatThrownBy(() -> factory.create("ZZ-99", SHIPMENT_ID, Map.of(), Map.of()))
            .isInstanceOf(TokenValidationException.class)
            .hasMessageContaining("Unknown token_type");
        assertThat(registry.size()).isZero();
    }

    @Test
    void missingRequiredFieldFailsAndSucceedsOncePresent() {
        Map<String, Object> metadata = new HashMap<>(Map.of("origin", "Chicago, IL", "destination", "Evanston, IL"));

        assertThatThrownBy(() -> factory.create("ST-01", SHIPMENT_ID, metadata, Map.of()))
            .isInstanceOf(TokenValidationException.class)
            .hasMessageContaining("carrier_id")
            .satisfies(e -> assertThat(((TokenValidationException) e).isRetryable()).isFalse());

        metadata.put("carrier_id", "CARRIER-7");
        assertThat(factory.create("ST-01", SHIPMENT_ID, metadata, Map.of()).tokenId()).isEqualTo(SHIPMENT_ID);
    }

    @Test
    void rejectsIllTypedFields() {
        createShipment(factory, SHIPMENT_ID);

        assertThatThrownBy(() -> factory.create("QT-01", SHIPMENT_ID,
            Map.of("rate_amount", "a lot", "rate_currency", "USD", "equipment_type", "DRY_VAN"),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID)))
            .isInstanceOf(TokenValidationException.class)
            .hasMessageContaining("rate_amount");
        assertThatThrownBy(() -> factory.create("QT-01", SHIPMENT_ID,
            Map.of("rate_amount", 1850.00, "rate_currency", "usd", "equipment_type", "DRY_VAN"),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID)))
            .isInstanceOf(TokenValidationException.class)
            .hasMessageContaining("rate_currency");
    }

    @Test
    void missingRequiredRelationIsRetryableRelationError() {
        createShipment(factory, SHIPMENT_ID);

        assertThatThrownBy(() -> factory.create("QT-01", SHIPMENT_ID, quoteMetadata(), Map.of()))
            .isInstanceOf(RelationValidationException.class)
            .satisfies(e -> {
                RelationValidationException error = (RelationValidationException) e;
                assertThat(error.getRole()).isEqualTo(TokenSchemas.ST01_ID);
                assertThat(error.getKind()).isEqualTo(ErrorKind.RELATION_VALIDATION);
                assertThat(error.isRetryable()).isTrue();
            });
    }

    @Test
    void relationToNonexistentTokenFails() {
        assertThatThrownBy(() -> factory.create("QT-01", SHIPMENT_ID, quoteMetadata(),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID)))
            .isInstanceOf(RelationValidationException.class)
            .hasMessageContaining("unknown token");
    }

    @Test
    void relationToWrongTypeOrOtherShipmentFails() {
        createShipment(factory, SHIPMENT_ID);
        createShipment(factory, "SHP-2002");
        Token quote = factory.create("QT-01", SHIPMENT_ID, quoteMetadata(), Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID));

        assertThatThrownBy(() -> factory.create("IT-01", SHIPMENT_ID, invoiceMetadata(),
            Map.of(TokenSchemas.QT01_ID, SHIPMENT_ID)))
            .isInstanceOf(RelationValidationException.class)
            .hasMessageContaining("must reference a QT-01");
        assertThatThrownBy(() -> factory.create("IT-01", "SHP-2002", invoiceMetadata(),
            Map.of(TokenSchemas.QT01_ID, quote.tokenId())))
            .isInstanceOf(RelationValidationException.class)
            .hasMessageContaining("of shipment " + SHIPMENT_ID);
    }

    @Test
    void tokenCannotReferenceItself() {
        createShipment(factory, SHIPMENT_ID);

        assertThatThrownBy(() -> factory.create(TokenType.QT_01, "QT-1", SHIPMENT_ID, quoteMetadata(),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID, "supersedes", "QT-1")))
            .isInstanceOf(RelationValidationException.class)
            .hasMessageContaining("itself");
    }

    @Test
    void buildsFullLineage() {
        createShipment(factory, SHIPMENT_ID);
        Token milestone = factory.create("MT-01", SHIPMENT_ID, Map.of(
                "milestone_type", "DELIVERED",
                "timestamp", "2024-03-01T15:00:00Z",
                "location", Map.of("lat", 42.0, "lon", -87.63)),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID));
        Token accessorial = factory.create("AT-02", SHIPMENT_ID, Map.of(
                "accessorial_type", "DETENTION",
                "amount", 150,
                "timestamp", "2024-03-01T17:00:00Z",
                "currency", "USD"),
            Map.of(TokenSchemas.MT01_ID, milestone.tokenId()));
        Token quote = factory.create("QT-01", SHIPMENT_ID, quoteMetadata(), Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID));
        Token invoice = factory.create("IT-01", SHIPMENT_ID, invoiceMetadata(),
            Map.of(TokenSchemas.QT01_ID, quote.tokenId()));
        Token payment = factory.create("PT-01", SHIPMENT_ID, Map.of(
                "payment_reference", "PAY-42",
                "currency", "USD",
                "amount", new BigDecimal("2000.00"),
                "escrow_account", "ESC-1"),
            Map.of(TokenSchemas.IT01_ID, invoice.tokenId()));

        assertThat(registry.size()).isEqualTo(6);
        assertThat(List.of(milestone, accessorial, payment))
            .allSatisfy(token -> assertThat(registry.find(token.tokenId())).contains(token));
    }

    @Test
    void metadataIsCanonicalJson() {
        createShipment(factory, SHIPMENT_ID);

        Token milestone = factory.create("MT-01", SHIPMENT_ID, Map.of(
                "milestone_type", "PICKUP_ARRIVED",
                "timestamp", Instant.parse("2024-03-01T14:00:00Z"),
                "location", Map.of("lat", 41.88, "lon", -87.63)),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID));

        assertThat(milestone.metadata().get("timestamp")).isEqualTo("2024-03-01T14:00:00Z");
        assertThat(milestone.metadata().get("location")).isEqualTo(
            Map.of("lat", new BigDecimal("41.88"), "lon", new BigDecimal("-87.63")));
    }

    @Test
    void registeringSameContentTwiceIsIdempotent() {
        createShipment(factory, SHIPMENT_ID);
        Token first = factory.create(TokenType.QT_01, "QT-1", SHIPMENT_ID, quoteMetadata(),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID));

        Token again = factory.create(TokenType.QT_01, "QT-1", SHIPMENT_ID, quoteMetadata(),
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID));

        assertThat(again).isSameAs(first);
        Map<String, Object> changed = new HashMap<>(quoteMetadata());
        changed.put("rate_amount", 1.0);
        assertThatThrownBy(() -> factory.create(TokenType.QT_01, "QT-1", SHIPMENT_ID, changed,
            Map.of(TokenSchemas.ST01_ID, SHIPMENT_ID)))
            .isInstanceOf(TokenValidationException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    void requiresParentShipment() {
        assertThatThrownBy(() -> factory.create("ST-01", " ", Map.of(), Map.of()))
            .isInstanceOf(TokenValidationException.class)
            .hasMessageContaining("parent_shipment_id");
    }

    private static Map<String, Object> quoteMetadata() {
        return Map.of("rate_amount", 1850.00, "rate_currency", "USD", "equipment_type", "DRY_VAN");
    }

    private static Map<String, Object> invoiceMetadata() {
        return Map.of(
            "invoice_number", "INV-1001",
            "currency", "USD",
            "total", 2000,
            "line_items", List.of(Map.of("description", "Linehaul", "amount", 1850)),
            "due_date", "2024-04-01");
    }
}
