package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.config.TelemetryProperties;
import com.shipmenttelemetry.engine.dto.ConsistencyFlag;
import com.shipmenttelemetry.engine.dto.DeviceState;
import com.shipmenttelemetry.engine.dto.GeofenceDefinition;
import com.shipmenttelemetry.engine.dto.ProcessingResult;
import com.shipmenttelemetry.engine.dto.RawTelemetry;
import com.shipmenttelemetry.engine.exception.ErrorKind;
import com.shipmenttelemetry.engine.exception.GeofenceCatalogUnavailableException;
import com.shipmenttelemetry.engine.model.FlagCode;
import com.shipmenttelemetry.engine.model.GeofenceEventType;
import com.shipmenttelemetry.engine.model.MilestoneType;
import com.shipmenttelemetry.engine.model.TrackingKey;
import com.shipmenttelemetry.engine.support.InMemoryTokenRecords;
import com.shipmenttelemetry.engine.support.MutableClock;
import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenFactory;
import com.shipmenttelemetry.engine.token.TokenLifecycleService;
import com.shipmenttelemetry.engine.token.TokenPayloadCodec;
import com.shipmenttelemetry.engine.token.TokenRegistry;
import com.shipmenttelemetry.engine.token.TokenState;
import com.shipmenttelemetry.engine.token.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.shipmenttelemetry.engine.support.TelemetryFixtures.CONSIGNEE_DOCK;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.SHIPMENT_ID;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.SHIPPER_YARD;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.T0;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.codec;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.createShipment;
import static com.shipmenttelemetry.engine.support.TelemetryFixtures.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ShipmentTelemetryPipelineTest {

    private static final List<GeofenceDefinition> ROUTE = List.of(SHIPPER_YARD, CONSIGNEE_DOCK);

    private final MutableClock clock = new MutableClock(T0);
    private final TokenPayloadCodec codec = codec();
    private final TelemetryProperties properties = TelemetryProperties.defaults();
    private InMemoryTokenRecords records;
    private TokenRegistry registry;
    private JpaTokenStore tokenStore;
    private GeofenceCatalogService catalogService;
    private ShipmentTelemetryPipeline pipeline;
    private ConsistencyStateStore stateStore;
    private MilestoneContextRegistry contextRegistry;
    private TokenLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        records = new InMemoryTokenRecords();
        catalogService = mock(GeofenceCatalogService.class);
        when(catalogService.definitions()).thenReturn(ROUTE);
        registry = new TokenRegistry(clock);
        tokenStore = new JpaTokenStore(records.repository(), codec, registry, clock);
        pipeline = newPipeline(registry);
    }

    @Test
    void shipmentJourneyDerivesPickupTransitAndDelivery() {
        persistShipment();

        ProcessingResult atYard = process(raw(T0, 41.88, -87.63, 0, true).build());
        ProcessingResult leaving = process(raw(T0.plusSeconds(600), 41.90, -87.63, 8, true).build());
        ProcessingResult arrived = process(raw(T0.plusSeconds(2400), 42.0, -87.63, 0, false).build());

        assertThat(milestones(atYard)).containsExactly("PICKUP_ARRIVED");
        assertThat(milestones(leaving)).containsExactly("IN_TRANSIT");
        assertThat(leaving.events()).singleElement()
            .satisfies(event -> assertThat(event.eventType()).isEqualTo(GeofenceEventType.EXIT));
        assertThat(milestones(arrived)).containsExactly("DELIVERED");
        assertThat(List.of(atYard, leaving, arrived)).allSatisfy(result -> {
            assertThat(result.success()).isTrue();
            assertThat(result.flags()).isEmpty();
        });
        assertThat(records.size()).isEqualTo(4);
        assertThat(tokenStore.loadLineage(SHIPMENT_ID)).hasSize(4);
        assertThat(registry.find(SHIPMENT_ID)).hasValueSatisfying(shipment ->
            assertThat(shipment.state()).isEqualTo(TokenState.CREATED));
    }

    @Test
    void dispatchedShipmentMovesWithPickupExitAndConsigneeEntry() {
        persistShipment();
        lifecycleService.transition(SHIPMENT_ID, TokenState.DISPATCHED);

        ProcessingResult atYard = process(raw(T0, 41.88, -87.63, 0, true).build());
        ProcessingResult leaving = process(raw(T0.plusSeconds(600), 41.90, -87.63, 8, true).build());
        ProcessingResult arrived = process(raw(T0.plusSeconds(2400), 42.0, -87.63, 0, false).build());

        assertThat(atYard.tokens()).extracting(Token::tokenType).containsExactly(TokenType.MT_01);
        assertThat(leaving.tokens()).filteredOn(token -> token.tokenType() == TokenType.ST_01)
            .singleElement()
            .satisfies(shipment -> assertThat(shipment.state()).isEqualTo(TokenState.IN_TRANSIT));
        assertThat(arrived.tokens()).filteredOn(token -> token.tokenType() == TokenType.ST_01)
            .singleElement()
            .satisfies(shipment -> assertThat(shipment.state()).isEqualTo(TokenState.ARRIVED));
        assertThat(records.row(SHIPMENT_ID)).hasValueSatisfying(row -> {
            assertThat(row.getState()).isEqualTo("ARRIVED");
            assertThat(row.getVersion()).isEqualTo(4);
        });
    }

    @Test
    void geofenceEventsOutOfOrderForTheShipmentStateChangeNothing() {
        persistShipment();
        lifecycleService.transition(SHIPMENT_ID, TokenState.DISPATCHED);

        ProcessingResult arrived = process(raw(T0, 42.0, -87.63, 0, false).build());

        assertThat(arrived.success()).isTrue();
        assertThat(arrived.tokens()).noneMatch(token -> token.tokenType() == TokenType.ST_01);
        assertThat(registry.find(SHIPMENT_ID)).hasValueSatisfying(shipment ->
            assertThat(shipment.state()).isEqualTo(TokenState.DISPATCHED));
    }

    @Test
    void repeatedSamplesDoNotRefireMilestones() {
        persistShipment();
        process(raw(T0, 41.88, -87.63, 0, true).build());
        process(raw(T0.plusSeconds(600), 41.90, -87.63, 8, true).build());

        ProcessingResult backAtYard = process(raw(T0.plusSeconds(900), 41.88, -87.63, 0, true).build());
        ProcessingResult leavingAgain = process(raw(T0.plusSeconds(1500), 41.90, -87.63, 8, true).build());

        assertThat(backAtYard.events()).hasSize(1);
        assertThat(backAtYard.tokens()).isEmpty();
        assertThat(leavingAgain.tokens()).isEmpty();
        assertThat(records.size()).isEqualTo(3);
    }

    @Test
    void movingWithoutEventsReaffirmsTransit() {
        persistShipment();
        process(raw(T0, 41.88, -87.63, 0, true).build());
        process(raw(T0.plusSeconds(600), 41.90, -87.63, 8, true).build());

        ProcessingResult cruising = process(raw(T0.plusSeconds(900), 41.92, -87.63, 30, true).build());

        assertThat(cruising.events()).isEmpty();
        assertThat(cruising.tokens()).singleElement().satisfies(token -> {
            assertThat(token.metadata()).containsEntry("milestone_type", "IN_TRANSIT")
                .containsEntry(MilestoneBuilder.REAFFIRMED_FIELD, true);
        });
    }

    @Test
    void impossibleJumpIsFlaggedButProcessingContinues() {
        persistShipment();
        process(raw(T0, 41.0, -87.63, 50, true).build(), List.of());

        ProcessingResult jump = process(raw(T0.plusSeconds(300), 41.75, -87.63, 50, true).build(), List.of());
        ProcessingResult after = process(raw(T0.plusSeconds(600), 41.75, -87.63, 0, true).build(), List.of());

        assertThat(jump.success()).isTrue();
        assertThat(jump.flags()).extracting(ConsistencyFlag::code).containsExactly(FlagCode.IMPOSSIBLE_SPEED);
        assertThat(after.success()).isTrue();
        assertThat(after.flags()).isEmpty();
    }

    @Test
    void malformedSampleFailsAloneInBatch() {
        persistShipment();
        List<RawTelemetry> batch = List.of(
            raw(T0, 41.88, -87.63, 0, true).build(),
            raw(T0.plusSeconds(60), 95.0, -87.63, 0, true).build(),
            raw(T0.plusSeconds(120), 41.881, -87.63, 0, true).build());

        List<ProcessingResult> results = pipeline.processBatch(batch);

        assertThat(results).hasSize(3);
        assertThat(results.get(0).success()).isTrue();
        assertThat(results.get(1).errorKind()).isEqualTo(ErrorKind.MALFORMED_TELEMETRY);
        assertThat(results.get(1).retryable()).isFalse();
        assertThat(results.get(1).deviceId()).isEqualTo("TRK-001");
        assertThat(results.get(2).success()).isTrue();
        assertThat(results.get(2).flags()).isEmpty();
    }

    @Test
    void transientStorageFailuresAreRetried() {
        persistShipment();
        records.failNextSaves(2);

        ProcessingResult result = process(raw(T0, 41.88, -87.63, 0, true).build());

        assertThat(result.success()).isTrue();
        assertThat(records.row(result.tokens().get(0).tokenId())).isPresent();
    }

    @Test
    void exhaustedRetriesFailRetryablyWithoutRecordingMilestone() {
        persistShipment();
        records.failNextSaves(3);

        ProcessingResult result = process(raw(T0, 41.88, -87.63, 0, true).build());

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.PERSISTENCE);
        assertThat(result.retryable()).isTrue();
        assertThat(result.tokens()).hasSize(1);
        assertThat(records.row(result.tokens().get(0).tokenId())).isEmpty();
        assertThat(contextRegistry.forShipment(SHIPMENT_ID).hasFired(MilestoneType.PICKUP_ARRIVED)).isFalse();
    }

    @Test
    void milestoneLostToStorageFailureIsDerivedOnTheNextSample() {
        persistShipment();
        process(raw(T0, 41.88, -87.63, 0, true).build());
        process(raw(T0.plusSeconds(600), 41.90, -87.63, 8, true).build());
        records.failNextSaves(3);

        ProcessingResult failed = process(raw(T0.plusSeconds(2400), 42.0, -87.63, 0, false).build());
        ProcessingResult next = process(raw(T0.plusSeconds(2460), 42.0, -87.63, 0, false).build());

        assertThat(failed.retryable()).isTrue();
        assertThat(next.success()).isTrue();
        assertThat(next.events()).isEmpty();
        assertThat(milestones(next)).containsExactly("DELIVERED");
        assertThat(records.row(next.tokens().get(0).tokenId())).isPresent();
        assertThat(contextRegistry.forShipment(SHIPMENT_ID).hasFired(MilestoneType.DELIVERED)).isTrue();
        assertThat(contextRegistry.forShipment(SHIPMENT_ID).hasDeferred()).isFalse();
    }

    @Test
    void deferredMilestoneIsKeptWhileStorageStaysDown() {
        persistShipment();
        records.failNextSaves(3);
        process(raw(T0, 41.88, -87.63, 0, true).build());
        records.failNextSaves(3);

        ProcessingResult stillDown = process(raw(T0.plusSeconds(60), 41.881, -87.63, 0, true).build());
        ProcessingResult recovered = process(raw(T0.plusSeconds(120), 41.881, -87.63, 0, true).build());

        assertThat(stillDown.errorKind()).isEqualTo(ErrorKind.PERSISTENCE);
        assertThat(milestones(recovered)).containsExactly("PICKUP_ARRIVED");
        assertThat(records.size()).isEqualTo(2);
    }

    @Test
    void milestoneWaitsForTheShipmentTokenToBeStored() {
        ProcessingResult early = process(raw(T0, 41.88, -87.63, 0, true).build());
        TokenRegistry otherRegistry = new TokenRegistry(clock);
        new JpaTokenStore(records.repository(), codec, otherRegistry, clock)
            .persist(createShipment(new TokenFactory(otherRegistry, codec, clock), SHIPMENT_ID));

        ProcessingResult next = process(raw(T0.plusSeconds(60), 41.881, -87.63, 0, true).build());

        assertThat(early.errorKind()).isEqualTo(ErrorKind.RELATION_VALIDATION);
        assertThat(next.success()).isTrue();
        assertThat(milestones(next)).containsExactly("PICKUP_ARRIVED");
        assertThat(records.size()).isEqualTo(2);
    }

    @Test
    void unavailableCatalogueFailsEverySampleOfTheBatch() {
        when(catalogService.definitions()).thenThrow(new GeofenceCatalogUnavailableException(
            "Geofence catalogue could not be loaded", new DataAccessResourceFailureException("db down")));
        List<RawTelemetry> batch = List.of(
            raw(T0, 41.88, -87.63, 0, true).build(),
            raw(T0.plusSeconds(60), 41.881, -87.63, 0, true).build());

        List<ProcessingResult> results = pipeline.processBatch(batch);

        assertThat(results).hasSize(2).allSatisfy(result -> {
            assertThat(result.errorKind()).isEqualTo(ErrorKind.GEOFENCE_CATALOG_UNAVAILABLE);
            assertThat(result.retryable()).isTrue();
            assertThat(result.deviceId()).isEqualTo("TRK-001");
        });
        assertThat(pipeline.process(batch.get(0)).errorKind()).isEqualTo(ErrorKind.GEOFENCE_CATALOG_UNAVAILABLE);
    }

    @Test
    void missingShipmentTokenIsRetryableRelationFailure() {
        ProcessingResult result = process(raw(T0, 41.88, -87.63, 0, true).build());

        assertThat(result.errorKind()).isEqualTo(ErrorKind.RELATION_VALIDATION);
        assertThat(result.retryable()).isTrue();
        assertThat(result.events()).hasSize(1);
        assertThat(result.tokens()).isEmpty();
    }

    @Test
    void shipmentTokenCreatedElsewhereIsLoadedFromStorage() {
        TokenRegistry otherRegistry = new TokenRegistry(clock);
        new JpaTokenStore(records.repository(), codec, otherRegistry, clock)
            .persist(createShipment(new TokenFactory(otherRegistry, codec, clock), SHIPMENT_ID));

        ProcessingResult result = process(raw(T0, 41.88, -87.63, 0, true).build());

        assertThat(result.success()).isTrue();
        assertThat(milestones(result)).containsExactly("PICKUP_ARRIVED");
        assertThat(registry.find(SHIPMENT_ID)).isPresent();
    }

    @Test
    void restartedInstanceDoesNotRefireMilestones() {
        persistShipment();
        process(raw(T0, 41.88, -87.63, 0, true).build());

        TokenRegistry freshRegistry = new TokenRegistry(clock);
        ShipmentTelemetryPipeline restarted = newPipeline(freshRegistry);
        clock.set(T0.plusSeconds(60));
        ProcessingResult result = restarted.process(raw(T0.plusSeconds(60), 41.881, -87.63, 0, true).build());

        assertThat(result.success()).isTrue();
        assertThat(result.events()).hasSize(1);
        assertThat(result.tokens()).isEmpty();
        assertThat(records.size()).isEqualTo(2);
    }

    @Test
    void omittedDeviceFieldsComeFromLastAcceptedSample() {
        persistShipment();
        process(raw(T0, 41.0, -87.63, 40, true).batteryVoltage(12.6).build(), List.of());

        ProcessingResult result = process(raw(T0.plusSeconds(60), 41.005, -87.63, 40, true)
            .batteryVoltage(null).engineState(null).ignition(null).build(), List.of());

        assertThat(result.record().batteryVoltage()).isEqualTo(12.6);
        assertThat(result.record().engineState()).isEqualTo("RUNNING");
        assertThat(result.record().ignition()).isTrue();
    }

    @Test
    void samplesOfOneShipmentAreSerialized() throws Exception {
        persistShipment();
        clock.set(T0.plusSeconds(3600));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<ProcessingResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                Instant time = T0.plusSeconds(3600 + i);
                futures.add(executor.submit(() -> pipeline.process(raw(time, 41.88, -87.63, 0, true).build())));
            }
            int tokens = 0;
            for (Future<ProcessingResult> future : futures) {
                tokens += future.get(10, TimeUnit.SECONDS).tokens().size();
            }
            assertThat(tokens).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(records.size()).isEqualTo(2);
    }

    private ProcessingResult process(RawTelemetry raw) {
        return process(raw, ROUTE);
    }

    private ProcessingResult process(RawTelemetry raw, List<GeofenceDefinition> definitions) {
        clock.set(Instant.parse(raw.timestamp()));
        return pipeline.process(raw, lastKnown(), definitions);
    }

    private DeviceState lastKnown() {
        return stateStore.lastKnown(new TrackingKey("TRK-001", SHIPMENT_ID))
            .map(DeviceState::fromLastKnown)
            .orElseGet(DeviceState::unknown);
    }

    private void persistShipment() {
        tokenStore.persist(createShipment(new TokenFactory(registry, codec, clock), SHIPMENT_ID));
    }

    private static List<String> milestones(ProcessingResult result) {
        return result.tokens().stream().map(token -> token.metadataString("milestone_type")).toList();
    }

    private ShipmentTelemetryPipeline newPipeline(TokenRegistry tokenRegistry) {
        JpaTokenStore store = new JpaTokenStore(records.repository(), codec, tokenRegistry, clock);
        TokenFactory factory = new TokenFactory(tokenRegistry, codec, clock);
        stateStore = new ConsistencyStateStore();
        contextRegistry = new MilestoneContextRegistry(store);
        lifecycleService = new TokenLifecycleService(tokenRegistry, store);
        return new ShipmentTelemetryPipeline(
            new TelemetryNormalizer(clock),
            new ConsistencyEngine(stateStore, properties),
            stateStore,
            new GeofenceEngine(new GeofenceMembershipStore()),
            new MilestoneBuilder(factory, properties),
            contextRegistry,
            catalogService,
            store,
            tokenRegistry,
            lifecycleService,
            properties,
            clock);
    }
}
