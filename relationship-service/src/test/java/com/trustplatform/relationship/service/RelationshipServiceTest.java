package com.trustplatform.relationship.service;

import com.trustplatform.core.event.DefaultAntecedentTable;
import com.trustplatform.core.event.EventTag;
import com.trustplatform.core.event.EventType;
import com.trustplatform.core.event.RelationshipEventProcessor;
import com.trustplatform.core.exception.SelfRelationshipException;
import com.trustplatform.core.model.RelationshipSnapshot;
import com.trustplatform.core.relationship.BondType;
import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.relationship.RelationshipStage;
import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.core.trust.StakesLevel;
import com.trustplatform.relationship.dto.CreateRelationshipRequest;
import com.trustplatform.relationship.dto.EventRequest;
import com.trustplatform.relationship.dto.PathUpdateRequest;
import com.trustplatform.relationship.dto.PatternUpdateRequest;
import com.trustplatform.relationship.exception.RelationshipAlreadyExistsException;
import com.trustplatform.relationship.exception.RelationshipNotFoundException;
import com.trustplatform.relationship.logger.TrustFlowLogger;
import com.trustplatform.relationship.registry.RelationshipRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipServiceTest {

    private static final double EPS = 1e-9;
    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    private RelationshipRegistry registry;
    private RelationshipService service;

    @BeforeEach
    void setUp() {
        registry = new RelationshipRegistry();
        DefaultAntecedentTable table = new DefaultAntecedentTable();
        service = new RelationshipService(
            registry,
            new RelationshipEventProcessor(table),
            table,
            new TrustFlowLogger(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void createAliceBob() {
        service.create(new CreateRelationshipRequest("alice", "bob", null, null, null)).block();
    }

    private static EventRequest event(EventType type, String source, String target) {
        EventRequest request = new EventRequest();
        request.setType(type);
        request.setSource(source);
        request.setTarget(target);
        return request;
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("create registers a stranger relationship")
        void create() {
            StepVerifier.create(service.create(new CreateRelationshipRequest(
                    "alice", "bob", null, null, List.of(BondType.FRIEND))))
                .assertNext(snapshot -> {
                    assertEquals("rel_alice_bob", snapshot.id());
                    assertEquals("STRANGER", snapshot.stage());
                    assertEquals(List.of("FRIEND"), snapshot.bonds());
                })
                .verifyComplete();
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("the same pair in either order cannot be created twice")
        void duplicateRejected() {
            createAliceBob();
            StepVerifier.create(service.create(new CreateRelationshipRequest("bob", "alice", null, null, null)))
                .expectError(RelationshipAlreadyExistsException.class)
                .verify();
        }

        @Test
        @DisplayName("self relationships and missing ids are rejected")
        void invalidCreate() {
            StepVerifier.create(service.create(new CreateRelationshipRequest("alice", "alice", null, null, null)))
                .expectError(SelfRelationshipException.class)
                .verify();
            StepVerifier.create(service.create(new CreateRelationshipRequest("alice", null, null, null, null)))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("get resolves the pair in either order; unknown pairs are not found")
        void get() {
            createAliceBob();
            StepVerifier.create(service.get("bob", "alice"))
                .assertNext(snapshot -> assertEquals("alice", snapshot.entityA()))
                .verifyComplete();
            StepVerifier.create(service.get("alice", "carol"))
                .expectError(RelationshipNotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("list filters by entity")
        void listByEntity() {
            createAliceBob();
            service.create(new CreateRelationshipRequest("carol", "dave", null, null, null)).block();

            StepVerifier.create(service.list(null)).expectNextCount(2).verifyComplete();
            StepVerifier.create(service.list("dave"))
                .assertNext(snapshot -> assertEquals("rel_carol_dave", snapshot.id()))
                .verifyComplete();
        }

        @Test
        @DisplayName("delete removes the relationship once")
        void delete() {
            createAliceBob();
            StepVerifier.create(service.delete("alice", "bob")).verifyComplete();
            StepVerifier.create(service.delete("alice", "bob"))
                .expectError(RelationshipNotFoundException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("mutation")
    class Mutation {

        @BeforeEach
        void create() {
            createAliceBob();
        }

        @Test
        @DisplayName("stage, bonds and pattern updates are reflected in the snapshot")
        void updates() {
            service.setStage("alice", "bob", RelationshipStage.ESTABLISHED).block();
            service.addBond("alice", "bob", BondType.COLLEAGUE).block();
            RelationshipSnapshot snapshot = service.updatePattern("alice", "bob",
                new PatternUpdateRequest(0.4, 0.9, null)).block();

            assertNotNull(snapshot);
            assertEquals("ESTABLISHED", snapshot.stage());
            assertEquals(List.of("COLLEAGUE"), snapshot.bonds());
            assertEquals(0.9, snapshot.pattern().consistency(), EPS);
            assertEquals(0.4, snapshot.pattern().frequency(), EPS);
        }

        @Test
        @DisplayName("missing stage is a bad request")
        void missingStage() {
            StepVerifier.create(service.setStage("alice", "bob", null))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("betrayal raises the perceived risk of one direction only")
        void betrayal() {
            RelationshipSnapshot snapshot = service.markBetrayal("alice", "bob", Direction.B_TO_A).block();
            assertNotNull(snapshot);
            assertTrue(snapshot.bToA().betrayalHistory());
            assertFalse(snapshot.aToB().betrayalHistory());
        }

        @Test
        @DisplayName("paths read and write values; the stage path takes a stage")
        void paths() {
            StepVerifier.create(service.updatePath("alice", "bob", "directional.a_to_b.warmth",
                    new PathUpdateRequest(null, 0.3, null)))
                .assertNext(response -> assertEquals(0.5, response.value().effective(), EPS))
                .verifyComplete();

            StepVerifier.create(service.updatePath("alice", "bob", "stage",
                    new PathUpdateRequest(null, null, RelationshipStage.INTIMATE)))
                .assertNext(response -> assertEquals("INTIMATE", response.stage()))
                .verifyComplete();

            StepVerifier.create(service.updatePath("alice", "bob", "stage", new PathUpdateRequest(0.5, null, null)))
                .expectError(IllegalArgumentException.class)
                .verify();

            StepVerifier.create(service.getPath("alice", "bob", "shared.nonsense"))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("events")
    class Events {

        @BeforeEach
        void create() {
            createAliceBob();
        }

        @Test
        @DisplayName("a betrayal lowers the target's trust in the source")
        void betrayalLowersTrust() {
            StepVerifier.create(TraceContextUtil.withTraceId(
                    service.ingest(event(EventType.BETRAYAL, "bob", "alice")), "trace-1"))
                .assertNext(response -> {
                    assertEquals("BETRAYAL", response.eventType());
                    assertEquals(2, response.antecedentsPerUpdate());
                    assertEquals(1, response.relationshipsUpdated());
                    assertEquals("trace-1", response.traceId());
                })
                .verifyComplete();

            RelationshipSnapshot snapshot = service.get("alice", "bob").block();
            assertNotNull(snapshot);
            assertTrue(snapshot.aToB().integrity().effective() < 0.3);
            assertEquals(NOW, snapshot.aToB().lastNegativeAntecedent());
            assertEquals(0, snapshot.bToA().antecedentCount());
        }

        @Test
        @DisplayName("events without a registered relationship update nothing")
        void unknownPair() {
            StepVerifier.create(service.ingest(event(EventType.SUPPORT, "carol", "alice")))
                .assertNext(response -> assertEquals(0, response.relationshipsUpdated()))
                .verifyComplete();
        }

        @Test
        @DisplayName("events without participants are accepted with no effect")
        void noParticipants() {
            StepVerifier.create(service.ingest(event(EventType.SUPPORT, null, "alice")))
                .assertNext(response -> {
                    assertEquals(0, response.antecedentsPerUpdate());
                    assertEquals(TraceContextUtil.UNKNOWN, response.traceId());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("missing event type is rejected")
        void missingType() {
            StepVerifier.create(service.ingest(event(null, "bob", "alice")))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("tags and life domain flow into the antecedents")
        void tagsApplied() {
            EventRequest request = event(EventType.ACHIEVEMENT, "bob", "alice");
            request.setTags(EnumSet.of(EventTag.WITNESSED));
            service.ingest(request).block();

            // 0.2 base, x0.6 typical achievement, x0.5 witnessed, x0.5 default consistency
            RelationshipSnapshot snapshot = service.get("alice", "bob").block();
            assertNotNull(snapshot);
            assertEquals(0.3 + 0.4 * 0.03, snapshot.aToB().competence().get("work").effective(), EPS);
        }
    }

    @Nested
    @DisplayName("decisions and decay")
    class DecisionsAndDecay {

        @BeforeEach
        void create() {
            createAliceBob();
        }

        @Test
        @DisplayName("decision reports stage, stakes and willingness")
        void decide() {
            StepVerifier.create(service.decide("alice", "bob", Direction.A_TO_B, 0.5, StakesLevel.HIGH, 1.0))
                .assertNext(response -> {
                    assertEquals("STRANGER", response.stage());
                    assertEquals("HIGH", response.stakes());
                    assertEquals(0.07, response.decision().decisionCertainty(), EPS);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("prediction buckets the risk level into stakes")
        void predict() {
            StepVerifier.create(service.predict("alice", "bob", Direction.A_TO_B, 0.9, 1.0))
                .assertNext(response -> {
                    assertEquals("CRITICAL", response.stakes());
                    assertFalse(response.wouldConfide());
                    assertFalse(response.wouldHelp());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("tick decays every relationship and accumulates elapsed time")
        void tick() {
            service.updatePath("alice", "bob", "shared.tension", new PathUpdateRequest(null, 0.4, null)).block();

            StepVerifier.create(service.tick(Duration.ofDays(7)))
                .assertNext(response -> {
                    assertEquals(1, response.relationshipsDecayed());
                    assertEquals(Duration.ofDays(7).getSeconds(), response.totalElapsedSeconds());
                })
                .verifyComplete();

            RelationshipSnapshot snapshot = service.get("alice", "bob").block();
            assertNotNull(snapshot);
            assertEquals(0.2, snapshot.shared().get("tension").effective(), EPS);
        }

        @Test
        @DisplayName("non-positive ticks are rejected")
        void invalidTick() {
            StepVerifier.create(service.tick(Duration.ZERO))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }

    @Test
    @DisplayName("mutations are published on the update stream")
    void updatesStream() {
        StepVerifier.create(service.updates().take(2))
            .then(() -> {
                createAliceBob();
                service.setStage("alice", "bob", RelationshipStage.ACQUAINTANCE).block();
            })
            .assertNext(snapshot -> assertEquals("STRANGER", snapshot.stage()))
            .assertNext(snapshot -> assertEquals("ACQUAINTANCE", snapshot.stage()))
            .verifyComplete();
    }

    @Test
    @DisplayName("concurrent mutations on different relationships all reach the update stream")
    void concurrentUpdatesStream() throws Exception {
        int pairs = 8;
        int rounds = 50;
        List<RelationshipSnapshot> received = new CopyOnWriteArrayList<>();
        Disposable subscription = service.updates().subscribe(received::add);

        for (int i = 0; i < pairs; i++) {
            service.create(new CreateRelationshipRequest("hub", "peer" + i, null, null, null)).block();
        }

        ExecutorService pool = Executors.newFixedThreadPool(pairs);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int i = 0; i < pairs; i++) {
                String peer = "peer" + i;
                workers.add(pool.submit(() -> {
                    start.await();
                    for (int r = 0; r < rounds; r++) {
                        service.setStage("hub", peer, r % 2 == 0
                            ? RelationshipStage.ACQUAINTANCE : RelationshipStage.ESTABLISHED).block();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
            subscription.dispose();
        }

        assertEquals(pairs * (rounds + 1), received.size());
        for (int i = 0; i < pairs; i++) {
            String peer = "peer" + i;
            long perPair = received.stream()
                .filter(snapshot -> peer.equals(snapshot.entityA()) || peer.equals(snapshot.entityB()))
                .count();
            assertEquals(rounds + 1, perPair, peer);
        }
    }
}
