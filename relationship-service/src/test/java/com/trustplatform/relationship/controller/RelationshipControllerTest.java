package com.trustplatform.relationship.controller;

import com.trustplatform.core.event.DefaultAntecedentTable;
import com.trustplatform.core.event.RelationshipEventProcessor;
import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.relationship.exception.GlobalExceptionHandler;
import com.trustplatform.relationship.logger.TrustFlowLogger;
import com.trustplatform.relationship.registry.RelationshipRegistry;
import com.trustplatform.relationship.service.RelationshipService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.util.Map;

class RelationshipControllerTest {

    private static final String BASE = "/api/v1/relationships";

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        DefaultAntecedentTable table = new DefaultAntecedentTable();
        RelationshipService service = new RelationshipService(new RelationshipRegistry(),
            new RelationshipEventProcessor(table), table, new TrustFlowLogger(), Clock.systemUTC());
        client = WebTestClient
            .bindToController(new RelationshipController(service), new DecayController(service))
            .controllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private void createAliceBob() {
        client.post().uri(BASE)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("entityA", "alice", "entityB", "bob"))
            .exchange()
            .expectStatus().isCreated();
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("POST creates and returns the snapshot")
        void create() {
            client.post().uri(BASE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("entityA", "alice", "entityB", "bob", "stage", "ACQUAINTANCE",
                                  "bonds", new String[]{"FRIEND"}))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("rel_alice_bob")
                .jsonPath("$.stage").isEqualTo("ACQUAINTANCE")
                .jsonPath("$.bonds[0]").isEqualTo("FRIEND")
                .jsonPath("$.aToB.integrity.effective").isEqualTo(0.3);
        }

        @Test
        @DisplayName("duplicate pair is a 409")
        void duplicate() {
            createAliceBob();
            client.post().uri(BASE)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("entityA", "bob", "entityB", "alice"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.error").isEqualTo("ALREADY_EXISTS");
        }

        @Test
        @DisplayName("self relationship is a 400 carrying the trace id")
        void selfRelationship() {
            client.post().uri(BASE)
                .header(TraceContextUtil.TRACE_ID_HEADER, "trace-42")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("entityA", "alice", "entityB", "alice"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("SELF_RELATIONSHIP")
                .jsonPath("$.traceId").isEqualTo("trace-42");
        }

        @Test
        @DisplayName("unknown pair is a 404")
        void notFound() {
            client.get().uri(BASE + "/alice/zed")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("NOT_FOUND");
        }

        @Test
        @DisplayName("DELETE removes the pair")
        void delete() {
            createAliceBob();
            client.delete().uri(BASE + "/bob/alice").exchange().expectStatus().isNoContent();
            client.get().uri(BASE + "/alice/bob").exchange().expectStatus().isNotFound();
        }

        @Test
        @DisplayName("GET lists relationships, optionally by entity")
        void list() {
            createAliceBob();
            client.get().uri(BASE + "?entity=bob")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$[0].id").isEqualTo("rel_alice_bob");
            client.get().uri(BASE + "?entity=carol")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.length()").isEqualTo(0);
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
        @DisplayName("PUT stage changes the stage")
        void stage() {
            client.put().uri(BASE + "/alice/bob/stage")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("stage", "ESTRANGED"))
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.stage").isEqualTo("ESTRANGED");
        }

        @Test
        @DisplayName("bonds are added and removed by name")
        void bonds() {
            client.post().uri(BASE + "/alice/bob/bonds/RIVAL").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.bonds[0]").isEqualTo("RIVAL");
            client.delete().uri(BASE + "/alice/bob/bonds/RIVAL").exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.bonds.length()").isEqualTo(0);
        }

        @Test
        @DisplayName("betrayal marks the chosen direction")
        void betrayal() {
            client.post().uri(BASE + "/alice/bob/risk/betrayal?direction=a_to_b").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.aToB.betrayalHistory").isEqualTo(true)
                .jsonPath("$.bToA.betrayalHistory").isEqualTo(false);
        }

        @Test
        @DisplayName("unknown direction is a 400")
        void badDirection() {
            client.post().uri(BASE + "/alice/bob/risk/betrayal?direction=sideways").exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("paths are read and written by their dotted name")
        void paths() {
            client.put().uri(BASE + "/alice/bob/paths/directional.b_to_a.competence.health")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("base", 0.8))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.path").isEqualTo("directional.b_to_a.competence.health")
                .jsonPath("$.value.effective").isEqualTo(0.8);

            client.get().uri(BASE + "/alice/bob/paths/stage")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stage").isEqualTo("STRANGER")
                .jsonPath("$.value").doesNotExist();
        }

        @Test
        @DisplayName("lowering shared history is a 400")
        void historyCannotDecrease() {
            client.put().uri(BASE + "/alice/bob/paths/shared.history")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("delta", 0.5))
                .exchange()
                .expectStatus().isOk();
            client.put().uri(BASE + "/alice/bob/paths/shared.history")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("delta", 0.2))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("BAD_REQUEST");
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @BeforeEach
        void create() {
            createAliceBob();
        }

        @Test
        @DisplayName("decision uses defaults for omitted parameters")
        void decision() {
            client.get().uri(BASE + "/alice/bob/decision?direction=a_to_b")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stakes").isEqualTo("LOW")
                .jsonPath("$.contextMultiplier").isEqualTo(1.0)
                .jsonPath("$.decision.taskWillingness").isNumber()
                .jsonPath("$.direction").isEqualTo("a_to_b");
        }

        @Test
        @DisplayName("predictions report stakes and both behaviors")
        void predictions() {
            client.get().uri(BASE + "/alice/bob/predictions?direction=b_to_a&propensity=0.9&riskLevel=0.6")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stakes").isEqualTo("HIGH")
                .jsonPath("$.wouldConfide").isEqualTo(false)
                .jsonPath("$.direction").isEqualTo("b_to_a");
        }

        @Test
        @DisplayName("decay tick reports the relationships touched")
        void decayTick() {
            client.post().uri("/api/v1/decay/tick?elapsedHours=24")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.elapsedSeconds").isEqualTo(86400)
                .jsonPath("$.relationshipsDecayed").isEqualTo(1);
        }

        @Test
        @DisplayName("zero-hour tick is a 400")
        void zeroTick() {
            client.post().uri("/api/v1/decay/tick?elapsedHours=0")
                .exchange()
                .expectStatus().isBadRequest();
        }
    }
}
