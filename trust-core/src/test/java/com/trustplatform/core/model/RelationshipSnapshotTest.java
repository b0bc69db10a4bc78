package com.trustplatform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustplatform.core.relationship.BondType;
import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.relationship.Relationship;
import com.trustplatform.core.relationship.RelationshipStage;
import com.trustplatform.core.trust.AntecedentDirection;
import com.trustplatform.core.trust.AntecedentType;
import com.trustplatform.core.trust.TrustAntecedent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipSnapshotTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    @DisplayName("snapshot copies values and does not track later mutation")
    void detached() {
        Relationship rel = Relationship.between("alice", "bob").withStage(RelationshipStage.ACQUAINTANCE);
        RelationshipSnapshot snapshot = RelationshipSnapshot.of(rel);

        rel.shared().addAffinityDelta(0.5);

        assertEquals(0.1, snapshot.shared().get("affinity").effective(), 1e-9);
        assertEquals("ACQUAINTANCE", snapshot.stage());
        assertEquals("a_to_b", snapshot.aToB().direction());
        assertEquals(8, snapshot.aToB().competence().size());
        assertEquals(8, snapshot.aToB().dimensions().size());
        assertNull(snapshot.shared().get("history").halfLifeSeconds());
    }

    @Test
    @DisplayName("serializes to JSON with ISO timestamps")
    void serializes() throws Exception {
        Instant at = Instant.parse("2024-06-01T10:15:30Z");
        Relationship rel = Relationship.between("alice", "bob").withBond(BondType.FRIEND);
        rel.appendAntecedent(Direction.B_TO_A, TrustAntecedent.of(
            at, AntecedentType.BENEVOLENCE, AntecedentDirection.NEGATIVE, 0.2, "snub"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(RelationshipSnapshot.of(rel)));

        assertEquals("rel_alice_bob", json.get("id").asText());
        assertEquals("FRIEND", json.get("bonds").get(0).asText());
        assertEquals(1, json.get("bToA").get("antecedentCount").asInt());
        assertEquals("2024-06-01T10:15:30Z", json.get("bToA").get("lastNegativeAntecedent").asText());
        assertEquals(1_209_600L, json.get("shared").get("affinity").get("halfLifeSeconds").asLong());
    }
}
