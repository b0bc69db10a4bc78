package com.trustplatform.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.path.SharedPath;
import com.trustplatform.core.relationship.BondType;
import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.relationship.InteractionPattern;
import com.trustplatform.core.relationship.Relationship;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only JSON view of a relationship. Built under the caller's lock; never
 * shares mutable state with the relationship.
 */
public record RelationshipSnapshot(
    @JsonProperty("id")           String                     id,
    @JsonProperty("entityA")      String                     entityA,
    @JsonProperty("entityB")      String                     entityB,
    @JsonProperty("stage")        String                     stage,
    @JsonProperty("schema")       String                     schema,
    @JsonProperty("bonds")        List<String>               bonds,
    @JsonProperty("shared")       Map<String, ValueSnapshot> shared,
    @JsonProperty("pattern")      PatternSnapshot            pattern,
    @JsonProperty("aToB")         DirectionalSnapshot        aToB,
    @JsonProperty("bToA")         DirectionalSnapshot        bToA
) {
    public record PatternSnapshot(
        @JsonProperty("frequency")       double  frequency,
        @JsonProperty("consistency")     double  consistency,
        @JsonProperty("lastInteraction") Instant lastInteraction
    ) {
        static PatternSnapshot of(InteractionPattern pattern) {
            return new PatternSnapshot(pattern.getFrequency(), pattern.getConsistency(), pattern.getLastInteraction());
        }
    }

    public static RelationshipSnapshot of(Relationship relationship) {
        Map<String, ValueSnapshot> shared = new LinkedHashMap<>();
        for (SharedPath path : SharedPath.values()) {
            shared.put(path.key(), ValueSnapshot.of(relationship.shared().get(path)));
        }
        return new RelationshipSnapshot(
            relationship.getId(),
            relationship.getEntityA().value(),
            relationship.getEntityB().value(),
            relationship.getStage().name(),
            relationship.getSchema().name(),
            relationship.getBonds().stream().map(BondType::name).toList(),
            shared,
            PatternSnapshot.of(relationship.pattern()),
            DirectionalSnapshot.of(relationship, Direction.A_TO_B),
            DirectionalSnapshot.of(relationship, Direction.B_TO_A));
    }
}
