package com.trustplatform.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.path.DirectionalPath;
import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.relationship.DirectionalDimensions;
import com.trustplatform.core.relationship.Relationship;
import com.trustplatform.core.trust.LifeDomain;
import com.trustplatform.core.trust.PerceivedRisk;
import com.trustplatform.core.trust.TrustworthinessFactors;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One direction of a relationship: the trustor's view of the trustee.
 */
public record DirectionalSnapshot(
    @JsonProperty("direction")            String                     direction,
    @JsonProperty("competence")           Map<String, ValueSnapshot> competence,
    @JsonProperty("competenceEffective")  double                     competenceEffective,
    @JsonProperty("benevolence")          ValueSnapshot              benevolence,
    @JsonProperty("integrity")            ValueSnapshot              integrity,
    @JsonProperty("overallTrustworthiness") double                   overallTrustworthiness,
    @JsonProperty("perceivedRisk")        ValueSnapshot              perceivedRisk,
    @JsonProperty("betrayalHistory")      boolean                    betrayalHistory,
    @JsonProperty("dimensions")           Map<String, ValueSnapshot> dimensions,
    @JsonProperty("antecedentCount")      int                        antecedentCount,
    @JsonProperty("lastNegativeAntecedent") Instant                  lastNegativeAntecedent
) {
    public static DirectionalSnapshot of(Relationship relationship, Direction direction) {
        TrustworthinessFactors tw = relationship.trustworthiness(direction);
        PerceivedRisk risk = relationship.perceivedRisk(direction);
        DirectionalDimensions dims = relationship.directional(direction);

        Map<String, ValueSnapshot> competence = new LinkedHashMap<>();
        for (LifeDomain domain : LifeDomain.values()) {
            competence.put(domain.key(), ValueSnapshot.of(tw.competence(domain)));
        }
        Map<String, ValueSnapshot> dimensions = new LinkedHashMap<>();
        for (DirectionalPath path : DirectionalPath.values()) {
            if (dims.tracks(path)) {
                dimensions.put(path.key(), ValueSnapshot.of(dims.get(path)));
            }
        }

        return new DirectionalSnapshot(
            direction.key(),
            competence,
            tw.competenceEffective(),
            ValueSnapshot.of(tw.benevolence()),
            ValueSnapshot.of(tw.integrity()),
            tw.overall(),
            ValueSnapshot.of(risk.value()),
            risk.hasBetrayalHistory(),
            dimensions,
            relationship.antecedentHistory(direction).size(),
            relationship.lastNegativeAntecedent(direction).orElse(null));
    }
}
