package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.trust.TrustDecision;

public record DecisionResponse(
    @JsonProperty("relationshipId")    String        relationshipId,
    @JsonProperty("direction")         String        direction,
    @JsonProperty("stage")             String        stage,
    @JsonProperty("stakes")            String        stakes,
    @JsonProperty("contextMultiplier") double        contextMultiplier,
    @JsonProperty("decision")          TrustDecision decision
) {}
