package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PredictionResponse(
    @JsonProperty("relationshipId") String  relationshipId,
    @JsonProperty("direction")      String  direction,
    @JsonProperty("propensity")     double  propensity,
    @JsonProperty("riskLevel")      double  riskLevel,
    @JsonProperty("stakes")         String  stakes,
    @JsonProperty("wouldConfide")   boolean wouldConfide,
    @JsonProperty("wouldHelp")      boolean wouldHelp
) {}
