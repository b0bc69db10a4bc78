package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EventIngestResponse(
    @JsonProperty("eventType")            String eventType,
    @JsonProperty("antecedentsPerUpdate") int    antecedentsPerUpdate,
    @JsonProperty("relationshipsUpdated") int    relationshipsUpdated,
    @JsonProperty("traceId")              String traceId
) {}
