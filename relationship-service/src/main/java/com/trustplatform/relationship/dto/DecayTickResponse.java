package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DecayTickResponse(
    @JsonProperty("elapsedSeconds")       long elapsedSeconds,
    @JsonProperty("relationshipsDecayed") int  relationshipsDecayed,
    @JsonProperty("totalElapsedSeconds")  long totalElapsedSeconds
) {}
