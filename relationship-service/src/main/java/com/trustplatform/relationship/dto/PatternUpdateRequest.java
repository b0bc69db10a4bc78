package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Null fields leave the current value unchanged. */
public record PatternUpdateRequest(
    @JsonProperty("frequency")       Double  frequency,
    @JsonProperty("consistency")     Double  consistency,
    @JsonProperty("lastInteraction") Instant lastInteraction
) {}
