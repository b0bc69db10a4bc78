package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.relationship.RelationshipStage;

/**
 * Update for a single path. {@code base} and {@code delta} apply to value paths,
 * {@code stage} only to the {@code stage} path. Null fields are left unchanged.
 */
public record PathUpdateRequest(
    @JsonProperty("base")  Double            base,
    @JsonProperty("delta") Double            delta,
    @JsonProperty("stage") RelationshipStage stage
) {}
