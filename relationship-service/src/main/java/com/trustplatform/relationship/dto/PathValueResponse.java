package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.model.ValueSnapshot;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PathValueResponse(
    @JsonProperty("relationshipId") String        relationshipId,
    @JsonProperty("path")           String        path,
    @JsonProperty("value")          ValueSnapshot value,
    @JsonProperty("stage")          String        stage
) {
    public static PathValueResponse ofValue(String relationshipId, String path, ValueSnapshot value) {
        return new PathValueResponse(relationshipId, path, value, null);
    }

    public static PathValueResponse ofStage(String relationshipId, String stage) {
        return new PathValueResponse(relationshipId, "stage", null, stage);
    }
}
