package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.relationship.BondType;
import com.trustplatform.core.relationship.RelationshipSchema;
import com.trustplatform.core.relationship.RelationshipStage;

import java.util.List;

public record CreateRelationshipRequest(
    @JsonProperty("entityA") String             entityA,
    @JsonProperty("entityB") String             entityB,
    @JsonProperty("stage")   RelationshipStage  stage,
    @JsonProperty("schema")  RelationshipSchema schema,
    @JsonProperty("bonds")   List<BondType>     bonds
) {
    public CreateRelationshipRequest {
        bonds = bonds == null ? List.of() : List.copyOf(bonds);
    }
}
