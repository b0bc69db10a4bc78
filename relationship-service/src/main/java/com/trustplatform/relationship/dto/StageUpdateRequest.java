package com.trustplatform.relationship.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.relationship.RelationshipStage;

public record StageUpdateRequest(@JsonProperty("stage") RelationshipStage stage) {}
