package com.trustplatform.core.exception;

import com.trustplatform.core.relationship.Relationship;

/**
 * Thrown when a relationship is requested between an entity and itself.
 */
public class SelfRelationshipException extends RelationshipException {
    private final String entityId;

    public SelfRelationshipException(String entityId) {
        super(Relationship.idFor(entityId, entityId), "Cannot create a relationship between an entity and itself");
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
