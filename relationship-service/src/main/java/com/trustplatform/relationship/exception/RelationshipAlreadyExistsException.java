package com.trustplatform.relationship.exception;

import com.trustplatform.core.exception.RelationshipException;

public class RelationshipAlreadyExistsException extends RelationshipException {

    public RelationshipAlreadyExistsException(String relationshipId) {
        super(relationshipId, "Relationship already exists");
    }
}
