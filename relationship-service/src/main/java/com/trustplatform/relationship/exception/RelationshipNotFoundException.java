package com.trustplatform.relationship.exception;

import com.trustplatform.core.exception.RelationshipException;
import com.trustplatform.core.relationship.RelationshipKey;

public class RelationshipNotFoundException extends RelationshipException {

    public RelationshipNotFoundException(RelationshipKey key) {
        super(key.toString(), "Relationship not found");
    }
}
