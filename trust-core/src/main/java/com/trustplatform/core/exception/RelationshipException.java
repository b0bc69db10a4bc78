package com.trustplatform.core.exception;

public class RelationshipException extends RuntimeException {
    private final String relationshipId;

    public RelationshipException(String relationshipId, String message) {
        super("[" + relationshipId + "] " + message);
        this.relationshipId = relationshipId;
    }

    public RelationshipException(String relationshipId, String message, Throwable cause) {
        super("[" + relationshipId + "] " + message, cause);
        this.relationshipId = relationshipId;
    }

    public String getRelationshipId() {
        return relationshipId;
    }
}
