package com.trustplatform.core.exception;

import com.trustplatform.core.relationship.RelationshipStage;

/**
 * Rejected stage change. No transition is currently restricted, so this is never
 * thrown by {@code Relationship.setStage}.
 */
public class StageTransitionException extends RelationshipException {
    private final RelationshipStage from;
    private final RelationshipStage to;

    public StageTransitionException(String relationshipId, RelationshipStage from, RelationshipStage to) {
        super(relationshipId, "Invalid stage transition from " + from + " to " + to);
        this.from = from;
        this.to   = to;
    }

    public RelationshipStage getFrom() {
        return from;
    }

    public RelationshipStage getTo() {
        return to;
    }
}
