package com.trustplatform.core.relationship;

/**
 * Role tag attached to a relationship. A relationship may carry several bonds.
 */
public enum BondType {
    PEER,
    MENTOR,
    MENTEE,
    FAMILY,
    FRIEND,
    COLLEAGUE,
    ROMANTIC,
    RIVAL,
    AUTHORITY,
    SUBORDINATE,
    PARENT,
    CHILD,
    SIBLING;

    public boolean isHierarchical() {
        return this == MENTOR || this == MENTEE
            || this == AUTHORITY || this == SUBORDINATE
            || this == PARENT || this == CHILD;
    }

    public boolean isFamily() {
        return this == FAMILY || this == PARENT || this == CHILD || this == SIBLING;
    }

    /** The bond as seen from the other side, e.g. MENTOR ↔ MENTEE. */
    public BondType reciprocal() {
        return switch (this) {
            case MENTOR      -> MENTEE;
            case MENTEE      -> MENTOR;
            case AUTHORITY   -> SUBORDINATE;
            case SUBORDINATE -> AUTHORITY;
            case PARENT      -> CHILD;
            case CHILD       -> PARENT;
            default          -> this;
        };
    }
}
