package com.trustplatform.core.relationship;

/**
 * Overall relational template a relationship follows. {@link #PEER} by default.
 */
public enum RelationshipSchema {
    PEER        ("Peer",            "Equal standing, mutual relationship"),
    MENTOR      ("Mentor",          "Guidance relationship with teaching role"),
    SUBORDINATE ("Subordinate",     "Authority relationship with power differential"),
    ROMANTIC    ("Romantic",        "Romantic or intimate partnership"),
    FAMILY      ("Family",          "General family bond"),
    NUCLEAR     ("Nuclear Family",  "Core family unit (parents and children)"),
    EXTENDED    ("Extended Family", "Extended family network"),
    RIVAL       ("Rival",           "Competitive or adversarial dynamic");

    private final String displayName;
    private final String description;

    RelationshipSchema(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public boolean isHierarchical() {
        return this == MENTOR || this == SUBORDINATE;
    }

    public boolean isFamily() {
        return this == FAMILY || this == NUCLEAR || this == EXTENDED;
    }
}
