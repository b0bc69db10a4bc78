package com.trustplatform.core.trust;

/**
 * Life areas in which competence is tracked independently.
 */
public enum LifeDomain {
    WORK,
    ACADEMIC,
    SOCIAL,
    ATHLETIC,
    CREATIVE,
    FINANCIAL,
    HEALTH,
    RELATIONSHIP;

    public String key() {
        return name().toLowerCase();
    }

    public static LifeDomain fromKey(String key) {
        for (LifeDomain domain : values()) {
            if (domain.key().equalsIgnoreCase(key)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown life domain: " + key);
    }
}
