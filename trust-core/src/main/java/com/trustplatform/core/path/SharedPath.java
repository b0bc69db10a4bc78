package com.trustplatform.core.path;

/**
 * Symmetric dimensions shared by both parties of a relationship.
 */
public enum SharedPath {
    AFFINITY,
    RESPECT,
    TENSION,
    INTIMACY,
    HISTORY;

    public String key() {
        return name().toLowerCase();
    }

    public static SharedPath fromKey(String key) {
        for (SharedPath path : values()) {
            if (path.key().equalsIgnoreCase(key)) {
                return path;
            }
        }
        throw new IllegalArgumentException("Unknown shared dimension: " + key);
    }
}
