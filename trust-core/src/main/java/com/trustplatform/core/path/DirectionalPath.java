package com.trustplatform.core.path;

/**
 * Attributes that differ per direction of a relationship: the directional
 * dimensions, the trustworthiness factors and the perceived risk.
 */
public enum DirectionalPath {
    WARMTH,
    RESENTMENT,
    DEPENDENCE,
    ATTRACTION,
    ATTACHMENT,
    JEALOUSY,
    FEAR,
    OBLIGATION,
    PERCEIVED_RISK,
    COMPETENCE(TrustPath.COMPETENCE),
    BENEVOLENCE(TrustPath.BENEVOLENCE),
    INTEGRITY(TrustPath.INTEGRITY),
    SUPPORT_WILLINGNESS(TrustPath.SUPPORT_WILLINGNESS);

    private final TrustPath trustPath;

    DirectionalPath() {
        this(null);
    }

    DirectionalPath(TrustPath trustPath) {
        this.trustPath = trustPath;
    }

    /** The trust attribute behind this path, or {@code null} for non-trust attributes. */
    public TrustPath trustPath() {
        return trustPath;
    }

    public boolean isTrust() {
        return trustPath != null;
    }

    public String key() {
        return name().toLowerCase();
    }

    public static DirectionalPath fromKey(String key) {
        for (DirectionalPath path : values()) {
            if (path.key().equalsIgnoreCase(key)) {
                return path;
            }
        }
        throw new IllegalArgumentException("Unknown directional attribute: " + key);
    }
}
