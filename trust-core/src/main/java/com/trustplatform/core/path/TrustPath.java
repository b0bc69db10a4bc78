package com.trustplatform.core.path;

/**
 * Trustworthiness attributes addressable by path.
 *
 * <p>{@link #SUPPORT_WILLINGNESS} is computed from a trust decision and has no
 * stored value behind it.
 */
public enum TrustPath {
    COMPETENCE,
    BENEVOLENCE,
    INTEGRITY,
    SUPPORT_WILLINGNESS;

    public boolean isComputed() {
        return this == SUPPORT_WILLINGNESS;
    }
}
