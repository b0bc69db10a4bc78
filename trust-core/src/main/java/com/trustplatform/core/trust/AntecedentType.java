package com.trustplatform.core.trust;

/**
 * Trustworthiness factor an antecedent speaks to (Mayer's ABI model).
 */
public enum AntecedentType {
    ABILITY(TrustDomain.TASK),
    BENEVOLENCE(TrustDomain.SUPPORT),
    INTEGRITY(TrustDomain.DISCLOSURE);

    private final TrustDomain trustDomain;

    AntecedentType(TrustDomain trustDomain) {
        this.trustDomain = trustDomain;
    }

    public TrustDomain trustDomain() {
        return trustDomain;
    }
}
