package com.trustplatform.core.trust;

/**
 * A specific exposure: what is at stake and how much.
 */
public record Vulnerability(VulnerabilityType type, StakesLevel stakes) {

    public Vulnerability {
        type   = type   != null ? type   : VulnerabilityType.DEFAULT;
        stakes = stakes != null ? stakes : StakesLevel.LOW;
    }

    public static Vulnerability of(StakesLevel stakes) {
        return new Vulnerability(VulnerabilityType.DEFAULT, stakes);
    }
}
