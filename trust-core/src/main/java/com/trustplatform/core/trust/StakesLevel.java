package com.trustplatform.core.trust;

/**
 * How much is at risk in a trust-requiring action.
 */
public enum StakesLevel {
    LOW(0.0),
    MEDIUM(0.2),
    HIGH(0.4),
    CRITICAL(0.6);

    private final double riskContribution;

    StakesLevel(double riskContribution) {
        this.riskContribution = riskContribution;
    }

    /** Amount added to the base perceived risk. */
    public double riskContribution() {
        return riskContribution;
    }
}
