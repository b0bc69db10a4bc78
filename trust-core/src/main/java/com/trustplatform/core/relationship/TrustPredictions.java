package com.trustplatform.core.relationship;

import com.trustplatform.core.trust.StakesLevel;
import com.trustplatform.core.trust.TrustDecision;

/**
 * Behavioral predictions built on trust decisions.
 *
 * <p>The risk level enters twice: it selects the stakes bucket for the decision
 * and raises the threshold the willingness must exceed.
 */
public final class TrustPredictions {

    static final double CONFIDE_BASE_THRESHOLD = 0.6;
    static final double HELP_BASE_THRESHOLD    = 0.4;
    static final double RISK_THRESHOLD_SLOPE   = 0.3;

    private TrustPredictions() { /* utility class */ }

    /** Low below 0.25, Medium below 0.5, High below 0.75, otherwise Critical. */
    public static StakesLevel riskToStakes(double riskLevel) {
        if (riskLevel >= 0.75) return StakesLevel.CRITICAL;
        if (riskLevel >= 0.5)  return StakesLevel.HIGH;
        if (riskLevel >= 0.25) return StakesLevel.MEDIUM;
        return StakesLevel.LOW;
    }

    public static boolean wouldConfide(Relationship relationship, Direction direction,
                                       double propensity, double riskLevel) {
        TrustDecision decision = relationship.computeTrustDecision(direction, propensity, riskToStakes(riskLevel));
        return decision.disclosureWillingness() > CONFIDE_BASE_THRESHOLD + riskLevel * RISK_THRESHOLD_SLOPE;
    }

    public static boolean wouldHelp(Relationship relationship, Direction direction,
                                    double propensity, double riskLevel) {
        TrustDecision decision = relationship.computeTrustDecision(direction, propensity, riskToStakes(riskLevel));
        return decision.supportWillingness() > HELP_BASE_THRESHOLD + riskLevel * RISK_THRESHOLD_SLOPE;
    }
}
