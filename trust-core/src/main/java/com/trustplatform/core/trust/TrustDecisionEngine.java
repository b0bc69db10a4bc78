package com.trustplatform.core.trust;

import com.trustplatform.core.relationship.RelationshipStage;

import java.util.Objects;

/**
 * Pure logic class: turns trustworthiness, perceived risk and the relationship
 * stage into a {@link TrustDecision}.
 *
 * <pre>
 *   willingness(domain) = clamp((pw * propensity + tw * trustworthiness(domain)) * multiplier
 *                               - 0.5 * risk, 0, 1)
 *   risk                = perceivedRisk.computeWithStageModifier(stakes, stage.riskModifier)
 *   decisionCertainty   = clamp(history * 0.3 + stage.decisionCertaintyAnchor * 0.7)
 *   trusteeConfidence   = clamp(history * 0.4 + stage.trusteeConfidenceAnchor * 0.6)
 * </pre>
 *
 * Task willingness reads average competence, support reads benevolence and
 * disclosure reads integrity.
 *
 * <p>No logging. No state.
 */
public final class TrustDecisionEngine {

    static final double RISK_WEIGHT = 0.5;
    static final double MIN_CONTEXT_MULTIPLIER = 0.0;
    static final double MAX_CONTEXT_MULTIPLIER = 2.0;

    private static final double CERTAINTY_HISTORY_WEIGHT  = 0.3;
    private static final double CONFIDENCE_HISTORY_WEIGHT = 0.4;

    private TrustDecisionEngine() { /* utility class */ }

    /**
     * Input projection of the relationship state a decision needs.
     *
     * @param stage           current relationship stage
     * @param trustworthiness trustor's view of the trustee
     * @param perceivedRisk   trustor's perceived risk
     * @param history         effective shared history in [0, 1]
     */
    public record DecisionInput(
        RelationshipStage      stage,
        TrustworthinessFactors trustworthiness,
        PerceivedRisk          perceivedRisk,
        double                 history
    ) {
        public DecisionInput {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(trustworthiness, "trustworthiness");
            Objects.requireNonNull(perceivedRisk, "perceivedRisk");
        }
    }

    /**
     * @param propensity        trustor's general propensity to trust; clamped to [0, 1]
     * @param stakes            what is at risk
     * @param contextMultiplier situational multiplier; clamped to [0, 2], 1.0 is neutral
     */
    public static TrustDecision decide(DecisionInput input,
                                       double propensity,
                                       StakesLevel stakes,
                                       double contextMultiplier) {
        RelationshipStage stage = input.stage();
        TrustworthinessFactors tw = input.trustworthiness();

        double p = clamp(propensity, 0.0, 1.0);
        double multiplier = clamp(contextMultiplier, MIN_CONTEXT_MULTIPLIER, MAX_CONTEXT_MULTIPLIER);
        double risk = input.perceivedRisk().computeWithStageModifier(stakes, stage.riskModifier());

        double task       = willingness(stage, p, tw.competenceEffective(), multiplier, risk);
        double support    = willingness(stage, p, tw.benevolenceEffective(), multiplier, risk);
        double disclosure = willingness(stage, p, tw.integrityEffective(), multiplier, risk);

        double history = input.history();
        double certainty  = history * CERTAINTY_HISTORY_WEIGHT
            + stage.decisionCertaintyAnchor() * (1.0 - CERTAINTY_HISTORY_WEIGHT);
        double confidence = history * CONFIDENCE_HISTORY_WEIGHT
            + stage.trusteeConfidenceAnchor() * (1.0 - CONFIDENCE_HISTORY_WEIGHT);

        return new TrustDecision(task, support, disclosure, certainty, confidence);
    }

    public static TrustDecision decide(DecisionInput input,
                                       double propensity,
                                       StakesLevel stakes,
                                       TrustContext context) {
        return decide(input, propensity, stakes, context.computeMultiplier());
    }

    private static double willingness(RelationshipStage stage, double propensity,
                                      double trustworthiness, double multiplier, double risk) {
        double base = stage.propensityWeight() * propensity + stage.trustworthinessWeight() * trustworthiness;
        return clamp(base * multiplier - RISK_WEIGHT * risk, 0.0, 1.0);
    }

    private static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Math.max(min, Math.min(max, v));
    }
}
