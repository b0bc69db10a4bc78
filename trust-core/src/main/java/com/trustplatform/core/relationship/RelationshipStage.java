package com.trustplatform.core.relationship;

/**
 * Development stage of a relationship.
 *
 * <p>Each stage carries the constants used by trust decisions:
 * <ul>
 *   <li>{@code propensityWeight} + {@code trustworthinessWeight}: always sum to 1.0.
 *       Strangers lean on the trustor's disposition, intimates on observed trustworthiness.</li>
 *   <li>{@code riskModifier}: added to perceived risk before it is weighed.</li>
 *   <li>{@code decisionCertaintyAnchor}: how settled a willingness judgment is.</li>
 *   <li>{@code trusteeConfidenceAnchor}: how well the trustee's attributes are known.</li>
 * </ul>
 *
 * <p>{@link #ESTRANGED} is reachable from any stage and models deterioration, not
 * termination: the trustee is well known (high confidence) but the judgment is
 * conflicted (moderate certainty).
 */
public enum RelationshipStage {
    STRANGER    (0.6, 0.4,  0.3, 0.1, 0.1, "No significant interaction history"),
    ACQUAINTANCE(0.4, 0.6,  0.2, 0.3, 0.4, "Limited interactions, forming impressions"),
    ESTABLISHED (0.2, 0.8,  0.0, 0.6, 0.7, "Regular relationship with consistent patterns"),
    INTIMATE    (0.1, 0.9, -0.1, 0.9, 0.9, "Deep trust and extensive history"),
    ESTRANGED   (0.3, 0.7,  0.4, 0.5, 0.8, "Previously close but now deteriorated");

    private final double propensityWeight;
    private final double trustworthinessWeight;
    private final double riskModifier;
    private final double decisionCertaintyAnchor;
    private final double trusteeConfidenceAnchor;
    private final String description;

    RelationshipStage(double propensityWeight, double trustworthinessWeight, double riskModifier,
                      double decisionCertaintyAnchor, double trusteeConfidenceAnchor,
                      String description) {
        this.propensityWeight        = propensityWeight;
        this.trustworthinessWeight   = trustworthinessWeight;
        this.riskModifier            = riskModifier;
        this.decisionCertaintyAnchor = decisionCertaintyAnchor;
        this.trusteeConfidenceAnchor = trusteeConfidenceAnchor;
        this.description             = description;
    }

    public double propensityWeight() {
        return propensityWeight;
    }

    public double trustworthinessWeight() {
        return trustworthinessWeight;
    }

    public double riskModifier() {
        return riskModifier;
    }

    public double decisionCertaintyAnchor() {
        return decisionCertaintyAnchor;
    }

    public double trusteeConfidenceAnchor() {
        return trusteeConfidenceAnchor;
    }

    public String description() {
        return description;
    }

    /** True for stages on the developing path (acquaintance through intimate). */
    public boolean isPositive() {
        return this == ACQUAINTANCE || this == ESTABLISHED || this == INTIMATE;
    }

    /** True once the relationship has consistent, known patterns. */
    public boolean isDeveloped() {
        return this == ESTABLISHED || this == INTIMATE;
    }
}
