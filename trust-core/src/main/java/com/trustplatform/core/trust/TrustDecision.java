package com.trustplatform.core.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Willingness to be vulnerable to a trustee, per trust domain, with two
 * confidence measures. All fields are clamped to [0, 1] on construction.
 *
 * @param taskWillingness       willingness to delegate a task (competence-driven)
 * @param supportWillingness    willingness to seek support (benevolence-driven)
 * @param disclosureWillingness willingness to share private information (integrity-driven)
 * @param decisionCertainty     confidence in this willingness judgment
 * @param trusteeConfidence     confidence in the trustee's underlying attributes
 */
public record TrustDecision(
    @JsonProperty("taskWillingness")       double taskWillingness,
    @JsonProperty("supportWillingness")    double supportWillingness,
    @JsonProperty("disclosureWillingness") double disclosureWillingness,
    @JsonProperty("decisionCertainty")     double decisionCertainty,
    @JsonProperty("trusteeConfidence")     double trusteeConfidence
) {
    public TrustDecision {
        taskWillingness       = clamp01(taskWillingness);
        supportWillingness    = clamp01(supportWillingness);
        disclosureWillingness = clamp01(disclosureWillingness);
        decisionCertainty     = clamp01(decisionCertainty);
        trusteeConfidence     = clamp01(trusteeConfidence);
    }

    public static TrustDecision noTrust() {
        return new TrustDecision(0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public static TrustDecision fullTrust() {
        return new TrustDecision(1.0, 1.0, 1.0, 1.0, 1.0);
    }

    public double willingness(TrustDomain domain) {
        return switch (domain) {
            case TASK       -> taskWillingness;
            case SUPPORT    -> supportWillingness;
            case DISCLOSURE -> disclosureWillingness;
        };
    }

    public boolean wouldDelegateTask(double threshold) {
        return taskWillingness > threshold;
    }

    public boolean wouldSeekSupport(double threshold) {
        return supportWillingness > threshold;
    }

    public boolean wouldDisclose(double threshold) {
        return disclosureWillingness > threshold;
    }

    /** True when every domain exceeds the threshold. */
    public boolean fullyWilling(double threshold) {
        return wouldDelegateTask(threshold) && wouldSeekSupport(threshold) && wouldDisclose(threshold);
    }

    /** True when at least one domain exceeds the threshold. */
    public boolean anyWilling(double threshold) {
        return wouldDelegateTask(threshold) || wouldSeekSupport(threshold) || wouldDisclose(threshold);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
