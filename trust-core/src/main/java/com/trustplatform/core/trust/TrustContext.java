package com.trustplatform.core.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Situational factors that moderate a trust decision. Every factor is clamped
 * to [0, 1] and defaults to 0.5.
 *
 * <p>Social norms, institutional safeguards, institutional support and cultural
 * expectations encourage trust. Time pressure slightly degrades it.
 */
public record TrustContext(
    @JsonProperty("socialNorms")             double socialNorms,
    @JsonProperty("institutionalSafeguards") double institutionalSafeguards,
    @JsonProperty("timePressure")            double timePressure,
    @JsonProperty("institutionalSupport")    double institutionalSupport,
    @JsonProperty("culturalExpectations")    double culturalExpectations
) {
    public static final double NEUTRAL = 0.5;
    public static final double MIN_MULTIPLIER = 0.5;
    public static final double MAX_MULTIPLIER = 1.5;

    private static final double PRESSURE_PENALTY = 0.1;

    public TrustContext {
        socialNorms             = clamp(socialNorms, 0.0, 1.0);
        institutionalSafeguards = clamp(institutionalSafeguards, 0.0, 1.0);
        timePressure            = clamp(timePressure, 0.0, 1.0);
        institutionalSupport    = clamp(institutionalSupport, 0.0, 1.0);
        culturalExpectations    = clamp(culturalExpectations, 0.0, 1.0);
    }

    public static TrustContext neutral() {
        return new TrustContext(NEUTRAL, NEUTRAL, NEUTRAL, NEUTRAL, NEUTRAL);
    }

    /**
     * Context whose {@link #computeMultiplier()} reproduces the given multiplier,
     * assuming neutral time pressure. The multiplier is clamped to [0.5, 1.5].
     */
    public static TrustContext fromMultiplier(double multiplier) {
        double m = clamp(multiplier, MIN_MULTIPLIER, MAX_MULTIPLIER);
        double encouragement = clamp(m - (MIN_MULTIPLIER - PRESSURE_PENALTY * NEUTRAL), 0.0, 1.0);
        return new TrustContext(encouragement, encouragement, NEUTRAL, encouragement, encouragement);
    }

    public TrustContext withSocialNorms(double value) {
        return new TrustContext(value, institutionalSafeguards, timePressure, institutionalSupport, culturalExpectations);
    }

    public TrustContext withInstitutionalSafeguards(double value) {
        return new TrustContext(socialNorms, value, timePressure, institutionalSupport, culturalExpectations);
    }

    public TrustContext withTimePressure(double value) {
        return new TrustContext(socialNorms, institutionalSafeguards, value, institutionalSupport, culturalExpectations);
    }

    public TrustContext withInstitutionalSupport(double value) {
        return new TrustContext(socialNorms, institutionalSafeguards, timePressure, value, culturalExpectations);
    }

    public TrustContext withCulturalExpectations(double value) {
        return new TrustContext(socialNorms, institutionalSafeguards, timePressure, institutionalSupport, value);
    }

    /** Multiplier in [0.5, 1.5]; 0.95 for the all-neutral context. */
    public double computeMultiplier() {
        double encouragement = (socialNorms + institutionalSafeguards + institutionalSupport + culturalExpectations) / 4.0;
        double multiplier = MIN_MULTIPLIER + encouragement - PRESSURE_PENALTY * timePressure;
        return clamp(multiplier, MIN_MULTIPLIER, MAX_MULTIPLIER);
    }

    private static double clamp(double v, double min, double max) {
        if (Double.isNaN(v)) return min;
        return Math.max(min, Math.min(max, v));
    }
}
