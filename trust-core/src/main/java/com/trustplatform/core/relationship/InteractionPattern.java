package com.trustplatform.core.relationship;

import java.time.Instant;
import java.util.Objects;

/**
 * How regularly two entities interact. {@code consistency} scales the magnitude
 * of antecedents derived from events: erratic relationships register events at
 * half strength.
 */
public final class InteractionPattern {

    private double frequency;
    private double consistency;
    private Instant lastInteraction;

    public InteractionPattern() {
        this(0.0, 0.0, null);
    }

    public InteractionPattern(double frequency, double consistency, Instant lastInteraction) {
        this.frequency       = clamp01(frequency);
        this.consistency     = clamp01(consistency);
        this.lastInteraction = lastInteraction;
    }

    public double getFrequency() {
        return frequency;
    }

    public void setFrequency(double frequency) {
        this.frequency = clamp01(frequency);
    }

    public double getConsistency() {
        return consistency;
    }

    public void setConsistency(double consistency) {
        this.consistency = clamp01(consistency);
    }

    public Instant getLastInteraction() {
        return lastInteraction;
    }

    public void setLastInteraction(Instant lastInteraction) {
        this.lastInteraction = lastInteraction;
    }

    /** Multiplier in [0.5, 1.0] applied to event-derived antecedent magnitudes. */
    public double consistencyWeight() {
        return 0.5 + consistency * 0.5;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InteractionPattern that)) return false;
        return Double.compare(frequency, that.frequency) == 0
            && Double.compare(consistency, that.consistency) == 0
            && Objects.equals(lastInteraction, that.lastInteraction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, consistency, lastInteraction);
    }
}
