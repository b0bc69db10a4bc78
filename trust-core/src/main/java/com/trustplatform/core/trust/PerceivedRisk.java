package com.trustplatform.core.trust;

import com.trustplatform.core.state.DecayingValue;

import java.time.Duration;
import java.util.Objects;

/**
 * Trustor's perceived risk of relying on a trustee.
 *
 * <p>A decaying baseline plus a one-way betrayal latch. Every compute method
 * returns a value clamped to [0, 1]:
 * <pre>
 *   risk = effective + stakes.riskContribution + (betrayed ? 0.3 : 0) [+ extras]
 * </pre>
 */
public final class PerceivedRisk {

    public static final double DEFAULT_BASE = 0.3;
    public static final double BETRAYAL_PENALTY = 0.3;

    static final Duration HALF_LIFE = Duration.ofDays(7);
    static final double SENSITIVITY_SCALE = 0.4;

    private final DecayingValue value;
    private boolean betrayalHistory;

    public PerceivedRisk() {
        this(DEFAULT_BASE);
    }

    public PerceivedRisk(double base) {
        this.value = DecayingValue.bounded(base, HALF_LIFE);
    }

    public DecayingValue value() {
        return value;
    }

    public double effective() {
        return value.effective();
    }

    public boolean hasBetrayalHistory() {
        return betrayalHistory;
    }

    public void markBetrayal() {
        this.betrayalHistory = true;
    }

    /** Test support only: betrayal is otherwise permanent. */
    public void clearBetrayalHistory() {
        this.betrayalHistory = false;
    }

    public double computeForStakes(StakesLevel stakes) {
        return clamp01(raw(stakes));
    }

    public double computeWithStageModifier(StakesLevel stakes, double stageModifier) {
        return clamp01(raw(stakes) + stageModifier);
    }

    /**
     * @param sensitivity trustor's risk sensitivity; clamped to [0, 1], 0.5 is neutral
     */
    public double computeForTrustor(StakesLevel stakes, double sensitivity) {
        return clamp01(raw(stakes) + sensitivityTerm(sensitivity));
    }

    public double computeSubjective(StakesLevel stakes, double stageModifier, double sensitivity) {
        return clamp01(raw(stakes) + stageModifier + sensitivityTerm(sensitivity));
    }

    public double computeForVulnerability(Vulnerability vulnerability) {
        return computeForStakes(vulnerability.stakes());
    }

    public void applyDecay(Duration elapsed) {
        value.applyDecay(elapsed);
    }

    public void resetDelta() {
        value.resetDelta();
    }

    private double raw(StakesLevel stakes) {
        Objects.requireNonNull(stakes, "stakes");
        return value.effective() + stakes.riskContribution() + (betrayalHistory ? BETRAYAL_PENALTY : 0.0);
    }

    private static double sensitivityTerm(double sensitivity) {
        return (clamp01(sensitivity) - 0.5) * SENSITIVITY_SCALE;
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PerceivedRisk that)) return false;
        return betrayalHistory == that.betrayalHistory && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, betrayalHistory);
    }
}
