package com.trustplatform.core.state;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded numeric state made of a stable {@code base} and a transient {@code delta}.
 *
 * <p>The effective value is {@code clamp(base + delta, lowerBound, upperBound)}.
 * Only the delta decays: {@link #applyDecay(Duration)} multiplies it by
 * {@code 0.5^(elapsed / halfLife)}. A value without a half-life never decays.
 *
 * <p>Not thread-safe. Always embedded in an owner (dimension set, trust factors,
 * perceived risk) which serializes access.
 */
public final class DecayingValue {

    public static final double DEFAULT_LOWER_BOUND = 0.0;
    public static final double DEFAULT_UPPER_BOUND = 1.0;

    private double base;
    private double delta;
    private final double lowerBound;
    private final double upperBound;
    private final Duration halfLife;

    public DecayingValue(double base, double lowerBound, double upperBound, Duration halfLife) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                "lowerBound " + lowerBound + " exceeds upperBound " + upperBound);
        }
        this.base       = base;
        this.delta      = 0.0;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.halfLife   = halfLife;
    }

    /** Value bounded to [0, 1] that decays with the given half-life. */
    public static DecayingValue bounded(double base, Duration halfLife) {
        return new DecayingValue(base, DEFAULT_LOWER_BOUND, DEFAULT_UPPER_BOUND,
            Objects.requireNonNull(halfLife, "halfLife"));
    }

    /** Value bounded to [0, 1] whose delta never decays. */
    public static DecayingValue nonDecaying(double base) {
        return new DecayingValue(base, DEFAULT_LOWER_BOUND, DEFAULT_UPPER_BOUND, null);
    }

    public double effective() {
        return clamp(base + delta, lowerBound, upperBound);
    }

    public double getBase() {
        return base;
    }

    public double getDelta() {
        return delta;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public Optional<Duration> getHalfLife() {
        return Optional.ofNullable(halfLife);
    }

    public boolean decays() {
        return halfLife != null;
    }

    public void setBase(double base) {
        this.base = base;
    }

    public void setDelta(double delta) {
        this.delta = delta;
    }

    public void addDelta(double amount) {
        this.delta += amount;
    }

    public void resetDelta() {
        this.delta = 0.0;
    }

    /**
     * Decays the delta toward zero by the elapsed time.
     *
     * @param elapsed simulated time since the previous decay; callers must apply
     *                decay in increasing time order
     */
    public void applyDecay(Duration elapsed) {
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            return;
        }
        if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) {
            return;
        }
        double elapsedSeconds  = toSeconds(elapsed);
        double halfLifeSeconds = toSeconds(halfLife);
        delta *= Math.pow(0.5, elapsedSeconds / halfLifeSeconds);
    }

    public DecayingValue copy() {
        DecayingValue copy = new DecayingValue(base, lowerBound, upperBound, halfLife);
        copy.delta = delta;
        return copy;
    }

    static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecayingValue that)) return false;
        return Double.compare(base, that.base) == 0
            && Double.compare(delta, that.delta) == 0
            && Double.compare(lowerBound, that.lowerBound) == 0
            && Double.compare(upperBound, that.upperBound) == 0
            && Objects.equals(halfLife, that.halfLife);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, delta, lowerBound, upperBound, halfLife);
    }

    @Override
    public String toString() {
        return "DecayingValue{base=" + base + ", delta=" + delta
            + ", effective=" + effective() + ", halfLife=" + halfLife + "}";
    }
}
