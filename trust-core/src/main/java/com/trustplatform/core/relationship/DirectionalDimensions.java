package com.trustplatform.core.relationship;

import com.trustplatform.core.path.DirectionalPath;
import com.trustplatform.core.state.DecayingValue;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Feelings one party holds toward the other. One instance per direction.
 *
 * <p>Warmth starts at 0.2, everything else at 0. Attachment and obligation are
 * slow (30 days), jealousy and fear fast (7 days), the rest 14 days.
 */
public final class DirectionalDimensions {

    private static final Duration DEFAULT_HALF_LIFE = Duration.ofDays(14);
    private static final Duration SLOW_HALF_LIFE    = Duration.ofDays(30);
    private static final Duration FAST_HALF_LIFE    = Duration.ofDays(7);

    private final Map<DirectionalPath, DecayingValue> values = new EnumMap<>(DirectionalPath.class);

    public DirectionalDimensions() {
        values.put(DirectionalPath.WARMTH,     DecayingValue.bounded(0.2, DEFAULT_HALF_LIFE));
        values.put(DirectionalPath.RESENTMENT, DecayingValue.bounded(0.0, DEFAULT_HALF_LIFE));
        values.put(DirectionalPath.DEPENDENCE, DecayingValue.bounded(0.0, DEFAULT_HALF_LIFE));
        values.put(DirectionalPath.ATTRACTION, DecayingValue.bounded(0.0, DEFAULT_HALF_LIFE));
        values.put(DirectionalPath.ATTACHMENT, DecayingValue.bounded(0.0, SLOW_HALF_LIFE));
        values.put(DirectionalPath.JEALOUSY,   DecayingValue.bounded(0.0, FAST_HALF_LIFE));
        values.put(DirectionalPath.FEAR,       DecayingValue.bounded(0.0, FAST_HALF_LIFE));
        values.put(DirectionalPath.OBLIGATION, DecayingValue.bounded(0.0, SLOW_HALF_LIFE));
    }

    /**
     * Returns the value behind a directional dimension.
     *
     * @throws IllegalArgumentException for trust and risk paths, which live elsewhere
     */
    public DecayingValue get(DirectionalPath path) {
        DecayingValue value = values.get(path);
        if (value == null) {
            throw new IllegalArgumentException(path + " is not a directional dimension");
        }
        return value;
    }

    public boolean tracks(DirectionalPath path) {
        return values.containsKey(path);
    }

    public DecayingValue warmth() {
        return values.get(DirectionalPath.WARMTH);
    }

    public DecayingValue resentment() {
        return values.get(DirectionalPath.RESENTMENT);
    }

    public DecayingValue dependence() {
        return values.get(DirectionalPath.DEPENDENCE);
    }

    public DecayingValue attraction() {
        return values.get(DirectionalPath.ATTRACTION);
    }

    public DecayingValue attachment() {
        return values.get(DirectionalPath.ATTACHMENT);
    }

    public DecayingValue jealousy() {
        return values.get(DirectionalPath.JEALOUSY);
    }

    public DecayingValue fear() {
        return values.get(DirectionalPath.FEAR);
    }

    public DecayingValue obligation() {
        return values.get(DirectionalPath.OBLIGATION);
    }

    public double effective(DirectionalPath path) {
        return get(path).effective();
    }

    public void addDelta(DirectionalPath path, double amount) {
        get(path).addDelta(amount);
    }

    public void applyDecay(Duration elapsed) {
        values.values().forEach(value -> value.applyDecay(elapsed));
    }

    public void resetDeltas() {
        values.values().forEach(DecayingValue::resetDelta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectionalDimensions that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }
}
