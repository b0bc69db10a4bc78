package com.trustplatform.core.relationship;

import com.trustplatform.core.path.SharedPath;
import com.trustplatform.core.state.DecayingValue;

import java.time.Duration;
import java.util.Objects;

/**
 * Dimensions both parties experience identically.
 *
 * <p>{@code history} accumulates shared experience: it never decays and
 * {@link #addHistoryDelta(double)} ignores non-positive amounts, so it is
 * monotonically non-decreasing.
 */
public final class SharedDimensions {

    private static final Duration AFFINITY_HALF_LIFE = Duration.ofDays(14);
    private static final Duration RESPECT_HALF_LIFE  = Duration.ofDays(21);
    private static final Duration TENSION_HALF_LIFE  = Duration.ofDays(7);
    private static final Duration INTIMACY_HALF_LIFE = Duration.ofDays(30);

    private final DecayingValue affinity;
    private final DecayingValue respect;
    private final DecayingValue tension;
    private final DecayingValue intimacy;
    private final DecayingValue history;

    public SharedDimensions() {
        this.affinity = DecayingValue.bounded(0.1, AFFINITY_HALF_LIFE);
        this.respect  = DecayingValue.bounded(0.2, RESPECT_HALF_LIFE);
        this.tension  = DecayingValue.bounded(0.0, TENSION_HALF_LIFE);
        this.intimacy = DecayingValue.bounded(0.0, INTIMACY_HALF_LIFE);
        this.history  = DecayingValue.nonDecaying(0.0);
    }

    public DecayingValue get(SharedPath path) {
        return switch (path) {
            case AFFINITY -> affinity;
            case RESPECT  -> respect;
            case TENSION  -> tension;
            case INTIMACY -> intimacy;
            case HISTORY  -> history;
        };
    }

    public double affinityEffective() {
        return affinity.effective();
    }

    public double respectEffective() {
        return respect.effective();
    }

    public double tensionEffective() {
        return tension.effective();
    }

    public double intimacyEffective() {
        return intimacy.effective();
    }

    public double historyEffective() {
        return history.effective();
    }

    public void addAffinityDelta(double amount) {
        affinity.addDelta(amount);
    }

    public void addRespectDelta(double amount) {
        respect.addDelta(amount);
    }

    public void addTensionDelta(double amount) {
        tension.addDelta(amount);
    }

    public void addIntimacyDelta(double amount) {
        intimacy.addDelta(amount);
    }

    /** Negative and zero amounts are ignored: shared history only grows. */
    public void addHistoryDelta(double amount) {
        if (amount > 0.0) {
            history.addDelta(amount);
        }
    }

    public void addDelta(SharedPath path, double amount) {
        if (path == SharedPath.HISTORY) {
            addHistoryDelta(amount);
        } else {
            get(path).addDelta(amount);
        }
    }

    public void applyDecay(Duration elapsed) {
        affinity.applyDecay(elapsed);
        respect.applyDecay(elapsed);
        tension.applyDecay(elapsed);
        intimacy.applyDecay(elapsed);
    }

    /** Resets every transient delta except history, which is permanent. */
    public void resetDeltas() {
        affinity.resetDelta();
        respect.resetDelta();
        tension.resetDelta();
        intimacy.resetDelta();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SharedDimensions that)) return false;
        return affinity.equals(that.affinity) && respect.equals(that.respect)
            && tension.equals(that.tension) && intimacy.equals(that.intimacy)
            && history.equals(that.history);
    }

    @Override
    public int hashCode() {
        return Objects.hash(affinity, respect, tension, intimacy, history);
    }
}
