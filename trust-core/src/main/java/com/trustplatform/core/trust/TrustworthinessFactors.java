package com.trustplatform.core.trust;

import com.trustplatform.core.path.TrustPath;
import com.trustplatform.core.state.DecayingValue;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Perceived trustworthiness of a trustee: competence per life domain, benevolence
 * and integrity. Aggregates ({@link #competenceEffective()}, {@link #overall()}) are
 * derived on demand and never stored.
 *
 * <p>The competence map always holds every {@link LifeDomain}.
 */
public final class TrustworthinessFactors {

    public static final double DEFAULT_BASE = 0.3;

    static final Duration COMPETENCE_HALF_LIFE  = Duration.ofDays(30);
    static final Duration BENEVOLENCE_HALF_LIFE = Duration.ofDays(14);
    static final Duration INTEGRITY_HALF_LIFE   = Duration.ofDays(60);

    private final EnumMap<LifeDomain, DecayingValue> competence = new EnumMap<>(LifeDomain.class);
    private final DecayingValue benevolence;
    private final DecayingValue integrity;

    public TrustworthinessFactors() {
        this(DEFAULT_BASE, DEFAULT_BASE, DEFAULT_BASE);
    }

    private TrustworthinessFactors(double competenceBase, double benevolenceBase, double integrityBase) {
        for (LifeDomain domain : LifeDomain.values()) {
            competence.put(domain, DecayingValue.bounded(competenceBase, COMPETENCE_HALF_LIFE));
        }
        this.benevolence = DecayingValue.bounded(benevolenceBase, BENEVOLENCE_HALF_LIFE);
        this.integrity   = DecayingValue.bounded(integrityBase, INTEGRITY_HALF_LIFE);
    }

    /** Factors with the given bases; every competence domain gets {@code competenceBase}. */
    public static TrustworthinessFactors withBases(double competenceBase,
                                                   double benevolenceBase,
                                                   double integrityBase) {
        return new TrustworthinessFactors(competenceBase, benevolenceBase, integrityBase);
    }

    // ── Accessors ────────────────────────────────────────────────────────────

    public DecayingValue competence(LifeDomain domain) {
        return competence.get(Objects.requireNonNull(domain, "domain"));
    }

    public Map<LifeDomain, DecayingValue> competenceByDomain() {
        return Collections.unmodifiableMap(competence);
    }

    public DecayingValue benevolence() {
        return benevolence;
    }

    public DecayingValue integrity() {
        return integrity;
    }

    /** Stored value behind a trust path; empty for computed paths. */
    public Optional<DecayingValue> get(TrustPath path, LifeDomain domain) {
        return switch (path) {
            case COMPETENCE  -> Optional.of(competence(domain != null ? domain : LifeDomain.WORK));
            case BENEVOLENCE -> Optional.of(benevolence);
            case INTEGRITY   -> Optional.of(integrity);
            case SUPPORT_WILLINGNESS -> Optional.empty();
        };
    }

    // ── Derived values ───────────────────────────────────────────────────────

    public double competenceIn(LifeDomain domain) {
        return competence(domain).effective();
    }

    /** Average effective competence across all life domains. */
    public double competenceEffective() {
        double sum = 0.0;
        for (DecayingValue value : competence.values()) {
            sum += value.effective();
        }
        return sum / competence.size();
    }

    public double benevolenceEffective() {
        return benevolence.effective();
    }

    public double integrityEffective() {
        return integrity.effective();
    }

    public double overall() {
        return (competenceEffective() + benevolenceEffective() + integrityEffective()) / 3.0;
    }

    // ── Mutation ─────────────────────────────────────────────────────────────

    public void addCompetenceDeltaIn(LifeDomain domain, double amount) {
        competence(domain).addDelta(amount);
    }

    /** Adds the same delta to every competence domain. */
    public void addCompetenceDelta(double amount) {
        competence.values().forEach(value -> value.addDelta(amount));
    }

    public void addBenevolenceDelta(double amount) {
        benevolence.addDelta(amount);
    }

    public void addIntegrityDelta(double amount) {
        integrity.addDelta(amount);
    }

    /**
     * Adds a delta by trust path. Competence applies to every domain;
     * computed paths are ignored.
     */
    public void addDelta(TrustPath path, double amount) {
        switch (path) {
            case COMPETENCE  -> addCompetenceDelta(amount);
            case BENEVOLENCE -> addBenevolenceDelta(amount);
            case INTEGRITY   -> addIntegrityDelta(amount);
            case SUPPORT_WILLINGNESS -> { }
        }
    }

    /**
     * Rebuilds all deltas from the full antecedent history.
     *
     * <p>An empty history zeroes every delta. Otherwise each delta is re-anchored so
     * that {@code effective == clamp(base + ema)}. Competence domains that received
     * no ABILITY antecedent keep their current delta.
     */
    public void recomputeFromAntecedents(List<TrustAntecedent> history) {
        AntecedentReplay.ReplayResult result = AntecedentReplay.replay(history, competence.keySet());
        if (result.isEmpty()) {
            resetDeltas();
            return;
        }
        result.competenceEmas().forEach((domain, ema) -> anchor(competence.get(domain), ema));
        anchor(benevolence, result.benevolenceEma());
        anchor(integrity, result.integrityEma());
    }

    private static void anchor(DecayingValue value, double ema) {
        double target = Math.max(0.0, Math.min(1.0, value.getBase() + ema));
        value.setDelta(target - value.getBase());
    }

    public void applyDecay(Duration elapsed) {
        competence.values().forEach(value -> value.applyDecay(elapsed));
        benevolence.applyDecay(elapsed);
        integrity.applyDecay(elapsed);
    }

    public void resetDeltas() {
        competence.values().forEach(DecayingValue::resetDelta);
        benevolence.resetDelta();
        integrity.resetDelta();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrustworthinessFactors that)) return false;
        return competence.equals(that.competence)
            && benevolence.equals(that.benevolence)
            && integrity.equals(that.integrity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(competence, benevolence, integrity);
    }
}
