package com.trustplatform.core.trust;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure replay of an antecedent history into per-factor exponential moving averages.
 *
 * <p>The whole history is reprocessed on every call because temporal decay is
 * measured against the newest antecedent, which moves as the log grows.
 *
 * <h3>Per antecedent, in chronological order</h3>
 * <ol>
 *   <li><strong>Temporal decay</strong>: {@code exp(-ageDays * ln2 / 180)} where age is
 *       measured back from the newest antecedent. A six-month-old observation counts half.</li>
 *   <li><strong>Asymmetry</strong>: negative antecedents weigh {@value #NEGATIVE_WEIGHT}x.
 *       Positive antecedents within {@link #REBUILDING_WINDOW} after the latest negative
 *       seen so far weigh {@value #REBUILDING_WEIGHT}x (trust rebuilds slowly).</li>
 *   <li><strong>Smoothing</strong>: {@code ema = (1 - α) * ema + α * signed} with
 *       α = {@value #SMOOTHING_ALPHA}; one EMA per competence domain, one for benevolence,
 *       one for integrity.</li>
 * </ol>
 *
 * <p>ABILITY antecedents without a life domain fold into every tracked domain's EMA.
 * Antecedents for untracked domains are ignored.
 *
 * <p>No state. No logging. Deterministic.
 */
public final class AntecedentReplay {

    static final double SMOOTHING_ALPHA   = 0.4;
    static final double NEGATIVE_WEIGHT   = 2.5;
    static final double REBUILDING_WEIGHT = 0.7;
    static final double DECAY_HALF_LIFE_DAYS = 180.0;
    static final Duration REBUILDING_WINDOW = Duration.ofDays(180);

    private static final double SECONDS_PER_DAY = 86_400.0;

    private AntecedentReplay() { /* utility class */ }

    /**
     * Folds the supplied history into EMAs.
     *
     * @param history        antecedents in any order; not modified
     * @param trackedDomains competence domains the owner tracks
     * @return the replay result; {@link ReplayResult#isEmpty()} when history is empty
     */
    public static ReplayResult replay(List<TrustAntecedent> history, Set<LifeDomain> trackedDomains) {
        if (history == null || history.isEmpty()) {
            return ReplayResult.EMPTY;
        }

        List<TrustAntecedent> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(TrustAntecedent::timestamp));
        Instant reference = sorted.get(sorted.size() - 1).timestamp();

        Map<LifeDomain, Double> competence = new EnumMap<>(LifeDomain.class);
        double benevolence = 0.0;
        double integrity   = 0.0;
        Instant lastNegative = null;

        for (TrustAntecedent antecedent : sorted) {
            double weight;
            if (antecedent.isNegative()) {
                lastNegative = antecedent.timestamp();
                weight = NEGATIVE_WEIGHT;
            } else {
                weight = isRebuilding(antecedent.timestamp(), lastNegative) ? REBUILDING_WEIGHT : 1.0;
            }

            double signed = antecedent.signedMagnitude()
                * weight
                * temporalDecay(reference, antecedent.timestamp());

            switch (antecedent.type()) {
                case ABILITY -> {
                    LifeDomain domain = antecedent.lifeDomain();
                    if (domain == null) {
                        for (LifeDomain tracked : trackedDomains) {
                            competence.put(tracked, updateEma(competence.getOrDefault(tracked, 0.0), signed));
                        }
                    } else if (trackedDomains.contains(domain)) {
                        competence.put(domain, updateEma(competence.getOrDefault(domain, 0.0), signed));
                    }
                }
                case BENEVOLENCE -> benevolence = updateEma(benevolence, signed);
                case INTEGRITY   -> integrity   = updateEma(integrity, signed);
            }
        }

        return new ReplayResult(Collections.unmodifiableMap(competence), benevolence, integrity, false);
    }

    /** Weight multiplier in (0, 1] for an antecedent of the given age relative to the reference. */
    public static double temporalDecay(Instant reference, Instant timestamp) {
        double ageDays = Duration.between(timestamp, reference).getSeconds() / SECONDS_PER_DAY;
        return Math.exp(-ageDays * Math.log(2.0) / DECAY_HALF_LIFE_DAYS);
    }

    static boolean isRebuilding(Instant timestamp, Instant lastNegative) {
        if (lastNegative == null) {
            return false;
        }
        return Duration.between(lastNegative, timestamp).compareTo(REBUILDING_WINDOW) <= 0;
    }

    static double updateEma(double previous, double value) {
        return (1.0 - SMOOTHING_ALPHA) * previous + SMOOTHING_ALPHA * value;
    }

    /**
     * EMAs produced by a replay.
     *
     * @param competenceEmas EMA per domain that received at least one ABILITY antecedent
     * @param benevolenceEma benevolence EMA (0 when no benevolence antecedent)
     * @param integrityEma   integrity EMA (0 when no integrity antecedent)
     * @param empty          true when the history was empty
     */
    public record ReplayResult(
        Map<LifeDomain, Double> competenceEmas,
        double benevolenceEma,
        double integrityEma,
        boolean empty
    ) {
        static final ReplayResult EMPTY = new ReplayResult(Map.of(), 0.0, 0.0, true);

        public boolean isEmpty() {
            return empty;
        }
    }
}
