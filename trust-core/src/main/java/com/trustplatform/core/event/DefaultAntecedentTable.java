package com.trustplatform.core.event;

import com.trustplatform.core.trust.AntecedentDirection;
import com.trustplatform.core.trust.AntecedentType;
import com.trustplatform.core.trust.LifeDomain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.trustplatform.core.trust.AntecedentDirection.NEGATIVE;
import static com.trustplatform.core.trust.AntecedentDirection.POSITIVE;
import static com.trustplatform.core.trust.AntecedentType.ABILITY;
import static com.trustplatform.core.trust.AntecedentType.BENEVOLENCE;
import static com.trustplatform.core.trust.AntecedentType.INTEGRITY;

/**
 * Default {@link AntecedentMappingSource}: a fixed base table per {@link EventType}
 * scaled by event tags and by the typical strength of each event type.
 *
 * <h3>Tag weights</h3>
 * <pre>
 *   WITNESSED        x0.5   (second-hand observation)
 *   HIGH_STAKES      x1.3
 *   LOW_STAKES       x0.8   (ignored when HIGH_STAKES is present)
 *   MORAL_VIOLATION  x1.2   (betrayal integrity only, context "lied_to")
 * </pre>
 * VIOLENCE, TRAUMATIC_EXPOSURE and INTERACTION ignore the stakes tags.
 *
 * <h3>Typical strength</h3>
 * Events carry no detail beyond type, tags and life domain, so each type is scaled
 * by the strength of an ordinary occurrence:
 * <pre>
 *   ACHIEVEMENT         x0.6   moderate achievement
 *   SUPPORT             x0.7   emotional support; no ABILITY mapping
 *   BETRAYAL            x0.7   confidence violated
 *   CONFLICT            x1.0   verbal, unresolved; ABILITY only with HIGH_STAKES or WORK
 *   INTERACTION         ABILITY 0.01 + 0.04 x (10 / 60) for a ten minute chat; no BENEVOLENCE
 *   VIOLENCE            x0.7   injury severity
 *   HUMILIATION         x1.0   private; no ABILITY mapping
 *   EMPOWERMENT         x1.2   in WORK, ACADEMIC or FINANCIAL (WORK when no life domain)
 *   TRAUMATIC_EXPOSURE  x0.5   proximity
 * </pre>
 * SUPPORT under HIGH_STAKES uses the context "helped_in_crisis". Resulting
 * magnitudes are clamped to [0, 1]. ABILITY mappings inherit the event's life
 * domain when it has one.
 *
 * <p>Stateless and thread-safe.
 */
public class DefaultAntecedentTable implements AntecedentMappingSource {

    static final double WITNESSED_WEIGHT       = 0.5;
    static final double HIGH_STAKES_WEIGHT     = 1.3;
    static final double LOW_STAKES_WEIGHT      = 0.8;
    static final double MORAL_VIOLATION_WEIGHT = 1.2;

    static final double ACHIEVEMENT_STRENGTH      = 0.6;
    static final double SUPPORT_EFFECTIVENESS     = 0.7;
    static final double BETRAYAL_CONFIDENCE       = 0.7;
    static final double VIOLENCE_INJURY           = 0.7;
    static final double EMPOWERMENT_DOMAIN_WEIGHT = 1.2;
    static final double TRAUMA_PROXIMITY          = 0.5;
    static final double INTERACTION_MINUTES       = 10.0;

    private static final Map<EventType, List<AntecedentMapping>> BASE_TABLE = new EnumMap<>(EventType.class);

    static {
        put(EventType.ACHIEVEMENT,
            m(ABILITY, POSITIVE, 0.2, "task_completed_well"));
        put(EventType.FAILURE,
            m(ABILITY, NEGATIVE, 0.2, "task_failed"));
        put(EventType.SUPPORT,
            m(BENEVOLENCE, POSITIVE, 0.3, "support"),
            m(ABILITY, POSITIVE, 0.15, "support_competence"));
        put(EventType.BETRAYAL,
            m(INTEGRITY, NEGATIVE, 0.4, "betrayed_confidence"),
            m(BENEVOLENCE, NEGATIVE, 0.2, "betrayal"));
        put(EventType.CONFLICT,
            m(BENEVOLENCE, NEGATIVE, 0.2, "conflict"),
            m(ABILITY, NEGATIVE, 0.2, "public_disagreement"));
        put(EventType.INTERACTION,
            m(ABILITY, POSITIVE, 0.01, "daily_interaction"),
            m(BENEVOLENCE, POSITIVE, 0.15, "shared_vulnerability"));
        put(EventType.SOCIAL_INCLUSION,
            m(BENEVOLENCE, POSITIVE, 0.2, "social_inclusion"));
        put(EventType.SOCIAL_EXCLUSION,
            m(BENEVOLENCE, NEGATIVE, 0.2, "social_exclusion"));
        put(EventType.BURDEN_FEEDBACK,
            m(BENEVOLENCE, NEGATIVE, 0.25, "burden_feedback"));
        put(EventType.VIOLENCE,
            m(INTEGRITY, NEGATIVE, 0.5, "violence"),
            m(BENEVOLENCE, NEGATIVE, 0.4, "violence"));
        put(EventType.HUMILIATION,
            m(INTEGRITY, NEGATIVE, 0.25, "humiliation"),
            m(ABILITY, NEGATIVE, 0.15, "public_disagreement"));
        put(EventType.EMPOWERMENT,
            m(ABILITY, POSITIVE, 0.15, "empowerment"));
        put(EventType.LOSS,
            m(INTEGRITY, NEGATIVE, 0.2, "loss_caused"));
        put(EventType.REALIZATION,
            m(INTEGRITY, POSITIVE, 0.2, "honest_difficult_truth"));
        put(EventType.TRAUMATIC_EXPOSURE,
            m(INTEGRITY, NEGATIVE, 0.25, "traumatic_exposure"),
            m(BENEVOLENCE, NEGATIVE, 0.2, "traumatic_exposure"));
    }

    /**
     * Unscaled table entries for an event type; empty for unmapped types. Some
     * entries only apply under conditions, see {@link #mappingsFor}.
     */
    public static List<AntecedentMapping> baseMappings(EventType type) {
        return BASE_TABLE.getOrDefault(type, List.of());
    }

    @Override
    public List<AntecedentMapping> mappingsFor(RelationshipEvent event) {
        List<AntecedentMapping> base = baseMappings(event.type());
        if (base.isEmpty()) {
            return List.of();
        }

        double witness = witnessWeight(event);
        double weight = witness * stakesWeight(event);
        List<AntecedentMapping> result = new ArrayList<>(2);

        switch (event.type()) {
            case ACHIEVEMENT -> add(result, event, base.get(0), ACHIEVEMENT_STRENGTH * weight);
            case SUPPORT -> {
                AntecedentMapping support = event.hasTag(EventTag.HIGH_STAKES)
                    ? base.get(0).withContext("helped_in_crisis") : base.get(0);
                add(result, event, support, SUPPORT_EFFECTIVENESS * weight);
            }
            case BETRAYAL -> {
                boolean moral = event.hasTag(EventTag.MORAL_VIOLATION);
                AntecedentMapping integrity = moral ? base.get(0).withContext("lied_to") : base.get(0);
                add(result, event, integrity,
                    BETRAYAL_CONFIDENCE * (moral ? MORAL_VIOLATION_WEIGHT : 1.0) * weight);
                add(result, event, base.get(1), BETRAYAL_CONFIDENCE * weight);
            }
            case CONFLICT -> {
                add(result, event, base.get(0), weight);
                if (event.hasTag(EventTag.HIGH_STAKES) || event.hasTag(EventTag.WORK)) {
                    add(result, event, base.get(1), weight);
                }
            }
            case INTERACTION -> {
                double duration = Math.min(1.0, INTERACTION_MINUTES / 60.0);
                AntecedentMapping chat = base.get(0);
                result.add(withDomain(chat.withBaseMagnitude(
                    clamp01((chat.baseMagnitude() + 0.04 * duration) * witness)), event));
            }
            case VIOLENCE -> {
                add(result, event, base.get(0), VIOLENCE_INJURY * witness);
                add(result, event, base.get(1), VIOLENCE_INJURY * witness);
            }
            case HUMILIATION -> add(result, event, base.get(0), weight);
            case EMPOWERMENT -> add(result, event, base.get(0), empowermentWeight(event.lifeDomain()) * weight);
            case TRAUMATIC_EXPOSURE -> {
                add(result, event, base.get(0), TRAUMA_PROXIMITY * witness);
                add(result, event, base.get(1), TRAUMA_PROXIMITY * witness);
            }
            default -> base.forEach(mapping -> add(result, event, mapping, weight));
        }
        return result;
    }

    static double witnessWeight(RelationshipEvent event) {
        return event.hasTag(EventTag.WITNESSED) ? WITNESSED_WEIGHT : 1.0;
    }

    static double stakesWeight(RelationshipEvent event) {
        if (event.hasTag(EventTag.HIGH_STAKES)) return HIGH_STAKES_WEIGHT;
        if (event.hasTag(EventTag.LOW_STAKES))  return LOW_STAKES_WEIGHT;
        return 1.0;
    }

    static double empowermentWeight(LifeDomain domain) {
        if (domain == null) return EMPOWERMENT_DOMAIN_WEIGHT;
        return switch (domain) {
            case WORK, ACADEMIC, FINANCIAL -> EMPOWERMENT_DOMAIN_WEIGHT;
            default -> 1.0;
        };
    }

    private static void add(List<AntecedentMapping> result, RelationshipEvent event,
                            AntecedentMapping mapping, double factor) {
        result.add(withDomain(mapping.withBaseMagnitude(clamp01(mapping.baseMagnitude() * factor)), event));
    }

    private static AntecedentMapping withDomain(AntecedentMapping mapping, RelationshipEvent event) {
        if (mapping.type() == ABILITY && event.lifeDomain() != null) {
            return mapping.withLifeDomain(event.lifeDomain());
        }
        return mapping;
    }

    private static void put(EventType type, AntecedentMapping... mappings) {
        BASE_TABLE.put(type, List.of(mappings));
    }

    private static AntecedentMapping m(AntecedentType type, AntecedentDirection direction,
                                       double magnitude, String context) {
        return AntecedentMapping.of(type, direction, magnitude, context);
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
