package com.trustplatform.core.event;

import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.relationship.Relationship;
import com.trustplatform.core.trust.TrustAntecedent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns an event into trust antecedents on every relationship it concerns.
 *
 * <p>The event's target is the trustor and its source the trustee, so a
 * relationship with {@code entityA == target} and {@code entityB == source} is
 * updated in the A_TO_B direction. For each mapping:
 * <pre>
 *   magnitude = clamp(baseMagnitude * severity, 0, 1) * (0.5 + 0.5 * pattern.consistency)
 * </pre>
 * Non-positive magnitudes are dropped. The matched direction's trustworthiness
 * is then recomputed from its full history.
 *
 * <p>Callers must serialize access to each relationship. No logging.
 */
public final class RelationshipEventProcessor {

    private final AntecedentMappingSource mappingSource;

    public RelationshipEventProcessor(AntecedentMappingSource mappingSource) {
        this.mappingSource = Objects.requireNonNull(mappingSource, "mappingSource");
    }

    /**
     * @return number of relationships that received at least one antecedent
     */
    public int process(RelationshipEvent event, Iterable<Relationship> relationships) {
        if (!event.hasParticipants()) {
            return 0;
        }
        List<AntecedentMapping> mappings = mappingSource.mappingsFor(event);
        if (mappings == null || mappings.isEmpty()) {
            return 0;
        }

        int updated = 0;
        for (Relationship relationship : relationships) {
            if (apply(event, mappings, relationship)) {
                updated++;
            }
        }
        return updated;
    }

    /**
     * Applies the event to one relationship.
     *
     * @return true when at least one antecedent was appended
     */
    public boolean process(RelationshipEvent event, Relationship relationship) {
        return process(event, List.of(relationship)) > 0;
    }

    private boolean apply(RelationshipEvent event, List<AntecedentMapping> mappings, Relationship relationship) {
        Optional<Direction> direction = relationship.directionOf(event.target(), event.source());
        if (direction.isEmpty()) {
            return false;
        }

        double consistencyWeight = relationship.pattern().consistencyWeight();
        boolean appended = false;
        for (AntecedentMapping mapping : mappings) {
            double raw = Math.max(0.0, Math.min(1.0, mapping.baseMagnitude() * event.severity()));
            double magnitude = raw * consistencyWeight;
            if (magnitude <= 0.0) {
                continue;
            }
            TrustAntecedent antecedent = new TrustAntecedent(
                event.timestamp(), mapping.type(), mapping.direction(),
                magnitude, mapping.context(), mapping.lifeDomain());
            relationship.appendAntecedent(direction.get(), antecedent);
            appended = true;
        }

        relationship.recomputeTrust(direction.get());
        return appended;
    }
}
