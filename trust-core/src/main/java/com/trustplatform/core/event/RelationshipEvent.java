package com.trustplatform.core.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.relationship.EntityId;
import com.trustplatform.core.trust.LifeDomain;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * An event observed between two entities. The {@code target} is the trustor whose
 * view of the {@code source} changes.
 *
 * <p>{@code source} and {@code target} may be absent, in which case the event has
 * no effect on relationships. Severity is clamped to [0, 1].
 */
public record RelationshipEvent(
    @JsonProperty("type")       EventType    type,
    @JsonProperty("source")     EntityId     source,
    @JsonProperty("target")     EntityId     target,
    @JsonProperty("severity")   double       severity,
    @JsonProperty("timestamp")  Instant      timestamp,
    @JsonProperty("tags")       Set<EventTag> tags,
    @JsonProperty("lifeDomain") LifeDomain   lifeDomain
) {
    public RelationshipEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        severity = Double.isNaN(severity) ? 0.0 : Math.max(0.0, Math.min(1.0, severity));
        tags = tags == null || tags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(tags));
    }

    public static RelationshipEvent of(EventType type, EntityId source, EntityId target,
                                       double severity, Instant timestamp) {
        return new RelationshipEvent(type, source, target, severity, timestamp, Set.of(), null);
    }

    public RelationshipEvent withTags(Set<EventTag> newTags) {
        return new RelationshipEvent(type, source, target, severity, timestamp, newTags, lifeDomain);
    }

    public RelationshipEvent withLifeDomain(LifeDomain domain) {
        return new RelationshipEvent(type, source, target, severity, timestamp, tags, domain);
    }

    public boolean hasTag(EventTag tag) {
        return tags.contains(tag);
    }

    public boolean hasParticipants() {
        return source != null && target != null;
    }
}
