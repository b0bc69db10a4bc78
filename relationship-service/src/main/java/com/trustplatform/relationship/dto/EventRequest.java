package com.trustplatform.relationship.dto;

import com.trustplatform.core.event.EventTag;
import com.trustplatform.core.event.EventType;
import com.trustplatform.core.event.RelationshipEvent;
import com.trustplatform.core.relationship.EntityId;
import com.trustplatform.core.trust.LifeDomain;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Inbound event body. {@code source} and {@code target} are optional; an event
 * lacking either has no effect. A missing timestamp means "now".
 */
@Data
@NoArgsConstructor
public class EventRequest {

    private EventType type;
    private String source;
    private String target;
    private double severity = 1.0;
    private Instant timestamp;
    private Set<EventTag> tags = EnumSet.noneOf(EventTag.class);
    private LifeDomain lifeDomain;

    public RelationshipEvent toEvent(Instant now) {
        if (type == null) {
            throw new IllegalArgumentException("Event type is required");
        }
        return new RelationshipEvent(
            type,
            isBlank(source) ? null : EntityId.of(source),
            isBlank(target) ? null : EntityId.of(target),
            severity,
            timestamp != null ? timestamp : now,
            tags,
            lifeDomain);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
