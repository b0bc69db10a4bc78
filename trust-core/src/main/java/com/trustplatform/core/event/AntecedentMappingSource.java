package com.trustplatform.core.event;

import java.util.List;

/**
 * Supplies the antecedents an event produces. An empty list means the event has
 * no effect on trust.
 */
@FunctionalInterface
public interface AntecedentMappingSource {

    List<AntecedentMapping> mappingsFor(RelationshipEvent event);
}
