package com.trustplatform.core.relationship;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifier of a simulated entity. Opaque to this library apart from equality.
 */
public record EntityId(String value) implements Comparable<EntityId> {

    public EntityId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be blank");
        }
        value = value.trim();
    }

    @JsonCreator
    public static EntityId of(String value) {
        return new EntityId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(EntityId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
