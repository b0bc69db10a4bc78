package com.trustplatform.core.relationship;

import java.util.Objects;

/**
 * Order-independent identity of a relationship: {@code of(a, b).equals(of(b, a))}.
 */
public record RelationshipKey(EntityId first, EntityId second) {

    public RelationshipKey {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) > 0) {
            EntityId tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static RelationshipKey of(EntityId a, EntityId b) {
        return new RelationshipKey(a, b);
    }

    public static RelationshipKey of(String a, String b) {
        return new RelationshipKey(EntityId.of(a), EntityId.of(b));
    }

    public boolean involves(EntityId entity) {
        return first.equals(entity) || second.equals(entity);
    }

    @Override
    public String toString() {
        return first + "<->" + second;
    }
}
