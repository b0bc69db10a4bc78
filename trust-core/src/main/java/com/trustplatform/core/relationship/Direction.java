package com.trustplatform.core.relationship;

/**
 * Perspective inside a pairwise relationship.
 *
 * <p>{@link #A_TO_B} is entity A's view of entity B: A is the trustor, B the trustee.
 */
public enum Direction {
    A_TO_B("a_to_b"),
    B_TO_A("b_to_a");

    private final String key;

    Direction(String key) {
        this.key = key;
    }

    public Direction opposite() {
        return this == A_TO_B ? B_TO_A : A_TO_B;
    }

    /** Lower-case token used in structured paths, e.g. {@code a_to_b}. */
    public String key() {
        return key;
    }

    public static Direction fromKey(String key) {
        for (Direction direction : values()) {
            if (direction.key.equalsIgnoreCase(key) || direction.name().equalsIgnoreCase(key)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + key);
    }
}
