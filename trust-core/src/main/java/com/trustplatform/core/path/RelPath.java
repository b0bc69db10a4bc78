package com.trustplatform.core.path;

import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.trust.LifeDomain;

import java.util.Objects;

/**
 * Structured address of a single value inside a relationship.
 *
 * <p>String form, as accepted by {@link #parse(String)}:
 * <pre>
 *   shared.affinity
 *   directional.a_to_b.warmth
 *   directional.b_to_a.competence.health
 *   stage
 * </pre>
 *
 * <p>Competence paths without a life domain address {@link LifeDomain#WORK}.
 */
public record RelPath(Scope scope,
                      SharedPath shared,
                      Direction direction,
                      DirectionalPath attribute,
                      LifeDomain lifeDomain) {

    public enum Scope { SHARED, DIRECTIONAL, STAGE }

    private static final String SEPARATOR = ".";

    public RelPath {
        Objects.requireNonNull(scope, "scope");
        if (scope == Scope.SHARED) {
            Objects.requireNonNull(shared, "shared");
        }
        if (scope == Scope.DIRECTIONAL) {
            Objects.requireNonNull(direction, "direction");
            Objects.requireNonNull(attribute, "attribute");
            if (lifeDomain != null && attribute != DirectionalPath.COMPETENCE) {
                throw new IllegalArgumentException("Life domain only applies to competence paths");
            }
        }
    }

    public static RelPath shared(SharedPath path) {
        return new RelPath(Scope.SHARED, path, null, null, null);
    }

    public static RelPath directional(Direction direction, DirectionalPath attribute) {
        return new RelPath(Scope.DIRECTIONAL, null, direction, attribute, null);
    }

    public static RelPath competence(Direction direction, LifeDomain domain) {
        return new RelPath(Scope.DIRECTIONAL, null, direction, DirectionalPath.COMPETENCE, domain);
    }

    public static RelPath stage() {
        return new RelPath(Scope.STAGE, null, null, null, null);
    }

    /** Life domain addressed by a competence path, defaulting to WORK. */
    public LifeDomain effectiveLifeDomain() {
        return lifeDomain != null ? lifeDomain : LifeDomain.WORK;
    }

    public static RelPath parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Path must not be blank");
        }
        String[] parts = raw.trim().toLowerCase().split("\\.");
        switch (parts[0]) {
            case "stage":
                if (parts.length != 1) break;
                return stage();
            case "shared":
                if (parts.length != 2) break;
                return shared(SharedPath.fromKey(parts[1]));
            case "directional":
                if (parts.length == 3) {
                    return directional(Direction.fromKey(parts[1]), DirectionalPath.fromKey(parts[2]));
                }
                if (parts.length == 4) {
                    DirectionalPath attribute = DirectionalPath.fromKey(parts[2]);
                    if (attribute != DirectionalPath.COMPETENCE) break;
                    return competence(Direction.fromKey(parts[1]), LifeDomain.fromKey(parts[3]));
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Malformed relationship path: " + raw);
    }

    @Override
    public String toString() {
        return switch (scope) {
            case STAGE  -> "stage";
            case SHARED -> "shared" + SEPARATOR + shared.key();
            case DIRECTIONAL -> {
                String base = "directional" + SEPARATOR + direction.key() + SEPARATOR + attribute.key();
                yield lifeDomain != null ? base + SEPARATOR + lifeDomain.key() : base;
            }
        };
    }
}
