package com.trustplatform.core.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of the trustee that bears on trust.
 *
 * <ul>
 *   <li>{@code magnitude}: clamped to [0, 1].</li>
 *   <li>{@code trustDomain}: derived from {@code type}, never supplied.</li>
 *   <li>{@code lifeDomain}: only meaningful for ABILITY; {@code null} means the
 *       observation applies to every competence domain.</li>
 * </ul>
 */
public record TrustAntecedent(
    @JsonProperty("timestamp")   Instant             timestamp,
    @JsonProperty("type")        AntecedentType      type,
    @JsonProperty("direction")   AntecedentDirection direction,
    @JsonProperty("magnitude")   double              magnitude,
    @JsonProperty("context")     String              context,
    @JsonProperty("lifeDomain")  LifeDomain          lifeDomain
) {
    public TrustAntecedent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(direction, "direction");
        magnitude = Double.isNaN(magnitude) ? 0.0 : Math.max(0.0, Math.min(1.0, magnitude));
        context = context == null ? "" : context;
    }

    public static TrustAntecedent of(Instant timestamp, AntecedentType type,
                                     AntecedentDirection direction, double magnitude,
                                     String context) {
        return new TrustAntecedent(timestamp, type, direction, magnitude, context, null);
    }

    public TrustAntecedent withLifeDomain(LifeDomain domain) {
        return new TrustAntecedent(timestamp, type, direction, magnitude, context, domain);
    }

    @JsonProperty("trustDomain")
    public TrustDomain trustDomain() {
        return type.trustDomain();
    }

    public boolean isNegative() {
        return direction == AntecedentDirection.NEGATIVE;
    }

    /** Magnitude with the direction's sign applied. */
    public double signedMagnitude() {
        return direction.sign() * magnitude;
    }
}
