package com.trustplatform.core.event;

import com.trustplatform.core.trust.AntecedentDirection;
import com.trustplatform.core.trust.AntecedentType;
import com.trustplatform.core.trust.LifeDomain;
import com.trustplatform.core.trust.TrustDomain;

import java.util.Objects;

/**
 * One antecedent an event produces, before severity and consistency scaling.
 *
 * @param lifeDomain competence domain for ABILITY mappings; {@code null} means every domain
 */
public record AntecedentMapping(
    AntecedentType      type,
    AntecedentDirection direction,
    double              baseMagnitude,
    String              context,
    LifeDomain          lifeDomain
) {
    public AntecedentMapping {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(direction, "direction");
        context = context == null ? "" : context;
        if (type != AntecedentType.ABILITY) {
            lifeDomain = null;
        }
    }

    public static AntecedentMapping of(AntecedentType type, AntecedentDirection direction,
                                       double baseMagnitude, String context) {
        return new AntecedentMapping(type, direction, baseMagnitude, context, null);
    }

    public AntecedentMapping withBaseMagnitude(double magnitude) {
        return new AntecedentMapping(type, direction, magnitude, context, lifeDomain);
    }

    public AntecedentMapping withContext(String newContext) {
        return new AntecedentMapping(type, direction, baseMagnitude, newContext, lifeDomain);
    }

    public AntecedentMapping withLifeDomain(LifeDomain domain) {
        return new AntecedentMapping(type, direction, baseMagnitude, context, domain);
    }

    public TrustDomain trustDomain() {
        return type.trustDomain();
    }
}
