package com.trustplatform.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.core.state.DecayingValue;

public record ValueSnapshot(
    @JsonProperty("base")            double base,
    @JsonProperty("delta")           double delta,
    @JsonProperty("effective")       double effective,
    @JsonProperty("halfLifeSeconds") Long   halfLifeSeconds
) {
    public static ValueSnapshot of(DecayingValue value) {
        return new ValueSnapshot(
            value.getBase(),
            value.getDelta(),
            value.effective(),
            value.getHalfLife().map(h -> h.getSeconds()).orElse(null));
    }
}
