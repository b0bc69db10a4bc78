package com.trustplatform.core.trust;

public enum AntecedentDirection {
    POSITIVE,
    NEGATIVE;

    public double sign() {
        return this == POSITIVE ? 1.0 : -1.0;
    }
}
