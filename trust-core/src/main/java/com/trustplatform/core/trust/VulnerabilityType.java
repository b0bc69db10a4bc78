package com.trustplatform.core.trust;

/**
 * What the trustor exposes by trusting.
 */
public enum VulnerabilityType {
    IDENTITY,
    RESOURCES,
    SAFETY,
    RELATIONSHIP,
    REPUTATION,
    EMOTIONAL;

    public static final VulnerabilityType DEFAULT = RESOURCES;
}
