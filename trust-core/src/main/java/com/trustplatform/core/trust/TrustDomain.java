package com.trustplatform.core.trust;

/**
 * Kind of vulnerability a trust decision is about: delegating a task,
 * relying on support, or disclosing something personal.
 */
public enum TrustDomain {
    TASK,
    SUPPORT,
    DISCLOSURE
}
