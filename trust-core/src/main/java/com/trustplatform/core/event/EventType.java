package com.trustplatform.core.event;

/**
 * Kinds of observable events that can bear on trust.
 */
public enum EventType {
    ACHIEVEMENT,
    FAILURE,
    SUPPORT,
    BETRAYAL,
    CONFLICT,
    INTERACTION,
    SOCIAL_INCLUSION,
    SOCIAL_EXCLUSION,
    BURDEN_FEEDBACK,
    VIOLENCE,
    HUMILIATION,
    EMPOWERMENT,
    LOSS,
    REALIZATION,
    TRAUMATIC_EXPOSURE
}
