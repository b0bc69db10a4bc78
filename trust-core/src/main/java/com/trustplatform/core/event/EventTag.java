package com.trustplatform.core.event;

/**
 * Qualifiers attached to an event. Only some of them change antecedent magnitudes.
 */
public enum EventTag {
    PERSONAL,
    SOCIAL,
    WORK,
    FAMILY,
    WITNESSED,
    DIRECT_EXPERIENCE,
    POSITIVE,
    NEGATIVE,
    MORAL_VIOLATION,
    NEUTRAL,
    HIGH_STAKES,
    LOW_STAKES,
    ACUTE_EVENT,
    CHRONIC_PATTERN
}
