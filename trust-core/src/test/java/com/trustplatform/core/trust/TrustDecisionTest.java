package com.trustplatform.core.trust;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrustDecisionTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("fields are clamped to [0, 1] and NaN becomes 0")
    void clamps() {
        TrustDecision decision = new TrustDecision(1.4, -0.2, Double.NaN, 0.5, 2.0);
        assertEquals(1.0, decision.taskWillingness(), EPS);
        assertEquals(0.0, decision.supportWillingness(), EPS);
        assertEquals(0.0, decision.disclosureWillingness(), EPS);
        assertEquals(0.5, decision.decisionCertainty(), EPS);
        assertEquals(1.0, decision.trusteeConfidence(), EPS);
    }

    @Test
    @DisplayName("thresholds are strict")
    void strictThresholds() {
        TrustDecision decision = new TrustDecision(0.5, 0.5, 0.5, 0.0, 0.0);
        assertFalse(decision.wouldDelegateTask(0.5));
        assertTrue(decision.wouldDelegateTask(0.49));
        assertFalse(decision.anyWilling(0.5));
    }

    @Test
    @DisplayName("fullyWilling needs every domain, anyWilling needs one")
    void aggregates() {
        TrustDecision decision = new TrustDecision(0.9, 0.2, 0.9, 0.5, 0.5);
        assertFalse(decision.fullyWilling(0.5));
        assertTrue(decision.anyWilling(0.5));
        assertEquals(0.2, decision.willingness(TrustDomain.SUPPORT), EPS);
        assertEquals(0.9, decision.willingness(TrustDomain.DISCLOSURE), EPS);
    }

    @Test
    @DisplayName("noTrust and fullTrust are the extremes")
    void extremes() {
        assertFalse(TrustDecision.noTrust().anyWilling(0.0));
        assertEquals(0.0, TrustDecision.noTrust().decisionCertainty(), EPS);
        assertTrue(TrustDecision.fullTrust().fullyWilling(0.99));
    }
}
