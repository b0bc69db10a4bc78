package com.trustplatform.core.event;

import com.trustplatform.core.relationship.EntityId;
import com.trustplatform.core.trust.AntecedentDirection;
import com.trustplatform.core.trust.AntecedentType;
import com.trustplatform.core.trust.LifeDomain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultAntecedentTableTest {

    private static final double EPS = 1e-9;
    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final DefaultAntecedentTable table = new DefaultAntecedentTable();

    private static RelationshipEvent event(EventType type) {
        return RelationshipEvent.of(type, EntityId.of("bob"), EntityId.of("alice"), 1.0, NOW);
    }

    @Test
    @DisplayName("every event type has at least one mapping")
    void everyTypeMapped() {
        for (EventType type : EventType.values()) {
            assertFalse(DefaultAntecedentTable.baseMappings(type).isEmpty(), type.name());
        }
    }

    @Test
    @DisplayName("betrayal maps to negative integrity and benevolence")
    void betrayal() {
        List<AntecedentMapping> mappings = table.mappingsFor(event(EventType.BETRAYAL));
        assertEquals(2, mappings.size());
        assertEquals(AntecedentType.INTEGRITY, mappings.get(0).type());
        assertEquals(AntecedentDirection.NEGATIVE, mappings.get(0).direction());
        // 0.4 and 0.2 at the typical 0.7 confidence violated
        assertEquals(0.28, mappings.get(0).baseMagnitude(), EPS);
        assertEquals(0.14, mappings.get(1).baseMagnitude(), EPS);
    }

    @Test
    @DisplayName("witnessed events count half")
    void witnessed() {
        List<AntecedentMapping> mappings = table.mappingsFor(
            event(EventType.ACHIEVEMENT).withTags(Set.of(EventTag.WITNESSED)));
        assertEquals(0.06, mappings.get(0).baseMagnitude(), EPS);
    }

    @Test
    @DisplayName("high stakes wins over low stakes")
    void stakesTags() {
        double high = table.mappingsFor(event(EventType.FAILURE)
            .withTags(EnumSet.of(EventTag.HIGH_STAKES, EventTag.LOW_STAKES))).get(0).baseMagnitude();
        double low = table.mappingsFor(event(EventType.FAILURE)
            .withTags(EnumSet.of(EventTag.LOW_STAKES))).get(0).baseMagnitude();
        assertEquals(0.26, high, EPS);
        assertEquals(0.16, low, EPS);
    }

    @Test
    @DisplayName("moral violation strengthens betrayal integrity only")
    void moralViolation() {
        List<AntecedentMapping> mappings = table.mappingsFor(
            event(EventType.BETRAYAL).withTags(Set.of(EventTag.MORAL_VIOLATION)));
        assertEquals(0.336, mappings.get(0).baseMagnitude(), EPS);
        assertEquals("lied_to", mappings.get(0).context());
        assertEquals(0.14, mappings.get(1).baseMagnitude(), EPS);
        assertEquals("betrayal", mappings.get(1).context());
    }

    @Test
    @DisplayName("ability mappings inherit the event's life domain")
    void lifeDomain() {
        List<AntecedentMapping> mappings = table.mappingsFor(
            event(EventType.CONFLICT).withTags(Set.of(EventTag.WORK)).withLifeDomain(LifeDomain.HEALTH));
        assertNull(mappings.get(0).lifeDomain());
        assertEquals(AntecedentType.ABILITY, mappings.get(1).type());
        assertEquals(LifeDomain.HEALTH, mappings.get(1).lifeDomain());
    }

    @Nested
    @DisplayName("typical event strength")
    class TypicalStrength {

        @Test
        @DisplayName("an achievement counts as a moderate one")
        void achievement() {
            List<AntecedentMapping> mappings = table.mappingsFor(event(EventType.ACHIEVEMENT));
            assertEquals(1, mappings.size());
            assertEquals(0.12, mappings.get(0).baseMagnitude(), EPS);
        }

        @Test
        @DisplayName("a ten minute interaction gives a small ability boost and ignores stakes")
        void interaction() {
            double expected = 0.01 + 0.04 * (10.0 / 60.0);
            List<AntecedentMapping> plain = table.mappingsFor(event(EventType.INTERACTION));
            assertEquals(1, plain.size());
            assertEquals(AntecedentType.ABILITY, plain.get(0).type());
            assertEquals(expected, plain.get(0).baseMagnitude(), EPS);

            double witnessed = table.mappingsFor(event(EventType.INTERACTION)
                .withTags(EnumSet.of(EventTag.WITNESSED, EventTag.HIGH_STAKES))).get(0).baseMagnitude();
            assertEquals(expected * 0.5, witnessed, EPS);
        }

        @Test
        @DisplayName("violence and trauma ignore stakes tags")
        void stakesIgnored() {
            List<AntecedentMapping> violence = table.mappingsFor(
                event(EventType.VIOLENCE).withTags(Set.of(EventTag.HIGH_STAKES)));
            assertEquals(0.35, violence.get(0).baseMagnitude(), EPS);
            assertEquals(0.28, violence.get(1).baseMagnitude(), EPS);

            List<AntecedentMapping> trauma = table.mappingsFor(
                event(EventType.TRAUMATIC_EXPOSURE).withTags(Set.of(EventTag.LOW_STAKES)));
            assertEquals(0.125, trauma.get(0).baseMagnitude(), EPS);
            assertEquals(0.1, trauma.get(1).baseMagnitude(), EPS);
        }

        @Test
        @DisplayName("empowerment weighs more in work, academic and financial domains")
        void empowerment() {
            assertEquals(0.18, table.mappingsFor(event(EventType.EMPOWERMENT)).get(0).baseMagnitude(), EPS);
            assertEquals(0.18, table.mappingsFor(event(EventType.EMPOWERMENT)
                .withLifeDomain(LifeDomain.FINANCIAL)).get(0).baseMagnitude(), EPS);
            assertEquals(0.15, table.mappingsFor(event(EventType.EMPOWERMENT)
                .withLifeDomain(LifeDomain.HEALTH)).get(0).baseMagnitude(), EPS);
        }
    }

    @Nested
    @DisplayName("conditional ability mappings")
    class ConditionalMappings {

        @Test
        @DisplayName("an ordinary conflict only costs benevolence")
        void conflictWithoutWorkContext() {
            List<AntecedentMapping> mappings = table.mappingsFor(event(EventType.CONFLICT));
            assertEquals(1, mappings.size());
            assertEquals(AntecedentType.BENEVOLENCE, mappings.get(0).type());
            assertEquals(0.2, mappings.get(0).baseMagnitude(), EPS);
        }

        @Test
        @DisplayName("a work or high stakes conflict also costs ability")
        void conflictAtWork() {
            List<AntecedentMapping> work = table.mappingsFor(
                event(EventType.CONFLICT).withTags(Set.of(EventTag.WORK)));
            assertEquals(2, work.size());
            assertEquals(AntecedentType.ABILITY, work.get(1).type());
            assertEquals(AntecedentDirection.NEGATIVE, work.get(1).direction());
            assertEquals(0.2, work.get(1).baseMagnitude(), EPS);
            assertEquals("public_disagreement", work.get(1).context());

            List<AntecedentMapping> highStakes = table.mappingsFor(
                event(EventType.CONFLICT).withTags(Set.of(EventTag.HIGH_STAKES)));
            assertEquals(2, highStakes.size());
            assertEquals(0.26, highStakes.get(1).baseMagnitude(), EPS);
        }

        @Test
        @DisplayName("support is emotional and only raises benevolence")
        void supportIsEmotional() {
            List<AntecedentMapping> mappings = table.mappingsFor(event(EventType.SUPPORT));
            assertEquals(1, mappings.size());
            assertEquals(AntecedentType.BENEVOLENCE, mappings.get(0).type());
            assertEquals(0.21, mappings.get(0).baseMagnitude(), EPS);
            assertEquals("support", mappings.get(0).context());
        }

        @Test
        @DisplayName("high stakes support reads as help in a crisis")
        void supportInCrisis() {
            List<AntecedentMapping> mappings = table.mappingsFor(
                event(EventType.SUPPORT).withTags(Set.of(EventTag.HIGH_STAKES)));
            assertEquals(1, mappings.size());
            assertEquals(0.273, mappings.get(0).baseMagnitude(), EPS);
            assertEquals("helped_in_crisis", mappings.get(0).context());
        }

        @Test
        @DisplayName("a private humiliation costs integrity but not ability")
        void humiliationIsPrivate() {
            List<AntecedentMapping> mappings = table.mappingsFor(event(EventType.HUMILIATION));
            assertEquals(1, mappings.size());
            assertEquals(AntecedentType.INTEGRITY, mappings.get(0).type());
            assertEquals(0.25, mappings.get(0).baseMagnitude(), EPS);
        }
    }
}
