package com.trustplatform.core.relationship;

import com.trustplatform.core.exception.SelfRelationshipException;
import com.trustplatform.core.exception.StageTransitionException;
import com.trustplatform.core.path.RelPath;
import com.trustplatform.core.path.DirectionalPath;
import com.trustplatform.core.path.SharedPath;
import com.trustplatform.core.state.DecayingValue;
import com.trustplatform.core.trust.AntecedentHistory;
import com.trustplatform.core.trust.PerceivedRisk;
import com.trustplatform.core.trust.StakesLevel;
import com.trustplatform.core.trust.TrustAntecedent;
import com.trustplatform.core.trust.TrustContext;
import com.trustplatform.core.trust.TrustDecision;
import com.trustplatform.core.trust.TrustDecisionEngine;
import com.trustplatform.core.trust.TrustworthinessFactors;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pairwise relationship between entity A and entity B.
 *
 * <p>Shared dimensions and the interaction pattern are symmetric. Everything else
 * is held once per {@link Direction}: {@code A_TO_B} is A's view of B (A is the
 * trustor, B the trustee).
 *
 * <p>Not thread-safe. A relationship is owned by one caller at a time; callers that
 * share it must serialize mutation.
 */
public final class Relationship {

    private final String id;
    private final EntityId entityA;
    private final EntityId entityB;
    private final List<BondType> bonds = new ArrayList<>();
    private RelationshipSchema schema = RelationshipSchema.PEER;
    private RelationshipStage stage = RelationshipStage.STRANGER;
    private final SharedDimensions shared = new SharedDimensions();
    private final InteractionPattern pattern = new InteractionPattern();
    private final EnumMap<Direction, DirectionalState> sides = new EnumMap<>(Direction.class);

    private Relationship(EntityId entityA, EntityId entityB) {
        this.id      = idFor(entityA.value(), entityB.value());
        this.entityA = entityA;
        this.entityB = entityB;
        for (Direction direction : Direction.values()) {
            sides.put(direction, new DirectionalState());
        }
    }

    /**
     * Id string {@code rel_<a>_<b>}. Underscores and percent signs inside an entity
     * id are percent-encoded so that distinct pairs never share an id.
     */
    public static String idFor(String entityA, String entityB) {
        return "rel_" + escapeIdPart(entityA) + "_" + escapeIdPart(entityB);
    }

    private static String escapeIdPart(String part) {
        return part.replace("%", "%25").replace("_", "%5F");
    }

    /**
     * Creates a relationship in the STRANGER stage with the PEER schema.
     *
     * @throws SelfRelationshipException when both ids are equal
     */
    public static Relationship between(EntityId entityA, EntityId entityB) {
        Objects.requireNonNull(entityA, "entityA");
        Objects.requireNonNull(entityB, "entityB");
        if (entityA.equals(entityB)) {
            throw new SelfRelationshipException(entityA.value());
        }
        return new Relationship(entityA, entityB);
    }

    public static Relationship between(String entityA, String entityB) {
        return between(EntityId.of(entityA), EntityId.of(entityB));
    }

    public Relationship withStage(RelationshipStage stage) {
        setStage(stage);
        return this;
    }

    public Relationship withSchema(RelationshipSchema schema) {
        setSchema(schema);
        return this;
    }

    public Relationship withBond(BondType bond) {
        addBond(bond);
        return this;
    }

    // ── Identity ─────────────────────────────────────────────────────────────

    public String getId() {
        return id;
    }

    public EntityId getEntityA() {
        return entityA;
    }

    public EntityId getEntityB() {
        return entityB;
    }

    public RelationshipKey key() {
        return RelationshipKey.of(entityA, entityB);
    }

    /**
     * Direction whose trustor is {@code trustor} and trustee is {@code trustee},
     * or empty when the pair does not match this relationship.
     */
    public Optional<Direction> directionOf(EntityId trustor, EntityId trustee) {
        if (entityA.equals(trustor) && entityB.equals(trustee)) {
            return Optional.of(Direction.A_TO_B);
        }
        if (entityB.equals(trustor) && entityA.equals(trustee)) {
            return Optional.of(Direction.B_TO_A);
        }
        return Optional.empty();
    }

    // ── Bonds, schema, stage ─────────────────────────────────────────────────

    public List<BondType> getBonds() {
        return Collections.unmodifiableList(bonds);
    }

    /** Adds a bond; duplicates are ignored. */
    public void addBond(BondType bond) {
        Objects.requireNonNull(bond, "bond");
        if (!bonds.contains(bond)) {
            bonds.add(bond);
        }
    }

    public void removeBond(BondType bond) {
        bonds.removeIf(existing -> existing == bond);
    }

    public boolean hasBond(BondType bond) {
        return bonds.contains(bond);
    }

    public RelationshipSchema getSchema() {
        return schema;
    }

    public void setSchema(RelationshipSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public RelationshipStage getStage() {
        return stage;
    }

    /**
     * Moves the relationship to a new stage.
     *
     * @throws StageTransitionException if the transition is not permitted; every
     *                                  transition is currently permitted
     */
    public void setStage(RelationshipStage next) {
        Objects.requireNonNull(next, "stage");
        validateTransition(stage, next);
        this.stage = next;
    }

    private void validateTransition(RelationshipStage from, RelationshipStage to) {
        if (from == null || to == null) {
            throw new StageTransitionException(id, from, to);
        }
    }

    // ── Components ───────────────────────────────────────────────────────────

    public SharedDimensions shared() {
        return shared;
    }

    public InteractionPattern pattern() {
        return pattern;
    }

    public TrustworthinessFactors trustworthiness(Direction direction) {
        return side(direction).trustworthiness;
    }

    public PerceivedRisk perceivedRisk(Direction direction) {
        return side(direction).perceivedRisk;
    }

    public DirectionalDimensions directional(Direction direction) {
        return side(direction).directional;
    }

    // ── Antecedents ──────────────────────────────────────────────────────────

    /** Appends to the direction's history. Trustworthiness is not recomputed. */
    public void appendAntecedent(Direction direction, TrustAntecedent antecedent) {
        side(direction).history.append(antecedent);
    }

    public List<TrustAntecedent> antecedentHistory(Direction direction) {
        return side(direction).history.entries();
    }

    public Optional<Instant> lastNegativeAntecedent(Direction direction) {
        return side(direction).history.lastNegative();
    }

    /** Rebuilds the direction's trustworthiness deltas from its full history. */
    public void recomputeTrust(Direction direction) {
        DirectionalState state = side(direction);
        state.trustworthiness.recomputeFromAntecedents(state.history.entries());
    }

    // ── Path access ──────────────────────────────────────────────────────────

    /**
     * Stored value behind a path. Empty for {@code stage} and for computed trust
     * attributes such as support willingness.
     */
    public Optional<DecayingValue> get(RelPath path) {
        Objects.requireNonNull(path, "path");
        return switch (path.scope()) {
            case STAGE  -> Optional.empty();
            case SHARED -> Optional.of(shared.get(path.shared()));
            case DIRECTIONAL -> getDirectional(path);
        };
    }

    /**
     * Overwrites the base and/or delta behind a path. A {@code null} argument leaves
     * that part unchanged.
     *
     * @throws IllegalArgumentException when the path has no stored value, or the
     *                                  update would lower shared history
     */
    public DecayingValue update(RelPath path, Double base, Double delta) {
        DecayingValue value = get(path).orElseThrow(() ->
            new IllegalArgumentException("Path has no stored value: " + path));
        if (path.scope() == RelPath.Scope.SHARED && path.shared() == SharedPath.HISTORY) {
            double current = value.effective();
            double next = Math.max(value.getLowerBound(), Math.min(value.getUpperBound(),
                (base != null ? base : value.getBase()) + (delta != null ? delta : value.getDelta())));
            if (next < current) {
                throw new IllegalArgumentException("Shared history cannot decrease");
            }
        }
        if (base != null) {
            value.setBase(base);
        }
        if (delta != null) {
            value.setDelta(delta);
        }
        return value;
    }

    private Optional<DecayingValue> getDirectional(RelPath path) {
        DirectionalState state = side(path.direction());
        DirectionalPath attribute = path.attribute();
        if (attribute.isTrust()) {
            return state.trustworthiness.get(attribute.trustPath(), path.effectiveLifeDomain());
        }
        if (attribute == DirectionalPath.PERCEIVED_RISK) {
            return Optional.of(state.perceivedRisk.value());
        }
        return Optional.of(state.directional.get(attribute));
    }

    // ── Decisions ────────────────────────────────────────────────────────────

    public TrustDecision computeTrustDecision(Direction direction, double propensity, StakesLevel stakes) {
        return computeTrustDecisionWithContext(direction, propensity, stakes, 1.0);
    }

    /**
     * @param contextMultiplier situational multiplier; clamped to [0, 2]
     */
    public TrustDecision computeTrustDecisionWithContext(Direction direction, double propensity,
                                                         StakesLevel stakes, double contextMultiplier) {
        return TrustDecisionEngine.decide(decisionInput(direction), propensity, stakes, contextMultiplier);
    }

    public TrustDecision computeTrustDecision(Direction direction, double propensity,
                                              StakesLevel stakes, TrustContext context) {
        return TrustDecisionEngine.decide(decisionInput(direction), propensity, stakes, context);
    }

    private TrustDecisionEngine.DecisionInput decisionInput(Direction direction) {
        DirectionalState state = side(direction);
        return new TrustDecisionEngine.DecisionInput(
            stage, state.trustworthiness, state.perceivedRisk, shared.historyEffective());
    }

    public boolean wouldAConfideInB(double propensity, double riskLevel) {
        return TrustPredictions.wouldConfide(this, Direction.A_TO_B, propensity, riskLevel);
    }

    public boolean wouldBConfideInA(double propensity, double riskLevel) {
        return TrustPredictions.wouldConfide(this, Direction.B_TO_A, propensity, riskLevel);
    }

    public boolean wouldAHelpB(double propensity, double riskLevel) {
        return TrustPredictions.wouldHelp(this, Direction.A_TO_B, propensity, riskLevel);
    }

    public boolean wouldBHelpA(double propensity, double riskLevel) {
        return TrustPredictions.wouldHelp(this, Direction.B_TO_A, propensity, riskLevel);
    }

    // ── Decay ────────────────────────────────────────────────────────────────

    /** Decays every decaying value. Calls must be made in increasing time order. */
    public void applyDecay(Duration elapsed) {
        shared.applyDecay(elapsed);
        for (DirectionalState state : sides.values()) {
            state.trustworthiness.applyDecay(elapsed);
            state.perceivedRisk.applyDecay(elapsed);
            state.directional.applyDecay(elapsed);
        }
    }

    private DirectionalState side(Direction direction) {
        return sides.get(Objects.requireNonNull(direction, "direction"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relationship that)) return false;
        return key().equals(that.key());
    }

    @Override
    public int hashCode() {
        return key().hashCode();
    }

    @Override
    public String toString() {
        return "Relationship{id=" + id + ", stage=" + stage + ", bonds=" + bonds + "}";
    }

    private static final class DirectionalState {
        private final TrustworthinessFactors trustworthiness = new TrustworthinessFactors();
        private final PerceivedRisk perceivedRisk = new PerceivedRisk();
        private final DirectionalDimensions directional = new DirectionalDimensions();
        private final AntecedentHistory history = new AntecedentHistory();
    }
}
