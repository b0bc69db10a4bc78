package com.trustplatform.relationship.service;

import com.trustplatform.core.event.AntecedentMapping;
import com.trustplatform.core.event.AntecedentMappingSource;
import com.trustplatform.core.event.RelationshipEvent;
import com.trustplatform.core.event.RelationshipEventProcessor;
import com.trustplatform.core.model.RelationshipSnapshot;
import com.trustplatform.core.model.ValueSnapshot;
import com.trustplatform.core.path.RelPath;
import com.trustplatform.core.relationship.BondType;
import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.relationship.EntityId;
import com.trustplatform.core.relationship.InteractionPattern;
import com.trustplatform.core.relationship.Relationship;
import com.trustplatform.core.relationship.RelationshipKey;
import com.trustplatform.core.relationship.RelationshipStage;
import com.trustplatform.core.relationship.TrustPredictions;
import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.core.trust.StakesLevel;
import com.trustplatform.core.trust.TrustDecision;
import com.trustplatform.relationship.dto.CreateRelationshipRequest;
import com.trustplatform.relationship.dto.DecayTickResponse;
import com.trustplatform.relationship.dto.DecisionResponse;
import com.trustplatform.relationship.dto.EventIngestResponse;
import com.trustplatform.relationship.dto.EventRequest;
import com.trustplatform.relationship.dto.PathUpdateRequest;
import com.trustplatform.relationship.dto.PathValueResponse;
import com.trustplatform.relationship.dto.PatternUpdateRequest;
import com.trustplatform.relationship.dto.PredictionResponse;
import com.trustplatform.relationship.exception.RelationshipAlreadyExistsException;
import com.trustplatform.relationship.exception.RelationshipNotFoundException;
import com.trustplatform.relationship.logger.TrustFlowLogger;
import com.trustplatform.relationship.registry.RelationshipRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Reactive facade over the relationship registry.
 *
 * <p>Every read or mutation of a {@link Relationship} runs inside
 * {@code synchronized (relationship)}; distinct relationships proceed
 * independently. Computation is CPU-only, so work is wrapped in
 * {@link Mono#fromCallable} without a scheduler hop.
 */
@Service
public class RelationshipService {

    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    private final RelationshipRegistry registry;
    private final RelationshipEventProcessor eventProcessor;
    private final AntecedentMappingSource mappingSource;
    private final TrustFlowLogger flowLogger;
    private final Clock clock;
    private final AtomicLong totalDecaySeconds = new AtomicLong();
    static final Duration EMIT_RETRY_WINDOW = Duration.ofMillis(100);

    private final Sinks.Many<RelationshipSnapshot> updateSink =
        Sinks.many().multicast().onBackpressureBuffer(64, false);

    public RelationshipService(RelationshipRegistry registry,
                               RelationshipEventProcessor eventProcessor,
                               AntecedentMappingSource mappingSource,
                               TrustFlowLogger flowLogger,
                               Clock clock) {
        this.registry       = registry;
        this.eventProcessor = eventProcessor;
        this.mappingSource  = mappingSource;
        this.flowLogger     = flowLogger;
        this.clock          = clock;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public Mono<RelationshipSnapshot> create(CreateRelationshipRequest request) {
        return Mono.fromCallable(() -> {
                if (request == null || request.entityA() == null || request.entityB() == null) {
                    throw new IllegalArgumentException("entityA and entityB are required");
                }
                Relationship relationship = Relationship.between(request.entityA(), request.entityB());
                if (request.stage() != null)  relationship.setStage(request.stage());
                if (request.schema() != null) relationship.setSchema(request.schema());
                request.bonds().forEach(relationship::addBond);

                synchronized (relationship) {
                    if (!registry.register(relationship)) {
                        throw new RelationshipAlreadyExistsException(relationship.getId());
                    }
                    return publish(relationship);
                }
            })
            .doOnEach(flowLogger.stage(TrustFlowLogger.RELATIONSHIP_CREATED));
    }

    public Flux<RelationshipSnapshot> list(String entity) {
        return Flux.defer(() -> {
            List<Relationship> relationships = entity == null || entity.isBlank()
                ? registry.all()
                : registry.involving(EntityId.of(entity));
            return Flux.fromIterable(relationships).map(this::snapshot);
        });
    }

    public Mono<RelationshipSnapshot> get(String a, String b) {
        return withRelationship(a, b, RelationshipSnapshot::of);
    }

    public Mono<Void> delete(String a, String b) {
        return Mono.fromRunnable(() -> {
            RelationshipKey key = RelationshipKey.of(a, b);
            if (!registry.remove(key)) {
                throw new RelationshipNotFoundException(key);
            }
            log.info("RELATIONSHIP_REMOVED key={}", key);
        });
    }

    /** Snapshots of every relationship as it changes. Hot; no replay. */
    public Flux<RelationshipSnapshot> updates() {
        return updateSink.asFlux();
    }

    // ── Mutation ─────────────────────────────────────────────────────────────

    public Mono<RelationshipSnapshot> setStage(String a, String b, RelationshipStage stage) {
        return mutate(a, b, relationship -> {
            if (stage == null) {
                throw new IllegalArgumentException("stage is required");
            }
            RelationshipStage previous = relationship.getStage();
            relationship.setStage(stage);
            log.info("STAGE_CHANGED id={} from={} to={}", relationship.getId(), previous, stage);
        });
    }

    public Mono<RelationshipSnapshot> addBond(String a, String b, BondType bond) {
        return mutate(a, b, relationship -> relationship.addBond(bond));
    }

    public Mono<RelationshipSnapshot> removeBond(String a, String b, BondType bond) {
        return mutate(a, b, relationship -> relationship.removeBond(bond));
    }

    public Mono<RelationshipSnapshot> updatePattern(String a, String b, PatternUpdateRequest request) {
        return mutate(a, b, relationship -> {
            InteractionPattern pattern = relationship.pattern();
            if (request.frequency() != null)       pattern.setFrequency(request.frequency());
            if (request.consistency() != null)     pattern.setConsistency(request.consistency());
            if (request.lastInteraction() != null) pattern.setLastInteraction(request.lastInteraction());
        });
    }

    public Mono<RelationshipSnapshot> markBetrayal(String a, String b, Direction direction) {
        return mutate(a, b, relationship -> {
            relationship.perceivedRisk(direction).markBetrayal();
            log.info("BETRAYAL_MARKED id={} direction={}", relationship.getId(), direction.key());
        });
    }

    // ── Decisions ────────────────────────────────────────────────────────────

    public Mono<DecisionResponse> decide(String a, String b, Direction direction, double propensity,
                                         StakesLevel stakes, double contextMultiplier) {
        return withRelationship(a, b, relationship -> {
                TrustDecision decision = relationship.computeTrustDecisionWithContext(
                    direction, propensity, stakes, contextMultiplier);
                return new DecisionResponse(relationship.getId(), direction.key(),
                    relationship.getStage().name(), stakes.name(), contextMultiplier, decision);
            })
            .doOnEach(flowLogger.stage(TrustFlowLogger.DECISION_COMPUTED));
    }

    public Mono<PredictionResponse> predict(String a, String b, Direction direction,
                                            double propensity, double riskLevel) {
        return withRelationship(a, b, relationship -> new PredictionResponse(
                relationship.getId(),
                direction.key(),
                propensity,
                riskLevel,
                TrustPredictions.riskToStakes(riskLevel).name(),
                TrustPredictions.wouldConfide(relationship, direction, propensity, riskLevel),
                TrustPredictions.wouldHelp(relationship, direction, propensity, riskLevel)))
            .doOnEach(flowLogger.stage(TrustFlowLogger.DECISION_COMPUTED));
    }

    // ── Paths ────────────────────────────────────────────────────────────────

    public Mono<PathValueResponse> getPath(String a, String b, String rawPath) {
        return Mono.fromCallable(() -> RelPath.parse(rawPath))
            .flatMap(path -> withRelationship(a, b, relationship -> pathValue(relationship, path)));
    }

    public Mono<PathValueResponse> updatePath(String a, String b, String rawPath, PathUpdateRequest request) {
        return Mono.fromCallable(() -> RelPath.parse(rawPath))
            .flatMap(path -> withRelationship(a, b, relationship -> {
                if (path.scope() == RelPath.Scope.STAGE) {
                    if (request.stage() == null) {
                        throw new IllegalArgumentException("stage is required for the stage path");
                    }
                    relationship.setStage(request.stage());
                } else {
                    relationship.update(path, request.base(), request.delta());
                }
                PathValueResponse response = pathValue(relationship, path);
                emit(RelationshipSnapshot.of(relationship));
                return response;
            }))
            .doOnEach(flowLogger.stage(TrustFlowLogger.STATE_MUTATED));
    }

    private static PathValueResponse pathValue(Relationship relationship, RelPath path) {
        if (path.scope() == RelPath.Scope.STAGE) {
            return PathValueResponse.ofStage(relationship.getId(), relationship.getStage().name());
        }
        ValueSnapshot value = relationship.get(path)
            .map(ValueSnapshot::of)
            .orElseThrow(() -> new IllegalArgumentException("Path has no stored value: " + path));
        return PathValueResponse.ofValue(relationship.getId(), path.toString(), value);
    }

    // ── Events ───────────────────────────────────────────────────────────────

    /** Converts the request, stamping it with the current time when it carries none. */
    public Mono<EventIngestResponse> ingest(EventRequest request) {
        return Mono.fromCallable(() -> request.toEvent(clock.instant()))
            .flatMap(this::ingest);
    }

    /**
     * Applies an event to the relationship between its source and target, if one
     * is registered. Events without both participants, or without mappings, are
     * accepted and have no effect.
     */
    public Mono<EventIngestResponse> ingest(RelationshipEvent event) {
        return Mono.deferContextual(ctx -> Mono.fromCallable(() -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            flowLogger.logWithTraceId(TrustFlowLogger.EVENT_RECEIVED, traceId,
                "type=" + event.type() + " source=" + event.source() + " target=" + event.target());

            List<AntecedentMapping> mappings = event.hasParticipants() ? mappingSource.mappingsFor(event) : List.of();
            int updated = 0;
            if (!mappings.isEmpty()) {
                Optional<Relationship> match = registry.find(RelationshipKey.of(event.source(), event.target()));
                if (match.isPresent()) {
                    Relationship relationship = match.get();
                    synchronized (relationship) {
                        updated = eventProcessor.process(event, List.of(relationship));
                        if (updated > 0) {
                            emit(RelationshipSnapshot.of(relationship));
                        }
                    }
                }
            }

            flowLogger.logWithTraceId(TrustFlowLogger.ANTECEDENTS_APPENDED, traceId,
                "mappings=" + mappings.size() + " updated=" + updated);
            if (updated > 0) {
                flowLogger.logWithTraceId(TrustFlowLogger.TRUST_RECOMPUTED, traceId,
                    "source=" + event.source() + " target=" + event.target());
            }
            log.info("EVENT_INGESTED type={} updated={} traceId={}", event.type(), updated, traceId);
            return new EventIngestResponse(event.type().name(), mappings.size(), updated, traceId);
        }));
    }

    // ── Decay ────────────────────────────────────────────────────────────────

    /**
     * Decays every relationship by {@code elapsed} of simulated time.
     *
     * @throws IllegalArgumentException when {@code elapsed} is zero or negative
     */
    public Mono<DecayTickResponse> tick(Duration elapsed) {
        return Mono.fromCallable(() -> {
                if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) {
                    throw new IllegalArgumentException("elapsed must be positive");
                }
                int count = 0;
                for (Relationship relationship : registry.all()) {
                    synchronized (relationship) {
                        relationship.applyDecay(elapsed);
                    }
                    count++;
                }
                long total = totalDecaySeconds.addAndGet(elapsed.getSeconds());
                log.info("DECAY_TICK elapsedSeconds={} relationships={} totalElapsedSeconds={}",
                         elapsed.getSeconds(), count, total);
                return new DecayTickResponse(elapsed.getSeconds(), count, total);
            })
            .doOnEach(flowLogger.stage(TrustFlowLogger.DECAY_APPLIED));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> Mono<T> withRelationship(String a, String b, Function<Relationship, T> action) {
        return Mono.fromCallable(() -> {
            Relationship relationship = require(a, b);
            synchronized (relationship) {
                return action.apply(relationship);
            }
        });
    }

    private Mono<RelationshipSnapshot> mutate(String a, String b, Consumer<Relationship> mutation) {
        return withRelationship(a, b, relationship -> {
                mutation.accept(relationship);
                return publish(relationship);
            })
            .doOnEach(flowLogger.stage(TrustFlowLogger.STATE_MUTATED));
    }

    private RelationshipSnapshot snapshot(Relationship relationship) {
        synchronized (relationship) {
            return RelationshipSnapshot.of(relationship);
        }
    }

    /** Caller must hold the relationship's lock. */
    private RelationshipSnapshot publish(Relationship relationship) {
        RelationshipSnapshot snapshot = RelationshipSnapshot.of(relationship);
        emit(snapshot);
        return snapshot;
    }

    /**
     * Emits under the relationship's lock. Distinct relationships emit concurrently,
     * so a contended emission is retried for up to {@link #EMIT_RETRY_WINDOW}.
     */
    private void emit(RelationshipSnapshot snapshot) {
        long deadline = System.nanoTime() + EMIT_RETRY_WINDOW.toNanos();
        Sinks.EmitResult result = updateSink.tryEmitNext(snapshot);
        while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED && System.nanoTime() < deadline) {
            Thread.onSpinWait();
            result = updateSink.tryEmitNext(snapshot);
        }
        if (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            log.warn("UPDATE_DROPPED id={} result={}", snapshot.id(), result);
        } else if (result.isFailure()) {
            // no subscriber, or the warm-up buffer is full
            log.debug("UPDATE_NOT_DELIVERED id={} result={}", snapshot.id(), result);
        }
    }

    private Relationship require(String a, String b) {
        RelationshipKey key = RelationshipKey.of(a, b);
        return registry.find(key).orElseThrow(() -> new RelationshipNotFoundException(key));
    }
}
