package com.trustplatform.relationship.controller;

import com.trustplatform.core.model.RelationshipSnapshot;
import com.trustplatform.core.relationship.BondType;
import com.trustplatform.core.relationship.Direction;
import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.core.trust.StakesLevel;
import com.trustplatform.relationship.dto.CreateRelationshipRequest;
import com.trustplatform.relationship.dto.DecisionResponse;
import com.trustplatform.relationship.dto.PathUpdateRequest;
import com.trustplatform.relationship.dto.PathValueResponse;
import com.trustplatform.relationship.dto.PatternUpdateRequest;
import com.trustplatform.relationship.dto.PredictionResponse;
import com.trustplatform.relationship.dto.StageUpdateRequest;
import com.trustplatform.relationship.service.RelationshipService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Relationship endpoints. {@code {a}/{b}} identifies the unordered pair; the
 * {@code direction} parameter is relative to the pair's stored entity A and B.
 */
@RestController
@RequestMapping("/api/v1/relationships")
public class RelationshipController {

    private static final Logger log = LoggerFactory.getLogger(RelationshipController.class);

    private final RelationshipService relationshipService;

    public RelationshipController(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    @PostMapping
    public Mono<ResponseEntity<RelationshipSnapshot>> create(
            @RequestBody CreateRelationshipRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        log.info("Create relationship requested. entityA={} entityB={} traceId={}",
                 request.entityA(), request.entityB(), traceId);
        return TraceContextUtil.withTraceId(
            relationshipService.create(request)
                .map(snapshot -> ResponseEntity.status(HttpStatus.CREATED).body(snapshot)),
            traceId);
    }

    @GetMapping
    public Flux<RelationshipSnapshot> list(@RequestParam(required = false) String entity) {
        log.info("Relationship list requested. entity={}", entity);
        return relationshipService.list(entity);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<RelationshipSnapshot>> stream() {
        log.info("Relationship SSE client connected");
        return relationshipService.updates()
            .map(snapshot -> ServerSentEvent.<RelationshipSnapshot>builder()
                .event("relationship")
                .id(snapshot.id())
                .data(snapshot)
                .build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @GetMapping("/{a}/{b}")
    public Mono<ResponseEntity<RelationshipSnapshot>> get(@PathVariable String a, @PathVariable String b) {
        return relationshipService.get(a, b).map(ResponseEntity::ok);
    }

    @DeleteMapping("/{a}/{b}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String a, @PathVariable String b) {
        log.info("Delete relationship requested. a={} b={}", a, b);
        return relationshipService.delete(a, b)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PutMapping("/{a}/{b}/stage")
    public Mono<ResponseEntity<RelationshipSnapshot>> setStage(
            @PathVariable String a, @PathVariable String b,
            @RequestBody StageUpdateRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(relationshipService.setStage(a, b, request.stage()).map(ResponseEntity::ok), traceHeader);
    }

    @PostMapping("/{a}/{b}/bonds/{bond}")
    public Mono<ResponseEntity<RelationshipSnapshot>> addBond(
            @PathVariable String a, @PathVariable String b, @PathVariable BondType bond,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(relationshipService.addBond(a, b, bond).map(ResponseEntity::ok), traceHeader);
    }

    @DeleteMapping("/{a}/{b}/bonds/{bond}")
    public Mono<ResponseEntity<RelationshipSnapshot>> removeBond(
            @PathVariable String a, @PathVariable String b, @PathVariable BondType bond,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(relationshipService.removeBond(a, b, bond).map(ResponseEntity::ok), traceHeader);
    }

    @PutMapping("/{a}/{b}/pattern")
    public Mono<ResponseEntity<RelationshipSnapshot>> updatePattern(
            @PathVariable String a, @PathVariable String b,
            @RequestBody PatternUpdateRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(relationshipService.updatePattern(a, b, request).map(ResponseEntity::ok), traceHeader);
    }

    @PostMapping("/{a}/{b}/risk/betrayal")
    public Mono<ResponseEntity<RelationshipSnapshot>> markBetrayal(
            @PathVariable String a, @PathVariable String b,
            @RequestParam String direction,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(Mono.fromCallable(() -> Direction.fromKey(direction))
            .flatMap(dir -> relationshipService.markBetrayal(a, b, dir))
            .map(ResponseEntity::ok), traceHeader);
    }

    @GetMapping("/{a}/{b}/decision")
    public Mono<ResponseEntity<DecisionResponse>> decision(
            @PathVariable String a, @PathVariable String b,
            @RequestParam String direction,
            @RequestParam(defaultValue = "0.5") double propensity,
            @RequestParam(defaultValue = "LOW") StakesLevel stakes,
            @RequestParam(defaultValue = "1.0") double contextMultiplier,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(Mono.fromCallable(() -> Direction.fromKey(direction))
            .flatMap(dir -> relationshipService.decide(a, b, dir, propensity, stakes, contextMultiplier))
            .map(ResponseEntity::ok), traceHeader);
    }

    @GetMapping("/{a}/{b}/predictions")
    public Mono<ResponseEntity<PredictionResponse>> predictions(
            @PathVariable String a, @PathVariable String b,
            @RequestParam String direction,
            @RequestParam(defaultValue = "0.5") double propensity,
            @RequestParam(defaultValue = "0.0") double riskLevel,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return traced(Mono.fromCallable(() -> Direction.fromKey(direction))
            .flatMap(dir -> relationshipService.predict(a, b, dir, propensity, riskLevel))
            .map(ResponseEntity::ok), traceHeader);
    }

    @GetMapping("/{a}/{b}/paths/{path}")
    public Mono<ResponseEntity<PathValueResponse>> getPath(
            @PathVariable String a, @PathVariable String b, @PathVariable String path) {
        return relationshipService.getPath(a, b, path).map(ResponseEntity::ok);
    }

    @PutMapping("/{a}/{b}/paths/{path}")
    public Mono<ResponseEntity<PathValueResponse>> updatePath(
            @PathVariable String a, @PathVariable String b, @PathVariable String path,
            @RequestBody PathUpdateRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        log.info("Path update requested. a={} b={} path={}", a, b, path);
        return traced(relationshipService.updatePath(a, b, path, request).map(ResponseEntity::ok), traceHeader);
    }

    private static <T> Mono<T> traced(Mono<T> mono, String traceHeader) {
        return TraceContextUtil.withTraceId(mono, TraceContextUtil.resolveTraceId(traceHeader));
    }
}
