package com.trustplatform.relationship.controller;

import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.relationship.dto.DecayTickResponse;
import com.trustplatform.relationship.service.RelationshipService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/decay")
public class DecayController {

    private final RelationshipService relationshipService;

    public DecayController(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    /** Applies {@code elapsedHours} of simulated time to every relationship. */
    @PostMapping("/tick")
    public Mono<ResponseEntity<DecayTickResponse>> tick(
            @RequestParam(defaultValue = "1") long elapsedHours,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        return TraceContextUtil.withTraceId(
            relationshipService.tick(Duration.ofHours(elapsedHours)).map(ResponseEntity::ok),
            TraceContextUtil.resolveTraceId(traceHeader));
    }
}
