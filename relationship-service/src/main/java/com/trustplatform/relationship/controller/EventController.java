package com.trustplatform.relationship.controller;

import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.relationship.dto.EventIngestResponse;
import com.trustplatform.relationship.dto.EventRequest;
import com.trustplatform.relationship.service.RelationshipService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private final RelationshipService relationshipService;

    public EventController(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    @PostMapping
    public Mono<ResponseEntity<EventIngestResponse>> ingest(
            @RequestBody EventRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        log.info("Event received. type={} source={} target={} traceId={}",
                 request.getType(), request.getSource(), request.getTarget(), traceId);
        return TraceContextUtil.withTraceId(
            relationshipService.ingest(request)
                .map(ResponseEntity::ok)
                .doOnError(e -> log.error("Event ingestion failed. traceId={}", traceId, e)),
            traceId);
    }
}
