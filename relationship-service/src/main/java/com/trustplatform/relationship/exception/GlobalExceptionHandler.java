package com.trustplatform.relationship.exception;

import com.trustplatform.core.exception.SelfRelationshipException;
import com.trustplatform.core.exception.StageTransitionException;
import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.relationship.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to {@link ErrorResponse} bodies.
 *
 * <pre>
 *   RelationshipNotFoundException        → 404
 *   RelationshipAlreadyExistsException   → 409
 *   SelfRelationshipException            → 400
 *   StageTransitionException             → 409
 *   IllegalArgumentException, bad input  → 400
 *   other ResponseStatusException        → its own status
 *   anything else                        → 500
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RelationshipNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(RelationshipNotFoundException e, ServerWebExchange exchange) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e, exchange);
    }

    @ExceptionHandler(RelationshipAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> conflict(RelationshipAlreadyExistsException e, ServerWebExchange exchange) {
        return respond(HttpStatus.CONFLICT, "ALREADY_EXISTS", e, exchange);
    }

    @ExceptionHandler(StageTransitionException.class)
    public ResponseEntity<ErrorResponse> stageTransition(StageTransitionException e, ServerWebExchange exchange) {
        return respond(HttpStatus.CONFLICT, "INVALID_STAGE_TRANSITION", e, exchange);
    }

    @ExceptionHandler(SelfRelationshipException.class)
    public ResponseEntity<ErrorResponse> selfRelationship(SelfRelationshipException e, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, "SELF_RELATIONSHIP", e, exchange);
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class, DecodingException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> status(ResponseStatusException e, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("Request rejected. status={} reason={} traceId={}",
                     e.getStatusCode().value(), e.getReason(), traceId));
        return ResponseEntity.status(e.getStatusCode())
            .body(new ErrorResponse(String.valueOf(e.getStatusCode().value()), e.getReason(), traceId));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        TraceContextUtil.withMdc(traceId, () ->
            log.error("Unhandled error. path={} traceId={}", exchange.getRequest().getPath(), traceId, e));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "Unexpected error", traceId));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, Exception e,
                                                  ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("Request rejected. status={} error={} message={} traceId={}",
                     status.value(), error, e.getMessage(), traceId));
        return ResponseEntity.status(status).body(new ErrorResponse(error, e.getMessage(), traceId));
    }

    private static String traceId(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_ID_HEADER);
        return header != null && !header.isBlank() ? header : TraceContextUtil.UNKNOWN;
    }
}
