package com.trustplatform.relationship.job;

import com.trustplatform.core.trace.TraceContextUtil;
import com.trustplatform.relationship.service.RelationshipService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Periodic decay driver.
 *
 * <p>Every {@code trust.decay.tick-interval} of wall-clock time it applies
 * {@code trust.decay.elapsed-per-tick} of simulated time to every relationship.
 * Ticks run one after another ({@code concatMap}), so decay is applied in
 * increasing time order. A failed tick is logged and the loop continues.
 */
@Component
public class DecayTickScheduler {

    private static final Logger log = LoggerFactory.getLogger(DecayTickScheduler.class);

    private final RelationshipService relationshipService;

    @Value("${trust.decay.enabled:false}")
    private boolean enabled;

    @Value("${trust.decay.tick-interval:PT1M}")
    private Duration tickInterval;

    @Value("${trust.decay.elapsed-per-tick:PT1H}")
    private Duration elapsedPerTick;

    private Disposable subscription;

    public DecayTickScheduler(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Decay scheduler disabled. Set trust.decay.enabled=true to enable");
            return;
        }
        log.info("Decay scheduler started. tickIntervalSeconds={} elapsedPerTickSeconds={}",
                 tickInterval.toSeconds(), elapsedPerTick.toSeconds());

        subscription = Flux.interval(tickInterval)
            .concatMap(n -> {
                String traceId = UUID.randomUUID().toString();
                return TraceContextUtil.withTraceId(relationshipService.tick(elapsedPerTick), traceId)
                    .doOnError(e -> log.error("Decay tick failed. tick={} traceId={}", n, traceId, e))
                    .onErrorResume(e -> Mono.empty());
            })
            .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("Decay scheduler stopped");
        }
    }

    boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }
}
