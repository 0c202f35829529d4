package com.chatrelay.coordinator.chat.service;

import com.chatrelay.coordinator.chat.ws.ConnectionRegistry;
import com.chatrelay.coordinator.chat.ws.ConversationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Drives every timed transition from one fixed-delay sweep: typing expiry, presence
 * away/offline, the authentication timeout of fresh connections, and idle dispatch lanes. All
 * timers are deadlines, so a late or skipped run is caught up by the next one.
 */
@Component
@ConditionalOnProperty(name = "app.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class CoordinatorSweeper {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorSweeper.class);

    private final EventRouter eventRouter;
    private final PresenceTracker presenceTracker;
    private final ConnectionRegistry connectionRegistry;
    private final ConversationDispatcher dispatcher;
    private final Clock clock;
    private final Duration authTimeout;
    private final Duration laneIdle;

    public CoordinatorSweeper(
            EventRouter eventRouter,
            PresenceTracker presenceTracker,
            ConnectionRegistry connectionRegistry,
            ConversationDispatcher dispatcher,
            Clock clock,
            @Value("${app.ws.auth-timeout:PT10S}") Duration authTimeout,
            @Value("${app.dispatch.lane-idle:PT1M}") Duration laneIdle
    ) {
        this.eventRouter = eventRouter;
        this.presenceTracker = presenceTracker;
        this.connectionRegistry = connectionRegistry;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.authTimeout = authTimeout;
        this.laneIdle = laneIdle;
    }

    @Scheduled(fixedDelayString = "${app.sweep.interval-ms:250}")
    public void sweep() {
        var now = clock.instant();

        try {
            eventRouter.expireTyping(now);
        } catch (Exception e) {
            log.warn("typing_sweep_failed", e);
        }

        try {
            presenceTracker.sweep(now);
        } catch (Exception e) {
            log.warn("presence_sweep_failed", e);
        }

        try {
            connectionRegistry.expireUnauthenticated(now.minus(authTimeout));
        } catch (Exception e) {
            log.warn("auth_timeout_sweep_failed", e);
        }

        try {
            dispatcher.evictIdleLanes(now.minus(laneIdle));
        } catch (Exception e) {
            log.warn("lane_sweep_failed", e);
        }
    }
}
