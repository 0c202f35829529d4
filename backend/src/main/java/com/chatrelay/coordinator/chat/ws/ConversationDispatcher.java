package com.chatrelay.coordinator.chat.ws;

import com.chatrelay.coordinator.chat.api.OutboundEvent;
import com.chatrelay.coordinator.chat.service.RoomManager;
import com.chatrelay.coordinator.common.error.MembershipUnavailableException;
import com.chatrelay.coordinator.common.error.StaleDispatchTargetException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongFunction;

/**
 * Fan-out in acceptance order. Each conversation has a lane: events are appended while the
 * caller still holds whatever ordered them, and drained later by one thread at a time, so every
 * recipient sees a conversation's events in {@code eventSeq} order.
 *
 * <p>Lanes that are drained and idle are dropped by {@link #evictIdleLanes(Instant)}. A new lane
 * starts its {@code eventSeq} from the clock (microseconds), so sequences keep increasing across
 * an eviction.
 */
@Component
public class ConversationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConversationDispatcher.class);

    /**
     * @param recipients          user ids to deliver to; {@code null} means the current members
     * @param excludeActor        skip every connection of the event's actor
     * @param excludeConnectionId skip this one connection (the sender's, which gets an ack instead)
     */
    private record Delivery(OutboundEvent event, Set<String> recipients, boolean excludeActor, String excludeConnectionId) {
    }

    private static final class Lane {
        final Queue<Delivery> queue = new ConcurrentLinkedQueue<>();
        final AtomicBoolean draining = new AtomicBoolean();
        long eventSeq;
        volatile Instant lastUsed;

        Lane(long seed, Instant now) {
            this.eventSeq = seed;
            this.lastUsed = now;
        }
    }

    private final Clock clock;
    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final OutboundEventWriter writer;
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();

    private final Counter deliveredFrames;
    private final Counter staleTargets;

    public ConversationDispatcher(
            Clock clock,
            ConnectionRegistry connectionRegistry,
            RoomManager roomManager,
            OutboundEventWriter writer,
            MeterRegistry meterRegistry
    ) {
        this.clock = clock;
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
        this.writer = writer;
        this.deliveredFrames = Counter.builder("chatrelay.dispatch.frames")
                .description("Frames written to live connections")
                .register(meterRegistry);
        this.staleTargets = Counter.builder("chatrelay.dispatch.stale_targets")
                .description("Writes dropped because the connection closed before send")
                .register(meterRegistry);
    }

    /**
     * Appends an event to the conversation's lane. The factory receives the next event sequence
     * and runs while the lane's map entry is held, so sequence order and queue order agree and
     * the lane cannot be evicted underneath the caller.
     *
     * @return the assigned event sequence
     */
    public long enqueue(
            String conversationId,
            Set<String> recipients,
            boolean excludeActor,
            String excludeConnectionId,
            LongFunction<OutboundEvent> eventFactory
    ) {
        var now = clock.instant();
        var assigned = new long[1];
        lanes.compute(conversationId, (id, existing) -> {
            var lane = existing == null ? new Lane(seedFor(now), now) : existing;
            var seq = ++lane.eventSeq;
            lane.queue.add(new Delivery(eventFactory.apply(seq), recipients, excludeActor, excludeConnectionId));
            lane.lastUsed = now;
            assigned[0] = seq;
            return lane;
        });
        return assigned[0];
    }

    /**
     * Delivers everything queued for the conversation. Returns immediately when another thread
     * is already draining; that thread picks up our events.
     */
    public void drain(String conversationId) {
        var lane = lanes.get(conversationId);
        if (lane == null) return;
        while (!lane.queue.isEmpty()) {
            if (!lane.draining.compareAndSet(false, true)) return;
            try {
                Delivery d;
                while ((d = lane.queue.poll()) != null) {
                    deliver(conversationId, d);
                }
            } finally {
                lane.draining.set(false);
            }
        }
    }

    /**
     * Direct fan-out for events that do not belong to one conversation (presence).
     */
    public void sendToUsers(Set<String> userIds, OutboundEvent event) {
        var frame = writer.write(event);
        for (var userId : userIds) {
            sendToUser(userId, frame, null);
        }
    }

    public void evict(String conversationId) {
        lanes.remove(conversationId);
    }

    /**
     * Drops lanes with nothing queued, nobody draining and no event since {@code idleSince}.
     *
     * @return number of lanes dropped
     */
    public int evictIdleLanes(Instant idleSince) {
        int dropped = 0;
        for (var conversationId : lanes.keySet()) {
            var removed = new boolean[1];
            lanes.computeIfPresent(conversationId, (id, lane) -> {
                if (!lane.queue.isEmpty() || lane.draining.get() || lane.lastUsed.isAfter(idleSince)) {
                    return lane;
                }
                removed[0] = true;
                return null;
            });
            if (removed[0]) dropped++;
        }
        if (dropped > 0) {
            log.debug("dispatch_lanes_evicted count={}", dropped);
        }
        return dropped;
    }

    public int laneCount() {
        return lanes.size();
    }

    private static long seedFor(Instant now) {
        return now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000;
    }

    private void deliver(String conversationId, Delivery d) {
        Set<String> recipients = d.recipients();
        if (recipients == null) {
            try {
                recipients = roomManager.membersOf(conversationId);
            } catch (MembershipUnavailableException ex) {
                log.warn("dispatch_skipped conversationId={} type={} reason=membership_unavailable",
                        conversationId, d.event().type());
                return;
            }
        }

        var frame = writer.write(d.event());
        var actor = d.event().actorId();
        for (var userId : recipients) {
            if (d.excludeActor() && userId.equals(actor)) continue;
            sendToUser(userId, frame, d.excludeConnectionId());
        }
    }

    private void sendToUser(String userId, String frame, String excludeConnectionId) {
        for (var handle : connectionRegistry.connectionsFor(userId)) {
            if (handle.id().equals(excludeConnectionId)) continue;
            try {
                handle.send(frame);
                deliveredFrames.increment();
            } catch (StaleDispatchTargetException ex) {
                staleTargets.increment();
                log.debug("dispatch_stale_target userId={} connectionId={}", userId, handle.id());
            } catch (RuntimeException ex) {
                log.warn("dispatch_failed userId={} connectionId={}", userId, handle.id(), ex);
            }
        }
    }
}
