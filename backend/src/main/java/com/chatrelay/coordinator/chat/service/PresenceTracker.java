package com.chatrelay.coordinator.chat.service;

import com.chatrelay.coordinator.chat.api.PresenceState;
import com.chatrelay.coordinator.chat.ws.ConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Online/away/offline per user, driven by {@link ConnectionRegistry} callbacks and the periodic
 * {@link #sweep(Instant)}. Going offline is debounced: the last disconnect only arms a deadline,
 * and a reconnect before it passes cancels it without any event.
 *
 * <p>Transitions are queued on a per-user lane while the user's entry is held and delivered by
 * one drainer at a time, so listeners see a user's transitions in the order they were committed.
 * Offline entries are forgotten once {@code app.presence.offline-retention} has passed.
 */
@Service
public class PresenceTracker implements ConnectionRegistry.Listener {

    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    public interface Listener {
        void onPresenceChanged(String userId, PresenceState state, Instant lastSeen);
    }

    public record Presence(PresenceState state, Instant lastSeen) {
    }

    private record Entry(PresenceState state, Instant lastSeen, Instant lastActivity, Instant offlineDeadline) {

        Entry with(PresenceState next, Instant now) {
            return new Entry(next, now, lastActivity, null);
        }
    }

    private record Transition(String userId, PresenceState state, Instant lastSeen) {
    }

    private static final class Lane {
        final Queue<Transition> queue = new ConcurrentLinkedQueue<>();
        final AtomicBoolean draining = new AtomicBoolean();

        boolean idle() {
            return queue.isEmpty() && !draining.get();
        }
    }

    private final ConnectionRegistry connectionRegistry;
    private final Clock clock;
    private final Duration offlineGrace;
    private final Duration awayAfter;
    private final Duration offlineRetention;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Counter transitions;

    public PresenceTracker(
            ConnectionRegistry connectionRegistry,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.presence.offline-grace:PT5S}") Duration offlineGrace,
            @Value("${app.presence.away-after:PT5M}") Duration awayAfter,
            @Value("${app.presence.offline-retention:PT24H}") Duration offlineRetention
    ) {
        this.connectionRegistry = connectionRegistry;
        this.clock = clock;
        this.offlineGrace = offlineGrace;
        this.awayAfter = awayAfter;
        this.offlineRetention = offlineRetention;
        this.transitions = Counter.builder("chatrelay.presence.transitions")
                .description("Presence state changes emitted")
                .register(meterRegistry);
        connectionRegistry.addListener(this);
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public Presence stateOf(String userId) {
        var e = entries.get(userId);
        if (e == null) return new Presence(PresenceState.OFFLINE, null);
        return new Presence(e.state(), e.lastSeen());
    }

    @Override
    public void onFirstConnection(String userId) {
        var now = clock.instant();
        entries.compute(userId, (uid, e) -> {
            if (e == null) {
                enqueue(new Transition(uid, PresenceState.ONLINE, now));
                return new Entry(PresenceState.ONLINE, now, now, null);
            }
            var touched = new Entry(e.state(), e.lastSeen(), now, null);
            if (e.state() == PresenceState.ONLINE) return touched;
            enqueue(new Transition(uid, PresenceState.ONLINE, now));
            return touched.with(PresenceState.ONLINE, now);
        });
        drain(userId);
    }

    @Override
    public void onLastConnectionClosed(String userId) {
        var deadline = clock.instant().plus(offlineGrace);
        entries.computeIfPresent(userId, (uid, e) -> {
            if (e.state() == PresenceState.OFFLINE) return e;
            return new Entry(e.state(), e.lastSeen(), e.lastActivity(), deadline);
        });
    }

    @Override
    public void onActivity(String userId) {
        var now = clock.instant();
        entries.computeIfPresent(userId, (uid, e) -> {
            if (e.state() == PresenceState.OFFLINE) return e;
            var touched = new Entry(e.state(), e.lastSeen(), now, e.offlineDeadline());
            if (e.state() != PresenceState.AWAY) return touched;
            enqueue(new Transition(uid, PresenceState.ONLINE, now));
            return new Entry(PresenceState.ONLINE, now, now, e.offlineDeadline());
        });
        drain(userId);
    }

    /**
     * Commits due offline transitions and marks idle users away. Deadlines that were missed (a
     * late sweep) are applied on the next call; the registry is re-checked so a reconnect always
     * wins over a pending offline.
     */
    public void sweep(Instant now) {
        var forgetBefore = now.minus(offlineRetention);
        for (var userId : entries.keySet()) {
            entries.computeIfPresent(userId, (uid, e) -> {
                if (e.state() == PresenceState.OFFLINE) {
                    if (e.lastSeen().isAfter(forgetBefore)) return e;
                    var lane = lanes.get(uid);
                    if (lane != null && !lane.idle()) return e;
                    lanes.remove(uid);
                    return null;
                }
                var connected = connectionRegistry.hasConnections(uid);

                if (e.offlineDeadline() != null) {
                    if (connected) {
                        return new Entry(e.state(), e.lastSeen(), e.lastActivity(), null);
                    }
                    if (!now.isBefore(e.offlineDeadline())) {
                        enqueue(new Transition(uid, PresenceState.OFFLINE, now));
                        return e.with(PresenceState.OFFLINE, now);
                    }
                    return e;
                }

                if (!connected) {
                    // Lost a disconnect callback; start the debounce now.
                    return new Entry(e.state(), e.lastSeen(), e.lastActivity(), now.plus(offlineGrace));
                }
                if (e.state() == PresenceState.ONLINE && !now.isBefore(e.lastActivity().plus(awayAfter))) {
                    enqueue(new Transition(uid, PresenceState.AWAY, now));
                    return e.with(PresenceState.AWAY, now);
                }
                return e;
            });
            drain(userId);
        }
    }

    int trackedUsers() {
        return entries.size();
    }

    /**
     * Called while the user's entry is held, so lane order is commit order.
     */
    private void enqueue(Transition t) {
        lanes.computeIfAbsent(t.userId(), k -> new Lane()).queue.add(t);
    }

    private void drain(String userId) {
        var lane = lanes.get(userId);
        if (lane == null) return;
        while (!lane.queue.isEmpty()) {
            if (!lane.draining.compareAndSet(false, true)) return;
            try {
                Transition t;
                while ((t = lane.queue.poll()) != null) {
                    emit(t);
                }
            } finally {
                lane.draining.set(false);
            }
        }
    }

    private void emit(Transition t) {
        transitions.increment();
        log.debug("presence_changed userId={} state={}", t.userId(), t.state());
        for (var l : listeners) {
            try {
                l.onPresenceChanged(t.userId(), t.state(), t.lastSeen());
            } catch (RuntimeException ex) {
                log.warn("presence_listener_failed userId={} state={}", t.userId(), t.state(), ex);
            }
        }
    }
}
