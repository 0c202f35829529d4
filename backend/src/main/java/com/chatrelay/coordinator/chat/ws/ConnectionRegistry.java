package com.chatrelay.coordinator.chat.ws;

import com.chatrelay.coordinator.common.error.DuplicateBindingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Owns every live {@link ConnectionHandle} and the user → connections index used at dispatch
 * time. Writes for one user are serialized by the per-key {@code compute} of the index; lookups
 * never block.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    public record RegistrationResult(String userId, boolean firstConnection, boolean bound) {
    }

    /**
     * Registry mutations are the only source of presence transitions.
     */
    public interface Listener {

        void onFirstConnection(String userId);

        void onLastConnectionClosed(String userId);

        void onActivity(String userId);
    }

    private final Clock clock;
    private final Map<String, ConnectionHandle> handles = new ConcurrentHashMap<>();
    private final Map<String, Set<ConnectionHandle>> userConnections = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public ConnectionHandle attach(ConnectionTransport transport) {
        var handle = new ConnectionHandle(transport, clock.instant());
        handles.put(handle.id(), handle);
        return handle;
    }

    public Optional<ConnectionHandle> find(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(handles.get(connectionId));
    }

    public RegistrationResult register(ConnectionHandle handle, String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("missing_user_id");
        }

        var outcome = handle.bind(userId);
        if (outcome == ConnectionHandle.BindOutcome.ALREADY_BOUND) {
            throw new DuplicateBindingException(handle.id());
        }
        if (outcome == ConnectionHandle.BindOutcome.CLOSED) {
            return new RegistrationResult(userId, false, false);
        }
        handles.putIfAbsent(handle.id(), handle);

        var first = new boolean[1];
        var added = new boolean[1];
        userConnections.compute(userId, (uid, set) -> {
            if (!handle.isOpen()) return set;
            var next = set == null ? ConcurrentHashMap.<ConnectionHandle>newKeySet() : set;
            first[0] = next.isEmpty();
            added[0] = next.add(handle);
            return next;
        });

        if (!added[0] || !handle.isOpen()) {
            // unregister may have run after bind; do not leave a closed handle behind
            handles.remove(handle.id(), handle);
        }
        if (!added[0]) {
            return new RegistrationResult(userId, false, false);
        }
        handle.touch(clock.instant());
        if (first[0]) {
            log.debug("user_first_connection userId={} connectionId={}", userId, handle.id());
            for (var l : listeners) {
                l.onFirstConnection(userId);
            }
        }
        return new RegistrationResult(userId, first[0], true);
    }

    /**
     * Tears the handle down. Safe to call more than once and for handles that never authenticated.
     */
    public void unregister(ConnectionHandle handle) {
        if (handle == null) return;
        handle.markClosing();
        handles.remove(handle.id(), handle);

        var owner = handle.userId();
        var emptied = new boolean[1];
        if (owner != null) {
            userConnections.computeIfPresent(owner, (uid, set) -> {
                if (!set.remove(handle)) return set;
                if (set.isEmpty()) {
                    emptied[0] = true;
                    return null;
                }
                return set;
            });
        }
        handle.markClosed();

        if (emptied[0]) {
            log.debug("user_last_connection_closed userId={} connectionId={}", owner, handle.id());
            for (var l : listeners) {
                l.onLastConnectionClosed(owner);
            }
        }
    }

    /**
     * Open connections of the user at the time of the call. Handles being torn down are skipped.
     */
    public Set<ConnectionHandle> connectionsFor(String userId) {
        if (userId == null) return Collections.emptySet();
        var set = userConnections.get(userId);
        if (set == null || set.isEmpty()) return Collections.emptySet();
        return set.stream().filter(ConnectionHandle::isOpen).collect(Collectors.toUnmodifiableSet());
    }

    public boolean hasConnections(String userId) {
        if (userId == null) return false;
        var set = userConnections.get(userId);
        return set != null && !set.isEmpty();
    }

    public void touch(ConnectionHandle handle) {
        if (handle == null) return;
        handle.touch(clock.instant());
        var owner = handle.userId();
        if (owner == null) return;
        for (var l : listeners) {
            l.onActivity(owner);
        }
    }

    /**
     * Closes handles that have not authenticated since {@code cutoff}.
     *
     * @return number of handles closed
     */
    public int expireUnauthenticated(Instant cutoff) {
        int closed = 0;
        for (var handle : handles.values()) {
            if (handle.isAuthenticated() || !handle.createdAt().isBefore(cutoff)) continue;
            log.info("ws_auth_timeout connectionId={}", handle.id());
            unregister(handle);
            handle.closeTransport();
            closed++;
        }
        return closed;
    }

    public int connectionCount() {
        return handles.size();
    }
}
