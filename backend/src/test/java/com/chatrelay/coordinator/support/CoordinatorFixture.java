package com.chatrelay.coordinator.support;

import com.chatrelay.coordinator.chat.service.ConversationLocks;
import com.chatrelay.coordinator.chat.service.EventRouter;
import com.chatrelay.coordinator.chat.service.PresenceTracker;
import com.chatrelay.coordinator.chat.service.RoomManager;
import com.chatrelay.coordinator.chat.service.TypingStateTable;
import com.chatrelay.coordinator.chat.ws.ConnectionHandle;
import com.chatrelay.coordinator.chat.ws.ConnectionRegistry;
import com.chatrelay.coordinator.chat.ws.ConversationDispatcher;
import com.chatrelay.coordinator.chat.ws.OutboundEventWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;

/**
 * The coordinator wired by hand around an in-memory store and a controllable clock.
 */
public class CoordinatorFixture {

    public static final Duration OFFLINE_GRACE = Duration.ofSeconds(5);
    public static final Duration AWAY_AFTER = Duration.ofMinutes(5);
    public static final Duration TYPING_TIMEOUT = Duration.ofSeconds(6);
    public static final Duration MEMBERSHIP_TTL = Duration.ofSeconds(30);
    public static final Duration ROOM_IDLE = Duration.ofMinutes(10);
    public static final Duration OFFLINE_RETENTION = Duration.ofHours(24);

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final InMemoryChatStore store = new InMemoryChatStore();
    public final ConnectionRegistry registry = new ConnectionRegistry(clock);
    public final RoomManager roomManager = new RoomManager(store, clock, MEMBERSHIP_TTL, 50_000, ROOM_IDLE);
    public final TypingStateTable typingState = new TypingStateTable();
    public final ConversationLocks locks = new ConversationLocks();
    public final OutboundEventWriter writer = new OutboundEventWriter(objectMapper);
    public final ConversationDispatcher dispatcher = new ConversationDispatcher(clock, registry, roomManager, writer, meters);
    public final PresenceTracker presence = new PresenceTracker(
            registry, clock, meters, OFFLINE_GRACE, AWAY_AFTER, OFFLINE_RETENTION);
    public final EventRouter router = new EventRouter(
            roomManager, store, locks, dispatcher, typingState, presence, clock, meters, TYPING_TIMEOUT, 200);

    public RecordingTransport transport(String id) {
        return new RecordingTransport(id);
    }

    /**
     * Opens and authenticates a connection for the user.
     */
    public ConnectionHandle connect(String userId, RecordingTransport transport) {
        var handle = registry.attach(transport);
        registry.register(handle, userId);
        return handle;
    }

    public ConnectionHandle connect(String userId, String connectionId) {
        return connect(userId, transport(connectionId));
    }
}
