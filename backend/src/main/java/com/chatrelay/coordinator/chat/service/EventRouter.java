package com.chatrelay.coordinator.chat.service;

import com.chatrelay.coordinator.chat.api.MessageItem;
import com.chatrelay.coordinator.chat.api.MessagePage;
import com.chatrelay.coordinator.chat.api.OutboundEvent;
import com.chatrelay.coordinator.chat.api.PresenceState;
import com.chatrelay.coordinator.chat.repo.ChatStore;
import com.chatrelay.coordinator.chat.ws.ConnectionHandle;
import com.chatrelay.coordinator.chat.ws.ConversationDispatcher;
import com.chatrelay.coordinator.common.error.MembershipUnavailableException;
import com.chatrelay.coordinator.common.error.MessageNotFoundException;
import com.chatrelay.coordinator.common.error.NotAMemberException;
import com.chatrelay.coordinator.common.error.PersistenceFailureException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for every client event. Validates membership through {@link RoomManager}, records
 * durable effects in the {@link ChatStore} and hands outbound events to the
 * {@link ConversationDispatcher}.
 *
 * <p>Messages of one conversation are accepted one at a time: sequence assignment, the store
 * append and queueing of the delivery happen under that conversation's lock. Delivery itself runs
 * after the lock is released. Typing and read events never take the lock; they are ordered by the
 * dispatcher lane alone.
 */
@Service
public class EventRouter implements PresenceTracker.Listener {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    public record SendResult(String conversationId, long seq, long eventSeq, Instant acceptedAt) {
    }

    private final RoomManager roomManager;
    private final ChatStore store;
    private final ConversationLocks conversationLocks;
    private final ConversationDispatcher dispatcher;
    private final TypingStateTable typingState;
    private final Clock clock;
    private final Duration typingTimeout;
    private final int maxHistoryPageSize;

    private final Counter messagesAccepted;
    private final Counter persistenceFailures;
    private final Counter membershipRejections;
    private final Counter typingExpired;

    public EventRouter(
            RoomManager roomManager,
            ChatStore store,
            ConversationLocks conversationLocks,
            ConversationDispatcher dispatcher,
            TypingStateTable typingState,
            PresenceTracker presenceTracker,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${app.typing.timeout:PT6S}") Duration typingTimeout,
            @Value("${app.history.max-page-size:200}") int maxHistoryPageSize
    ) {
        this.roomManager = roomManager;
        this.store = store;
        this.conversationLocks = conversationLocks;
        this.dispatcher = dispatcher;
        this.typingState = typingState;
        this.clock = clock;
        this.typingTimeout = typingTimeout;
        this.maxHistoryPageSize = Math.max(1, Math.min(maxHistoryPageSize, 1000));

        // Low-cardinality metrics: never tag by conversation or user.
        this.messagesAccepted = Counter.builder("chatrelay.router.messages_accepted")
                .description("Messages durably recorded and queued for fan-out")
                .register(meterRegistry);
        this.persistenceFailures = Counter.builder("chatrelay.router.persistence_failures")
                .description("Store writes that failed and were reported to the sender")
                .register(meterRegistry);
        this.membershipRejections = Counter.builder("chatrelay.router.not_a_member")
                .description("Events rejected because the actor is not a member")
                .register(meterRegistry);
        this.typingExpired = Counter.builder("chatrelay.router.typing_expired")
                .description("Typing indicators cleared by timeout")
                .register(meterRegistry);

        presenceTracker.addListener(this);
    }

    public SendResult sendMessage(ConnectionHandle origin, String conversationId, ChatStore.MessagePayload payload) {
        var senderId = requireUser(origin);
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("empty_message");
        }
        var members = requireMember(conversationId, senderId);

        var accepted = conversationLocks.withLock(conversationId, () -> {
            final long seq;
            try {
                seq = store.appendMessage(conversationId, senderId, payload);
            } catch (RuntimeException ex) {
                persistenceFailures.increment();
                log.warn("message_append_failed conversationId={} senderId={}", conversationId, senderId, ex);
                throw new PersistenceFailureException(conversationId, ex);
            }
            var at = clock.instant();
            var eventSeq = dispatcher.enqueue(conversationId, members, false, origin.id(),
                    es -> new OutboundEvent.MessageDelivered(
                            conversationId, senderId, seq, es, payload.text(), payload.attachmentRef(), at));
            return new SendResult(conversationId, seq, eventSeq, at);
        });
        messagesAccepted.increment();

        // A sent message ends the sender's typing indicator.
        typingState.stop(conversationId, senderId, () -> enqueueTypingStopped(conversationId, senderId, false));

        dispatcher.drain(conversationId);
        return accepted;
    }

    public void startTyping(ConnectionHandle origin, String conversationId) {
        var userId = requireUser(origin);
        requireMember(conversationId, userId);

        var deadline = clock.instant().plus(typingTimeout);
        typingState.start(conversationId, userId, deadline, () -> {
            var at = clock.instant();
            dispatcher.enqueue(conversationId, null, true, null,
                    es -> new OutboundEvent.TypingStarted(conversationId, userId, es, at));
        });
        dispatcher.drain(conversationId);
    }

    public void stopTyping(ConnectionHandle origin, String conversationId) {
        var userId = requireUser(origin);
        requireMember(conversationId, userId);

        typingState.stop(conversationId, userId, () -> enqueueTypingStopped(conversationId, userId, false));
        dispatcher.drain(conversationId);
    }

    /**
     * @return the reader's cursor after the update
     */
    public long markRead(ConnectionHandle origin, String conversationId, long upToSeq) {
        var readerId = requireUser(origin);
        if (upToSeq < 1) {
            throw new IllegalArgumentException("invalid_seq");
        }
        requireMember(conversationId, readerId);

        final ChatStore.StoredMessage message;
        final long cursor;
        try {
            message = store.findMessage(conversationId, upToSeq)
                    .orElseThrow(() -> new MessageNotFoundException(conversationId, upToSeq));
            cursor = store.updateReadCursor(conversationId, readerId, upToSeq);
        } catch (MessageNotFoundException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            persistenceFailures.increment();
            log.warn("read_cursor_update_failed conversationId={} userId={}", conversationId, readerId, ex);
            throw new PersistenceFailureException(conversationId, ex);
        }

        var senderId = message.senderId();
        if (cursor == upToSeq && !senderId.equals(readerId) && roomManager.isMember(conversationId, senderId)) {
            var at = clock.instant();
            dispatcher.enqueue(conversationId, Set.of(senderId), false, null,
                    es -> new OutboundEvent.MessageRead(conversationId, readerId, upToSeq, es, at));
            dispatcher.drain(conversationId);
        }
        return cursor;
    }

    /**
     * Messages after {@code sinceSeq} in sequence order, one page at a time.
     */
    public MessagePage fetchHistory(String userId, String conversationId, long sinceSeq, int pageSize) {
        requireMember(conversationId, userId);
        var effectiveSince = Math.max(0, sinceSeq);
        var effectivePageSize = Math.max(1, Math.min(pageSize, maxHistoryPageSize));

        List<ChatStore.StoredMessage> rows;
        try {
            rows = store.fetchHistory(conversationId, effectiveSince, effectivePageSize + 1);
        } catch (RuntimeException ex) {
            log.warn("history_fetch_failed conversationId={} sinceSeq={}", conversationId, sinceSeq, ex);
            throw new PersistenceFailureException(conversationId, ex);
        }

        var hasMore = rows.size() > effectivePageSize;
        if (hasMore) {
            rows = rows.subList(0, effectivePageSize);
        }
        var items = rows.stream().map(MessageItem::from).toList();
        var nextSince = items.isEmpty() ? effectiveSince : items.get(items.size() - 1).seq();
        return new MessagePage(items, hasMore, nextSince);
    }

    /**
     * Clears typing indicators whose deadline has passed, telling the other members.
     */
    public int expireTyping(Instant now) {
        var affected = new LinkedHashSet<String>();
        var expired = typingState.expire(now, key -> {
            enqueueTypingStopped(key.conversationId(), key.userId(), true);
            affected.add(key.conversationId());
        });
        affected.forEach(dispatcher::drain);
        if (!expired.isEmpty()) {
            typingExpired.increment(expired.size());
        }
        return expired.size();
    }

    /**
     * Tells everyone who shares a conversation with the user. Recipients are resolved now rather
     * than tracked as a separate subscription graph.
     */
    @Override
    public void onPresenceChanged(String userId, PresenceState state, Instant lastSeen) {
        var audience = new HashSet<String>();
        for (var conversationId : roomManager.conversationsOf(userId)) {
            try {
                audience.addAll(roomManager.membersOf(conversationId));
            } catch (MembershipUnavailableException ex) {
                log.debug("presence_audience_partial userId={} conversationId={}", userId, conversationId);
            }
        }
        audience.remove(userId);
        if (audience.isEmpty()) return;
        dispatcher.sendToUsers(audience, new OutboundEvent.PresenceChanged(userId, state, lastSeen, clock.instant()));
    }

    /**
     * Room teardown requested by the conversation owner: drops cached membership, typing state
     * and the dispatch lane.
     */
    public void teardownConversation(String conversationId) {
        typingState.evictConversation(conversationId);
        dispatcher.evict(conversationId);
        roomManager.evict(conversationId);
        log.info("conversation_torn_down conversationId={}", conversationId);
    }

    private void enqueueTypingStopped(String conversationId, String userId, boolean expired) {
        var at = clock.instant();
        dispatcher.enqueue(conversationId, null, true, null,
                es -> new OutboundEvent.TypingStopped(conversationId, userId, es, expired, at));
    }

    private Set<String> requireMember(String conversationId, String userId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("missing_conversation_id");
        }
        var members = roomManager.membersOf(conversationId);
        if (!members.contains(userId)) {
            membershipRejections.increment();
            throw new NotAMemberException(conversationId, userId);
        }
        return members;
    }

    private static String requireUser(ConnectionHandle origin) {
        if (origin == null || origin.userId() == null) {
            throw new IllegalArgumentException("unauthorized");
        }
        return origin.userId();
    }
}
