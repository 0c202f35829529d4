package com.chatrelay.coordinator.chat.api;

import java.time.Instant;

/**
 * Events fanned out to live connections. Conversation events carry the conversation-local
 * {@code eventSeq} assigned when the router accepted them; it orders every event of one
 * conversation, durable or not.
 */
public sealed interface OutboundEvent {

    String type();

    String actorId();

    Instant at();

    record MessageDelivered(
            String conversationId,
            String actorId,
            long seq,
            long eventSeq,
            String text,
            String attachmentRef,
            Instant at
    ) implements OutboundEvent {
        @Override
        public String type() {
            return "message_delivered";
        }
    }

    record TypingStarted(String conversationId, String actorId, long eventSeq, Instant at) implements OutboundEvent {
        @Override
        public String type() {
            return "typing_started";
        }
    }

    /**
     * @param expired true when synthesized by the typing timeout rather than sent by the client
     */
    record TypingStopped(
            String conversationId,
            String actorId,
            long eventSeq,
            boolean expired,
            Instant at
    ) implements OutboundEvent {
        @Override
        public String type() {
            return "typing_stopped";
        }
    }

    record MessageRead(
            String conversationId,
            String actorId,
            long upToSeq,
            long eventSeq,
            Instant at
    ) implements OutboundEvent {
        @Override
        public String type() {
            return "message_read";
        }
    }

    record PresenceChanged(String actorId, PresenceState status, Instant lastSeen, Instant at) implements OutboundEvent {
        @Override
        public String type() {
            return "presence_changed";
        }
    }
}
