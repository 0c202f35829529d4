package com.chatrelay.coordinator.chat.repo;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable storage for messages, memberships and read cursors. Implementations own their retry
 * policy; any {@link RuntimeException} thrown here is treated by callers as a store failure.
 */
public interface ChatStore {

    record MessagePayload(String text, String attachmentRef) {

        public boolean isEmpty() {
            return (text == null || text.isBlank()) && (attachmentRef == null || attachmentRef.isBlank());
        }
    }

    record StoredMessage(
            String conversationId,
            long seq,
            String senderId,
            MessagePayload payload,
            Instant createdAt
    ) {
    }

    /**
     * Appends a message and returns its sequence number: one more than the highest sequence stored
     * for the conversation, starting at 1.
     */
    long appendMessage(String conversationId, String senderId, MessagePayload payload);

    /**
     * Messages with {@code seq > sinceSeq}, ascending, at most {@code limit} of them.
     */
    List<StoredMessage> fetchHistory(String conversationId, long sinceSeq, int limit);

    Optional<StoredMessage> findMessage(String conversationId, long seq);

    Set<String> fetchMembership(String conversationId);

    Set<String> listConversationIds(String userId);

    /**
     * Moves the reader's cursor forward to {@code seq}; a lower value leaves it untouched.
     *
     * @return the cursor after the update
     */
    long updateReadCursor(String conversationId, String userId, long seq);
}
