package com.chatrelay.coordinator.chat.api;

import com.chatrelay.coordinator.chat.repo.ChatStore;

public record MessageItem(
        long seq,
        String sender_id,
        String text,
        String attachment_ref,
        long created_at
) {
    public static MessageItem from(ChatStore.StoredMessage m) {
        return new MessageItem(
                m.seq(),
                m.senderId(),
                m.payload().text(),
                m.payload().attachmentRef(),
                m.createdAt().getEpochSecond()
        );
    }
}
