package com.chatrelay.coordinator.chat.api;

import java.util.List;

public record MessagePage(
        List<MessageItem> messages,
        boolean has_more,
        long next_since_seq
) {
}
