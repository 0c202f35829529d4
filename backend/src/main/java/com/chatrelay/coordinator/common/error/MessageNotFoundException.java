package com.chatrelay.coordinator.common.error;

public class MessageNotFoundException extends ChatException {

    public MessageNotFoundException(String conversationId, long seq) {
        super("message_not_found", "no message " + seq + " in " + conversationId);
    }
}
