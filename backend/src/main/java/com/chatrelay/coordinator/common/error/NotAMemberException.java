package com.chatrelay.coordinator.common.error;

public class NotAMemberException extends ChatException {

    public NotAMemberException(String conversationId, String userId) {
        super("not_a_member", "user " + userId + " is not a member of " + conversationId);
    }
}
