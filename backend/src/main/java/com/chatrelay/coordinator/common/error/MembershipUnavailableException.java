package com.chatrelay.coordinator.common.error;

public class MembershipUnavailableException extends ChatException {

    public MembershipUnavailableException(String conversationId, Throwable cause) {
        super("membership_unavailable", "membership of " + conversationId + " unavailable", cause);
    }
}
