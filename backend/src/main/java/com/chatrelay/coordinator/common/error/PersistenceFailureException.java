package com.chatrelay.coordinator.common.error;

public class PersistenceFailureException extends ChatException {

    public PersistenceFailureException(String conversationId, Throwable cause) {
        super("persistence_failure", "store write failed for " + conversationId, cause);
    }
}
