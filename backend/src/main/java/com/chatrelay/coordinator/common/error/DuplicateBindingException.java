package com.chatrelay.coordinator.common.error;

public class DuplicateBindingException extends ChatException {

    public DuplicateBindingException(String connectionId) {
        super("duplicate_binding", "connection " + connectionId + " is already bound");
    }
}
