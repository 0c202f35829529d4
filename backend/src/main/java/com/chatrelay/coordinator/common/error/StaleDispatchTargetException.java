package com.chatrelay.coordinator.common.error;

/**
 * The connection went away between recipient resolution and the write. Never surfaced to clients.
 */
public class StaleDispatchTargetException extends ChatException {

    public StaleDispatchTargetException(String connectionId, Throwable cause) {
        super("stale_dispatch_target", "connection " + connectionId + " closed before send", cause);
    }
}
