package com.chatrelay.coordinator.common.error;

/**
 * Base type for coordinator failures that are reported to the originating connection.
 * The code is sent verbatim in the {@code error} frame.
 */
public abstract class ChatException extends RuntimeException {

    private final String code;

    protected ChatException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected ChatException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
