package com.chatrelay.coordinator.chat.ws;

import java.io.IOException;

/**
 * The wire underneath a {@link ConnectionHandle}. Implementations must tolerate concurrent
 * {@link #send(String)} calls.
 */
public interface ConnectionTransport {

    String id();

    boolean isOpen();

    void send(String frame) throws IOException;

    void close();
}
