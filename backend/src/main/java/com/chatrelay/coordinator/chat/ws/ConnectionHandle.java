package com.chatrelay.coordinator.chat.ws;

import com.chatrelay.coordinator.common.error.StaleDispatchTargetException;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live transport connection. Created on connect, bound to a user once on authentication,
 * and torn down by {@link ConnectionRegistry#unregister(ConnectionHandle)}.
 */
public final class ConnectionHandle {

    public enum State { OPEN, CLOSING, CLOSED }

    enum BindOutcome { BOUND, ALREADY_BOUND, CLOSED }

    private final ConnectionTransport transport;
    private final Instant createdAt;
    private final AtomicReference<String> userId = new AtomicReference<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private volatile Instant lastActivityAt;

    public ConnectionHandle(ConnectionTransport transport, Instant createdAt) {
        this.transport = transport;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public String id() {
        return transport.id();
    }

    public String userId() {
        return userId.get();
    }

    public boolean isAuthenticated() {
        return userId.get() != null;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivityAt() {
        return lastActivityAt;
    }

    public State state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == State.OPEN && transport.isOpen();
    }

    /**
     * Sends one frame. A handle that is closing or closed drops the frame silently.
     *
     * @throws StaleDispatchTargetException when the transport fails mid-write
     */
    public void send(String frame) {
        if (!isOpen()) return;
        try {
            transport.send(frame);
        } catch (IOException | RuntimeException ex) {
            throw new StaleDispatchTargetException(id(), ex);
        }
    }

    void touch(Instant now) {
        lastActivityAt = now;
    }

    BindOutcome bind(String owner) {
        if (state.get() != State.OPEN) return BindOutcome.CLOSED;
        if (!userId.compareAndSet(null, owner)) return BindOutcome.ALREADY_BOUND;
        // unregister() marks CLOSING before reading the owner; re-check so neither side misses the other
        return state.get() == State.OPEN ? BindOutcome.BOUND : BindOutcome.CLOSED;
    }

    boolean markClosing() {
        return state.compareAndSet(State.OPEN, State.CLOSING);
    }

    void markClosed() {
        state.set(State.CLOSED);
    }

    void closeTransport() {
        transport.close();
    }
}
