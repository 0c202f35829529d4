package com.chatrelay.coordinator.chat.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per conversation, created on demand and dropped when the last holder leaves, so idle
 * conversations cost nothing and busy ones never contend with each other.
 */
@Component
public class ConversationLocks {

    private static final class RefCountedLock {
        final ReentrantLock lock = new ReentrantLock();
        int holders;
    }

    private final Map<String, RefCountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String conversationId, Supplier<T> action) {
        var ref = locks.compute(conversationId, (id, existing) -> {
            var next = existing == null ? new RefCountedLock() : existing;
            next.holders++;
            return next;
        });

        ref.lock.lock();
        try {
            return action.get();
        } finally {
            ref.lock.unlock();
            locks.computeIfPresent(conversationId, (id, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    int activeLocks() {
        return locks.size();
    }
}
