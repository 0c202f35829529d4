package com.chatrelay.coordinator.chat.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Who is typing where, with an expiry deadline per entry. Transition callbacks run while the
 * entry is held, so a start and its stop (explicit or expired) are observed in that order and a
 * stop fires at most once per start. Not durable.
 */
@Component
public class TypingStateTable {

    public record TypingKey(String conversationId, String userId) {
    }

    private final Map<TypingKey, Instant> deadlines = new ConcurrentHashMap<>();

    /**
     * Starts or refreshes typing. {@code onStarted} runs only when the user was not already typing.
     */
    public boolean start(String conversationId, String userId, Instant deadline, Runnable onStarted) {
        var started = new boolean[1];
        deadlines.compute(new TypingKey(conversationId, userId), (k, old) -> {
            if (old == null) {
                started[0] = true;
                onStarted.run();
            }
            return deadline;
        });
        return started[0];
    }

    public boolean stop(String conversationId, String userId, Runnable onStopped) {
        var stopped = new boolean[1];
        deadlines.computeIfPresent(new TypingKey(conversationId, userId), (k, old) -> {
            stopped[0] = true;
            onStopped.run();
            return null;
        });
        return stopped[0];
    }

    /**
     * Removes every entry whose deadline is at or before {@code now}.
     *
     * @return keys that expired on this call
     */
    public List<TypingKey> expire(Instant now, Consumer<TypingKey> onExpired) {
        var expired = new ArrayList<TypingKey>();
        for (var key : deadlines.keySet()) {
            deadlines.computeIfPresent(key, (k, deadline) -> {
                if (deadline.isAfter(now)) return deadline;
                expired.add(k);
                onExpired.accept(k);
                return null;
            });
        }
        return expired;
    }

    public boolean isTyping(String conversationId, String userId) {
        return deadlines.containsKey(new TypingKey(conversationId, userId));
    }

    public void evictConversation(String conversationId) {
        deadlines.keySet().removeIf(k -> k.conversationId().equals(conversationId));
    }

    public int size() {
        return deadlines.size();
    }
}
