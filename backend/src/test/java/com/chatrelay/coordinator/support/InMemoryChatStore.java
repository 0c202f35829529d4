package com.chatrelay.coordinator.support;

import com.chatrelay.coordinator.chat.repo.ChatStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryChatStore implements ChatStore {

    private final Map<String, List<StoredMessage>> messages = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();
    private final Map<String, Long> cursors = new ConcurrentHashMap<>();
    private final AtomicInteger membershipFetches = new AtomicInteger();

    private final AtomicReference<CountDownLatch[]> pausedLookup = new AtomicReference<>();

    private volatile boolean failWrites;
    private volatile boolean failReads;

    public void addMember(String conversationId, String userId) {
        members.computeIfAbsent(conversationId, k -> ConcurrentHashMap.newKeySet()).add(userId);
    }

    public void removeMember(String conversationId, String userId) {
        members.getOrDefault(conversationId, Set.of()).remove(userId);
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failReads(boolean fail) {
        this.failReads = fail;
    }

    /**
     * The next {@link #listConversationIds} call counts down {@code entered} and then waits for
     * {@code release}.
     */
    public void pauseNextConversationLookup(CountDownLatch entered, CountDownLatch release) {
        pausedLookup.set(new CountDownLatch[]{entered, release});
    }

    public int membershipFetches() {
        return membershipFetches.get();
    }

    public List<StoredMessage> all(String conversationId) {
        return List.copyOf(messages.getOrDefault(conversationId, List.of()));
    }

    public Long cursorOf(String conversationId, String userId) {
        return cursors.get(conversationId + "|" + userId);
    }

    @Override
    public long appendMessage(String conversationId, String senderId, MessagePayload payload) {
        if (failWrites) throw new IllegalStateException("store down");
        var list = messages.computeIfAbsent(conversationId, k -> new ArrayList<>());
        synchronized (list) {
            long seq = list.size() + 1L;
            list.add(new StoredMessage(conversationId, seq, senderId, payload, Instant.now()));
            return seq;
        }
    }

    @Override
    public List<StoredMessage> fetchHistory(String conversationId, long sinceSeq, int limit) {
        if (failReads) throw new IllegalStateException("store down");
        var list = messages.getOrDefault(conversationId, List.of());
        synchronized (list) {
            return list.stream().filter(m -> m.seq() > sinceSeq).limit(limit).toList();
        }
    }

    @Override
    public Optional<StoredMessage> findMessage(String conversationId, long seq) {
        if (failReads) throw new IllegalStateException("store down");
        var list = messages.getOrDefault(conversationId, List.of());
        synchronized (list) {
            return list.stream().filter(m -> m.seq() == seq).findFirst();
        }
    }

    @Override
    public Set<String> fetchMembership(String conversationId) {
        membershipFetches.incrementAndGet();
        if (failReads) throw new IllegalStateException("store down");
        return new LinkedHashSet<>(members.getOrDefault(conversationId, Set.of()));
    }

    @Override
    public Set<String> listConversationIds(String userId) {
        var pause = pausedLookup.getAndSet(null);
        if (pause != null) {
            pause[0].countDown();
            try {
                pause[1].await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failReads) throw new IllegalStateException("store down");
        var out = new LinkedHashSet<String>();
        members.forEach((conversationId, set) -> {
            if (set.contains(userId)) out.add(conversationId);
        });
        return out;
    }

    @Override
    public long updateReadCursor(String conversationId, String userId, long seq) {
        if (failWrites) throw new IllegalStateException("store down");
        return cursors.merge(conversationId + "|" + userId, seq, Math::max);
    }
}
