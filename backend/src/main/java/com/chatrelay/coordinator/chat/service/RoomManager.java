package com.chatrelay.coordinator.chat.service;

import com.chatrelay.coordinator.chat.repo.ChatStore;
import com.chatrelay.coordinator.common.error.MembershipUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * The only place that knows who belongs to a conversation. Keeps a per-conversation snapshot of
 * the membership held by the store, refreshed when older than the staleness window or after
 * {@link #invalidate(String)}. Snapshots of conversations nobody touches for the idle window are
 * dropped, and the number kept is capped.
 */
@Service
public class RoomManager {

    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    private record Snapshot(Set<String> members, Instant fetchedAt, boolean stale) {

        Snapshot markStale() {
            return stale ? this : new Snapshot(members, fetchedAt, true);
        }
    }

    private final ChatStore store;
    private final Clock clock;
    private final Duration membershipTtl;

    private final Cache<String, Snapshot> cache;
    // Generation counters only need to outlive one in-flight fetch; an expired counter reads as a
    // race and costs one extra refetch.
    private final Cache<String, Long> invalidations;

    public RoomManager(
            ChatStore store,
            Clock clock,
            @Value("${app.rooms.membership-ttl:PT30S}") Duration membershipTtl,
            @Value("${app.rooms.cache-maximum-size:50000}") long cacheMaximumSize,
            @Value("${app.rooms.cache-expire-after-access:PT10M}") Duration cacheExpireAfterAccess
    ) {
        this.store = store;
        this.clock = clock;
        this.membershipTtl = membershipTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheMaximumSize)
                .expireAfterAccess(cacheExpireAfterAccess)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        this.invalidations = Caffeine.newBuilder()
                .maximumSize(cacheMaximumSize)
                .expireAfterWrite(cacheExpireAfterAccess)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * @throws MembershipUnavailableException when the store fails and nothing is cached
     */
    public Set<String> membersOf(String conversationId) {
        var cached = cache.getIfPresent(conversationId);
        var now = clock.instant();
        if (cached != null && !cached.stale() && now.isBefore(cached.fetchedAt().plus(membershipTtl))) {
            return cached.members();
        }

        var generation = generationOf(conversationId);
        final Set<String> fetched;
        try {
            fetched = Set.copyOf(store.fetchMembership(conversationId));
        } catch (RuntimeException ex) {
            if (cached != null) {
                log.warn("membership_refresh_failed conversationId={} fallback=cached fetchedAt={}",
                        conversationId, cached.fetchedAt(), ex);
                return cached.members();
            }
            log.warn("membership_unavailable conversationId={}", conversationId, ex);
            throw new MembershipUnavailableException(conversationId, ex);
        }

        // An invalidation that landed while we were fetching may predate our read; keep the
        // result for fallback but force the next lookup to refetch.
        var raced = generation != generationOf(conversationId);
        var fresh = new Snapshot(fetched, now, raced);
        cache.asMap().compute(conversationId, (id, existing) -> {
            if (existing != null && !existing.stale() && existing.fetchedAt().isAfter(now)) {
                return existing;
            }
            return fresh;
        });
        return fetched;
    }

    public boolean isMember(String conversationId, String userId) {
        return userId != null && membersOf(conversationId).contains(userId);
    }

    public void invalidate(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) return;
        invalidations.asMap().merge(conversationId, 1L, Long::sum);
        cache.asMap().computeIfPresent(conversationId, (id, s) -> s.markStale());
        log.debug("membership_invalidated conversationId={}", conversationId);
    }

    /**
     * Conversations the user belongs to. Falls back to cached snapshots when the store is down,
     * which may miss conversations nobody has touched since startup.
     */
    public Set<String> conversationsOf(String userId) {
        try {
            return store.listConversationIds(userId);
        } catch (RuntimeException ex) {
            log.warn("conversation_lookup_failed userId={} fallback=cached", userId, ex);
            var out = new LinkedHashSet<String>();
            cache.asMap().forEach((conversationId, snapshot) -> {
                if (snapshot.members().contains(userId)) out.add(conversationId);
            });
            return out;
        }
    }

    public void evict(String conversationId) {
        cache.invalidate(conversationId);
        invalidations.invalidate(conversationId);
    }

    /**
     * Snapshots currently held, after dropping expired ones.
     */
    public long cachedConversations() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private long generationOf(String conversationId) {
        var g = invalidations.getIfPresent(conversationId);
        return g == null ? 0L : g;
    }
}
