package com.chatrelay.coordinator.chat.service;

import com.chatrelay.coordinator.chat.repo.ChatStore;
import com.chatrelay.coordinator.common.error.MembershipUnavailableException;
import com.chatrelay.coordinator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomManagerTest {

    private ChatStore store;
    private MutableClock clock;
    private RoomManager rooms;

    @BeforeEach
    void setUp() {
        store = mock(ChatStore.class);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        rooms = new RoomManager(store, clock, Duration.ofSeconds(30), 50_000, Duration.ofMinutes(10));
    }

    @Test
    void serves_from_cache_inside_the_staleness_window() {
        when(store.fetchMembership("k1")).thenReturn(Set.of("alice", "bob"));

        assertThat(rooms.membersOf("k1")).containsExactlyInAnyOrder("alice", "bob");
        clock.advance(Duration.ofSeconds(29));
        assertThat(rooms.membersOf("k1")).containsExactlyInAnyOrder("alice", "bob");

        verify(store, times(1)).fetchMembership("k1");
    }

    @Test
    void refreshes_once_the_window_has_passed() {
        when(store.fetchMembership("k1"))
                .thenReturn(Set.of("alice"))
                .thenReturn(Set.of("alice", "carol"));

        rooms.membersOf("k1");
        clock.advance(Duration.ofSeconds(30));

        assertThat(rooms.membersOf("k1")).containsExactlyInAnyOrder("alice", "carol");
        verify(store, times(2)).fetchMembership("k1");
    }

    @Test
    void invalidate_forces_a_refetch() {
        when(store.fetchMembership("k1"))
                .thenReturn(Set.of("alice"))
                .thenReturn(Set.of("alice", "dave"));

        rooms.membersOf("k1");
        rooms.invalidate("k1");

        assertThat(rooms.isMember("k1", "dave")).isTrue();
        verify(store, times(2)).fetchMembership("k1");
    }

    @Test
    void falls_back_to_last_snapshot_when_store_fails() {
        when(store.fetchMembership("k1"))
                .thenReturn(Set.of("alice", "bob"))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        rooms.membersOf("k1");
        rooms.invalidate("k1");

        assertThat(rooms.membersOf("k1")).containsExactlyInAnyOrder("alice", "bob");
    }

    @Test
    void fails_when_store_is_down_and_nothing_is_cached() {
        when(store.fetchMembership("k1")).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> rooms.membersOf("k1"))
                .isInstanceOf(MembershipUnavailableException.class)
                .satisfies(ex -> assertThat(((MembershipUnavailableException) ex).code()).isEqualTo("membership_unavailable"));
    }

    @Test
    void invalidation_during_fetch_is_not_lost() {
        when(store.fetchMembership("k1")).thenAnswer(inv -> {
            // the conversation service changes membership while our read is in flight
            rooms.invalidate("k1");
            return Set.of("alice");
        }).thenReturn(Set.of("alice", "erin"));

        assertThat(rooms.membersOf("k1")).containsExactly("alice");
        assertThat(rooms.membersOf("k1")).containsExactlyInAnyOrder("alice", "erin");
    }

    @Test
    void conversations_of_user_fall_back_to_cached_snapshots() {
        when(store.fetchMembership("k1")).thenReturn(Set.of("alice", "bob"));
        when(store.fetchMembership("k2")).thenReturn(Set.of("bob"));
        when(store.listConversationIds("alice")).thenThrow(new DataAccessResourceFailureException("db down"));
        rooms.membersOf("k1");
        rooms.membersOf("k2");

        assertThat(rooms.conversationsOf("alice")).containsExactly("k1");
    }

    @Test
    void evict_drops_the_snapshot() {
        when(store.fetchMembership("k1")).thenReturn(Set.of("alice"));
        rooms.membersOf("k1");

        rooms.evict("k1");
        rooms.membersOf("k1");

        verify(store, times(2)).fetchMembership("k1");
    }
}
