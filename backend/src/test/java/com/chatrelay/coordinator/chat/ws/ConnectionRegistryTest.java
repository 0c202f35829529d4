package com.chatrelay.coordinator.chat.ws;

import com.chatrelay.coordinator.common.error.DuplicateBindingException;
import com.chatrelay.coordinator.support.MutableClock;
import com.chatrelay.coordinator.support.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private MutableClock clock;
    private ConnectionRegistry registry;
    private final List<String> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new ConnectionRegistry(clock);
        registry.addListener(new ConnectionRegistry.Listener() {
            @Override
            public void onFirstConnection(String userId) {
                events.add("first:" + userId);
            }

            @Override
            public void onLastConnectionClosed(String userId) {
                events.add("last:" + userId);
            }

            @Override
            public void onActivity(String userId) {
                events.add("activity:" + userId);
            }
        });
    }

    @Test
    void first_registration_notifies_once_per_user() {
        var a = registry.attach(new RecordingTransport("c1"));
        var b = registry.attach(new RecordingTransport("c2"));

        var r1 = registry.register(a, "alice");
        var r2 = registry.register(b, "alice");

        assertThat(r1.firstConnection()).isTrue();
        assertThat(r2.firstConnection()).isFalse();
        assertThat(registry.connectionsFor("alice")).containsExactlyInAnyOrder(a, b);
        assertThat(events).containsExactly("first:alice");
    }

    @Test
    void binding_twice_is_rejected() {
        var a = registry.attach(new RecordingTransport("c1"));
        registry.register(a, "alice");

        assertThatThrownBy(() -> registry.register(a, "bob"))
                .isInstanceOf(DuplicateBindingException.class)
                .hasMessageContaining("c1");
        assertThat(registry.connectionsFor("bob")).isEmpty();
    }

    @Test
    void last_unregister_notifies_and_is_idempotent() {
        var a = registry.attach(new RecordingTransport("c1"));
        var b = registry.attach(new RecordingTransport("c2"));
        registry.register(a, "alice");
        registry.register(b, "alice");

        registry.unregister(a);
        assertThat(events).doesNotContain("last:alice");

        registry.unregister(b);
        registry.unregister(b);

        assertThat(events).containsOnlyOnce("last:alice");
        assertThat(registry.hasConnections("alice")).isFalse();
        assertThat(registry.find("c1")).isEmpty();
    }

    @Test
    void connections_being_torn_down_are_not_returned() {
        var transport = new RecordingTransport("c1");
        var a = registry.attach(transport);
        registry.register(a, "alice");

        transport.close();

        assertThat(registry.connectionsFor("alice")).isEmpty();
        // sending to a half-closed handle is a no-op
        a.send("{}");
        assertThat(transport.frames()).isEmpty();
    }

    @Test
    void registering_a_closed_handle_does_not_bind() {
        var a = registry.attach(new RecordingTransport("c1"));
        registry.unregister(a);

        var result = registry.register(a, "alice");

        assertThat(result.bound()).isFalse();
        assertThat(registry.hasConnections("alice")).isFalse();
        assertThat(events).isEmpty();
    }

    @Test
    void handle_closed_right_after_bind_is_not_kept() {
        var onNextLookup = new AtomicReference<Runnable>();
        var transport = new RecordingTransport("c1") {
            @Override
            public String id() {
                var action = onNextLookup.getAndSet(null);
                if (action != null) action.run();
                return super.id();
            }
        };
        var a = registry.attach(transport);
        // the socket goes away between binding and indexing the handle
        onNextLookup.set(() -> registry.unregister(a));

        var result = registry.register(a, "alice");

        assertThat(result.bound()).isFalse();
        assertThat(a.state()).isEqualTo(ConnectionHandle.State.CLOSED);
        assertThat(registry.find("c1")).isEmpty();
        assertThat(registry.connectionCount()).isZero();
        assertThat(registry.hasConnections("alice")).isFalse();
        assertThat(events).isEmpty();
    }

    @Test
    void unauthenticated_connections_time_out() {
        var pending = new RecordingTransport("c1");
        var authed = new RecordingTransport("c2");
        registry.attach(pending);
        registry.register(registry.attach(authed), "alice");

        clock.advance(Duration.ofSeconds(11));
        var closed = registry.expireUnauthenticated(clock.instant().minusSeconds(10));

        assertThat(closed).isEqualTo(1);
        assertThat(pending.isOpen()).isFalse();
        assertThat(authed.isOpen()).isTrue();
        assertThat(registry.find("c1")).isEmpty();
        assertThat(registry.find("c2")).isPresent();
    }

    @Test
    void touch_reports_activity_for_bound_connections_only() {
        var a = registry.attach(new RecordingTransport("c1"));
        registry.touch(a);
        registry.register(a, "alice");
        clock.advance(Duration.ofSeconds(3));
        registry.touch(a);

        assertThat(events).containsExactly("first:alice", "activity:alice");
        assertThat(a.lastActivityAt()).isEqualTo(clock.instant());
    }

    @Test
    void concurrent_connect_and_disconnect_leaves_consistent_state() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();
        try {
            for (int t = 0; t < threads; t++) {
                final int tid = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        var h = registry.attach(new RecordingTransport("t" + tid + "-" + i));
                        registry.register(h, "alice");
                        registry.unregister(h);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.hasConnections("alice")).isFalse();
        assertThat(registry.connectionCount()).isZero();
        var firsts = events.stream().filter("first:alice"::equals).count();
        var lasts = events.stream().filter("last:alice"::equals).count();
        assertThat(firsts).isEqualTo(lasts);
    }
}
