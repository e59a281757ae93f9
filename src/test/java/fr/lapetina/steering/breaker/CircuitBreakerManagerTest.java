package fr.lapetina.steering.breaker;

import fr.lapetina.steering.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerManagerTest {

    private MutableClock clock;
    private CircuitBreakerManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        manager = new CircuitBreakerManager(BreakerConfig.builder()
                .failureThreshold(1)
                .timeout(Duration.ofSeconds(5))
                .build(), clock);
    }

    private static void failOnce(CircuitBreaker breaker) {
        try {
            breaker.execute(() -> {
                throw new IllegalStateException("down");
            });
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("down");
        }
    }

    @Test
    @DisplayName("should create breakers lazily with the default config")
    void shouldCreateLazily() {
        assertThat(manager.size()).isZero();

        CircuitBreaker breaker = manager.getBreaker("billing");

        assertThat(breaker.getName()).isEqualTo("billing");
        assertThat(breaker.getConfig()).isEqualTo(manager.getDefaultConfig());
        assertThat(manager.getBreaker("billing")).isSameAs(breaker);
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should use the given config only when creating")
    void shouldUseGivenConfigOnCreate() {
        BreakerConfig custom = BreakerConfig.builder().failureThreshold(9).build();

        CircuitBreaker created = manager.getBreaker("search", custom);
        CircuitBreaker again = manager.getBreaker("search", BreakerConfig.defaults());

        assertThat(created.getConfig()).isEqualTo(custom);
        assertThat(again).isSameAs(created);
    }

    @Test
    @DisplayName("should construct exactly one breaker under concurrent first requests")
    void shouldCreateOnceConcurrently() throws InterruptedException {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        Set<CircuitBreaker> seen = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    seen.add(manager.getBreaker("shared"));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(seen).hasSize(1);
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should list, find and remove breakers")
    void shouldListAndRemove() {
        manager.getBreaker("orders");
        manager.getBreaker("billing");

        assertThat(manager.listBreakers()).containsExactly("billing", "orders");
        assertThat(manager.findBreaker("orders")).isPresent();
        assertThat(manager.findBreaker("missing")).isEmpty();

        assertThat(manager.removeBreaker("orders")).isTrue();
        assertThat(manager.removeBreaker("orders")).isFalse();
        assertThat(manager.listBreakers()).containsExactly("billing");
    }

    @Test
    @DisplayName("should reset one or all breakers")
    void shouldReset() {
        CircuitBreaker billing = manager.getBreaker("billing");
        CircuitBreaker orders = manager.getBreaker("orders");
        failOnce(billing);
        failOnce(orders);
        assertThat(billing.getState()).isEqualTo(State.OPEN);

        manager.reset("billing");
        assertThat(billing.getState()).isEqualTo(State.CLOSED);
        assertThat(orders.getState()).isEqualTo(State.OPEN);

        manager.resetAll();
        assertThat(orders.getState()).isEqualTo(State.CLOSED);
    }

    @Test
    @DisplayName("should reject reset of an unknown breaker")
    void shouldRejectUnknownReset() {
        assertThatThrownBy(() -> manager.reset("ghost"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("should fan out transitions to every listener")
    void shouldFanOutTransitions() {
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        manager.addListener((name, from, to) -> first.add(name + ":" + to.label()));
        manager.addListener((name, from, to) -> second.add(name + ":" + to.label()));
        manager.addListener((name, from, to) -> {
            throw new IllegalStateException("bad listener");
        });

        failOnce(manager.getBreaker("billing"));

        assertThat(first).containsExactly("billing:open");
        assertThat(second).containsExactly("billing:open");
    }

    @Test
    @DisplayName("should stop notifying about removed breakers")
    void shouldDetachRemovedBreakers() {
        List<String> events = new CopyOnWriteArrayList<>();
        manager.addListener((name, from, to) -> events.add(name));
        CircuitBreaker breaker = manager.getBreaker("billing");

        manager.removeBreaker("billing");
        failOnce(breaker);

        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("should report snapshots and per-state counts")
    void shouldReportStats() {
        manager.getBreaker("orders");
        failOnce(manager.getBreaker("billing"));
        failOnce(manager.getBreaker("search"));
        clock.advance(Duration.ofSeconds(6));

        Map<String, BreakerSnapshot> stats = manager.getStats();
        Map<State, Long> byState = manager.countByState();

        assertThat(stats).containsOnlyKeys("billing", "orders", "search");
        assertThat(stats.keySet()).containsExactly("billing", "orders", "search");
        assertThat(stats.get("billing").state()).isEqualTo(State.HALF_OPEN);
        assertThat(byState)
                .containsEntry(State.CLOSED, 1L)
                .containsEntry(State.HALF_OPEN, 2L)
                .containsEntry(State.OPEN, 0L);
    }
}
