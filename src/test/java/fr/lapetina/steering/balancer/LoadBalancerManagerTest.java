package fr.lapetina.steering.balancer;

import fr.lapetina.steering.MutableClock;
import fr.lapetina.steering.domain.model.HealthStatus;
import fr.lapetina.steering.domain.model.InstanceStats;
import fr.lapetina.steering.domain.model.ServiceInstance;
import fr.lapetina.steering.domain.strategy.Algorithm;
import fr.lapetina.steering.exception.InvalidAlgorithmException;
import fr.lapetina.steering.exception.NoHealthyInstancesException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadBalancerManagerTest {

    private MutableClock clock;
    private LoadBalancerManager manager;
    private List<ServiceInstance> instances;

    private static ServiceInstance instance(String id, HealthStatus health) {
        return ServiceInstance.builder()
                .id(id)
                .serviceName("billing")
                .address("10.0.0.1")
                .port(8080)
                .health(health)
                .build();
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        manager = LoadBalancerManager.builder().clock(clock).build();
        instances = List.of(
                instance("a", HealthStatus.PASSING),
                instance("b", HealthStatus.CRITICAL),
                instance("c", HealthStatus.PASSING)
        );
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("should skip instances that are not passing")
        void shouldFilterUnhealthy() {
            List<String> picked = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                picked.add(manager.select(instances, null).getId());
            }

            assertThat(picked).containsExactly("a", "c", "a", "c");
        }

        @Test
        @DisplayName("should keep every instance when health checking is disabled")
        void shouldKeepAllWithoutHealthCheck() {
            LoadBalancerManager lenient = LoadBalancerManager.builder().healthCheckEnabled(false).build();

            assertThat(lenient.select(instances, null).getId()).isEqualTo("a");
            assertThat(lenient.select(instances, null).getId()).isEqualTo("b");
        }

        @Test
        @DisplayName("should fail when there are no candidates")
        void shouldFailOnEmpty() {
            assertThatThrownBy(() -> manager.select(List.of(), null))
                    .isInstanceOf(NoHealthyInstancesException.class);
        }

        @Test
        @DisplayName("should fail when no candidate is healthy")
        void shouldFailWhenAllUnhealthy() {
            List<ServiceInstance> unhealthy = List.of(
                    instance("x", HealthStatus.WARNING),
                    instance("y", HealthStatus.CRITICAL));

            assertThatThrownBy(() -> manager.select(unhealthy, null))
                    .isInstanceOf(NoHealthyInstancesException.class);
        }

        @Test
        @DisplayName("should reject an unknown algorithm override")
        void shouldRejectUnknownOverride() {
            assertThatThrownBy(() -> manager.select(instances, null, "fastest"))
                    .isInstanceOf(InvalidAlgorithmException.class)
                    .extracting(e -> ((InvalidAlgorithmException) e).getAlgorithm())
                    .isEqualTo("fastest");
        }

        @Test
        @DisplayName("should use the override for one call only")
        void shouldApplyOverride() {
            manager.updateStats("a", InstanceStats.EMPTY.withActiveConnections(4));

            ServiceInstance selected = manager.select(instances, null, "least-connections");

            assertThat(selected.getId()).isEqualTo("c");
            assertThat(manager.getAlgorithm()).isEqualTo("round-robin");
        }

        @Test
        @DisplayName("should honour static weights")
        void shouldHonourWeights() {
            LoadBalancerManager weighted = LoadBalancerManager.builder()
                    .algorithm(Algorithm.WEIGHTED_ROUND_ROBIN)
                    .weight("a", 2)
                    .build();

            List<String> picked = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                picked.add(weighted.select(instances, null).getId());
            }

            assertThat(picked).containsExactly("a", "a", "c", "a", "a", "c");
        }

        @Test
        @DisplayName("should keep routing a key to the same instance with consistent hashing")
        void shouldRouteKeysConsistently() {
            manager.setAlgorithm("consistent-hash");
            String first = manager.select(instances, "user-7").getId();

            assertThat(manager.select(instances, "user-7").getId()).isEqualTo(first);
            assertThat(first).isIn("a", "c");
        }
    }

    @Nested
    @DisplayName("Algorithm switching")
    class SwitchingTests {

        @Test
        @DisplayName("should switch algorithms at runtime")
        void shouldSwitch() {
            manager.setAlgorithm("LEAST_CONNECTIONS");

            assertThat(manager.getAlgorithm()).isEqualTo("least-connections");
        }

        @Test
        @DisplayName("should keep the active algorithm when the new one is unknown")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> manager.setAlgorithm("fastest"))
                    .isInstanceOf(InvalidAlgorithmException.class);

            assertThat(manager.getAlgorithm()).isEqualTo("round-robin");
        }

        @Test
        @DisplayName("should fail selection when configured with an unknown algorithm")
        void shouldFailWithUnknownConfiguredAlgorithm() {
            LoadBalancerManager broken = LoadBalancerManager.builder().algorithm("fastest").build();

            assertThatThrownBy(() -> broken.select(instances, null))
                    .isInstanceOf(InvalidAlgorithmException.class);
        }

        @Test
        @DisplayName("should build without an algorithm and fail at selection")
        void shouldFailWithoutConfiguredAlgorithm() {
            LoadBalancerManager unconfigured = LoadBalancerManager.builder().algorithm((String) null).build();

            assertThat(unconfigured.getAlgorithm()).isNull();
            assertThatThrownBy(() -> unconfigured.select(instances, null))
                    .isInstanceOf(InvalidAlgorithmException.class)
                    .extracting(e -> ((InvalidAlgorithmException) e).getAlgorithm())
                    .isNull();
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("should record requests and last use on selection")
        void shouldRecordSelections() {
            manager.select(instances, null);
            clock.advance(Duration.ofSeconds(1));
            manager.select(instances, null);
            manager.select(instances, null);

            InstanceStats a = manager.getInstanceStats("a");
            assertThat(a.totalRequests()).isEqualTo(2);
            assertThat(a.lastUsed()).isEqualTo(clock.instant());
            assertThat(manager.getInstanceStats("c").totalRequests()).isEqualTo(1);
            assertThat(manager.getInstanceStats("b")).isEqualTo(InstanceStats.EMPTY);
            assertThat(manager.getStrategyStats().get("round-robin")).containsEntry("selections", 3L);
        }

        @Test
        @DisplayName("should copy only measured fields on update")
        void shouldMergeMeasuredFields() {
            manager.select(instances, null);

            manager.updateStats("a", new InstanceStats(3, 99, 2, Duration.ofMillis(40), null));

            InstanceStats a = manager.getInstanceStats("a");
            assertThat(a.activeConnections()).isEqualTo(3);
            assertThat(a.failedRequests()).isEqualTo(2);
            assertThat(a.responseTime()).isEqualTo(Duration.ofMillis(40));
            assertThat(a.totalRequests()).isEqualTo(1);
            assertThat(a.lastUsed()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should apply concurrent increments atomically")
        void shouldUpdateAtomically() throws InterruptedException {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < 500; i++) {
                            manager.updateStats("a", s -> s.withActiveConnections(s.activeConnections() + 1));
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }
            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(manager.getInstanceStats("a").activeConnections()).isEqualTo(4000);
        }

        @Test
        @DisplayName("should record nothing when statistics are disabled")
        void shouldSkipWhenDisabled() {
            LoadBalancerManager quiet = LoadBalancerManager.builder().statsEnabled(false).build();

            quiet.select(instances, null);
            quiet.updateStats("a", InstanceStats.EMPTY.withActiveConnections(7));

            assertThat(quiet.getAllInstanceStats()).isEmpty();
        }

        @Test
        @DisplayName("should expose a snapshot and clear it on reset")
        void shouldSnapshotAndReset() {
            manager.select(instances, null);

            BalancerSnapshot snapshot = manager.snapshot();
            assertThat(snapshot.algorithm()).isEqualTo("round-robin");
            assertThat(snapshot.instances()).containsOnlyKeys("a");
            assertThat(snapshot.strategies()).containsKeys(
                    "round-robin", "weighted-round-robin", "least-connections", "random",
                    "weighted-random", "consistent-hash", "source-hash");

            manager.reset();

            assertThat(manager.getAllInstanceStats()).isEmpty();
            assertThat(manager.select(instances, null).getId()).isEqualTo("a");
        }
    }
}
