package fr.lapetina.steering.infrastructure.status;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.steering.MutableClock;
import fr.lapetina.steering.balancer.LoadBalancerManager;
import fr.lapetina.steering.breaker.BreakerConfig;
import fr.lapetina.steering.breaker.CircuitBreakerManager;
import fr.lapetina.steering.domain.model.InstanceStats;
import fr.lapetina.steering.domain.model.ServiceInstance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusReporterTest {

    @Test
    @DisplayName("should render breakers and load balancer as JSON")
    void shouldRenderStatus() throws Exception {
        MutableClock clock = new MutableClock();
        CircuitBreakerManager breakers = new CircuitBreakerManager(BreakerConfig.defaults(), clock);
        LoadBalancerManager loadBalancer = LoadBalancerManager.builder().clock(clock).build();
        breakers.getBreaker("billing").execute(() -> "ok");
        loadBalancer.select(List.of(ServiceInstance.builder()
                .id("a").serviceName("billing").address("10.0.0.1").port(80).build()), null);
        loadBalancer.updateStats("a", InstanceStats.EMPTY.withResponseTime(Duration.ofMillis(250)));
        StatusReporter reporter = new StatusReporter(breakers, loadBalancer);

        JsonNode root = reporter.getObjectMapper().readTree(reporter.toJson());

        JsonNode billing = root.path("breakers").path("billing");
        assertThat(billing.path("state").asText()).isEqualTo("CLOSED");
        assertThat(billing.path("counts").path("totalSuccesses").asLong()).isEqualTo(1);
        assertThat(billing.path("config").path("timeout").asLong()).isEqualTo(60_000);
        assertThat(billing.path("expiry").asText()).isEqualTo("2024-01-01T00:01:00Z");

        JsonNode instance = root.path("loadBalancer").path("instances").path("a");
        assertThat(root.path("loadBalancer").path("algorithm").asText()).isEqualTo("round-robin");
        assertThat(instance.path("totalRequests").asLong()).isEqualTo(1);
        assertThat(instance.path("responseTime").asLong()).isEqualTo(250);
        assertThat(instance.path("lastUsed").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(reporter.toPrettyJson()).contains("\n");
    }
}
