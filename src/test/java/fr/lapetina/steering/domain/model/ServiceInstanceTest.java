package fr.lapetina.steering.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceInstanceTest {

    private static ServiceInstance.Builder base() {
        return ServiceInstance.builder()
                .id("billing-1")
                .serviceName("billing")
                .address("10.0.0.1")
                .port(8080);
    }

    @Test
    @DisplayName("should build with passing health by default")
    void shouldBuildWithDefaults() {
        ServiceInstance instance = base().addTag("eu").build();

        assertThat(instance.getHealth()).isEqualTo(HealthStatus.PASSING);
        assertThat(instance.isPassing()).isTrue();
        assertThat(instance.hostPort()).isEqualTo("10.0.0.1:8080");
        assertThat(instance.hasTag("eu")).isTrue();
        assertThat(instance.getTags()).containsExactly("eu");
    }

    @Test
    @DisplayName("should require id, service name and address")
    void shouldRequireFields() {
        assertThatThrownBy(() -> base().id(null).build()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> base().serviceName(null).build()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> base().address(null).build()).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("should reject ports out of range")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> base().port(70000).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base().port(-1).build()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should copy with a new health status and compare by id")
    void shouldCopyWithHealth() {
        ServiceInstance passing = base().build();

        ServiceInstance critical = passing.withHealth(HealthStatus.CRITICAL);

        assertThat(critical.isPassing()).isFalse();
        assertThat(critical).isEqualTo(passing);
        assertThat(passing.withHealth(HealthStatus.PASSING)).isSameAs(passing);
    }

    @Test
    @DisplayName("should map unknown health labels to critical")
    void shouldParseHealthLabels() {
        assertThat(HealthStatus.fromLabel("passing")).isEqualTo(HealthStatus.PASSING);
        assertThat(HealthStatus.fromLabel("WARNING")).isEqualTo(HealthStatus.WARNING);
        assertThat(HealthStatus.fromLabel("maintenance")).isEqualTo(HealthStatus.CRITICAL);
        assertThat(HealthStatus.fromLabel(null)).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    @DisplayName("should derive instance stats immutably")
    void shouldDeriveStats() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        InstanceStats stats = InstanceStats.EMPTY
                .selectedAt(now)
                .withActiveConnections(2)
                .withFailedRequests(1)
                .withResponseTime(Duration.ofMillis(15));

        assertThat(stats.totalRequests()).isEqualTo(1);
        assertThat(stats.lastUsed()).isEqualTo(now);
        assertThat(stats.activeConnections()).isEqualTo(2);
        assertThat(stats.failedRequests()).isEqualTo(1);
        assertThat(stats.responseTime()).isEqualTo(Duration.ofMillis(15));
        assertThat(InstanceStats.EMPTY.totalRequests()).isZero();
    }
}
