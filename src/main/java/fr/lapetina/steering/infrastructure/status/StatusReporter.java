package fr.lapetina.steering.infrastructure.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.steering.balancer.LoadBalancerManager;
import fr.lapetina.steering.breaker.CircuitBreakerManager;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the read-only breaker and load balancer statistics as JSON
 * for an external status page.
 *
 * Instants are ISO-8601 strings, durations are milliseconds.
 */
public final class StatusReporter {

    private final CircuitBreakerManager breakers;
    private final LoadBalancerManager loadBalancer;
    private final ObjectMapper objectMapper;

    public StatusReporter(CircuitBreakerManager breakers, LoadBalancerManager loadBalancer) {
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.loadBalancer = Objects.requireNonNull(loadBalancer, "loadBalancer");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS);
    }

    /**
     * Snapshot of both layers as a JSON-ready tree.
     */
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("breakers", breakers.getStats());
        status.put("loadBalancer", loadBalancer.snapshot());
        return status;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(status());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render status", e);
        }
    }

    public String toPrettyJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render status", e);
        }
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
