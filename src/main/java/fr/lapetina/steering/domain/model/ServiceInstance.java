package fr.lapetina.steering.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One backend instance of a named service, as listed by the service registry.
 *
 * Immutable: a health change produces a new instance through {@link #withHealth(HealthStatus)}.
 * Identity (equals/hashCode) is the instance ID only.
 */
public final class ServiceInstance {
    private final String id;
    private final String serviceName;
    private final String address;
    private final int port;
    private final HealthStatus health;
    private final Set<String> tags;

    private ServiceInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Instance ID is required");
        this.serviceName = Objects.requireNonNull(builder.serviceName, "Service name is required");
        this.address = Objects.requireNonNull(builder.address, "Address is required");
        if (builder.port < 0 || builder.port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + builder.port);
        }
        this.port = builder.port;
        this.health = Objects.requireNonNull(builder.health, "Health status is required");
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
    }

    public String getId() {
        return id;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public HealthStatus getHealth() {
        return health;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public boolean isPassing() {
        return health == HealthStatus.PASSING;
    }

    public String hostPort() {
        return address + ":" + port;
    }

    public ServiceInstance withHealth(HealthStatus newHealth) {
        if (newHealth == health) {
            return this;
        }
        return toBuilder().health(newHealth).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .serviceName(serviceName)
                .address(address)
                .port(port)
                .health(health)
                .tags(tags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceInstance that = (ServiceInstance) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ServiceInstance{" +
                "id='" + id + '\'' +
                ", service='" + serviceName + '\'' +
                ", address=" + hostPort() +
                ", health=" + health.label() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String serviceName;
        private String address;
        private int port;
        private HealthStatus health = HealthStatus.PASSING;
        private final Set<String> tags = new LinkedHashSet<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder health(HealthStatus health) {
            this.health = health;
            return this;
        }

        public Builder addTag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags.addAll(tags);
            return this;
        }

        public ServiceInstance build() {
            return new ServiceInstance(this);
        }
    }
}
