package fr.lapetina.steering.domain.model;

import java.util.Locale;

/**
 * Health status of a service instance, as reported by the external health prober.
 *
 * PASSING: Instance answered its last probe and may receive traffic
 * WARNING: Instance answered but reported a degraded condition
 * CRITICAL: Instance failed its last probe or was never probed successfully
 */
public enum HealthStatus {
    PASSING,
    WARNING,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a registry status label. Anything that is not a known label is CRITICAL.
     */
    public static HealthStatus fromLabel(String label) {
        if (label == null) {
            return CRITICAL;
        }
        for (HealthStatus status : values()) {
            if (status.label().equalsIgnoreCase(label.trim())) {
                return status;
            }
        }
        return CRITICAL;
    }
}
