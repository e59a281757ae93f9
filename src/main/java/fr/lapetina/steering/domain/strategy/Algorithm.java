package fr.lapetina.steering.domain.strategy;

import java.util.Locale;
import java.util.Optional;

/**
 * Built-in load balancing algorithms and their configuration names.
 */
public enum Algorithm {
    ROUND_ROBIN("round-robin"),
    WEIGHTED_ROUND_ROBIN("weighted-round-robin"),
    LEAST_CONNECTIONS("least-connections"),
    RANDOM("random"),
    WEIGHTED_RANDOM("weighted-random"),
    CONSISTENT_HASH("consistent-hash"),
    SOURCE_HASH("source-hash");

    private final String configName;

    Algorithm(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves a configuration name. Case-insensitive, '_' and '-' are interchangeable,
     * and "ip-hash" is accepted for {@link #SOURCE_HASH}.
     */
    public static Optional<Algorithm> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("ip-hash")) {
            return Optional.of(SOURCE_HASH);
        }
        for (Algorithm algorithm : values()) {
            if (algorithm.configName.equals(normalized)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}
