package fr.lapetina.steering.breaker;

import java.time.Instant;

/**
 * Read-only view of a breaker at one point in time.
 *
 * @param expiry end of the current closed window or open cool-down, null when none applies
 */
public record BreakerSnapshot(
        String name,
        State state,
        long generation,
        Counts counts,
        Instant expiry,
        BreakerConfig config
) {
}
