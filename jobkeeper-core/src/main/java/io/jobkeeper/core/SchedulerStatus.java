package io.jobkeeper.core;

import java.time.Instant;

/**
 * Point-in-time view of the scheduler for health checks.
 */
public record SchedulerStatus(boolean running, String ownerId, int inFlight, Instant lastTickAt) {
}
