package io.jobkeeper.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted definition of a scheduled job.
 *
 * <p>{@code version} is the compare-and-swap token of the row: every store write increments it,
 * and an update that was computed against an older version fails with {@link ConflictException}.
 */
public record JobDefinition(
        String id,
        String handler,
        Map<String, Object> data,
        ScheduleSpec schedule,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt,
        long version
) {
    public JobDefinition {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(handler, "handler must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        // LinkedHashMap keeps key order and tolerates null JSON values
        data = (data == null || data.isEmpty()) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public JobDefinition withVersion(long version, Instant updatedAt) {
        return new JobDefinition(id, handler, data, schedule, enabled, createdAt, updatedAt, version);
    }
}
