package io.jobkeeper.core;

import java.util.Map;

/**
 * Immutable registration request produced by {@link io.jobkeeper.JobBuilder#build()}.
 * This is a pure data object with no persistence logic.
 */
public record JobSpec(

        // identity
        String id,
        String handler,

        // scheduling
        ScheduleSpec schedule,
        boolean enabled,
        boolean runImmediately,
        boolean replaceExisting,

        // payload
        Map<String, Object> data
) {
}
