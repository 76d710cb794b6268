package io.jobkeeper.core;

import java.util.Map;

/**
 * Partial update of a {@link JobDefinition}. Null fields are left unchanged.
 *
 * <p>When {@code expectedVersion} is set the update only applies if the stored version still
 * matches it.
 */
public record JobUpdate(
        String handler,
        Map<String, Object> data,
        ScheduleSpec schedule,
        Boolean enabled,
        Long expectedVersion
) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return handler == null && data == null && schedule == null && enabled == null;
    }

    public boolean changesTiming() {
        return schedule != null || enabled != null;
    }

    public JobDefinition applyTo(JobDefinition current) {
        return new JobDefinition(
                current.id(),
                handler != null ? handler : current.handler(),
                data != null ? data : current.data(),
                schedule != null ? schedule : current.schedule(),
                enabled != null ? enabled : current.enabled(),
                current.createdAt(),
                current.updatedAt(),
                current.version()
        );
    }

    public static final class Builder {
        private String handler;
        private Map<String, Object> data;
        private ScheduleSpec schedule;
        private Boolean enabled;
        private Long expectedVersion;

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder schedule(ScheduleSpec schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder expectedVersion(long expectedVersion) {
            this.expectedVersion = expectedVersion;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(handler, data, schedule, enabled, expectedVersion);
        }
    }
}
