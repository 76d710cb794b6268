package io.jobkeeper.core;

/**
 * Selection criteria for listing jobs. Null fields match everything.
 */
public record JobFilter(Boolean enabled, String handler, int limit) {

    public static JobFilter all() {
        return new JobFilter(null, null, Integer.MAX_VALUE);
    }

    public static JobFilter enabledOnly() {
        return new JobFilter(Boolean.TRUE, null, Integer.MAX_VALUE);
    }

    public static JobFilter byHandler(String handler) {
        return new JobFilter(null, handler, Integer.MAX_VALUE);
    }

    public boolean matches(JobDefinition job) {
        if (enabled != null && job.enabled() != enabled) {
            return false;
        }
        return handler == null || handler.equals(job.handler());
    }
}
