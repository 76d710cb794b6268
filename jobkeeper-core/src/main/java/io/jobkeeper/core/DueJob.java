package io.jobkeeper.core;

/**
 * An enabled job whose next fire time has been reached.
 */
public record DueJob(JobDefinition definition, ScheduleState state) {

    public String id() {
        return definition.id();
    }
}
