package io.jobkeeper;

/**
 * Body of a scheduled job, looked up by {@link #name()} from the handler stored on the job.
 *
 * <p>Exceptions thrown from {@code execute} fail the current run only; the next occurrence
 * is scheduled as usual.
 */
public interface JobHandler<T> {
    String name();

    Class<T> dataClass();

    void execute(T data) throws Exception;

    /**
     * Variant that also receives run metadata. Defaults to {@link #execute(Object)}.
     */
    default void execute(T data, JobContext context) throws Exception {
        execute(data);
    }
}
