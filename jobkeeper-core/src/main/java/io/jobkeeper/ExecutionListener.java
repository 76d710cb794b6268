package io.jobkeeper;

import io.jobkeeper.core.ExecutionEvent;

/**
 * Receives an event for every completed or skipped execution.
 *
 * <p>Called from scheduler threads; implementations must not block for long.
 */
@FunctionalInterface
public interface ExecutionListener {
    void onExecution(ExecutionEvent event);
}
