package io.jobkeeper.internal.mongo;

import io.jobkeeper.core.StoreUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.util.function.Supplier;

/**
 * Maps connectivity failures of the Mongo driver to {@link StoreUnavailableException}.
 * Other data access errors propagate unchanged.
 */
final class MongoCalls {
    private MongoCalls() {
    }

    static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new StoreUnavailableException("MongoDB unavailable during " + operation + ": " + e.getMessage(), e);
        }
    }

    static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
