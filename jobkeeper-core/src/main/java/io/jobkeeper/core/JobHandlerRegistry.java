package io.jobkeeper.core;

import io.jobkeeper.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves the callable reference stored on a job definition to the registered handler.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler<?>> handlersByName;

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler name: " + a.name());
                        }
                ));
    }

    public JobHandler<?> getRequired(String name) {
        JobHandler<?> handler = handlersByName.get(name);
        if (handler == null) {
            throw new IllegalStateException("No JobHandler registered for name: " + name);
        }
        return handler;
    }

    public boolean contains(String name) {
        return handlersByName.containsKey(name);
    }

    public Set<String> names() {
        return handlersByName.keySet();
    }
}
