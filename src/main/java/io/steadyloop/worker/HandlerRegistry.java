package io.steadyloop.worker;

import io.steadyloop.model.TaskCategory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class HandlerRegistry {
    private final Map<TaskCategory, TaskHandler> handlers = new EnumMap<>(TaskCategory.class);

    public synchronized void register(TaskHandler handler) {
        handlers.put(handler.category(), handler);
    }

    public synchronized Optional<TaskHandler> find(TaskCategory category) {
        return Optional.ofNullable(handlers.get(category));
    }

    public synchronized Set<TaskCategory> categories() {
        return Set.copyOf(handlers.keySet());
    }
}
