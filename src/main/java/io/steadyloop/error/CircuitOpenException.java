package io.steadyloop.error;

import io.steadyloop.model.TaskCategory;

public final class CircuitOpenException extends SteadyLoopException {
    private final TaskCategory category;

    public CircuitOpenException(TaskCategory category) {
        super("Circuit open for category " + category.key() + ", call rejected");
        this.category = category;
    }

    public TaskCategory category() {
        return category;
    }
}
