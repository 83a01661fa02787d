package io.steadyloop.worker;

import io.steadyloop.model.TaskCategory;

public record TaskContext(
        String taskId,
        String description,
        TaskCategory category,
        String payload,
        String checkpoint,
        int attempt,
        ProgressReporter progress
) {
    public TaskContext {
        progress = progress == null ? ProgressReporter.NONE : progress;
    }
}
