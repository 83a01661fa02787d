package io.steadyloop.model;

import java.util.List;

public record TaskRecord(
        String taskId,
        String description,
        TaskCategory category,
        TaskPriority priority,
        TaskStatus status,
        String payload,
        List<String> dependencies,
        Long deadlineAtMs,
        int attempts,
        String lastError,
        double progress,
        String checkpoint,
        String result,
        String leaseOwner,
        long createdAtMs,
        Long startedAtMs,
        Long completedAtMs,
        long updatedAtMs
) {
    public TaskRecord {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
