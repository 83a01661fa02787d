package io.steadyloop.worker;

import io.steadyloop.model.TaskCategory;
import io.steadyloop.util.Jsons;

import java.time.Instant;

public final class EchoTaskHandler implements TaskHandler {
    private final TaskCategory category;

    public EchoTaskHandler() {
        this(TaskCategory.DEFAULT);
    }

    public EchoTaskHandler(TaskCategory category) {
        this.category = category;
    }

    @Override
    public TaskCategory category() {
        return category;
    }

    @Override
    public String execute(TaskContext context) {
        context.progress().report(1.0d, null);
        return """
                {
                  "handler": "echo",
                  "timestamp": "%s",
                  "taskId": %s,
                  "category": "%s",
                  "attempt": %d,
                  "received": %s
                }
                """.formatted(
                Instant.now(),
                Jsons.toJson(context.taskId()),
                category.key(),
                context.attempt(),
                Jsons.toJson(context.payload())
        );
    }
}
