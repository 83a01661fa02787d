package io.steadyloop.worker;

import io.steadyloop.model.TaskCategory;

public interface TaskHandler {
    TaskCategory category();

    String execute(TaskContext context) throws Exception;
}
