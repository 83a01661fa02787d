package io.steadyloop.worker;

import io.steadyloop.storage.TaskStore;

@FunctionalInterface
public interface TaskProcessor {
    /**
     * @return true when the task completed, possibly on a workaround
     */
    boolean process(TaskStore.ClaimedTask task, String workerId);
}
