package io.steadyloop.worker;

public record WorkerStats(
        boolean running,
        boolean paused,
        int targetWorkers,
        int liveWorkers,
        int busyWorkers,
        int peakWorkers,
        int minWorkers,
        int maxWorkers,
        long processed,
        long failed,
        long scaleUps,
        long scaleDowns
) {
}
