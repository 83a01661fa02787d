package io.steadyloop.worker;

@FunctionalInterface
public interface ProgressReporter {
    ProgressReporter NONE = (progress, checkpoint) -> {
    };

    void report(double progress, String checkpoint);
}
