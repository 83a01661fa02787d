package io.steadyloop.retry;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = d -> Thread.sleep(Math.max(0L, d.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
