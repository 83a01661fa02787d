package io.steadyloop.error;

import java.time.Duration;

public final class PoolExhaustedException extends SteadyLoopException {
    public PoolExhaustedException(String poolName, Duration timeout) {
        super("Pool " + poolName + " exhausted, no handle within " + timeout.toMillis() + "ms");
    }
}
