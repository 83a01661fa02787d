package io.steadyloop.pool;

public interface HandleFactory<H> {
    H create() throws Exception;

    boolean isHealthy(H handle);

    default void reset(H handle) throws Exception {
    }

    void close(H handle) throws Exception;
}
