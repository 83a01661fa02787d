package io.steadyloop.error;

public class SteadyLoopException extends RuntimeException {
    public SteadyLoopException(String message) {
        super(message);
    }

    public SteadyLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
