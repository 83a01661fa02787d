package io.steadyloop.error;

public class FatalTaskException extends SteadyLoopException {
    public FatalTaskException(String message) {
        super(message);
    }

    public FatalTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
