package io.steadyloop.error;

public class TransientTaskException extends SteadyLoopException {
    public TransientTaskException(String message) {
        super(message);
    }

    public TransientTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
