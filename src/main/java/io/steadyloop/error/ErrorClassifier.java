package io.steadyloop.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps a failure to its {@link ErrorKind}. Pure: the result depends only on the exception type,
 * never on its message text.
 */
public final class ErrorClassifier {
    private static final int MAX_UNWRAP_DEPTH = 8;

    private ErrorClassifier() {
    }

    public static ErrorKind classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t == null) {
            return ErrorKind.TRANSIENT;
        }
        if (t instanceof CircuitOpenException) {
            return ErrorKind.CIRCUIT_OPEN;
        }
        if (t instanceof BudgetExceededException) {
            return ErrorKind.BUDGET_EXCEEDED;
        }
        if (t instanceof ApprovalRequiredException) {
            return ErrorKind.APPROVAL_REQUIRED;
        }
        if (t instanceof FatalTaskException
                || t instanceof InterruptedException
                || t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof NullPointerException
                || t instanceof UnsupportedOperationException
                || t instanceof ClassCastException
                || t instanceof Error) {
            return ErrorKind.FATAL;
        }
        return ErrorKind.TRANSIENT;
    }

    public static String errorType(Throwable error) {
        Throwable t = unwrap(error);
        return t == null ? "unknown" : t.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        int depth = 0;
        while ((t instanceof ExecutionException || t instanceof CompletionException)
                && t.getCause() != null
                && depth++ < MAX_UNWRAP_DEPTH) {
            t = t.getCause();
        }
        return t;
    }
}
