package io.steadyloop.worker;

import io.steadyloop.error.FatalTaskException;
import io.steadyloop.error.TransientTaskException;
import io.steadyloop.model.TaskCategory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public final class ScriptTaskHandler implements TaskHandler {
    static final int EXIT_TEMPFAIL = 75;
    private static final int MAX_ERROR_CHARS = 512;

    private final TaskCategory category;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptTaskHandler(TaskCategory category, List<String> command, long timeoutMs) {
        if (category == null) {
            throw new IllegalArgumentException("script handler category cannot be null");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script handler command cannot be empty: " + category.key());
        }
        this.category = category;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public TaskCategory category() {
        return category;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public String execute(TaskContext context) throws Exception {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Map<String, String> env = pb.environment();
        env.put("STEADYLOOP_TASK_ID", context.taskId());
        env.put("STEADYLOOP_ATTEMPT", String.valueOf(context.attempt()));
        if (context.checkpoint() != null) {
            env.put("STEADYLOOP_CHECKPOINT", context.checkpoint());
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TransientTaskException("script spawn failed: " + e.getMessage(), e);
        }

        try {
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
            byte[] input = context.payload() == null
                    ? new byte[0]
                    : context.payload().getBytes(StandardCharsets.UTF_8);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input);
                stdin.flush();
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new TransientTaskException("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = output.get(1, TimeUnit.SECONDS);
            int exit = process.exitValue();
            if (exit == 0) {
                return combined.strip();
            }
            String message = "script exit=" + exit + " output=" + truncate(combined);
            if (exit == EXIT_TEMPFAIL) {
                throw new TransientTaskException(message);
            }
            throw new FatalTaskException(message);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        } catch (IOException e) {
            process.destroyForcibly();
            throw new TransientTaskException("script execution failed: " + e.getMessage(), e);
        }
    }

    private static String drain(InputStream in) {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransientTaskException("script output read failed: " + e.getMessage(), e);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
