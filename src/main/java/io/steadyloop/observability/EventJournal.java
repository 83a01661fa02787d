package io.steadyloop.observability;

import io.steadyloop.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EventJournal {
    private final Path journalFile;
    private final Clock clock;

    public EventJournal(Path journalFile, Clock clock) {
        this.journalFile = journalFile;
        this.clock = clock;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created by another engine between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event journal: " + journalFile, e);
        }
    }

    public Path journalFile() {
        return journalFile;
    }

    public synchronized void log(JournalEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write event journal", e);
        }
    }

    public synchronized List<String> tail(String actionPrefix, int limit) {
        try {
            List<String> matched = new ArrayList<>();
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                if (actionPrefix == null
                        || Jsons.mapper().readTree(line).path("action").asText("").startsWith(actionPrefix)) {
                    matched.add(line);
                }
            }
            int from = Math.max(0, matched.size() - Math.max(1, limit));
            return List.copyOf(matched.subList(from, matched.size()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read event journal", e);
        }
    }

    public record JournalEvent(
            String action,
            String actor,
            String resource,
            String result,
            String taskId,
            Map<String, Object> details
    ) {
        public static JournalEvent of(String action, String actor, String resource, String result,
                                      String taskId, Map<String, Object> details) {
            return new JournalEvent(action, actor, resource, result, taskId, details == null ? Map.of() : details);
        }
    }
}
