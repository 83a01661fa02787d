package io.steadyloop.model;

import java.util.Locale;

public enum TaskCategory {
    NETWORK,
    DATABASE,
    TIMEOUT,
    RESOURCE,
    DEFAULT;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskCategory fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        for (TaskCategory value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task category: " + raw);
    }

    public static TaskCategory inferFromDescription(String description) {
        if (description == null) {
            return DEFAULT;
        }
        String text = description.toLowerCase(Locale.ROOT);
        if (containsAny(text, "fetch", "request", "api", "web", "http", "download")) {
            return NETWORK;
        }
        if (containsAny(text, "database", "db", "sql", "query")) {
            return DATABASE;
        }
        if (containsAny(text, "timeout", "test")) {
            return TIMEOUT;
        }
        if (containsAny(text, "memory", "cpu", "disk")) {
            return RESOURCE;
        }
        return DEFAULT;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
