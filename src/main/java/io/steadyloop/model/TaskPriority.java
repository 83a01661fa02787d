package io.steadyloop.model;

public enum TaskPriority {
    CRITICAL(1),
    HIGH(2),
    NORMAL(3),
    LOW(4);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static TaskPriority fromRank(int rank) {
        for (TaskPriority value : values()) {
            if (value.rank == rank) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }

    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        String trimmed = raw.trim();
        for (TaskPriority value : values()) {
            if (value.name().equalsIgnoreCase(trimmed) || String.valueOf(value.rank).equals(trimmed)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
