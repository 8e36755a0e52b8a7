package io.macroq.task;

public enum TaskStatus {
    WAITING,
    RUNNING,
    COMPLETE,
    UNKNOWN;

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
