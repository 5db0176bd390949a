package io.conductor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status must not be blank");
        }
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
