package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskKind {
    TASK("Task"),
    CLUSTER_TASK("ClusterTask");

    private final String value;

    TaskKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TaskKind from(String value) {
        if (value == null || value.isEmpty()) {
            return TASK;
        }

        for (TaskKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }

        throw new IllegalArgumentException("Unknown task kind '" + value + "'");
    }
}
