package io.tasklane.kubernetes.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRef {
    private String name;
    private TaskKind kind;
    private String apiVersion;

    public TaskKind effectiveKind() {
        return kind != null ? kind : TaskKind.TASK;
    }
}
