package io.tasklane.kubernetes.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRunSpec {
    public static final String CANCELLED = "TaskRunCancelled";

    private TaskRef taskRef;
    private TaskSpec taskSpec;
    private TaskRunInputs inputs;
    private TaskRunOutputs outputs;
    private String serviceAccountName;
    private Duration timeout;
    private String status;

    public List<Param> params() {
        return inputs == null || inputs.getParams() == null ? List.of() : inputs.getParams();
    }

    public List<TaskResourceBinding> inputBindings() {
        return inputs == null || inputs.getResources() == null ? List.of() : inputs.getResources();
    }

    public List<TaskResourceBinding> outputBindings() {
        return outputs == null || outputs.getResources() == null ? List.of() : outputs.getResources();
    }
}
