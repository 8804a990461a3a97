package io.tasklane.kubernetes.models;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Volume;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * The reusable template: ordered steps, volumes and the params and resources they may reference.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSpec {
    private List<Container> steps;
    private List<Volume> volumes;
    private TaskInputs inputs;
    private TaskOutputs outputs;

    public List<ParamSpec> paramSpecs() {
        return inputs == null || inputs.getParams() == null ? List.of() : inputs.getParams();
    }

    public List<ResourceDeclaration> inputResources() {
        return inputs == null || inputs.getResources() == null ? List.of() : inputs.getResources();
    }

    public List<ResourceDeclaration> outputResources() {
        return outputs == null || outputs.getResources() == null ? List.of() : outputs.getResources();
    }
}
