package io.tasklane.kubernetes.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Binds a declared task resource to a pipeline resource, by reference or inline.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResourceBinding {
    private String name;
    private PipelineResourceRef resourceRef;
    private PipelineResourceSpec resourceSpec;
    private List<String> paths;
}
