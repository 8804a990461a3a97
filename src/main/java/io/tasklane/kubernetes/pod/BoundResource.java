package io.tasklane.kubernetes.pod;

import io.tasklane.kubernetes.models.PipelineResourceSpec;
import io.tasklane.kubernetes.models.ResourceDeclaration;
import io.tasklane.kubernetes.models.ResourceParam;
import io.tasklane.kubernetes.models.ResourceType;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declared task resource together with the pipeline resource the run binds to it.
 */
@Builder
@Getter
public class BoundResource {
    private final ResourceDeclaration declaration;
    private final String resourceName;
    private final PipelineResourceSpec spec;
    private final boolean output;

    public String getName() {
        return declaration.getName();
    }

    public ResourceType getType() {
        return spec.getType() != null ? spec.getType() : declaration.getType();
    }

    public String path() {
        if (output) {
            return TaskPodBuilder.WORKSPACE_DIR + "/output/" + declaration.getName();
        }

        String target = declaration.getTargetPath() != null && !declaration.getTargetPath().isEmpty() ?
            declaration.getTargetPath() :
            declaration.getName();

        return TaskPodBuilder.WORKSPACE_DIR + "/" + target;
    }

    public String param(String name, String defaultValue) {
        return spec.param(name).orElse(defaultValue);
    }

    /**
     * Values usable as {@code $(inputs.resources.<name>.<key>)}, keyed by {@code <key>}.
     */
    public Map<String, String> replacements() {
        Map<String, String> values = new LinkedHashMap<>();

        if (spec.getParams() != null) {
            for (ResourceParam param : spec.getParams()) {
                if (param.getName() != null && param.getValue() != null) {
                    values.put(param.getName(), param.getValue());
                    values.putIfAbsent(param.getName().toLowerCase(), param.getValue());
                }
            }
        }

        values.put("name", resourceName);
        values.put("type", getType().getValue());
        values.put("path", path());

        return values;
    }
}
