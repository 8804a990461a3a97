package io.tasklane.kubernetes.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Optional;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResourceSpec {
    private ResourceType type;
    private List<ResourceParam> params;

    /**
     * Params are matched case-insensitively, {@code TargetURI} and {@code targeturi} are the same.
     */
    public Optional<String> param(String name) {
        if (params == null) {
            return Optional.empty();
        }

        return params.stream()
            .filter(param -> param.getName() != null && param.getName().equalsIgnoreCase(name))
            .map(ResourceParam::getValue)
            .findFirst();
    }
}
