package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonProperty;
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
public class ParamSpec {
    private String name;
    private ParamType type;
    private String description;

    @JsonProperty("default")
    private ArrayOrString defaultValue;

    public ParamType effectiveType() {
        if (type != null) {
            return type;
        }

        return defaultValue != null ? defaultValue.getType() : ParamType.STRING;
    }
}
