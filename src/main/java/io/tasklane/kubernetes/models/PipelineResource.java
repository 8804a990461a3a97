package io.tasklane.kubernetes.models;

import io.fabric8.kubernetes.api.model.ObjectMeta;
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
public class PipelineResource {
    public static final String KIND = "PipelineResource";

    private String apiVersion;
    private String kind;
    private ObjectMeta metadata;
    private PipelineResourceSpec spec;
}
