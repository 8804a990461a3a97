package io.tasklane.kubernetes.models;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A namespaced {@code Task} or a cluster scoped {@code ClusterTask}, both carry the same spec.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private String apiVersion;
    private String kind;
    private ObjectMeta metadata;
    private TaskSpec spec;
}
