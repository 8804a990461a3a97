package io.tasklane.kubernetes.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Optional;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRun {
    public static final String API_VERSION = "tekton.dev/v1alpha1";
    public static final String KIND = "TaskRun";

    private String apiVersion;
    private String kind;
    private ObjectMeta metadata;
    private TaskRunSpec spec;
    private TaskRunStatus status;

    public static String key(String namespace, String name) {
        return namespace + "/" + name;
    }

    public String key() {
        return key(metadata.getNamespace(), metadata.getName());
    }

    public TaskRunStatus status() {
        if (status == null) {
            status = new TaskRunStatus();
        }

        return status;
    }

    public Optional<Condition> succeededCondition() {
        return status == null ? Optional.empty() : status.succeededCondition();
    }

    @JsonIgnore
    public boolean isDone() {
        return succeededCondition().map(Condition::isTerminal).orElse(false);
    }

    @JsonIgnore
    public boolean isCancelled() {
        return spec != null && TaskRunSpec.CANCELLED.equals(spec.getStatus());
    }

    public String serviceAccountName(String defaultServiceAccount) {
        if (spec != null && spec.getServiceAccountName() != null && !spec.getServiceAccountName().isEmpty()) {
            return spec.getServiceAccountName();
        }

        return defaultServiceAccount;
    }

    public String selfLink() {
        if (metadata.getSelfLink() != null) {
            return metadata.getSelfLink();
        }

        return "/apis/" + API_VERSION + "/namespaces/" + metadata.getNamespace() + "/taskruns/" + metadata.getName();
    }
}
