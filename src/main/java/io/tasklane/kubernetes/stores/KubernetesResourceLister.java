package io.tasklane.kubernetes.stores;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.models.PipelineResource;
import io.tasklane.kubernetes.models.PipelineResourceSpec;
import io.tasklane.kubernetes.models.Task;
import io.tasklane.kubernetes.models.TaskKind;
import io.tasklane.kubernetes.models.TaskRef;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.models.TaskSpec;
import io.tasklane.kubernetes.serializers.JacksonMapper;

import java.util.function.Supplier;

/**
 * Looks up tasks, cluster tasks and pipeline resources. Errors other than a missing object are
 * left to the caller as {@link KubernetesClientException} so the run is retried.
 */
public class KubernetesResourceLister implements TaskResolver, PipelineResourceResolver {
    private final KubernetesClient client;

    public KubernetesResourceLister(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public TaskSpec resolve(String namespace, TaskRef ref) throws ResolutionException {
        if (ref == null || ref.getName() == null || ref.getName().isEmpty()) {
            throw new ResolutionException(ResolutionException.Kind.NOT_FOUND, "task reference has no name");
        }

        TaskKind kind = ref.effectiveKind();
        String apiVersion = ref.getApiVersion() != null ? ref.getApiVersion() : TaskRun.API_VERSION;

        GenericKubernetesResource resource = get(() -> kind == TaskKind.CLUSTER_TASK ?
            client.genericKubernetesResources(apiVersion, kind.getValue()).withName(ref.getName()).get() :
            client.genericKubernetesResources(apiVersion, kind.getValue()).inNamespace(namespace).withName(ref.getName()).get()
        );

        if (resource == null) {
            throw new ResolutionException(
                ResolutionException.Kind.NOT_FOUND,
                kind.getValue() + " \"" + ref.getName() + "\" not found" + (kind == TaskKind.TASK ? " in namespace \"" + namespace + "\"" : "")
            );
        }

        Task task = JacksonMapper.toObject(resource, Task.class);
        if (task.getKind() != null && !task.getKind().equals(kind.getValue())) {
            throw new ResolutionException(
                ResolutionException.Kind.KIND_MISMATCH,
                "\"" + ref.getName() + "\" is a " + task.getKind() + ", not a " + kind.getValue()
            );
        }

        if (task.getSpec() == null) {
            throw new ResolutionException(ResolutionException.Kind.NOT_FOUND, kind.getValue() + " \"" + ref.getName() + "\" has no spec");
        }

        return task.getSpec();
    }

    @Override
    public PipelineResourceSpec resolve(String namespace, String name) throws ResolutionException {
        GenericKubernetesResource resource = get(() -> client.genericKubernetesResources(TaskRun.API_VERSION, PipelineResource.KIND)
            .inNamespace(namespace)
            .withName(name)
            .get()
        );

        if (resource == null) {
            throw new ResolutionException(
                ResolutionException.Kind.NOT_FOUND,
                "PipelineResource \"" + name + "\" not found in namespace \"" + namespace + "\""
            );
        }

        PipelineResource pipelineResource = JacksonMapper.toObject(resource, PipelineResource.class);
        if (pipelineResource.getSpec() == null) {
            throw new ResolutionException(ResolutionException.Kind.NOT_FOUND, "PipelineResource \"" + name + "\" has no spec");
        }

        return pipelineResource.getSpec();
    }

    private static GenericKubernetesResource get(Supplier<GenericKubernetesResource> lookup) {
        try {
            return lookup.get();
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                return null;
            }

            throw e;
        }
    }
}
