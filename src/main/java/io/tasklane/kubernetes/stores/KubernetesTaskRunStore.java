package io.tasklane.kubernetes.stores;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.serializers.JacksonMapper;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads and writes {@code TaskRun} custom resources through the generic resource API, no typed
 * client is generated for them.
 */
public class KubernetesTaskRunStore implements TaskRunStore {
    private final KubernetesClient client;

    public KubernetesTaskRunStore(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<TaskRun> get(String namespace, String name) throws StoreException {
        try {
            GenericKubernetesResource resource = taskRuns()
                .inNamespace(namespace)
                .withName(name)
                .get();

            return Optional.ofNullable(resource).map(KubernetesTaskRunStore::toTaskRun);
        } catch (KubernetesClientException e) {
            throw new StoreException(StoreException.kindOf(e.getCode()), "Unable to get run '" + namespace + "/" + name + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<TaskRun> list() throws StoreException {
        try {
            return taskRuns()
                .inAnyNamespace()
                .list()
                .getItems()
                .stream()
                .map(KubernetesTaskRunStore::toTaskRun)
                .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            throw new StoreException(StoreException.kindOf(e.getCode()), "Unable to list runs: " + e.getMessage(), e);
        }
    }

    @Override
    public TaskRun updateStatus(TaskRun run) throws StoreException {
        try {
            GenericKubernetesResource updated = taskRuns()
                .inNamespace(run.getMetadata().getNamespace())
                .resource(JacksonMapper.toObject(run, GenericKubernetesResource.class))
                .updateStatus();

            return toTaskRun(updated);
        } catch (KubernetesClientException e) {
            throw new StoreException(StoreException.kindOf(e.getCode()), "Unable to update status of '" + run.key() + "': " + e.getMessage(), e);
        }
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> taskRuns() {
        return client.genericKubernetesResources(TaskRun.API_VERSION, TaskRun.KIND);
    }

    static TaskRun toTaskRun(GenericKubernetesResource resource) {
        return JacksonMapper.toObject(resource, TaskRun.class);
    }
}
