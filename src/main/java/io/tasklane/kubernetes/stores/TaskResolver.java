package io.tasklane.kubernetes.stores;

import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.models.TaskRef;
import io.tasklane.kubernetes.models.TaskSpec;

public interface TaskResolver {
    /**
     * Resolves a namespaced {@code Task} or a cluster scoped {@code ClusterTask}.
     *
     * @throws ResolutionException of kind {@code NOT_FOUND} or {@code KIND_MISMATCH}
     */
    TaskSpec resolve(String namespace, TaskRef ref) throws ResolutionException;
}
