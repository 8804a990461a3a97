package io.tasklane.kubernetes.stores;

import io.tasklane.kubernetes.models.TaskRun;

import java.util.List;
import java.util.Optional;

public interface TaskRunStore {
    Optional<TaskRun> get(String namespace, String name) throws StoreException;

    /**
     * Every run of every namespace the controller watches.
     */
    List<TaskRun> list() throws StoreException;

    /**
     * Writes the status subresource only.
     */
    TaskRun updateStatus(TaskRun run) throws StoreException;
}
