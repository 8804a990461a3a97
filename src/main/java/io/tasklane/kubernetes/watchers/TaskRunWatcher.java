package io.tasklane.kubernetes.watchers;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.tasklane.kubernetes.models.TaskRun;
import org.slf4j.Logger;

import java.util.Optional;
import java.util.function.Consumer;

public class TaskRunWatcher extends AbstractWatch<GenericKubernetesResource> {
    public TaskRunWatcher(Logger logger, Consumer<String> enqueue, Runnable onFailure) {
        super(logger, enqueue, onFailure);
    }

    protected String logContext(GenericKubernetesResource resource) {
        return String.join(
            ", ",
            "Type: " + resource.getKind(),
            "Namespace: " + resource.getMetadata().getNamespace(),
            "Name: " + resource.getMetadata().getName(),
            "Uid: " + resource.getMetadata().getUid()
        );
    }

    protected Optional<String> keyOf(GenericKubernetesResource resource) {
        if (resource.getMetadata() == null || resource.getMetadata().getName() == null) {
            return Optional.empty();
        }

        return Optional.of(TaskRun.key(resource.getMetadata().getNamespace(), resource.getMetadata().getName()));
    }
}
