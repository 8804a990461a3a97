package io.tasklane.kubernetes.watchers;

import io.fabric8.kubernetes.api.model.Pod;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.pod.TaskPodBuilder;
import io.tasklane.kubernetes.services.PodService;
import org.slf4j.Logger;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Requeues the owning run whenever one of its pods changes.
 */
public class PodWatcher extends AbstractWatch<Pod> {
    public PodWatcher(Logger logger, Consumer<String> enqueue, Runnable onFailure) {
        super(logger, enqueue, onFailure);
    }

    protected String logContext(Pod resource) {
        return String.join(
            ", ",
            "Type: " + resource.getClass().getSimpleName(),
            "Namespace: " + resource.getMetadata().getNamespace(),
            "Name: " + resource.getMetadata().getName(),
            "Uid: " + resource.getMetadata().getUid(),
            "Phase: " + PodService.phase(resource)
        );
    }

    protected Optional<String> keyOf(Pod resource) {
        if (resource.getMetadata() == null || resource.getMetadata().getLabels() == null) {
            return Optional.empty();
        }

        return Optional.ofNullable(resource.getMetadata().getLabels().get(TaskPodBuilder.LABEL_TASK_RUN))
            .map(run -> TaskRun.key(resource.getMetadata().getNamespace(), run));
    }
}
