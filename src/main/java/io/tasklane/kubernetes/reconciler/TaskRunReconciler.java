package io.tasklane.kubernetes.reconciler;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.tasklane.kubernetes.config.ControllerConfig;
import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.exceptions.ResultExtractionException;
import io.tasklane.kubernetes.exceptions.TemplatingException;
import io.tasklane.kubernetes.models.Condition;
import io.tasklane.kubernetes.models.ConditionStatus;
import io.tasklane.kubernetes.models.PipelineResourceSpec;
import io.tasklane.kubernetes.models.Reason;
import io.tasklane.kubernetes.models.ResourceResult;
import io.tasklane.kubernetes.models.ResourceType;
import io.tasklane.kubernetes.models.TaskResourceBinding;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.models.TaskRunStatus;
import io.tasklane.kubernetes.models.TaskSpec;
import io.tasklane.kubernetes.pod.TaskPodBuilder;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import io.tasklane.kubernetes.services.NotificationDispatcher;
import io.tasklane.kubernetes.services.PodService;
import io.tasklane.kubernetes.services.ResultExtractor;
import io.tasklane.kubernetes.services.TimeoutHandler;
import io.tasklane.kubernetes.stores.PipelineResourceResolver;
import io.tasklane.kubernetes.stores.PodStore;
import io.tasklane.kubernetes.stores.PodStoreException;
import io.tasklane.kubernetes.stores.StoreException;
import io.tasklane.kubernetes.stores.TaskResolver;
import io.tasklane.kubernetes.stores.TaskRunStore;
import io.tasklane.kubernetes.utils.Durations;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one run towards completion: resolves its task, creates its pod, enforces its timeout and
 * projects the pod state on the run status. Each call is one pass over one run key; passes over
 * the same key are never concurrent.
 */
@Slf4j
@Builder
public class TaskRunReconciler {
    public static final String MESSAGE_RUNNING = "Not all Steps in the Task have finished executing";
    public static final String MESSAGE_SUCCEEDED = "All Steps have completed executing";

    private static final String IMAGE_DIGEST_EXPORTER = PodService.STEP_PREFIX + "image-digest-exporter";

    private final ControllerConfig config;
    private final TaskRunStore runs;
    private final TaskResolver tasks;
    private final PipelineResourceResolver resources;
    private final PodStore pods;
    private final TaskPodBuilder podBuilder;
    private final ResultExtractor resultExtractor;
    private final TimeoutHandler timeouts;
    private final NotificationDispatcher notifications;

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    public ReconcileOutcome reconcile(String key) throws ReconcileException {
        String[] parts = key.split("/", 2);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            log.warn("Ignoring invalid run key '{}'", key);
            return ReconcileOutcome.DONE;
        }

        Optional<TaskRun> found;
        try {
            found = runs.get(parts[0], parts[1]);
        } catch (StoreException e) {
            throw new ReconcileException("Unable to get run '" + key + "'", e);
        }

        if (found.isEmpty()) {
            log.debug("Run '{}' no longer exists", key);
            timeouts.release(key);
            return ReconcileOutcome.DONE;
        }

        TaskRun run = found.get();

        if (run.isDone()) {
            timeouts.release(key);

            if (notifications.dispatch(run)) {
                this.persist(run);
            }

            return ReconcileOutcome.DONE;
        }

        JsonNode before = JacksonMapper.tree(run.status());
        ReconcileOutcome outcome = this.reconcileActive(run);

        if (run.isDone()) {
            if (run.getStatus().getCompletionTime() == null) {
                run.getStatus().setCompletionTime(Instant.now(clock));
            }

            timeouts.release(key);
            log.debug("Run '{}' completed with reason '{}'", key, run.succeededCondition().map(Condition::getReason).orElse(null));
        }

        if (!JacksonMapper.tree(run.getStatus()).equals(before)) {
            run = this.persist(run);
        }

        if (run.isDone() && notifications.dispatch(run)) {
            this.persist(run);
        }

        return outcome;
    }

    private ReconcileOutcome reconcileActive(TaskRun run) throws ReconcileException {
        String namespace = run.getMetadata().getNamespace();
        TaskRunStatus status = run.status();

        if (run.isCancelled()) {
            this.cancel(run);
            return ReconcileOutcome.DONE;
        }

        TaskSpec task;
        Map<String, PipelineResourceSpec> inputs;
        Map<String, PipelineResourceSpec> outputs;
        try {
            task = this.resolveTask(run);
            inputs = this.resolveResources(namespace, run.getSpec().inputBindings());
            outputs = this.resolveResources(namespace, run.getSpec().outputBindings());
        } catch (ResolutionException e) {
            this.fail(run, Reason.FAILED_RESOLUTION, e.getMessage());
            return ReconcileOutcome.DONE;
        }

        NotificationDispatcher.initialize(status, cloudEventTargets(outputs));

        if (status.getStartTime() != null && this.checkTimeout(run)) {
            return ReconcileOutcome.DONE;
        }

        List<Pod> existing;
        try {
            existing = pods.list(namespace, run.getMetadata().getName());
        } catch (PodStoreException e) {
            throw new ReconcileException("Unable to list pods of '" + run.key() + "'", e);
        }

        Pod pod = select(existing, status.getPodName());

        if (pod == null && status.getPodName() != null) {
            this.fail(run, Reason.FAILED, "pod \"" + status.getPodName() + "\" not found");
            return ReconcileOutcome.DONE;
        }

        if (pod == null) {
            return this.createPod(run, task, inputs, outputs);
        }

        if (status.getPodName() == null) {
            status.setPodName(pod.getMetadata().getName());
        }

        if (status.getStartTime() == null) {
            status.setStartTime(Instant.now(clock));
        }

        ReconcileOutcome outcome = this.interpret(run, pod);
        status.setSteps(PodService.stepStates(pod));

        if (!run.isDone()) {
            this.armTimeout(run);
        }

        return outcome;
    }

    private TaskSpec resolveTask(TaskRun run) throws ResolutionException {
        if (run.getSpec().getTaskSpec() != null) {
            return run.getSpec().getTaskSpec();
        }

        if (run.getSpec().getTaskRef() == null) {
            throw new ResolutionException(ResolutionException.Kind.NOT_FOUND, "run has neither a task reference nor an embedded task");
        }

        return tasks.resolve(run.getMetadata().getNamespace(), run.getSpec().getTaskRef());
    }

    private Map<String, PipelineResourceSpec> resolveResources(String namespace, List<TaskResourceBinding> bindings) throws ResolutionException {
        Map<String, PipelineResourceSpec> resolved = new LinkedHashMap<>();

        for (TaskResourceBinding binding : bindings) {
            if (binding.getResourceSpec() != null) {
                resolved.put(binding.getName(), binding.getResourceSpec());
            } else if (binding.getResourceRef() != null && binding.getResourceRef().getName() != null) {
                resolved.put(binding.getName(), resources.resolve(namespace, binding.getResourceRef().getName()));
            } else {
                throw new ResolutionException(
                    ResolutionException.Kind.NOT_FOUND,
                    "resource binding \"" + binding.getName() + "\" has neither a reference nor an embedded spec"
                );
            }
        }

        return resolved;
    }

    private static List<String> cloudEventTargets(Map<String, PipelineResourceSpec> outputs) {
        List<String> targets = new ArrayList<>();

        outputs.values()
            .stream()
            .filter(spec -> spec.getType() == ResourceType.CLOUD_EVENT)
            .forEach(spec -> spec.param("TargetURI").ifPresent(targets::add));

        return targets;
    }

    private static Pod select(List<Pod> candidates, String podName) {
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }

        if (podName == null) {
            return candidates.get(0);
        }

        return candidates.stream()
            .filter(candidate -> podName.equals(candidate.getMetadata().getName()))
            .findFirst()
            .orElse(null);
    }

    private ReconcileOutcome createPod(
        TaskRun run,
        TaskSpec task,
        Map<String, PipelineResourceSpec> inputs,
        Map<String, PipelineResourceSpec> outputs
    ) {
        String name = run.getMetadata().getName();
        TaskRunStatus status = run.status();

        Pod pod;
        try {
            pod = podBuilder.build(run, task, inputs, outputs);
        } catch (TemplatingException e) {
            this.fail(run, Reason.VALIDATION_FAILED, e.getMessage());
            return ReconcileOutcome.DONE;
        } catch (ResolutionException e) {
            this.fail(run, Reason.FAILED_RESOLUTION, e.getMessage());
            return ReconcileOutcome.DONE;
        }

        Pod created;
        try {
            created = pods.create(pod);
        } catch (PodStoreException e) {
            if (e.getKind() == PodStoreException.Kind.FORBIDDEN) {
                if (e.isQuotaExceeded()) {
                    log.debug("Pod of '{}' exceeds the namespace quota, will retry: {}", run.key(), e.getMessage());
                } else {
                    log.debug("Pod of '{}' rejected, will retry: {}", run.key(), e.getMessage());
                }
                this.setCondition(run, ConditionStatus.UNKNOWN, Reason.EXCEEDED_RESOURCE_QUOTA,
                    "TaskRun pod \"" + name + "\" exceeded available resources: " + e.getMessage()
                );
                return ReconcileOutcome.REQUEUE;
            }

            this.fail(run, Reason.COULDNT_GET_TASK, "failed to create task run pod \"" + name + "\": " + e.getMessage());
            return ReconcileOutcome.DONE;
        }

        if (created == null) {
            created = pod;
        }

        status.setPodName(created.getMetadata().getName());
        if (status.getStartTime() == null) {
            status.setStartTime(Instant.now(clock));
        }

        this.setCondition(run, ConditionStatus.UNKNOWN, Reason.PENDING, PodService.waitingMessage(created));
        status.setSteps(PodService.stepStates(created));
        this.armTimeout(run);

        return ReconcileOutcome.DONE;
    }

    /**
     * Arms the remaining timeout of a run already started before this process, so that it expires
     * on time even if no pod event comes in.
     */
    public void resume(TaskRun run) {
        if (run.isDone() || run.getStatus() == null || run.getStatus().getStartTime() == null) {
            return;
        }

        this.armTimeout(run);
    }

    private Duration timeout(TaskRun run) {
        if (run.getSpec().getTimeout() != null) {
            return run.getSpec().getTimeout();
        }

        return config.getDefaultTimeout();
    }

    private void armTimeout(TaskRun run) {
        Duration timeout = this.timeout(run);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }

        Duration elapsed = Duration.between(run.getStatus().getStartTime(), Instant.now(clock));
        Duration remaining = timeout.minus(elapsed);

        timeouts.setTimeout(run.key(), remaining.isNegative() ? Duration.ZERO : remaining);
    }

    private boolean checkTimeout(TaskRun run) {
        Duration timeout = this.timeout(run);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return false;
        }

        Duration elapsed = Duration.between(run.getStatus().getStartTime(), Instant.now(clock));
        if (elapsed.compareTo(timeout) <= 0) {
            return false;
        }

        this.stopPod(run);
        this.fail(
            run,
            Reason.TIMEOUT,
            "TaskRun \"" + run.getMetadata().getName() + "\" failed to finish within \"" + Durations.format(timeout) + "\""
        );

        return true;
    }

    private void cancel(TaskRun run) {
        this.stopPod(run);
        this.fail(run, Reason.CANCELLED, "TaskRun \"" + run.getMetadata().getName() + "\" was cancelled");
    }

    private void stopPod(TaskRun run) {
        String podName = run.status().getPodName();
        if (podName == null) {
            return;
        }

        try {
            pods.stop(run.getMetadata().getNamespace(), podName);
        } catch (PodStoreException e) {
            if (e.getKind() != PodStoreException.Kind.NOT_FOUND) {
                log.warn("Unable to stop pod '{}' of '{}': {}", podName, run.key(), e.getMessage());
            }
        }
    }

    private ReconcileOutcome interpret(TaskRun run, Pod pod) {
        String phase = PodService.phase(pod);

        if (PodService.PHASE_SUCCEEDED.equals(phase)) {
            this.setCondition(run, ConditionStatus.TRUE, Reason.SUCCEEDED, MESSAGE_SUCCEEDED);
            this.extractResults(run, pod);
            return ReconcileOutcome.DONE;
        }

        if (PodService.PHASE_FAILED.equals(phase)) {
            Reason reason = PodService.isOomKilled(pod) ? Reason.OOM_KILLED : Reason.FAILED;
            this.setCondition(run, ConditionStatus.FALSE, reason, PodService.failedMessage(pod));
            return ReconcileOutcome.DONE;
        }

        if (PodService.PHASE_RUNNING.equals(phase)) {
            this.setCondition(run, ConditionStatus.UNKNOWN, Reason.RUNNING, MESSAGE_RUNNING);

            if (!PodService.isReady(pod)) {
                try {
                    pods.markReady(pod.getMetadata().getNamespace(), pod.getMetadata().getName());
                } catch (PodStoreException e) {
                    log.warn("Unable to mark pod '{}' of '{}' ready: {}", pod.getMetadata().getName(), run.key(), e.getMessage());
                    return ReconcileOutcome.REQUEUE;
                }
            }

            return ReconcileOutcome.DONE;
        }

        Optional<ContainerStatus> configError = PodService.createContainerConfigError(pod);
        if (configError.isPresent()) {
            this.setCondition(run, ConditionStatus.FALSE, Reason.CREATE_CONTAINER_CONFIG_ERROR,
                "Failed to create pod due to config error: " + configError.get().getState().getWaiting().getMessage()
            );
            return ReconcileOutcome.DONE;
        }

        if (PodService.isExceedingNodeResources(pod)) {
            this.setCondition(run, ConditionStatus.UNKNOWN, Reason.EXCEEDED_NODE_RESOURCES,
                "TaskRun pod \"" + pod.getMetadata().getName() + "\" exceeded available resources"
            );
            return ReconcileOutcome.DONE;
        }

        this.setCondition(run, ConditionStatus.UNKNOWN, Reason.PENDING, PodService.waitingMessage(pod));
        return ReconcileOutcome.DONE;
    }

    private void extractResults(TaskRun run, Pod pod) {
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return;
        }

        List<ResourceResult> results = new ArrayList<>();

        for (Container container : pod.getSpec().getContainers()) {
            if (!container.getName().startsWith(IMAGE_DIGEST_EXPORTER)) {
                continue;
            }

            String payload = PodService.containerStatus(pod, container.getName())
                .filter(containerStatus -> containerStatus.getState() != null && containerStatus.getState().getTerminated() != null)
                .map(containerStatus -> containerStatus.getState().getTerminated().getMessage())
                .orElse(null);

            try {
                if (payload == null || payload.isBlank()) {
                    payload = pods.containerLog(pod.getMetadata().getNamespace(), pod.getMetadata().getName(), container.getName());
                }

                results.addAll(resultExtractor.extract(payload));
            } catch (PodStoreException | ResultExtractionException e) {
                log.warn("Unable to extract results of '{}' from container '{}': {}", run.key(), container.getName(), e.getMessage());
                return;
            }
        }

        if (!results.isEmpty()) {
            run.status().setResourcesResult(results);
        }
    }

    private void fail(TaskRun run, Reason reason, String message) {
        log.debug("Run '{}' failed with reason '{}': {}", run.key(), reason, message);
        this.setCondition(run, ConditionStatus.FALSE, reason, message);
    }

    private void setCondition(TaskRun run, ConditionStatus status, Reason reason, String message) {
        if (run.isDone()) {
            log.debug("Run '{}' is already done, ignoring '{}'", run.key(), reason);
            return;
        }

        run.status().setSucceededCondition(Condition.succeeded(status, reason, message, Instant.now(clock)));
    }

    private TaskRun persist(TaskRun run) throws ReconcileException {
        try {
            TaskRun updated = runs.updateStatus(run);
            return updated != null ? updated : run;
        } catch (StoreException e) {
            throw new ReconcileException("Unable to update status of '" + run.key() + "'", e);
        }
    }
}
