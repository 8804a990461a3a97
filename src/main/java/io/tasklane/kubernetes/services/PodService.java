package io.tasklane.kubernetes.services;

import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.tasklane.kubernetes.models.StepState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the state of a task pod: phase, per step container states and failure details.
 */
abstract public class PodService {
    public static final String STEP_PREFIX = "step-";
    public static final String READY_ANNOTATION = "tekton.dev/ready";
    public static final String READY_VALUE = "READY";

    public static final String PHASE_PENDING = "Pending";
    public static final String PHASE_RUNNING = "Running";
    public static final String PHASE_SUCCEEDED = "Succeeded";
    public static final String PHASE_FAILED = "Failed";

    public static PodResource podRef(KubernetesClient client, String namespace, String name) {
        return client.pods()
            .inNamespace(namespace)
            .withName(name);
    }

    public static String phase(Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getPhase() == null) {
            return PHASE_PENDING;
        }

        return pod.getStatus().getPhase();
    }

    public static boolean isReady(Pod pod) {
        Map<String, String> annotations = pod.getMetadata() == null ? null : pod.getMetadata().getAnnotations();

        return annotations != null && READY_VALUE.equals(annotations.get(READY_ANNOTATION));
    }

    public static List<ContainerStatus> containerStatuses(Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null) {
            return List.of();
        }

        return pod.getStatus().getContainerStatuses();
    }

    public static Optional<ContainerStatus> containerStatus(Pod pod, String container) {
        return containerStatuses(pod)
            .stream()
            .filter(containerStatus -> container.equals(containerStatus.getName()))
            .findFirst();
    }

    /**
     * States of the step containers, in the order the pod declares them.
     */
    public static List<StepState> stepStates(Pod pod) {
        List<StepState> steps = new ArrayList<>();

        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return steps;
        }

        pod.getSpec()
            .getContainers()
            .stream()
            .filter(container -> container.getName().startsWith(STEP_PREFIX))
            .forEach(container -> containerStatus(pod, container.getName())
                .ifPresent(containerStatus -> steps.add(StepState.builder()
                    .name(container.getName().substring(STEP_PREFIX.length()))
                    .container(container.getName())
                    .imageID(containerStatus.getImageID())
                    .waiting(containerStatus.getState() == null ? null : containerStatus.getState().getWaiting())
                    .running(containerStatus.getState() == null ? null : containerStatus.getState().getRunning())
                    .terminated(containerStatus.getState() == null ? null : containerStatus.getState().getTerminated())
                    .build()
                ))
            );

        return steps;
    }

    public static boolean isOomKilled(Pod pod) {
        return allStatuses(pod)
            .anyMatch(containerStatus -> containerStatus.getState() != null &&
                containerStatus.getState().getTerminated() != null &&
                "OOMKilled".equals(containerStatus.getState().getTerminated().getReason())
            );
    }

    /**
     * The pod could not be scheduled because no node has enough cpu or memory left.
     */
    public static boolean isExceedingNodeResources(Pod pod) {
        return conditions(pod)
            .stream()
            .anyMatch(condition -> "PodScheduled".equals(condition.getType()) &&
                "False".equals(condition.getStatus()) &&
                "Unschedulable".equals(condition.getReason()) &&
                condition.getMessage() != null &&
                condition.getMessage().contains("Insufficient")
            );
    }

    public static Optional<ContainerStatus> createContainerConfigError(Pod pod) {
        return allStatuses(pod)
            .filter(containerStatus -> containerStatus.getState() != null &&
                containerStatus.getState().getWaiting() != null &&
                "CreateContainerConfigError".equals(containerStatus.getState().getWaiting().getReason())
            )
            .findFirst();
    }

    public static String waitingMessage(Pod pod) {
        Optional<String> waiting = containerStatuses(pod)
            .stream()
            .filter(containerStatus -> containerStatus.getState() != null && containerStatus.getState().getWaiting() != null)
            .map(containerStatus -> {
                String detail = containerStatus.getState().getWaiting().getMessage();
                if (detail == null || detail.isEmpty()) {
                    detail = containerStatus.getState().getWaiting().getReason();
                }

                return detail == null || detail.isEmpty() ? null :
                    "build step \"" + containerStatus.getName() + "\" is pending with reason \"" + detail + "\"";
            })
            .filter(Objects::nonNull)
            .findFirst();

        if (waiting.isPresent()) {
            return waiting.get();
        }

        Optional<String> unscheduled = conditions(pod)
            .stream()
            .filter(condition -> "PodScheduled".equals(condition.getType()) && "False".equals(condition.getStatus()))
            .map(condition -> "pod status \"" + condition.getType() + "\":\"" + condition.getStatus() + "\"; message: \"" + condition.getMessage() + "\"")
            .findFirst();

        if (unscheduled.isPresent()) {
            return unscheduled.get();
        }

        if (pod.getStatus() != null && pod.getStatus().getMessage() != null && !pod.getStatus().getMessage().isEmpty()) {
            return "pod status message: " + pod.getStatus().getMessage();
        }

        return "Pending";
    }

    /**
     * Describes the first container that exited with a non zero code, falling back on the pod
     * message.
     */
    public static String failedMessage(Pod pod) {
        if (pod.getStatus() == null) {
            return "Pod terminated without any status";
        }

        String namespace = pod.getMetadata().getNamespace();
        String name = pod.getMetadata().getName();

        return allStatuses(pod)
            .filter(containerStatus -> containerStatus.getState() != null &&
                containerStatus.getState().getTerminated() != null &&
                containerStatus.getState().getTerminated().getExitCode() != null &&
                containerStatus.getState().getTerminated().getExitCode() != 0
            )
            .findFirst()
            .map(containerStatus -> "\"" + containerStatus.getName() + "\" exited with code " +
                containerStatus.getState().getTerminated().getExitCode() +
                " (image: \"" + containerStatus.getImageID() + "\"); " +
                "for logs run: kubectl -n " + namespace + " logs " + name + " -c " + containerStatus.getName()
            )
            .orElseGet(() -> pod.getStatus().getMessage() != null && !pod.getStatus().getMessage().isEmpty() ?
                pod.getStatus().getMessage() :
                "build failed for unspecified reasons."
            );
    }

    private static Stream<ContainerStatus> allStatuses(Pod pod) {
        if (pod.getStatus() == null) {
            return Stream.empty();
        }

        List<ContainerStatus> init = pod.getStatus().getInitContainerStatuses() == null ? List.of() : pod.getStatus().getInitContainerStatuses();

        return Stream.concat(init.stream(), containerStatuses(pod).stream());
    }

    private static List<PodCondition> conditions(Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getConditions() == null) {
            return List.of();
        }

        return pod.getStatus().getConditions();
    }
}
