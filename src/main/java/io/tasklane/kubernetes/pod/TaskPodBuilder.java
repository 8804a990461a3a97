package io.tasklane.kubernetes.pod;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.tasklane.kubernetes.config.ControllerConfig;
import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.exceptions.TemplatingException;
import io.tasklane.kubernetes.models.ArrayOrString;
import io.tasklane.kubernetes.models.Param;
import io.tasklane.kubernetes.models.ParamSpec;
import io.tasklane.kubernetes.models.ParamType;
import io.tasklane.kubernetes.models.PipelineResourceSpec;
import io.tasklane.kubernetes.models.ResourceDeclaration;
import io.tasklane.kubernetes.models.TaskResourceBinding;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.models.TaskSpec;
import io.tasklane.kubernetes.registry.ImageReference;
import io.tasklane.kubernetes.services.PodService;
import io.tasklane.kubernetes.services.SubstitutionService;
import io.tasklane.kubernetes.utils.Names;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the pod running a task. The platform starts all containers of a pod at once, so every
 * container is wrapped in the entrypoint binary which waits for the file posted by the previous
 * container before running the real command, then posts its own:
 * <pre>
 * /tekton/tools/entrypoint -wait_file /tekton/tools/0 -post_file /tekton/tools/1 -entrypoint cmd -- args...
 * </pre>
 * The first container waits on the downward API readiness file, written once the pod is marked
 * ready.
 */
@Slf4j
public class TaskPodBuilder {
    public static final String WORKSPACE_DIR = "/workspace";
    public static final String HOME_DIR = "/tekton/home";
    public static final String TOOLS_DIR = "/tekton/tools";
    public static final String ENTRYPOINT_BINARY = TOOLS_DIR + "/entrypoint";
    public static final String DOWNWARD_DIR = "/tekton/downward";
    public static final String READY_FILE = DOWNWARD_DIR + "/ready";

    public static final String TOOLS_VOLUME = "tekton-internal-tools";
    public static final String WORKSPACE_VOLUME = "tekton-internal-workspace";
    public static final String HOME_VOLUME = "tekton-internal-home";
    public static final String DOWNWARD_VOLUME = "tekton-internal-downward";

    public static final String INIT_CONTAINER = "place-tools";
    public static final String ENTRYPOINT_SOURCE = "/ko-app/entrypoint";

    public static final String LABEL_TASK_RUN = "tekton.dev/taskRun";
    public static final String LABEL_TASK = "tekton.dev/task";
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String ANNOTATION_RELEASE = "pipeline.tekton.dev/release";

    private static final VolumeMount TOOLS_MOUNT = new VolumeMountBuilder().withName(TOOLS_VOLUME).withMountPath(TOOLS_DIR).build();
    private static final VolumeMount DOWNWARD_MOUNT = new VolumeMountBuilder().withName(DOWNWARD_VOLUME).withMountPath(DOWNWARD_DIR).build();
    private static final VolumeMount WORKSPACE_MOUNT = new VolumeMountBuilder().withName(WORKSPACE_VOLUME).withMountPath(WORKSPACE_DIR).build();
    private static final VolumeMount HOME_MOUNT = new VolumeMountBuilder().withName(HOME_VOLUME).withMountPath(HOME_DIR).build();

    private final ControllerConfig config;
    private final EntrypointCache entrypointCache;
    private final Names names;
    private final ResourceSteps resourceSteps;

    public TaskPodBuilder(ControllerConfig config, EntrypointCache entrypointCache, Names names) {
        this.config = config;
        this.entrypointCache = entrypointCache;
        this.names = names;
        this.resourceSteps = new ResourceSteps(config.getImages(), names);
    }

    /**
     * @param inputs resolved input resources, by binding name
     * @param outputs resolved output resources, by binding name
     * @throws TemplatingException when the run does not provide what the task declares
     * @throws ResolutionException when the entrypoint of a step image could not be resolved
     */
    public Pod build(
        TaskRun run,
        TaskSpec task,
        Map<String, PipelineResourceSpec> inputs,
        Map<String, PipelineResourceSpec> outputs
    ) throws TemplatingException, ResolutionException {
        String namespace = run.getMetadata().getNamespace();
        String serviceAccount = run.serviceAccountName(config.getDefaultServiceAccount());

        List<BoundResource> boundInputs = bind(run.getSpec().inputBindings(), task.inputResources(), inputs, false);
        List<BoundResource> boundOutputs = bind(run.getSpec().outputBindings(), task.outputResources(), outputs, true);

        SubstitutionService substitution = substitution(run, task, boundInputs, boundOutputs);

        List<Container> steps = new ArrayList<>();
        List<Container> declared = task.getSteps() == null ? List.of() : task.getSteps();
        for (int i = 0; i < declared.size(); i++) {
            Container step = substitution.apply(declared.get(i), Container.class);
            String name = step.getName() == null || step.getName().isEmpty() ? "unnamed-" + i : step.getName();
            step.setName(PodService.STEP_PREFIX + name);

            steps.add(this.resolveEntrypoint(step, namespace, serviceAccount));
        }

        List<Container> containers = new ArrayList<>(resourceSteps.before(boundInputs, boundOutputs));
        containers.addAll(steps);
        try {
            containers.addAll(resourceSteps.after(boundOutputs));
        } catch (JsonProcessingException e) {
            throw new TemplatingException("Unable to describe output images: " + e.getMessage());
        }

        List<Container> sequenced = new ArrayList<>();
        for (int i = 0; i < containers.size(); i++) {
            sequenced.add(sequence(containers.get(i), i));
        }

        List<Volume> volumes = new ArrayList<>(implicitVolumes());
        volumes.addAll(substitution.applyAll(task.getVolumes(), Volume.class));

        Pod pod = new PodBuilder()
            .withMetadata(metadata(run))
            .withSpec(new PodSpecBuilder()
                .withRestartPolicy("Never")
                .withServiceAccountName(serviceAccount)
                .withInitContainers(placeTools())
                .withContainers(sequenced)
                .withVolumes(volumes)
                .build()
            )
            .build();

        log.debug("Built pod '{}' for '{}' with {} containers", pod.getMetadata().getName(), run.key(), sequenced.size());

        return pod;
    }

    /**
     * Bound values win over declared defaults; a declared param without either is an error.
     */
    static Map<String, ArrayOrString> effectiveParams(TaskRun run, TaskSpec task) throws TemplatingException {
        Map<String, ArrayOrString> bound = new HashMap<>();
        for (Param param : run.getSpec().params()) {
            bound.put(param.getName(), param.getValue());
        }

        Map<String, ArrayOrString> effective = new LinkedHashMap<>();
        for (ParamSpec spec : task.paramSpecs()) {
            ArrayOrString value = bound.containsKey(spec.getName()) ? bound.get(spec.getName()) : spec.getDefaultValue();

            if (value == null) {
                throw new TemplatingException("missing value for param \"" + spec.getName() + "\"");
            }

            if (value.getType() != spec.effectiveType()) {
                throw new TemplatingException(
                    "param \"" + spec.getName() + "\" should be of type " + spec.effectiveType().getValue() +
                        " but got " + value.getType().getValue()
                );
            }

            effective.put(spec.getName(), value);
        }

        return effective;
    }

    private static List<BoundResource> bind(
        List<TaskResourceBinding> bindings,
        List<ResourceDeclaration> declarations,
        Map<String, PipelineResourceSpec> resolved,
        boolean output
    ) throws TemplatingException {
        List<BoundResource> bound = new ArrayList<>();
        String direction = output ? "output" : "input";

        for (ResourceDeclaration declaration : declarations) {
            Optional<TaskResourceBinding> binding = bindings.stream()
                .filter(candidate -> declaration.getName().equals(candidate.getName()))
                .findFirst();

            PipelineResourceSpec spec = resolved.get(declaration.getName());
            if (binding.isEmpty() || spec == null) {
                throw new TemplatingException("missing " + direction + " resource \"" + declaration.getName() + "\"");
            }

            if (declaration.getType() != null && spec.getType() != null && declaration.getType() != spec.getType()) {
                throw new TemplatingException(
                    direction + " resource \"" + declaration.getName() + "\" should be of type " + declaration.getType().getValue() +
                        " but got " + spec.getType().getValue()
                );
            }

            String resourceName = binding.get().getResourceRef() != null && binding.get().getResourceRef().getName() != null ?
                binding.get().getResourceRef().getName() :
                declaration.getName();

            bound.add(BoundResource.builder()
                .declaration(declaration)
                .resourceName(resourceName)
                .spec(spec)
                .output(output)
                .build()
            );
        }

        return bound;
    }

    private static SubstitutionService substitution(
        TaskRun run,
        TaskSpec task,
        List<BoundResource> inputs,
        List<BoundResource> outputs
    ) throws TemplatingException {
        Map<String, String> strings = new HashMap<>();
        Map<String, List<String>> arrays = new HashMap<>();

        for (Map.Entry<String, ArrayOrString> param : effectiveParams(run, task).entrySet()) {
            String key = "inputs.params." + param.getKey();

            if (param.getValue().getType() == ParamType.ARRAY) {
                arrays.put(key, param.getValue().getArrayVal());
            } else {
                strings.put(key, param.getValue().getStringVal());
            }
        }

        for (BoundResource resource : inputs) {
            resource.replacements().forEach((name, value) -> strings.put("inputs.resources." + resource.getName() + "." + name, value));
        }

        for (BoundResource resource : outputs) {
            resource.replacements().forEach((name, value) -> strings.put("outputs.resources." + resource.getName() + "." + name, value));
        }

        return SubstitutionService.of(strings, arrays);
    }

    /**
     * Steps without a command run the image entrypoint, which only the registry knows; the image is
     * pinned to the digest the entrypoint was read from.
     */
    private Container resolveEntrypoint(Container step, String namespace, String serviceAccount) throws ResolutionException {
        boolean explicit = step.getCommand() != null && !step.getCommand().isEmpty();

        if (explicit) {
            if (!config.getRegistry().isResolveDigestForExplicitCommand() || isPinned(step.getImage())) {
                return step;
            }
        }

        ResolvedEntrypoint resolved = entrypointCache.get(step.getImage(), namespace, serviceAccount);
        step.setImage(resolved.getImage());

        if (!explicit) {
            if (resolved.getCommand() == null || resolved.getCommand().isEmpty()) {
                throw new ResolutionException(
                    ResolutionException.Kind.ENTRYPOINT,
                    "image \"" + resolved.getImage() + "\" of step \"" + step.getName() + "\" has no entrypoint nor command"
                );
            }

            step.setCommand(new ArrayList<>(resolved.getCommand()));
        }

        return step;
    }

    private static boolean isPinned(String image) throws ResolutionException {
        try {
            return ImageReference.parse(image).isPinned();
        } catch (IllegalArgumentException e) {
            throw new ResolutionException(ResolutionException.Kind.ENTRYPOINT, e.getMessage(), e);
        }
    }

    private static Container sequence(Container container, int index) {
        List<String> command = container.getCommand();

        List<String> args = new ArrayList<>();
        if (index == 0) {
            args.add("-wait_file");
            args.add(READY_FILE);
            args.add("-wait_file_content");
        } else {
            args.add("-wait_file");
            args.add(TOOLS_DIR + "/" + (index - 1));
        }

        args.add("-post_file");
        args.add(TOOLS_DIR + "/" + index);
        args.add("-entrypoint");
        args.add(command.get(0));
        args.add("--");
        args.addAll(command.subList(1, command.size()));
        if (container.getArgs() != null) {
            args.addAll(container.getArgs());
        }

        List<VolumeMount> mounts = new ArrayList<>();
        mounts.add(TOOLS_MOUNT);
        if (index == 0) {
            mounts.add(DOWNWARD_MOUNT);
        }
        mounts.add(WORKSPACE_MOUNT);
        mounts.add(HOME_MOUNT);
        if (container.getVolumeMounts() != null) {
            mounts.addAll(container.getVolumeMounts());
        }

        List<EnvVar> env = new ArrayList<>();
        boolean hasHome = container.getEnv() != null && container.getEnv().stream().anyMatch(var -> "HOME".equals(var.getName()));
        if (!hasHome) {
            env.add(new EnvVarBuilder().withName("HOME").withValue(HOME_DIR).build());
        }
        if (container.getEnv() != null) {
            env.addAll(container.getEnv());
        }

        return new ContainerBuilder(container)
            .withCommand(ENTRYPOINT_BINARY)
            .withArgs(args)
            .withVolumeMounts(mounts)
            .withEnv(env)
            .withWorkingDir(container.getWorkingDir() == null || container.getWorkingDir().isEmpty() ? WORKSPACE_DIR : container.getWorkingDir())
            .build();
    }

    private Container placeTools() {
        return new ContainerBuilder()
            .withName(INIT_CONTAINER)
            .withImage(config.getImages().getEntrypointImage())
            .withCommand("cp", ENTRYPOINT_SOURCE, ENTRYPOINT_BINARY)
            .withVolumeMounts(TOOLS_MOUNT)
            .build();
    }

    private static List<Volume> implicitVolumes() {
        return List.of(
            new VolumeBuilder().withName(WORKSPACE_VOLUME).withNewEmptyDir().endEmptyDir().build(),
            new VolumeBuilder().withName(HOME_VOLUME).withNewEmptyDir().endEmptyDir().build(),
            new VolumeBuilder().withName(TOOLS_VOLUME).withNewEmptyDir().endEmptyDir().build(),
            new VolumeBuilder()
                .withName(DOWNWARD_VOLUME)
                .withNewDownwardAPI()
                .addNewItem()
                .withPath("ready")
                .withNewFieldRef()
                .withFieldPath("metadata.annotations['" + PodService.READY_ANNOTATION + "']")
                .endFieldRef()
                .endItem()
                .endDownwardAPI()
                .build()
        );
    }

    private ObjectMeta metadata(TaskRun run) {
        ObjectMeta runMetadata = run.getMetadata();

        Map<String, String> labels = new LinkedHashMap<>();
        if (runMetadata.getLabels() != null) {
            labels.putAll(runMetadata.getLabels());
        }
        if (run.getSpec().getTaskRef() != null && run.getSpec().getTaskRef().getName() != null) {
            labels.put(LABEL_TASK, run.getSpec().getTaskRef().getName());
        }
        labels.put(LABEL_TASK_RUN, runMetadata.getName());
        labels.put(LABEL_MANAGED_BY, config.getManagedBy());

        Map<String, String> annotations = new LinkedHashMap<>();
        if (runMetadata.getAnnotations() != null) {
            annotations.putAll(runMetadata.getAnnotations());
        }
        annotations.put(ANNOTATION_RELEASE, config.getReleaseVersion());

        return new ObjectMetaBuilder()
            .withName(names.withRandomSuffix(runMetadata.getName() + "-pod"))
            .withNamespace(runMetadata.getNamespace())
            .withLabels(labels)
            .withAnnotations(annotations)
            .withOwnerReferences(new OwnerReferenceBuilder()
                .withApiVersion(TaskRun.API_VERSION)
                .withKind(TaskRun.KIND)
                .withName(runMetadata.getName())
                .withUid(runMetadata.getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build()
            )
            .build();
    }
}
