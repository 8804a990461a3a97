package io.tasklane.kubernetes.pod;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.tasklane.kubernetes.config.Images;
import io.tasklane.kubernetes.models.ResourceType;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import io.tasklane.kubernetes.utils.Names;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Containers fetching input resources before the steps and exporting output resources after
 * them.
 */
class ResourceSteps {
    static final String GIT_INIT = "/ko-app/git-init";
    static final String IMAGE_DIGEST_EXPORTER = "/ko-app/imagedigestexporter";

    private final Images images;
    private final Names names;

    ResourceSteps(Images images, Names names) {
        this.images = images;
        this.names = names;
    }

    /**
     * Output directories first, then one fetch container per input.
     */
    List<Container> before(List<BoundResource> inputs, List<BoundResource> outputs) {
        List<Container> containers = new ArrayList<>();

        outputs.stream()
            .filter(resource -> resource.getType() == ResourceType.IMAGE)
            .forEach(resource -> containers.add(createDir(resource)));

        inputs.stream()
            .filter(resource -> resource.getType() == ResourceType.GIT)
            .forEach(resource -> containers.add(gitSource(resource)));

        return containers;
    }

    List<Container> after(List<BoundResource> outputs) throws JsonProcessingException {
        List<BoundResource> imageOutputs = outputs.stream()
            .filter(resource -> resource.getType() == ResourceType.IMAGE)
            .collect(Collectors.toList());

        if (imageOutputs.isEmpty()) {
            return List.of();
        }

        return List.of(imageDigestExporter(imageOutputs));
    }

    private Container createDir(BoundResource resource) {
        return new ContainerBuilder()
            .withName(names.withRandomSuffix("step-create-dir-" + resource.getName()))
            .withImage(images.getShellImage())
            .withCommand("mkdir")
            .withArgs("-p", resource.path())
            .build();
    }

    private Container gitSource(BoundResource resource) {
        return new ContainerBuilder()
            .withName(names.withRandomSuffix("step-git-source-" + resource.getResourceName()))
            .withImage(images.getGitImage())
            .withCommand(GIT_INIT)
            .withArgs(
                "-url", resource.param("url", ""),
                "-revision", resource.param("revision", "master"),
                "-path", resource.path()
            )
            .withWorkingDir(TaskPodBuilder.WORKSPACE_DIR)
            .withEnv(new EnvVarBuilder()
                .withName("TEKTON_RESOURCE_NAME")
                .withValue(resource.getResourceName())
                .build()
            )
            .build();
    }

    private Container imageDigestExporter(List<BoundResource> outputs) throws JsonProcessingException {
        List<Map<String, String>> described = new ArrayList<>();

        for (BoundResource resource : outputs) {
            Map<String, String> image = new LinkedHashMap<>();
            image.put("name", resource.getResourceName());
            image.put("type", ResourceType.IMAGE.getValue());
            image.put("url", resource.param("url", ""));
            image.put("digest", resource.param("digest", ""));
            image.put("OutputImageDir", resource.path());
            described.add(image);
        }

        return new ContainerBuilder()
            .withName(names.withRandomSuffix("step-image-digest-exporter"))
            .withImage(images.getImageDigestExporterImage())
            .withCommand(IMAGE_DIGEST_EXPORTER)
            .withArgs("-images", JacksonMapper.ofJson().writeValueAsString(described))
            .withTerminationMessagePolicy("FallbackToLogsOnError")
            .build();
    }
}
