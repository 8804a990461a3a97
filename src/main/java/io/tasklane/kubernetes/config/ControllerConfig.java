package io.tasklane.kubernetes.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tasklane.kubernetes.models.Connection;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;

@Builder(toBuilder = true)
@Getter
@Jacksonized
public class ControllerConfig {
    public static final String DEFAULT_RESOURCE = "tasklane-default.yml";

    private final Connection connection;

    /**
     * Applied to runs without an explicit timeout, zero disables the timeout.
     */
    @Builder.Default
    private final Duration defaultTimeout = Duration.ofMinutes(60);

    @Builder.Default
    private final String defaultServiceAccount = "default";

    @Builder.Default
    private final Images images = Images.builder().build();

    @Builder.Default
    private final RegistryConfig registry = RegistryConfig.builder().build();

    @Builder.Default
    private final NotificationConfig notifications = NotificationConfig.builder().build();

    @Builder.Default
    private final int workers = 2;

    @Builder.Default
    private final Duration requeueBaseDelay = Duration.ofMillis(100);

    @Builder.Default
    private final Duration requeueMaxDelay = Duration.ofMinutes(5);

    @Builder.Default
    private final String releaseVersion = "devel";

    @Builder.Default
    private final String managedBy = "tekton-pipelines";

    /**
     * The defaults shipped in {@value #DEFAULT_RESOURCE}.
     */
    public static ControllerConfig defaults() throws IOException {
        return JacksonMapper.ofYaml().treeToValue(defaultTree(), ControllerConfig.class);
    }

    /**
     * Loads a YAML file, keys it leaves out keep their default value.
     */
    public static ControllerConfig load(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream);
        }
    }

    public static ControllerConfig load(InputStream inputStream) throws IOException {
        JsonNode tree = JacksonMapper.ofYaml().readTree(inputStream);
        JsonNode merged = defaultTree();

        if (tree != null && tree.isObject()) {
            merge((ObjectNode) merged, (ObjectNode) tree);
        }

        return JacksonMapper.ofYaml().treeToValue(merged, ControllerConfig.class);
    }

    private static JsonNode defaultTree() throws IOException {
        try (InputStream inputStream = ControllerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (inputStream == null) {
                throw new IOException("Missing '" + DEFAULT_RESOURCE + "' on the classpath");
            }

            JsonNode tree = JacksonMapper.ofYaml().readTree(inputStream);
            return tree == null || tree.isMissingNode() ? JacksonMapper.ofYaml().createObjectNode() : tree;
        }
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();

        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());

            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
