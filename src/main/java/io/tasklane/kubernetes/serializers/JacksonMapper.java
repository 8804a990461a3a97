package io.tasklane.kubernetes.serializers;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Duration;
import java.util.Map;

/**
 * Shared {@link ObjectMapper} instances. Durations are written the way Kubernetes objects carry
 * them ({@code 1h0m0s}), instants as RFC 3339 strings.
 */
abstract public class JacksonMapper {
    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(
        YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build()
    ));

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static ObjectMapper ofJson() {
        return JSON;
    }

    public static ObjectMapper ofYaml() {
        return YAML;
    }

    public static Map<String, Object> toMap(Object object) {
        return JSON.convertValue(object, MAP_TYPE);
    }

    public static <T> T toObject(Object object, Class<T> cls) {
        return JSON.convertValue(object, cls);
    }

    /**
     * Deep copy through the JSON tree, the source is never shared with the result.
     */
    public static <T> T copy(T object, Class<T> cls) {
        if (object == null) {
            return null;
        }

        return JSON.convertValue(JSON.valueToTree(object), cls);
    }

    public static JsonNode tree(Object object) {
        return JSON.valueToTree(object);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        SimpleModule durations = new SimpleModule("go-duration")
            .addSerializer(Duration.class, new GoDurationSerializer())
            .addDeserializer(Duration.class, new GoDurationDeserializer());

        return mapper
            .registerModule(new JavaTimeModule())
            .registerModule(durations)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
