package io.tasklane.kubernetes.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import lombok.Builder;
import lombok.Getter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry logins, by registry host, as found in image pull secrets.
 */
public class RegistryCredentials {
    private static final RegistryCredentials ANONYMOUS = new RegistryCredentials(Map.of());

    private final Map<String, Auth> auths;

    private RegistryCredentials(Map<String, Auth> auths) {
        this.auths = auths;
    }

    public static RegistryCredentials anonymous() {
        return ANONYMOUS;
    }

    public static RegistryCredentials of(Map<String, Auth> auths) {
        Map<String, Auth> normalized = new LinkedHashMap<>();
        auths.forEach((host, auth) -> normalized.put(normalize(host), auth));

        return new RegistryCredentials(Map.copyOf(normalized));
    }

    /**
     * Reads a {@code .dockerconfigjson} document, or the legacy {@code .dockercfg} one which has no
     * {@code auths} wrapper.
     */
    public static RegistryCredentials fromDockerConfig(byte[] json) throws IOException {
        JsonNode root = JacksonMapper.ofJson().readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Invalid docker config, expected an object");
        }

        JsonNode entries = root.has("auths") ? root.get("auths") : root;
        Map<String, Auth> auths = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();

            String username = entry.path("username").asText(null);
            String password = entry.path("password").asText(null);

            if ((username == null || password == null) && entry.hasNonNull("auth")) {
                String decoded = new String(Base64.getDecoder().decode(entry.get("auth").asText()), StandardCharsets.UTF_8);
                int separator = decoded.indexOf(':');
                if (separator > 0) {
                    username = decoded.substring(0, separator);
                    password = decoded.substring(separator + 1);
                }
            }

            if (username != null && password != null) {
                auths.put(field.getKey(), Auth.builder().username(username).password(password).build());
            }
        }

        return of(auths);
    }

    public RegistryCredentials merge(RegistryCredentials other) {
        Map<String, Auth> merged = new LinkedHashMap<>(other.auths);
        merged.putAll(this.auths);

        return new RegistryCredentials(Map.copyOf(merged));
    }

    public Optional<Auth> forRegistry(String registry) {
        return Optional.ofNullable(auths.get(normalize(registry)));
    }

    public boolean isAnonymous() {
        return auths.isEmpty();
    }

    static String normalize(String host) {
        String value = host.trim();

        if (value.startsWith("https://")) {
            value = value.substring("https://".length());
        } else if (value.startsWith("http://")) {
            value = value.substring("http://".length());
        }

        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }

        if (value.equals("docker.io") || value.equals("registry-1.docker.io")) {
            value = ImageReference.DOCKER_HUB;
        }

        return value;
    }

    @Builder
    @Getter
    public static class Auth {
        private final String username;
        private final String password;

        public String basic() {
            return "Basic " + Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        }
    }
}
