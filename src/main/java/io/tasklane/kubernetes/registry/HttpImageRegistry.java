package io.tasklane.kubernetes.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.hash.Hashing;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Docker Registry HTTP API v2 client reading image manifests and configs, authenticating with
 * bearer tokens or basic auth as the registry asks for.
 */
@Slf4j
public class HttpImageRegistry implements ImageRegistry {
    static final String DOCKER_MANIFEST = "application/vnd.docker.distribution.manifest.v2+json";
    static final String DOCKER_MANIFEST_LIST = "application/vnd.docker.distribution.manifest.list.v2+json";
    static final String OCI_MANIFEST = "application/vnd.oci.image.manifest.v1+json";
    static final String OCI_INDEX = "application/vnd.oci.image.index.v1+json";

    private static final String ACCEPT = String.join(", ", DOCKER_MANIFEST, DOCKER_MANIFEST_LIST, OCI_MANIFEST, OCI_INDEX);
    private static final Pattern CHALLENGE_PARAM = Pattern.compile("(\\w+)=\"([^\"]*)\"");
    private static final int MAX_REDIRECTS = 5;

    private final HttpClient http;
    private final Duration timeout;
    private final Set<String> insecureRegistries;

    public HttpImageRegistry(Duration timeout, List<String> insecureRegistries) {
        this.timeout = timeout;
        this.insecureRegistries = Set.copyOf(insecureRegistries);
        this.http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public ImageConfig fetch(ImageReference reference, RegistryCredentials credentials) throws IOException {
        Session session = new Session(reference, credentials);

        Manifest manifest = manifest(session, reference.reference());
        if (manifest.isIndex()) {
            String platform = platformDigest(reference, manifest.body);
            manifest = manifest(session, platform);
        }

        String configDigest = manifest.body.path("config").path("digest").asText(null);
        if (configDigest == null) {
            throw new IOException("Manifest of '" + reference + "' has no config");
        }

        HttpResponse<byte[]> response = get(session, "/blobs/" + configDigest, "application/json, */*");
        JsonNode config = JacksonMapper.ofJson().readTree(response.body()).path("config");

        return ImageConfig.builder()
            .digest(manifest.digest)
            .entrypoint(strings(config.path("Entrypoint")))
            .cmd(strings(config.path("Cmd")))
            .build();
    }

    private Manifest manifest(Session session, String reference) throws IOException {
        HttpResponse<byte[]> response = get(session, "/manifests/" + reference, ACCEPT);

        String digest = response.headers()
            .firstValue("Docker-Content-Digest")
            .orElseGet(() -> "sha256:" + Hashing.sha256().hashBytes(response.body()).toString());

        JsonNode body = JacksonMapper.ofJson().readTree(response.body());
        String mediaType = body.path("mediaType").asText(response.headers().firstValue("Content-Type").orElse(""));

        return new Manifest(digest, mediaType, body);
    }

    private static String platformDigest(ImageReference reference, JsonNode index) throws IOException {
        JsonNode selected = null;

        for (JsonNode entry : index.path("manifests")) {
            JsonNode platform = entry.path("platform");
            if ("linux".equals(platform.path("os").asText()) && "amd64".equals(platform.path("architecture").asText())) {
                selected = entry;
                break;
            }

            if (selected == null) {
                selected = entry;
            }
        }

        if (selected == null || !selected.hasNonNull("digest")) {
            throw new IOException("Manifest list of '" + reference + "' has no usable manifest");
        }

        return selected.get("digest").asText();
    }

    private HttpResponse<byte[]> get(Session session, String path, String accept) throws IOException {
        URI uri = URI.create(session.base + path);
        boolean authenticated = false;

        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", accept)
                .GET();

            // credentials are only sent to the registry itself, never to redirect targets
            boolean sameHost = uri.getHost() != null && uri.getHost().equals(session.host);
            if (sameHost && session.authorization != null) {
                builder.header("Authorization", session.authorization);
            }

            HttpResponse<byte[]> response = send(builder.build());
            int code = response.statusCode();

            if (code == 401 && sameHost && !authenticated) {
                authenticated = true;
                authenticate(session, response);
                hop--;
                continue;
            }

            if (code >= 300 && code < 400) {
                Optional<String> location = response.headers().firstValue("Location");
                if (location.isEmpty()) {
                    throw new IOException("Redirect without location for " + uri);
                }

                uri = uri.resolve(location.get());
                continue;
            }

            if (code == 404) {
                throw new IOException("Image '" + session.reference + "' not found: " + uri);
            }

            if (code < 200 || code >= 300) {
                throw new IOException("Unexpected HTTP " + code + " for " + uri);
            }

            return response;
        }

        throw new IOException("Too many redirects for " + session.base + path);
    }

    private void authenticate(Session session, HttpResponse<byte[]> challenge) throws IOException {
        String header = challenge.headers().firstValue("WWW-Authenticate")
            .orElseThrow(() -> new IOException("Unauthorized on '" + session.host + "' without challenge"));

        Optional<RegistryCredentials.Auth> auth = session.credentials.forRegistry(session.reference.getRegistry());

        if (header.regionMatches(true, 0, "Basic", 0, 5)) {
            session.authorization = auth
                .map(RegistryCredentials.Auth::basic)
                .orElseThrow(() -> new IOException("Registry '" + session.host + "' requires credentials"));
            return;
        }

        if (!header.regionMatches(true, 0, "Bearer", 0, 6)) {
            throw new IOException("Unsupported authentication challenge '" + header + "'");
        }

        Map<String, String> params = new HashMap<>();
        Matcher matcher = CHALLENGE_PARAM.matcher(header);
        while (matcher.find()) {
            params.put(matcher.group(1), matcher.group(2));
        }

        String realm = params.get("realm");
        if (realm == null) {
            throw new IOException("Bearer challenge without realm '" + header + "'");
        }

        String scope = params.getOrDefault("scope", "repository:" + session.reference.getRepository() + ":pull");
        StringBuilder query = new StringBuilder("?scope=").append(URLEncoder.encode(scope, StandardCharsets.UTF_8));
        if (params.containsKey("service")) {
            query.append("&service=").append(URLEncoder.encode(params.get("service"), StandardCharsets.UTF_8));
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(realm + query))
            .timeout(timeout)
            .GET();
        auth.ifPresent(value -> builder.header("Authorization", value.basic()));

        HttpResponse<byte[]> response = send(builder.build());
        if (response.statusCode() != 200) {
            throw new IOException("Token request to '" + realm + "' failed with HTTP " + response.statusCode());
        }

        JsonNode token = JacksonMapper.ofJson().readTree(response.body());
        String value = token.hasNonNull("token") ? token.get("token").asText() : token.path("access_token").asText(null);
        if (value == null) {
            throw new IOException("Token response of '" + realm + "' has no token");
        }

        session.authorization = "Bearer " + value;
        log.trace("Authenticated on '{}' for '{}'", session.host, scope);
    }

    private HttpResponse<byte[]> send(HttpRequest request) throws IOException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + request.uri(), e);
        }
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();

        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }

        return values;
    }

    private String scheme(String registry) {
        String host = registry.contains(":") ? registry.substring(0, registry.indexOf(':')) : registry;

        if (insecureRegistries.contains(registry) || host.equals("localhost") || host.equals("127.0.0.1")) {
            return "http";
        }

        return "https";
    }

    private class Session {
        private final ImageReference reference;
        private final RegistryCredentials credentials;
        private final String base;
        private final String host;
        private String authorization;

        private Session(ImageReference reference, RegistryCredentials credentials) {
            this.reference = reference;
            this.credentials = credentials;
            this.base = scheme(reference.getRegistry()) + "://" + reference.getRegistry() + "/v2/" + reference.getRepository();
            this.host = URI.create(base).getHost();
        }
    }

    private static class Manifest {
        private final String digest;
        private final String mediaType;
        private final JsonNode body;

        private Manifest(String digest, String mediaType, JsonNode body) {
            this.digest = digest;
            this.mediaType = mediaType;
            this.body = body;
        }

        private boolean isIndex() {
            return DOCKER_MANIFEST_LIST.equals(mediaType) || OCI_INDEX.equals(mediaType) || body.has("manifests");
        }
    }
}
