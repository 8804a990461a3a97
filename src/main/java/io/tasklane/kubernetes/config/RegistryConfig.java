package io.tasklane.kubernetes.config;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;

@Builder
@Getter
@Jacksonized
public class RegistryConfig {
    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(30);

    /**
     * Registries reached over plain http, {@code localhost} ones always are.
     */
    @Builder.Default
    private final List<String> insecureRegistries = List.of();

    /**
     * Pin the digest of steps declaring their command too, this costs one registry round trip per
     * uncached image.
     */
    @Builder.Default
    private final boolean resolveDigestForExplicitCommand = false;
}
