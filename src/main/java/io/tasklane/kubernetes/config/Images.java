package io.tasklane.kubernetes.config;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Images of the helper containers added around the task steps.
 */
@Builder
@Getter
@Jacksonized
public class Images {
    @Builder.Default
    private final String entrypointImage = "override-with-entrypoint:latest";

    @Builder.Default
    private final String gitImage = "override-with-git:latest";

    @Builder.Default
    private final String shellImage = "busybox";

    @Builder.Default
    private final String imageDigestExporterImage = "override-with-imagedigest-exporter-image:latest";
}
