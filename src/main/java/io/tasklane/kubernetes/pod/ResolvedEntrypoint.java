package io.tasklane.kubernetes.pod;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Builder
@Getter
public class ResolvedEntrypoint {
    /**
     * The image pinned by digest, e.g. {@code index.docker.io/library/ubuntu@sha256:...}.
     */
    private final String image;

    private final List<String> command;

    private final String digest;
}
