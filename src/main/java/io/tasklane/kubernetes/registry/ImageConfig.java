package io.tasklane.kubernetes.registry;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Builder
@Getter
public class ImageConfig {
    /**
     * Content digest of the resolved image manifest.
     */
    private final String digest;

    private final List<String> entrypoint;

    private final List<String> cmd;

    /**
     * The command the image runs when the container does not override it.
     */
    public List<String> command() {
        if (entrypoint != null && !entrypoint.isEmpty()) {
            return entrypoint;
        }

        return cmd == null ? List.of() : cmd;
    }
}
