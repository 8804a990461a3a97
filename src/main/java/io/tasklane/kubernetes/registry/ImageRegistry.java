package io.tasklane.kubernetes.registry;

import java.io.IOException;

public interface ImageRegistry {
    /**
     * Fetches the manifest and config of an image.
     */
    ImageConfig fetch(ImageReference reference, RegistryCredentials credentials) throws IOException;
}
