package io.tasklane.kubernetes.registry;

import java.io.IOException;

public interface CredentialResolver {
    /**
     * The pull credentials available to pods running as {@code serviceAccount}.
     */
    RegistryCredentials resolve(String namespace, String serviceAccount) throws IOException;
}
