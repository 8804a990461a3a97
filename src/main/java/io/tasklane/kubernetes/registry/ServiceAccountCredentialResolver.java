package io.tasklane.kubernetes.registry;

import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Resolves pull credentials from the image pull secrets attached to a service account.
 */
@Slf4j
public class ServiceAccountCredentialResolver implements CredentialResolver {
    private static final List<String> DOCKER_CONFIG_KEYS = List.of(".dockerconfigjson", ".dockercfg");

    private final KubernetesClient client;

    public ServiceAccountCredentialResolver(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public RegistryCredentials resolve(String namespace, String serviceAccount) throws IOException {
        try {
            ServiceAccount account = client.serviceAccounts()
                .inNamespace(namespace)
                .withName(serviceAccount)
                .get();

            if (account == null || account.getImagePullSecrets() == null) {
                log.debug("No image pull secrets for service account '{}/{}'", namespace, serviceAccount);
                return RegistryCredentials.anonymous();
            }

            RegistryCredentials credentials = RegistryCredentials.anonymous();
            for (LocalObjectReference reference : account.getImagePullSecrets()) {
                Secret secret = client.secrets()
                    .inNamespace(namespace)
                    .withName(reference.getName())
                    .get();

                if (secret == null) {
                    log.warn("Image pull secret '{}/{}' of service account '{}' not found", namespace, reference.getName(), serviceAccount);
                    continue;
                }

                credentials = credentials.merge(fromSecret(secret));
            }

            return credentials;
        } catch (KubernetesClientException e) {
            throw new IOException("Unable to read the pull secrets of '" + namespace + "/" + serviceAccount + "': " + e.getMessage(), e);
        }
    }

    static RegistryCredentials fromSecret(Secret secret) throws IOException {
        Map<String, String> data = secret.getData();
        if (data == null) {
            return RegistryCredentials.anonymous();
        }

        for (String key : DOCKER_CONFIG_KEYS) {
            if (data.containsKey(key)) {
                return RegistryCredentials.fromDockerConfig(Base64.getDecoder().decode(data.get(key)));
            }
        }

        return RegistryCredentials.anonymous();
    }
}
