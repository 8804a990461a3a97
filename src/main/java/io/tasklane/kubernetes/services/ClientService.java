package io.tasklane.kubernetes.services;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.tasklane.kubernetes.models.Connection;
import lombok.extern.slf4j.Slf4j;

@Slf4j
abstract public class ClientService {
    /**
     * Client for the controller: from the given {@link Connection}, or auto-configured when none is
     * given (system properties, environment, kube config, then the in-cluster service account).
     */
    public static KubernetesClient of(Connection connection) {
        if (connection == null) {
            log.debug("No connection configured, using the auto-detected cluster configuration");
            return new KubernetesClientBuilder().build();
        }

        return of(connection.toConfig());
    }

    public static KubernetesClient of(Config config) {
        KubernetesClient client = new KubernetesClientBuilder()
            .withConfig(config)
            .build();

        log.debug("Kubernetes client created for '{}'", client.getMasterUrl());

        return client;
    }
}
