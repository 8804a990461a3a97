package io.tasklane.kubernetes.stores;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.tasklane.kubernetes.pod.TaskPodBuilder;
import io.tasklane.kubernetes.services.PodService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class KubernetesPodStore implements PodStore {
    private final KubernetesClient client;

    public KubernetesPodStore(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Pod create(Pod pod) throws PodStoreException {
        try {
            Pod created = client.pods()
                .inNamespace(pod.getMetadata().getNamespace())
                .resource(pod)
                .create();

            log.info("Pod '{}' created in namespace '{}'", created.getMetadata().getName(), created.getMetadata().getNamespace());

            return created;
        } catch (KubernetesClientException e) {
            throw wrap(e, "create pod '" + pod.getMetadata().getName() + "'");
        }
    }

    @Override
    public List<Pod> list(String namespace, String runName) throws PodStoreException {
        try {
            return client.pods()
                .inNamespace(namespace)
                .withLabel(TaskPodBuilder.LABEL_TASK_RUN, runName)
                .list()
                .getItems();
        } catch (KubernetesClientException e) {
            throw wrap(e, "list pods of '" + namespace + "/" + runName + "'");
        }
    }

    @Override
    public void markReady(String namespace, String podName) throws PodStoreException {
        try {
            PodService.podRef(client, namespace, podName)
                .edit(pod -> new PodBuilder(pod)
                    .editMetadata()
                    .addToAnnotations(PodService.READY_ANNOTATION, PodService.READY_VALUE)
                    .endMetadata()
                    .build()
                );

            log.debug("Pod '{}/{}' marked as ready", namespace, podName);
        } catch (KubernetesClientException e) {
            throw wrap(e, "mark pod '" + namespace + "/" + podName + "' ready");
        }
    }

    @Override
    public void stop(String namespace, String podName) throws PodStoreException {
        try {
            PodService.podRef(client, namespace, podName)
                .withGracePeriod(0L)
                .delete();

            log.info("Pod '{}' deleted in namespace '{}'", podName, namespace);
        } catch (KubernetesClientException e) {
            throw wrap(e, "delete pod '" + namespace + "/" + podName + "'");
        }
    }

    @Override
    public String containerLog(String namespace, String podName, String container) throws PodStoreException {
        try {
            return PodService.podRef(client, namespace, podName)
                .inContainer(container)
                .getLog();
        } catch (KubernetesClientException e) {
            throw wrap(e, "read logs of '" + namespace + "/" + podName + "/" + container + "'");
        }
    }

    private static PodStoreException wrap(KubernetesClientException e, String action) {
        return new PodStoreException(
            StoreException.kindOf(e.getCode()),
            "Unable to " + action + ": " + e.getMessage(),
            e
        );
    }
}
