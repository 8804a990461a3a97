package io.tasklane.kubernetes.stores;

import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;

public interface PodStore {
    Pod create(Pod pod) throws PodStoreException;

    /**
     * Pods labelled as belonging to the run.
     */
    List<Pod> list(String namespace, String runName) throws PodStoreException;

    /**
     * Sets the annotation the first step waits on through the downward API.
     */
    void markReady(String namespace, String podName) throws PodStoreException;

    void stop(String namespace, String podName) throws PodStoreException;

    String containerLog(String namespace, String podName, String container) throws PodStoreException;
}
