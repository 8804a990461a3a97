package io.tasklane.kubernetes.pod;

import io.tasklane.kubernetes.exceptions.ResolutionException;

/**
 * Resolves the command and digest of an image, as seen with the pull credentials of a service
 * account. Implementations are shared by all workers and must be thread safe.
 */
public interface EntrypointCache {
    ResolvedEntrypoint get(String image, String namespace, String serviceAccount) throws ResolutionException;
}
