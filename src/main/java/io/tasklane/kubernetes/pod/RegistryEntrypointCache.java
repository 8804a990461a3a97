package io.tasklane.kubernetes.pod;

import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.registry.CredentialResolver;
import io.tasklane.kubernetes.registry.ImageConfig;
import io.tasklane.kubernetes.registry.ImageReference;
import io.tasklane.kubernetes.registry.ImageRegistry;
import io.tasklane.kubernetes.registry.RegistryCredentials;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes registry lookups per image, namespace and service account. Entries never expire;
 * two workers missing the same key concurrently both query the registry and the last write wins.
 */
@Slf4j
public class RegistryEntrypointCache implements EntrypointCache {
    private final ImageRegistry registry;
    private final CredentialResolver credentialResolver;
    private final ConcurrentHashMap<Key, ResolvedEntrypoint> entries = new ConcurrentHashMap<>();

    public RegistryEntrypointCache(ImageRegistry registry, CredentialResolver credentialResolver) {
        this.registry = registry;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public ResolvedEntrypoint get(String image, String namespace, String serviceAccount) throws ResolutionException {
        ImageReference reference;
        try {
            reference = ImageReference.parse(image);
        } catch (IllegalArgumentException e) {
            throw new ResolutionException(ResolutionException.Kind.ENTRYPOINT, e.getMessage(), e);
        }

        Key key = new Key(reference.canonical(), namespace, serviceAccount);
        ResolvedEntrypoint cached = entries.get(key);
        if (cached != null) {
            return cached;
        }

        ImageConfig config;
        try {
            RegistryCredentials credentials = credentialResolver.resolve(namespace, serviceAccount);
            config = registry.fetch(reference, credentials);
        } catch (IOException e) {
            throw new ResolutionException(
                ResolutionException.Kind.ENTRYPOINT,
                "Failed to fetch image \"" + image + "\" from registry: " + e.getMessage(),
                e
            );
        }

        // a reference pinned by digest keeps it, the registry is only asked for the config
        String digest = reference.isPinned() ? reference.getDigest() : config.getDigest();
        if (digest == null) {
            throw new ResolutionException(ResolutionException.Kind.ENTRYPOINT, "No digest returned for image \"" + image + "\"");
        }

        ResolvedEntrypoint entry = ResolvedEntrypoint.builder()
            .image(reference.withDigest(digest))
            .command(List.copyOf(config.command()))
            .digest(digest)
            .build();

        entries.put(key, entry);
        log.debug("Resolved image '{}' for '{}/{}' to '{}' with command {}", image, namespace, serviceAccount, entry.getImage(), entry.getCommand());

        return entry;
    }

    public int size() {
        return entries.size();
    }

    @AllArgsConstructor
    @EqualsAndHashCode
    private static class Key {
        private final String image;
        private final String namespace;
        private final String serviceAccount;
    }
}
