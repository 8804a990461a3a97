package io.tasklane.kubernetes.registry;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * A parsed image reference, normalized the way the Docker daemon does it: {@code ubuntu} is
 * {@code index.docker.io/library/ubuntu:latest}.
 */
@Getter
@EqualsAndHashCode
public class ImageReference {
    public static final String DOCKER_HUB = "index.docker.io";
    public static final String DEFAULT_TAG = "latest";

    private static final Pattern REPOSITORY = Pattern.compile("[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*(?:/[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*)*");
    private static final Pattern TAG = Pattern.compile("[\\w][\\w.-]{0,127}");
    private static final Pattern DIGEST = Pattern.compile("[a-z0-9]+(?:[.+_-][a-z0-9]+)*:[a-zA-Z0-9=_-]{32,}");

    private final String registry;
    private final String repository;
    private final String tag;
    private final String digest;

    private ImageReference(String registry, String repository, String tag, String digest) {
        this.registry = registry;
        this.repository = repository;
        this.tag = tag;
        this.digest = digest;
    }

    public static ImageReference parse(String image) {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("Invalid image reference: empty");
        }

        String name = image.trim();
        String digest = null;
        String tag = null;

        int at = name.indexOf('@');
        if (at >= 0) {
            digest = name.substring(at + 1);
            name = name.substring(0, at);

            if (!DIGEST.matcher(digest).matches()) {
                throw new IllegalArgumentException("Invalid image reference '" + image + "': bad digest");
            }
        }

        int colon = name.lastIndexOf(':');
        if (colon > name.lastIndexOf('/')) {
            tag = name.substring(colon + 1);
            name = name.substring(0, colon);

            if (!TAG.matcher(tag).matches()) {
                throw new IllegalArgumentException("Invalid image reference '" + image + "': bad tag");
            }
        }

        String registry = DOCKER_HUB;
        String repository = name;

        int slash = name.indexOf('/');
        if (slash > 0) {
            String first = name.substring(0, slash);
            if (first.contains(".") || first.contains(":") || first.equals("localhost")) {
                registry = first;
                repository = name.substring(slash + 1);
            }
        }

        if (registry.equals("docker.io") || registry.equals("registry-1.docker.io")) {
            registry = DOCKER_HUB;
        }

        if (registry.equals(DOCKER_HUB) && !repository.contains("/")) {
            repository = "library/" + repository;
        }

        if (!REPOSITORY.matcher(repository).matches()) {
            throw new IllegalArgumentException("Invalid image reference '" + image + "': bad repository");
        }

        if (tag == null && digest == null) {
            tag = DEFAULT_TAG;
        }

        return new ImageReference(registry, repository, tag, digest);
    }

    public String name() {
        return registry + "/" + repository;
    }

    /**
     * The tag or the digest, whichever identifies the manifest; the digest wins when both are set.
     */
    public String reference() {
        return digest != null ? digest : tag;
    }

    public boolean isPinned() {
        return digest != null;
    }

    public String withDigest(String digest) {
        return name() + "@" + digest;
    }

    public String canonical() {
        return digest != null ? withDigest(digest) : name() + ":" + tag;
    }

    @Override
    public String toString() {
        return canonical();
    }
}
