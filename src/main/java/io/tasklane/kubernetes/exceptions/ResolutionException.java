package io.tasklane.kubernetes.exceptions;

import lombok.Getter;

/**
 * A referenced object (task, cluster task, pipeline resource or image entrypoint) could not be
 * resolved.
 */
@Getter
public class ResolutionException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        NOT_FOUND,
        KIND_MISMATCH,
        ENTRYPOINT
    }

    private final Kind kind;

    public ResolutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResolutionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
