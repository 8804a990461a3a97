package io.tasklane.kubernetes.stores;

import lombok.Getter;

/**
 * A call to the cluster object store failed.
 */
@Getter
public class StoreException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        FORBIDDEN,
        NOT_FOUND,
        CONFLICT,
        OTHER
    }

    private final Kind kind;

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static Kind kindOf(int code) {
        switch (code) {
            case 403:
                return Kind.FORBIDDEN;
            case 404:
                return Kind.NOT_FOUND;
            case 409:
                return Kind.CONFLICT;
            default:
                return Kind.OTHER;
        }
    }
}
