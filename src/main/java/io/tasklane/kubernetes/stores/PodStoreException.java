package io.tasklane.kubernetes.stores;

public class PodStoreException extends StoreException {
    private static final long serialVersionUID = 1L;

    public PodStoreException(Kind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public PodStoreException(Kind kind, String message) {
        super(kind, message, null);
    }

    public boolean isQuotaExceeded() {
        return getKind() == Kind.FORBIDDEN && getMessage() != null && getMessage().contains("exceeded quota");
    }
}
