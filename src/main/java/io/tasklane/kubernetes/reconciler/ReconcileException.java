package io.tasklane.kubernetes.reconciler;

/**
 * A transient failure, the key is requeued with backoff and the run status is left untouched.
 */
public class ReconcileException extends Exception {
    private static final long serialVersionUID = 1L;

    public ReconcileException(String message, Throwable cause) {
        super(message, cause);
    }
}
