package io.tasklane.kubernetes.reconciler;

public enum ReconcileOutcome {
    /**
     * Nothing left to do until the run or its pod changes again.
     */
    DONE,

    /**
     * Run the key again later, with the backoff of the work queue.
     */
    REQUEUE
}
