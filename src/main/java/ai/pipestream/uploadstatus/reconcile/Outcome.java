package ai.pipestream.uploadstatus.reconcile;

/**
 * Result of reconciling one storage event. Failures are not outcomes: they fail the {@code Uni}.
 */
public enum Outcome {

    /** The record moved from pending to uploaded and downstream actions were triggered. */
    RECONCILED,

    /** The record moved from pending to failed, e.g. the object exceeds the size limit. */
    REJECTED,

    /** Nothing to do: no live record for the key, or a redundant event for a terminal record. */
    IGNORED,

    /** The same notification was already applied, or a concurrent worker won the transition. */
    DUPLICATE_IGNORED,

    /** An uploaded object was removed from the store; logged, status kept. */
    ANOMALY
}
