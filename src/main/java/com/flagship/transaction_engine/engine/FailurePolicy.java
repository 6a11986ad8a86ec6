package com.flagship.transaction_engine.engine;

/**
 * What the engine does with a record that is malformed or rejected by its account.
 * Configured through {@code engine.failure-policy}.
 */
public enum FailurePolicy {
    /**
     * Stop at the first bad record. No account table is produced and the run fails.
     */
    ABORT,

    /**
     * Log the bad record, leave all state as it was before it, and continue.
     * Final balances then differ from an ABORT run that was given clean input.
     */
    SKIP
}
