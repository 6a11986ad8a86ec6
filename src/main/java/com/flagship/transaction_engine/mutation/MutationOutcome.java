package com.flagship.transaction_engine.mutation;

/**
 * Result of applying a mutation that did not fail.
 */
public enum MutationOutcome {
    /** Balances and/or ledger were changed. */
    APPLIED,

    /**
     * Nothing changed. The record pointed at an unknown transaction or at one
     * whose status does not allow the requested step.
     */
    IGNORED
}
