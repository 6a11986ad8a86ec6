package com.flagship.transaction_engine.ledger;

/**
 * Lifecycle of a recorded deposit or withdrawal.
 *
 * The lifecycle is strictly linear: OK → DISPUTED → RESOLVED → REFUNDED.
 * No step may be skipped and there are no back-transitions.
 */
public enum TransactionStatus {
    /**
     * Transaction has been applied and is not under dispute.
     * Initial state for every ledger entry.
     */
    OK,

    /**
     * Client has disputed the transaction; its amount is held.
     */
    DISPUTED,

    /**
     * Dispute was resolved and the held amount released back to available.
     */
    RESOLVED,

    /**
     * Transaction was charged back and the owning account locked.
     * Terminal state.
     */
    REFUNDED;

    /**
     * The only status this one may advance to, or {@code null} for the terminal state.
     */
    public TransactionStatus next() {
        return switch (this) {
            case OK -> DISPUTED;
            case DISPUTED -> RESOLVED;
            case RESOLVED -> REFUNDED;
            case REFUNDED -> null;
        };
    }

    public boolean canTransitionTo(TransactionStatus target) {
        return target != null && target == next();
    }
}
