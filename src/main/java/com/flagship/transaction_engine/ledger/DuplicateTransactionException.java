package com.flagship.transaction_engine.ledger;

import lombok.Getter;

/**
 * Thrown when a deposit or withdrawal reuses an id already in the ledger.
 * Upstream guarantees ids are unique, so this indicates bad input or a bug.
 */
@Getter
public class DuplicateTransactionException extends IllegalStateException {

    private final long transactionId;

    public DuplicateTransactionException(long transactionId) {
        super("Transaction " + transactionId + " already exists in the ledger");
        this.transactionId = transactionId;
    }
}
