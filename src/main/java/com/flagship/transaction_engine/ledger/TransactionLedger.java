package com.flagship.transaction_engine.ledger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * History of every applied deposit and withdrawal, keyed by transaction id.
 *
 * Any later record may refer to any earlier id, so entries are kept for the
 * whole run. One ledger is shared by all accounts of a run and is only touched
 * by the single thread driving that run.
 */
public class TransactionLedger {

    private final Map<Long, Transaction> transactions = new HashMap<>();

    /**
     * Records a newly applied transaction.
     *
     * @throws DuplicateTransactionException if the id is already recorded
     */
    public void insert(Transaction transaction) {
        Transaction existing = transactions.putIfAbsent(transaction.getId(), transaction);
        if (existing != null) {
            throw new DuplicateTransactionException(transaction.getId());
        }
    }

    public Optional<Transaction> find(long id) {
        return Optional.ofNullable(transactions.get(id));
    }

    public int size() {
        return transactions.size();
    }
}
