package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.mutation.MutationKind;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A recorded deposit or withdrawal.
 *
 * Disputes, resolves and chargebacks carry no amount, so the ledger keeps
 * every applied deposit and withdrawal to look the amount up later.
 * Only {@link #status} changes after creation.
 */
@Getter
@ToString
public class Transaction {
    private final long id;
    private final MutationKind kind;
    private final int clientId;
    private final long amount;
    private TransactionStatus status;

    public Transaction(long id, MutationKind kind, int clientId, long amount) {
        Objects.requireNonNull(kind, "kind");
        if (!kind.requiresAmount()) {
            throw new IllegalArgumentException("Only deposits and withdrawals are recorded, got " + kind);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative");
        }
        this.id = id;
        this.kind = kind;
        this.clientId = clientId;
        this.amount = amount;
        this.status = TransactionStatus.OK;
    }

    public boolean isDeposit() {
        return kind == MutationKind.DEPOSIT;
    }

    public boolean hasStatus(TransactionStatus expected) {
        return status == expected;
    }

    /**
     * Moves the transaction one step along its lifecycle.
     *
     * @throws IllegalStateException if {@code target} is not the direct successor of the current status
     */
    public void advanceTo(TransactionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move transaction %d from %s to %s.", id, status, target));
        }
        this.status = target;
    }
}
