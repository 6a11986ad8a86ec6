package com.flagship.transaction_engine.mutation;

import lombok.Value;

import java.util.Objects;

/**
 * A single validated input instruction, applied to exactly one account.
 *
 * Invariant: amount is non-null iff {@link MutationKind#requiresAmount()}.
 * The CSV reader enforces this before a mutation reaches the engine; the
 * account re-checks it through {@link #requireAmount()}.
 */
@Value
public class Mutation {
    long id;
    MutationKind kind;
    int clientId;
    Long amount;

    public Mutation(long id, MutationKind kind, int clientId, Long amount) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.clientId = clientId;
        this.amount = amount;
    }

    public static Mutation deposit(long id, int clientId, long amount) {
        return new Mutation(id, MutationKind.DEPOSIT, clientId, amount);
    }

    public static Mutation withdrawal(long id, int clientId, long amount) {
        return new Mutation(id, MutationKind.WITHDRAWAL, clientId, amount);
    }

    public static Mutation dispute(long id, int clientId) {
        return new Mutation(id, MutationKind.DISPUTE, clientId, null);
    }

    public static Mutation resolve(long id, int clientId) {
        return new Mutation(id, MutationKind.RESOLVE, clientId, null);
    }

    public static Mutation chargeback(long id, int clientId) {
        return new Mutation(id, MutationKind.CHARGEBACK, clientId, null);
    }

    /**
     * Returns the amount of a deposit or withdrawal.
     *
     * @throws MutationException with {@link MutationException.Reason#MISSING_AMOUNT} if absent
     */
    public long requireAmount() {
        if (amount == null) {
            throw new MutationException(MutationException.Reason.MISSING_AMOUNT, id, clientId, null);
        }
        return amount;
    }
}
