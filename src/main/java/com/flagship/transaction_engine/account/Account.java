package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.ledger.Transaction;
import com.flagship.transaction_engine.ledger.TransactionLedger;
import com.flagship.transaction_engine.ledger.TransactionStatus;
import com.flagship.transaction_engine.mutation.Mutation;
import com.flagship.transaction_engine.mutation.MutationException;
import com.flagship.transaction_engine.mutation.MutationException.Reason;
import com.flagship.transaction_engine.mutation.MutationOutcome;
import lombok.Getter;

import java.util.Optional;

/**
 * Balance state of a single client, plus the rules for changing it.
 *
 * All amounts are counts of 1/10,000 currency units. The account enforces:
 * <ul>
 *   <li>{@code total == available + held} after every mutation</li>
 *   <li>no balance ever drops below zero</li>
 *   <li>once locked (by a chargeback) the account rejects every mutation</li>
 *   <li>a rejected mutation leaves both the account and the ledger untouched</li>
 * </ul>
 *
 * Records that refer to an unknown transaction, or to one whose status does not
 * allow the requested step, are tolerated as stale counterparty messages and
 * reported as {@link MutationOutcome#IGNORED}.
 */
@Getter
public class Account {

    private final int clientId;
    private long available;
    private long held;
    private long total;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
    }

    /**
     * Applies one mutation to this account.
     *
     * @param mutation the record to apply; must belong to this client
     * @param ledger the run's transaction history, read for dispute-family
     *               records and extended by deposits and withdrawals
     * @return whether the mutation changed anything
     * @throws MutationException if the mutation is rejected
     * @throws com.flagship.transaction_engine.ledger.DuplicateTransactionException
     *         if a deposit or withdrawal reuses a recorded id
     */
    public MutationOutcome mutate(Mutation mutation, TransactionLedger ledger) {
        if (locked) {
            throw reject(Reason.LOCKED_ACCOUNT, mutation, mutation.getAmount());
        }
        if (mutation.getClientId() != clientId) {
            throw reject(Reason.CLIENT_MISMATCH, mutation, mutation.getAmount());
        }
        return switch (mutation.getKind()) {
            case DEPOSIT -> deposit(mutation, ledger);
            case WITHDRAWAL -> withdraw(mutation, ledger);
            case DISPUTE -> dispute(mutation, ledger);
            case RESOLVE -> resolve(mutation, ledger);
            case CHARGEBACK -> chargeback(mutation, ledger);
        };
    }

    public boolean isBalanced() {
        return available >= 0 && held >= 0 && available + held == total;
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, total, locked);
    }

    private MutationOutcome deposit(Mutation mutation, TransactionLedger ledger) {
        long amount = mutation.requireAmount();
        long newAvailable = add(available, amount, mutation);
        long newTotal = add(total, amount, mutation);

        ledger.insert(new Transaction(mutation.getId(), mutation.getKind(), clientId, amount));
        available = newAvailable;
        total = newTotal;
        return MutationOutcome.APPLIED;
    }

    private MutationOutcome withdraw(Mutation mutation, TransactionLedger ledger) {
        long amount = mutation.requireAmount();
        if (available < amount || total < amount) {
            throw reject(Reason.INSUFFICIENT_FUNDS, mutation, amount);
        }

        ledger.insert(new Transaction(mutation.getId(), mutation.getKind(), clientId, amount));
        available -= amount;
        total -= amount;
        return MutationOutcome.APPLIED;
    }

    private MutationOutcome dispute(Mutation mutation, TransactionLedger ledger) {
        Optional<Transaction> recorded = ledger.find(mutation.getId());
        if (recorded.isPresent() && !recorded.get().isDeposit()) {
            throw reject(Reason.ONLY_DEPOSITS_DISPUTABLE, mutation, recorded.get().getAmount());
        }
        Transaction transaction = eligible(recorded, TransactionStatus.OK);
        if (transaction == null) {
            return MutationOutcome.IGNORED;
        }

        long amount = transaction.getAmount();
        long newAvailable = subtract(available, amount, mutation);
        long newHeld = add(held, amount, mutation);

        transaction.advanceTo(TransactionStatus.DISPUTED);
        available = newAvailable;
        held = newHeld;
        return MutationOutcome.APPLIED;
    }

    private MutationOutcome resolve(Mutation mutation, TransactionLedger ledger) {
        Transaction transaction = eligible(ledger.find(mutation.getId()), TransactionStatus.DISPUTED);
        if (transaction == null) {
            return MutationOutcome.IGNORED;
        }

        long amount = transaction.getAmount();
        long newHeld = subtract(held, amount, mutation);
        long newAvailable = add(available, amount, mutation);

        transaction.advanceTo(TransactionStatus.RESOLVED);
        available = newAvailable;
        held = newHeld;
        return MutationOutcome.APPLIED;
    }

    private MutationOutcome chargeback(Mutation mutation, TransactionLedger ledger) {
        Transaction transaction = eligible(ledger.find(mutation.getId()), TransactionStatus.RESOLVED);
        if (transaction == null) {
            return MutationOutcome.IGNORED;
        }

        long amount = transaction.getAmount();
        long newAvailable = subtract(available, amount, mutation);
        long newTotal = subtract(total, amount, mutation);

        transaction.advanceTo(TransactionStatus.REFUNDED);
        available = newAvailable;
        total = newTotal;
        locked = true;
        return MutationOutcome.APPLIED;
    }

    /**
     * Returns the recorded transaction if it is in the {@code required} status, otherwise null.
     * Lookup is by transaction id alone; the entry's client is not compared.
     */
    private Transaction eligible(Optional<Transaction> recorded, TransactionStatus required) {
        return recorded
            .filter(transaction -> transaction.hasStatus(required))
            .orElse(null);
    }

    private long add(long balance, long amount, Mutation mutation) {
        try {
            return Math.addExact(balance, amount);
        } catch (ArithmeticException e) {
            throw reject(Reason.ARITHMETIC_OVERFLOW, mutation, amount);
        }
    }

    private long subtract(long balance, long amount, Mutation mutation) {
        if (balance < amount) {
            throw reject(Reason.ARITHMETIC_UNDERFLOW, mutation, amount);
        }
        return balance - amount;
    }

    private MutationException reject(Reason reason, Mutation mutation, Long amount) {
        return new MutationException(reason, mutation.getId(), clientId, amount);
    }
}
