package com.flagship.transaction_engine.mutation;

import lombok.Getter;

/**
 * A mutation that was rejected by an account.
 *
 * Raised for reportable logical errors (insufficient funds, disputing a
 * withdrawal, arithmetic over- or underflow) and for any mutation against a
 * locked account. The account is left exactly as it was before the attempt.
 */
@Getter
public class MutationException extends RuntimeException {

    public enum Reason {
        LOCKED_ACCOUNT("account is locked"),
        INSUFFICIENT_FUNDS("insufficient available funds"),
        ONLY_DEPOSITS_DISPUTABLE("only deposits can be disputed"),
        ARITHMETIC_UNDERFLOW("balance would drop below zero"),
        ARITHMETIC_OVERFLOW("balance would overflow"),
        MISSING_AMOUNT("deposits and withdrawals require an amount"),
        CLIENT_MISMATCH("mutation was routed to another client's account");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final long transactionId;
    private final int clientId;
    private final Long amount;

    public MutationException(Reason reason, long transactionId, int clientId, Long amount) {
        super(buildMessage(reason, transactionId, clientId, amount));
        this.reason = reason;
        this.transactionId = transactionId;
        this.clientId = clientId;
        this.amount = amount;
    }

    private static String buildMessage(Reason reason, long transactionId, int clientId, Long amount) {
        StringBuilder message = new StringBuilder()
            .append("Transaction ").append(transactionId)
            .append(" for client ").append(clientId)
            .append(" rejected: ").append(reason.getDescription());
        if (amount != null) {
            message.append(" (amount ").append(Amounts.format(amount)).append(')');
        }
        return message.toString();
    }
}
