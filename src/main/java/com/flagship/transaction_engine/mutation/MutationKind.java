package com.flagship.transaction_engine.mutation;

import java.util.Locale;

/**
 * The five record types the engine understands.
 *
 * Deposits and withdrawals move money and always carry an amount.
 * Disputes, resolves and chargebacks refer back to an earlier deposit by id
 * and never carry an amount of their own.
 */
public enum MutationKind {
    DEPOSIT("deposit", true),
    WITHDRAWAL("withdrawal", true),
    DISPUTE("dispute", false),
    RESOLVE("resolve", false),
    CHARGEBACK("chargeback", false);

    private final String label;
    private final boolean amountRequired;

    MutationKind(String label, boolean amountRequired) {
        this.label = label;
        this.amountRequired = amountRequired;
    }

    public String getLabel() {
        return label;
    }

    /**
     * True for the kinds that must carry an amount, false for the kinds that must not.
     */
    public boolean requiresAmount() {
        return amountRequired;
    }

    public static MutationKind fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (MutationKind kind : values()) {
                if (kind.label.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + label);
    }
}
