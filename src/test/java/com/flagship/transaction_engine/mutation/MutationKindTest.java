package com.flagship.transaction_engine.mutation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MutationKindTest {

    @Test
    @DisplayName("Labels are matched case-insensitively and trimmed")
    void testFromLabel() {
        assertEquals(MutationKind.DEPOSIT, MutationKind.fromLabel("deposit"));
        assertEquals(MutationKind.WITHDRAWAL, MutationKind.fromLabel("Withdrawal"));
        assertEquals(MutationKind.CHARGEBACK, MutationKind.fromLabel(" CHARGEBACK "));
    }

    @Test
    @DisplayName("Unknown labels are rejected")
    void testUnknownLabel() {
        assertThrows(IllegalArgumentException.class, () -> MutationKind.fromLabel("transfer"));
        assertThrows(IllegalArgumentException.class, () -> MutationKind.fromLabel(null));
    }

    @Test
    @DisplayName("Only deposits and withdrawals carry an amount")
    void testRequiresAmount() {
        assertTrue(MutationKind.DEPOSIT.requiresAmount());
        assertTrue(MutationKind.WITHDRAWAL.requiresAmount());
        assertFalse(MutationKind.DISPUTE.requiresAmount());
        assertFalse(MutationKind.RESOLVE.requiresAmount());
        assertFalse(MutationKind.CHARGEBACK.requiresAmount());
    }

    @Test
    @DisplayName("Rejection message names the transaction, client and amount")
    void testMutationExceptionMessage() {
        MutationException exception = new MutationException(
            MutationException.Reason.INSUFFICIENT_FUNDS, 12, 3, 70_000L);

        assertEquals("Transaction 12 for client 3 rejected: insufficient available funds (amount 7.0000)",
            exception.getMessage());
    }
}
