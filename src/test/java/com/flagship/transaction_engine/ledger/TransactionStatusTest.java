package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.mutation.MutationKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transaction lifecycle: OK → DISPUTED → RESOLVED → REFUNDED, no skipping, no going back.
 */
class TransactionStatusTest {

    @Test
    @DisplayName("Each status allows only its direct successor")
    void testLinearTransitions() {
        assertTrue(TransactionStatus.OK.canTransitionTo(TransactionStatus.DISPUTED));
        assertTrue(TransactionStatus.DISPUTED.canTransitionTo(TransactionStatus.RESOLVED));
        assertTrue(TransactionStatus.RESOLVED.canTransitionTo(TransactionStatus.REFUNDED));

        assertFalse(TransactionStatus.OK.canTransitionTo(TransactionStatus.RESOLVED));
        assertFalse(TransactionStatus.OK.canTransitionTo(TransactionStatus.OK));
        assertFalse(TransactionStatus.DISPUTED.canTransitionTo(TransactionStatus.OK));
        assertFalse(TransactionStatus.RESOLVED.canTransitionTo(TransactionStatus.DISPUTED));
        assertFalse(TransactionStatus.REFUNDED.canTransitionTo(TransactionStatus.OK));
        assertFalse(TransactionStatus.OK.canTransitionTo(null));
    }

    @Test
    @DisplayName("REFUNDED has no successor")
    void testTerminal() {
        assertNull(TransactionStatus.REFUNDED.next());
        for (TransactionStatus target : TransactionStatus.values()) {
            assertFalse(TransactionStatus.REFUNDED.canTransitionTo(target));
        }
    }

    @Test
    @DisplayName("Skipping a stage is rejected by the transaction")
    void testAdvanceRejectsSkip() {
        Transaction transaction = new Transaction(9, MutationKind.DEPOSIT, 1, 100);

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> transaction.advanceTo(TransactionStatus.RESOLVED));

        assertTrue(exception.getMessage().contains("OK") && exception.getMessage().contains("RESOLVED"));
        assertEquals(TransactionStatus.OK, transaction.getStatus());
    }
}
