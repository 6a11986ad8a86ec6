package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.mutation.MutationKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionLedgerTest {

    private final TransactionLedger ledger = new TransactionLedger();

    @Test
    @DisplayName("Inserted transactions can be found by id in OK status")
    void testInsertAndFind() {
        ledger.insert(new Transaction(1, MutationKind.DEPOSIT, 3, 15_000));

        Transaction found = ledger.find(1).orElseThrow();

        assertEquals(1, found.getId());
        assertEquals(3, found.getClientId());
        assertEquals(15_000, found.getAmount());
        assertEquals(TransactionStatus.OK, found.getStatus());
        assertTrue(ledger.find(1).isPresent());
        assertEquals(1, ledger.size());
    }

    @Test
    @DisplayName("Unknown ids are absent")
    void testFindMissing() {
        assertTrue(ledger.find(404).isEmpty());
        assertFalse(ledger.find(404).isPresent());
    }

    @Test
    @DisplayName("Duplicate id is rejected and the original entry kept")
    void testDuplicateInsert() {
        ledger.insert(new Transaction(1, MutationKind.DEPOSIT, 3, 15_000));

        DuplicateTransactionException exception = assertThrows(DuplicateTransactionException.class,
            () -> ledger.insert(new Transaction(1, MutationKind.WITHDRAWAL, 3, 1)));

        assertEquals(1, exception.getTransactionId());
        assertEquals(MutationKind.DEPOSIT, ledger.find(1).orElseThrow().getKind());
        assertEquals(1, ledger.size());
    }

    @Test
    @DisplayName("Status changes are visible through later lookups")
    void testFindReturnsLiveEntry() {
        ledger.insert(new Transaction(1, MutationKind.DEPOSIT, 3, 15_000));

        ledger.find(1).orElseThrow().advanceTo(TransactionStatus.DISPUTED);

        assertEquals(TransactionStatus.DISPUTED, ledger.find(1).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Only deposits and withdrawals can be recorded")
    void testRejectsDisputeFamily() {
        assertThrows(IllegalArgumentException.class, () -> new Transaction(1, MutationKind.DISPUTE, 3, 0));
        assertThrows(IllegalArgumentException.class, () -> new Transaction(1, MutationKind.CHARGEBACK, 3, 0));
    }
}
