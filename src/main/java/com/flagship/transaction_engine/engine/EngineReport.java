package com.flagship.transaction_engine.engine;

import com.flagship.transaction_engine.account.AccountSnapshot;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one engine run.
 *
 * On success {@link #accounts} holds the final state of every account in
 * unspecified order. On abort it is empty and {@link #failure} names the record
 * that stopped the run.
 */
@Value
public class EngineReport {
    List<AccountSnapshot> accounts;
    long applied;
    long ignored;
    long skipped;
    int ledgerSize;
    RuntimeException failure;

    public boolean isAborted() {
        return failure != null;
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public long getProcessed() {
        return applied + ignored + skipped;
    }
}
