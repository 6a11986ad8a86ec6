package com.flagship.transaction_engine.account;

import lombok.Value;

/**
 * Immutable copy of an account's final state, handed to the output layer.
 */
@Value
public class AccountSnapshot {
    int clientId;
    long available;
    long held;
    long total;
    boolean locked;
}
