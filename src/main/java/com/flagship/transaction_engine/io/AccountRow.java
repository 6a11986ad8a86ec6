package com.flagship.transaction_engine.io;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.transaction_engine.account.AccountSnapshot;
import com.flagship.transaction_engine.mutation.Amounts;
import lombok.Value;

/**
 * One row of the output CSV. Amounts are already rendered with four decimals.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountRow {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    public static AccountRow from(AccountSnapshot account) {
        return new AccountRow(
            account.getClientId(),
            Amounts.format(account.getAvailable()),
            Amounts.format(account.getHeld()),
            Amounts.format(account.getTotal()),
            account.isLocked()
        );
    }
}
