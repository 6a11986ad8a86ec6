package com.flagship.transaction_engine.account;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * All accounts seen during a run, indexed by client id.
 * Accounts are created on first reference and never removed.
 */
public class AccountRegistry {

    private final Map<Integer, Account> accounts = new HashMap<>();

    public Account getOrCreate(int clientId) {
        return accounts.computeIfAbsent(clientId, Account::new);
    }

    /**
     * Every account in unspecified order.
     */
    public Collection<Account> accounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public int size() {
        return accounts.size();
    }
}
