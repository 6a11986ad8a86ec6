package com.flagship.transaction_engine.engine;

import com.flagship.transaction_engine.account.Account;
import com.flagship.transaction_engine.account.AccountRegistry;
import com.flagship.transaction_engine.account.AccountSnapshot;
import com.flagship.transaction_engine.io.MalformedRecordException;
import com.flagship.transaction_engine.ledger.DuplicateTransactionException;
import com.flagship.transaction_engine.ledger.TransactionLedger;
import com.flagship.transaction_engine.mutation.Mutation;
import com.flagship.transaction_engine.mutation.MutationException;
import com.flagship.transaction_engine.mutation.MutationOutcome;
import com.flagship.transaction_engine.observability.EngineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drives an ordered stream of mutations through the accounts of one run.
 *
 * Each call to {@link #process(Iterator)} starts from an empty account
 * registry and an empty ledger, applies every mutation strictly in input
 * order on the calling thread, and returns the final account states.
 *
 * Failure handling:
 * - Ignored records (stale dispute, resolve or chargeback) are counted and logged at debug
 * - Malformed records, rejected mutations and duplicate transaction ids follow the
 *   configured {@link FailurePolicy}
 * - A broken balance invariant always aborts, since it means the state can no longer be trusted
 */
@Service
@Slf4j
public class TransactionEngine {

    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String CLIENT_ID_MDC_KEY = "clientId";

    private final EngineMetrics metrics;
    private final FailurePolicy failurePolicy;

    public TransactionEngine(EngineMetrics metrics,
                             @Value("${engine.failure-policy:ABORT}") FailurePolicy failurePolicy) {
        this.metrics = metrics;
        this.failurePolicy = failurePolicy;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public EngineReport process(Iterator<Mutation> mutations) {
        long startTime = System.currentTimeMillis();
        AccountRegistry registry = new AccountRegistry();
        TransactionLedger ledger = new TransactionLedger();
        long applied = 0;
        long ignored = 0;
        long skipped = 0;

        log.info("Starting run with failure policy {}", failurePolicy);

        try {
            while (true) {
                Mutation mutation;
                try {
                    if (!mutations.hasNext()) {
                        break;
                    }
                    mutation = mutations.next();
                } catch (MalformedRecordException e) {
                    metrics.recordMalformedRecord();
                    if (failurePolicy == FailurePolicy.ABORT) {
                        log.error("Aborting run: {}", e.getMessage());
                        return aborted(applied, ignored, skipped, ledger, e);
                    }
                    log.warn("Skipping malformed record: {}", e.getMessage());
                    skipped++;
                    continue;
                }

                try {
                    MutationOutcome outcome = apply(mutation, registry, ledger);
                    if (outcome == MutationOutcome.APPLIED) {
                        applied++;
                    } else {
                        ignored++;
                    }
                } catch (MutationException | DuplicateTransactionException e) {
                    metrics.recordMutation(mutation.getKind(), EngineMetrics.OUTCOME_REJECTED);
                    if (failurePolicy == FailurePolicy.ABORT) {
                        log.error("Aborting run at transaction {}: {}", mutation.getId(), e.getMessage());
                        return aborted(applied, ignored, skipped, ledger, e);
                    }
                    log.warn("Skipping transaction {}: {}", mutation.getId(), e.getMessage());
                    skipped++;
                }
            }

            List<AccountSnapshot> accounts = registry.accounts().stream()
                .map(Account::snapshot)
                .collect(Collectors.toList());

            log.info("Run completed: accounts={}, ledgerEntries={}, applied={}, ignored={}, skipped={}",
                registry.size(), ledger.size(), applied, ignored, skipped);

            return new EngineReport(accounts, applied, ignored, skipped, ledger.size(), null);
        } finally {
            metrics.recordRunDuration(Duration.ofMillis(System.currentTimeMillis() - startTime));
        }
    }

    private MutationOutcome apply(Mutation mutation, AccountRegistry registry, TransactionLedger ledger) {
        MDC.put(TRANSACTION_ID_MDC_KEY, String.valueOf(mutation.getId()));
        MDC.put(CLIENT_ID_MDC_KEY, String.valueOf(mutation.getClientId()));
        try {
            Account account = registry.getOrCreate(mutation.getClientId());
            boolean wasLocked = account.isLocked();

            MutationOutcome outcome = account.mutate(mutation, ledger);

            if (!account.isBalanced()) {
                throw new IllegalStateException(String.format(
                    "Balance invariant broken for client %d after transaction %d: available=%d, held=%d, total=%d",
                    account.getClientId(), mutation.getId(),
                    account.getAvailable(), account.getHeld(), account.getTotal()));
            }
            if (!wasLocked && account.isLocked()) {
                metrics.recordAccountLocked();
                log.info("Account {} locked by chargeback of transaction {}", account.getClientId(), mutation.getId());
            }

            metrics.recordMutation(mutation.getKind(), outcome == MutationOutcome.APPLIED
                ? EngineMetrics.OUTCOME_APPLIED
                : EngineMetrics.OUTCOME_IGNORED);
            log.debug("{} {}: {}", mutation.getKind(), mutation.getId(), outcome);
            return outcome;
        } finally {
            MDC.remove(TRANSACTION_ID_MDC_KEY);
            MDC.remove(CLIENT_ID_MDC_KEY);
        }
    }

    private EngineReport aborted(long applied, long ignored, long skipped,
                                 TransactionLedger ledger, RuntimeException failure) {
        return new EngineReport(List.of(), applied, ignored, skipped, ledger.size(), failure);
    }
}
