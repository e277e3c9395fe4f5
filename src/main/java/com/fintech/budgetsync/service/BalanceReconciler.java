package com.fintech.budgetsync.service;

import com.fintech.budgetsync.dto.LedgerAccount;
import com.fintech.budgetsync.exception.LedgerOperationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Re-applies account balances through the change-tracked update path.
 * <p>
 * Bank sync writes {@code balance_current} straight into the local store,
 * so the new balances never become CRDT messages and are never pushed to the
 * server. Writing the same values again through
 * {@link LedgerSession#updateAccountBalance} records them for the next push.
 * <p>
 * Best effort: a failure here is logged and never stops the push.
 */
@Service
@Slf4j
public class BalanceReconciler {

    private final MeterRegistry meterRegistry;

    private Counter updateFailureCounter;

    public BalanceReconciler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        updateFailureCounter = Counter.builder("budget.sync.balance.update.failures")
                .description("Account balances that could not be re-applied")
                .register(meterRegistry);
    }

    /**
     * @return true if every present balance was re-applied
     */
    public boolean reconcile(LedgerSession session) {
        List<LedgerAccount> accounts;
        try {
            accounts = session.readAccounts();
        } catch (LedgerOperationException e) {
            log.error("Unable to read account balances, skipping balance reconciliation", e);
            return false;
        }
        if (accounts == null) {
            log.error("Ledger returned no account list, skipping balance reconciliation");
            return false;
        }

        int updated = 0;
        int skipped = 0;
        int failed = 0;

        for (LedgerAccount account : accounts) {
            if (account == null) {
                failed++;
                updateFailureCounter.increment();
                log.warn("Skipping empty account row");
                continue;
            }

            Long balance = account.getBalanceCurrent();
            if (balance == null) {
                skipped++;
                continue;
            }

            try {
                session.updateAccountBalance(account.getId(), balance);
                updated++;
            } catch (LedgerOperationException e) {
                failed++;
                updateFailureCounter.increment();
                log.warn("Failed to re-apply balance for account {}: {}", account.getId(), e.getMessage());
            }
        }

        log.info("Balance reconciliation finished: {} updated, {} without balance, {} failed",
                updated, skipped, failed);
        return failed == 0;
    }
}
