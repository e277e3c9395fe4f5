package com.fintech.budgetsync.service;

import com.fintech.budgetsync.dto.LedgerAccount;

import java.nio.file.Path;
import java.util.List;

/**
 * Client for the remote ledger service.
 * <p>
 * The underlying library holds a single stateful session: one {@link #init}
 * at a time, and at most one budget loaded into it. Callers must never drive
 * it from more than one thread.
 * <p>
 * Every method may throw an unchecked exception on failure.
 */
public interface LedgerClient {

    /**
     * Connects to the ledger server and prepares the local store in {@code dataDir}.
     */
    void init(Path dataDir, String serverUrl, String password);

    /**
     * Closes the current session and unloads any budget.
     */
    void shutdown();

    /**
     * Downloads an unencrypted budget by sync ID and loads it.
     */
    void downloadBudget(String syncId);

    /**
     * Downloads an end-to-end encrypted budget by sync ID and loads it.
     */
    void downloadBudget(String syncId, String encryptionPassword);

    /**
     * Loads a budget that is already cached locally.
     *
     * @param localBudgetId the local identifier from the budget's metadata
     */
    void loadBudget(String localBudgetId);

    /**
     * Pulls transactions and balances from the linked bank data sources into
     * the loaded budget.
     */
    void runBankSync();

    /**
     * Pushes local edits of the loaded budget to the server.
     */
    void sync();

    /**
     * Raw account rows of the loaded budget.
     */
    List<LedgerAccount> getAccounts();

    /**
     * Writes an account's current balance through the change-tracked (CRDT)
     * update path, so the next {@link #sync()} sends it to the server.
     */
    void updateAccountBalance(String accountId, long balanceCurrent);
}
