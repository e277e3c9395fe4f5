package com.fintech.budgetsync.service;

import com.fintech.budgetsync.dto.LedgerAccount;
import com.fintech.budgetsync.dto.SyncTarget;
import com.fintech.budgetsync.exception.LedgerOperationException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * An open session against the ledger service.
 * <p>
 * Every call into the {@link LedgerClient} goes through {@link #invoke}, which
 * converts any failure into a {@link LedgerOperationException} at the call
 * site. Sessions are created and closed by {@link SessionManager} only.
 */
@Slf4j
public class LedgerSession {

    private final int id;
    private final LedgerClient client;
    private final Path dataDir;
    private final String serverUrl;
    private final String serverPassword;

    private volatile boolean open = true;

    LedgerSession(int id, LedgerClient client, Path dataDir, String serverUrl, String serverPassword) {
        this.id = id;
        this.client = client;
        this.dataDir = dataDir;
        this.serverUrl = serverUrl;
        this.serverPassword = serverPassword;
    }

    public int getId() {
        return id;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    String getServerPassword() {
        return serverPassword;
    }

    public boolean isOpen() {
        return open;
    }

    void markClosed() {
        this.open = false;
    }

    /**
     * Downloads the target's budget, passing the encryption password only
     * when the target has one.
     */
    public void downloadBudget(SyncTarget target) {
        log.info("Downloading budget {}...", target.getSyncId());
        if (target.hasEncryptionPassword()) {
            invoke("downloadBudget", () -> client.downloadBudget(
                    target.getSyncId(), target.getEncryptionPassword().orElseThrow()));
        } else {
            invoke("downloadBudget", () -> client.downloadBudget(target.getSyncId()));
        }
        log.info("Budget {} downloaded successfully.", target.getSyncId());
    }

    public void loadBudget(String localBudgetId) {
        log.info("Loading budget {}...", localBudgetId);
        invoke("loadBudget", () -> client.loadBudget(localBudgetId));
        log.info("Budget {} loaded successfully.", localBudgetId);
    }

    public void runBankSync() {
        log.info("Syncing all accounts...");
        invoke("runBankSync", client::runBankSync);
        log.info("All accounts synced.");
    }

    public void pushChanges() {
        log.info("Syncing budget to server...");
        invoke("sync", client::sync);
        log.info("Budget synced to server.");
    }

    public List<LedgerAccount> readAccounts() {
        return invoke("getAccounts", client::getAccounts);
    }

    public void updateAccountBalance(String accountId, long balanceCurrent) {
        invoke("updateAccountBalance", () -> client.updateAccountBalance(accountId, balanceCurrent));
    }

    private void invoke(String operation, Runnable call) {
        invoke(operation, () -> {
            call.run();
            return null;
        });
    }

    private <T> T invoke(String operation, Supplier<T> call) {
        if (!open) {
            throw new LedgerOperationException(operation,
                    String.format("Ledger session %d is closed, cannot run %s", id, operation));
        }
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw new LedgerOperationException(operation,
                    String.format("Ledger operation %s failed: %s", operation, e.getMessage()), e);
        }
    }

    @Override
    public String toString() {
        return "LedgerSession{id=" + id + ", serverUrl=" + serverUrl + ", open=" + open + "}";
    }
}
