package com.fintech.budgetsync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.budgetsync.dto.BudgetMetadata;
import com.fintech.budgetsync.dto.LedgerAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mock implementation of the ledger service client.
 * <p>
 * Simulates a ledger server and the library's local store:
 * - Budgets on the server, keyed by sync ID, optionally password protected
 * - A {@code metadata.json} per downloaded budget in the data directory
 * - Bank sync that writes balances directly into the local store, skipping
 *   the change log the way the real library does
 * - Intermittent failures and outages (for testing resilience)
 * <p>
 * In production, this would be replaced with a client for the real ledger library.
 */
@Service
@Slf4j
public class MockLedgerClient implements LedgerClient {

    private static final String ACCOUNTS_TABLE = "accounts";

    // Simulated server state
    private final Map<String, RemoteBudget> serverBudgets = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Random random = new Random();

    @Value("${ledger.mock.failure-rate:0.0}")
    private double failureRate;

    @Value("${ledger.mock.latency-ms:0}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    // Local session state
    private Path dataDir;
    private boolean initialized;
    private RemoteBudget loadedBudget;
    private Map<String, LedgerAccount> localAccounts;
    private final Map<String, Long> pendingChanges = new LinkedHashMap<>();

    private int downloadCount;

    public MockLedgerClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void init(Path dataDir, String serverUrl, String password) {
        if (initialized) {
            throw new IllegalStateException("Ledger service already running");
        }
        simulateLatency();
        if (simulateOutage) {
            throw new IllegalStateException("Could not reach ledger server at " + serverUrl);
        }
        this.dataDir = dataDir;
        this.initialized = true;
        log.debug("Mock ledger initialized against {} with data dir {}", serverUrl, dataDir);
    }

    @Override
    public synchronized void shutdown() {
        initialized = false;
        loadedBudget = null;
        localAccounts = null;
        pendingChanges.clear();
    }

    @Override
    public synchronized void downloadBudget(String syncId) {
        download(syncId, null);
    }

    @Override
    public synchronized void downloadBudget(String syncId, String encryptionPassword) {
        download(syncId, encryptionPassword);
    }

    @Override
    public synchronized void loadBudget(String localBudgetId) {
        requireInitialized();
        simulateFailure("loadBudget");

        BudgetMetadata metadata;
        try {
            metadata = objectMapper.readValue(
                    dataDir.resolve(localBudgetId).resolve(FileSystemBudgetCacheIndex.METADATA_FILE).toFile(),
                    BudgetMetadata.class);
        } catch (IOException e) {
            throw new IllegalStateException("Budget " + localBudgetId + " is not cached locally", e);
        }

        RemoteBudget budget = serverBudgets.get(metadata.getGroupId());
        if (budget == null) {
            throw new IllegalStateException("Budget " + metadata.getGroupId() + " not found on server");
        }
        load(budget);
    }

    @Override
    public synchronized void runBankSync() {
        requireLoaded();
        simulateFailure("runBankSync");

        // Direct write, no change recorded
        loadedBudget.bankBalances.forEach((accountId, balance) -> {
            LedgerAccount account = localAccounts.get(accountId);
            if (account != null) {
                account.setBalanceCurrent(balance);
            }
        });
    }

    @Override
    public synchronized void sync() {
        requireLoaded();
        simulateFailure("sync");

        loadedBudget.serverBalances.putAll(pendingChanges);
        log.debug("Pushed {} changes for budget {}", pendingChanges.size(), loadedBudget.syncId);
        pendingChanges.clear();
    }

    @Override
    public synchronized List<LedgerAccount> getAccounts() {
        requireLoaded();
        simulateFailure("getAccounts");

        List<LedgerAccount> accounts = new ArrayList<>();
        for (LedgerAccount account : localAccounts.values()) {
            accounts.add(LedgerAccount.builder()
                    .id(account.getId())
                    .name(account.getName())
                    .balanceCurrent(account.getBalanceCurrent())
                    .build());
        }
        return accounts;
    }

    @Override
    public synchronized void updateAccountBalance(String accountId, long balanceCurrent) {
        requireLoaded();
        simulateFailure("update " + ACCOUNTS_TABLE);

        LedgerAccount account = localAccounts.get(accountId);
        if (account == null) {
            throw new IllegalArgumentException("Unknown account " + accountId);
        }
        account.setBalanceCurrent(balanceCurrent);
        pendingChanges.put(accountId, balanceCurrent);
    }

    private void download(String syncId, String encryptionPassword) {
        requireInitialized();
        simulateLatency();
        simulateFailure("downloadBudget");

        RemoteBudget budget = serverBudgets.computeIfAbsent(syncId, RemoteBudget::withDemoAccounts);
        if (budget.encryptionPassword != null && !budget.encryptionPassword.equals(encryptionPassword)) {
            throw new IllegalStateException("Budget " + syncId + " requires a valid encryption password");
        }

        Path budgetDir = dataDir.resolve(budget.localBudgetId);
        try {
            Files.createDirectories(budgetDir);
            objectMapper.writeValue(
                    budgetDir.resolve(FileSystemBudgetCacheIndex.METADATA_FILE).toFile(),
                    BudgetMetadata.builder()
                            .id(budget.localBudgetId)
                            .groupId(syncId)
                            .budgetName(budget.name)
                            .build());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write budget " + syncId + " to " + budgetDir, e);
        }

        downloadCount++;
        load(budget);
    }

    private void load(RemoteBudget budget) {
        this.loadedBudget = budget;
        this.pendingChanges.clear();
        this.localAccounts = new LinkedHashMap<>();
        budget.serverBalances.forEach((accountId, balance) ->
                localAccounts.put(accountId, LedgerAccount.builder()
                        .id(accountId)
                        .name(budget.accountNames.get(accountId))
                        .balanceCurrent(balance)
                        .build()));
        log.debug("Mock ledger loaded budget {} ({} accounts)", budget.syncId, localAccounts.size());
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Ledger API is not initialized");
        }
    }

    private void requireLoaded() {
        requireInitialized();
        if (loadedBudget == null) {
            throw new IllegalStateException("No budget loaded");
        }
    }

    private void simulateFailure(String operation) {
        if (simulateOutage) {
            throw new IllegalStateException("Ledger server unavailable during " + operation);
        }
        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new IllegalStateException("Simulated network failure during " + operation);
        }
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // Methods for testing/simulation control

    /**
     * Adds a budget to the simulated server.
     *
     * @param bankBalances balance reported by the bank per account; a null
     *                     balance stands for an account with no bank link
     */
    public synchronized void addBudget(String syncId, String encryptionPassword, Map<String, Long> bankBalances) {
        RemoteBudget budget = new RemoteBudget(syncId, encryptionPassword);
        bankBalances.forEach((accountId, balance) -> {
            budget.accountNames.put(accountId, accountId);
            budget.serverBalances.put(accountId, null);
            if (balance != null) {
                budget.bankBalances.put(accountId, balance);
            }
        });
        serverBudgets.put(syncId, budget);
    }

    /**
     * Balance of an account as currently stored on the simulated server.
     */
    public synchronized Long getServerBalance(String syncId, String accountId) {
        RemoteBudget budget = serverBudgets.get(syncId);
        return budget == null ? null : budget.serverBalances.get(accountId);
    }

    public synchronized int getDownloadCount() {
        return downloadCount;
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Ledger outage simulation set to: {}", outage);
    }

    public synchronized void clearMockData() {
        serverBudgets.clear();
        downloadCount = 0;
        shutdown();
    }

    /**
     * A budget as held by the simulated server.
     */
    private static final class RemoteBudget {
        private final String syncId;
        private final String encryptionPassword;
        private final String localBudgetId;
        private final String name;
        private final Map<String, String> accountNames = new LinkedHashMap<>();
        private final Map<String, Long> serverBalances = new LinkedHashMap<>();
        private final Map<String, Long> bankBalances = new LinkedHashMap<>();

        private RemoteBudget(String syncId, String encryptionPassword) {
            this.syncId = syncId;
            this.encryptionPassword = encryptionPassword;
            this.localBudgetId = "budget-" + Integer.toHexString(Objects.hash(syncId));
            this.name = "Budget " + syncId;
        }

        private static RemoteBudget withDemoAccounts(String syncId) {
            RemoteBudget budget = new RemoteBudget(syncId, null);
            budget.accountNames.put("checking", "Checking");
            budget.accountNames.put("cash", "Cash");
            budget.serverBalances.put("checking", 0L);
            budget.serverBalances.put("cash", null);
            budget.bankBalances.put("checking", 125_000L);
            return budget;
        }
    }
}
