package com.fintech.budgetsync.service;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Index from server sync IDs to the budgets cached in the local data directory.
 * <p>
 * The ledger library has no lookup from a sync ID to the local budget ID, so
 * implementations work it out from what the library leaves on disk.
 */
public interface BudgetCacheIndex {

    /**
     * Scans the data directory and returns sync ID to local budget ID.
     * Cached budgets whose metadata cannot be read are left out.
     */
    Map<String, String> resolve(Path dataDir);

    /**
     * Local budget ID for a sync ID, rescanning if it is not known yet.
     */
    Optional<String> findLocalBudgetId(Path dataDir, String syncId);

    /**
     * Deletes the cached copy of one budget.
     *
     * @return true if a cached copy was found and deleted; false leaves the
     * data directory untouched
     */
    boolean invalidate(Path dataDir, String syncId);
}
