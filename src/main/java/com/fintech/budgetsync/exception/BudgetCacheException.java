package com.fintech.budgetsync.exception;

/**
 * Thrown when the local budget cache cannot be scanned at all.
 * Problems with a single cached budget never raise this.
 */
public class BudgetCacheException extends BudgetSyncException {

    public BudgetCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
