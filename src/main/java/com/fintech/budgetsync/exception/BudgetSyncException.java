package com.fintech.budgetsync.exception;

/**
 * Base exception for budget sync errors.
 */
public class BudgetSyncException extends RuntimeException {

    public BudgetSyncException(String message) {
        super(message);
    }

    public BudgetSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
