package com.fintech.budgetsync.exception;

/**
 * Thrown when a call into the ledger library fails while a session is open
 * (download, load, bank sync, push, account reads and writes).
 */
public class LedgerOperationException extends BudgetSyncException {

    private final String operation;

    public LedgerOperationException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public LedgerOperationException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * Name of the ledger operation that failed, e.g. {@code downloadBudget}.
     */
    public String getOperation() {
        return operation;
    }
}
