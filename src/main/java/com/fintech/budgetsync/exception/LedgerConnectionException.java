package com.fintech.budgetsync.exception;

/**
 * Thrown when a session to the ledger server cannot be opened.
 * The server may be unreachable or may have rejected the credentials.
 */
public class LedgerConnectionException extends BudgetSyncException {

    private final String serverUrl;

    public LedgerConnectionException(String message, String serverUrl, Throwable cause) {
        super(message, cause);
        this.serverUrl = serverUrl;
    }

    public String getServerUrl() {
        return serverUrl;
    }
}
