package com.fintech.budgetsync.exception;

/**
 * Thrown when a sync cycle is requested while another one is still running.
 */
public class CycleAlreadyRunningException extends BudgetSyncException {

    public CycleAlreadyRunningException() {
        super("Sync cycle already in progress");
    }
}
