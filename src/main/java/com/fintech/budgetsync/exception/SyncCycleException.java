package com.fintech.budgetsync.exception;

import com.fintech.budgetsync.dto.CycleReport;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised once per cycle when one or more budgets exhausted their attempts.
 * Names every failed sync ID; the other budgets in the cycle were still synced.
 */
public class SyncCycleException extends BudgetSyncException {

    private final Set<String> failedSyncIds;
    private final transient CycleReport report;

    public SyncCycleException(CycleReport report) {
        super("Sync failed for budgets: " + String.join(", ", report.getFailedSyncIds()));
        this.failedSyncIds = Collections.unmodifiableSet(new LinkedHashSet<>(report.getFailedSyncIds()));
        this.report = report;
    }

    public Set<String> getFailedSyncIds() {
        return failedSyncIds;
    }

    public CycleReport getReport() {
        return report;
    }
}
