package com.fintech.budgetsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Captures the results of one pass over all configured budgets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleReport {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int succeededTargets = 0;

    /**
     * Budgets that exhausted every attempt, in target order.
     */
    @Builder.Default
    private Set<String> failedSyncIds = new LinkedHashSet<>();

    @Builder.Default
    private List<SyncAttemptOutcome> outcomes = new ArrayList<>();

    public void recordOutcome(SyncAttemptOutcome outcome) {
        if (this.outcomes == null) {
            this.outcomes = new ArrayList<>();
        }
        this.outcomes.add(outcome);
    }

    public void incrementSucceededTargets() {
        this.succeededTargets++;
    }

    public void addFailedSyncId(String syncId) {
        if (this.failedSyncIds == null) {
            this.failedSyncIds = new LinkedHashSet<>();
        }
        this.failedSyncIds.add(syncId);
    }

    public boolean hasFailures() {
        return failedSyncIds != null && !failedSyncIds.isEmpty();
    }

    public int getTotalAttempts() {
        return outcomes == null ? 0 : outcomes.size();
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
