package com.fintech.budgetsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a single attempt to sync one budget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncAttemptOutcome {

    private String syncId;
    private int attemptNumber;
    private boolean succeeded;
    private Throwable error;

    public static SyncAttemptOutcome success(String syncId, int attemptNumber) {
        return SyncAttemptOutcome.builder()
                .syncId(syncId)
                .attemptNumber(attemptNumber)
                .succeeded(true)
                .build();
    }

    public static SyncAttemptOutcome failure(String syncId, int attemptNumber, Throwable error) {
        return SyncAttemptOutcome.builder()
                .syncId(syncId)
                .attemptNumber(attemptNumber)
                .succeeded(false)
                .error(error)
                .build();
    }
}
