package com.fintech.budgetsync.dto;

import lombok.Value;

/**
 * A budget cached in the local data directory.
 */
@Value
public class LocalCacheEntry {
    String directoryName;
    String localBudgetId;
    String syncId;
}
